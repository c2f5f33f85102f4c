package io.github.yok.evselink.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that binds the {@code dbunit} section in {@code application.yml}.
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "dbunit")
@Data
public class DbUnitConfig {

    /**
     * Database product of the destination. Selects the DBUnit data type factory.
     */
    private DataTypeFactoryMode dataTypeFactoryMode = DataTypeFactoryMode.MYSQL;

    /**
     * Schema passed to the DBUnit connection. {@code null} lets DBUnit use the connection
     * default.
     */
    private String schema;
}
