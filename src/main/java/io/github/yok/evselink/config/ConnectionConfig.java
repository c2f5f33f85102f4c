package io.github.yok.evselink.config;

import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that holds the JDBC settings of the destination database.
 *
 * <pre>
 * connection:
 *   url: jdbc:mysql://localhost:3306/evse
 *   user: importer
 *   password: secret
 *   driver-class: com.mysql.cj.jdbc.Driver
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "connection")
@Data
public class ConnectionConfig {

    // JDBC connection URL
    private String url;

    // Database user name
    private String user;

    // Database password
    private String password;

    // Fully qualified JDBC driver class name (optional for JDBC 4 drivers)
    private String driverClass;

    /**
     * Verifies that the mandatory connection settings are present.
     *
     * @throws IllegalStateException if {@code url} is not configured
     */
    public void validate() {
        if (StringUtils.isBlank(url)) {
            throw new IllegalStateException(
                    "connection.url is not configured. Please set it in application.yml.");
        }
    }
}
