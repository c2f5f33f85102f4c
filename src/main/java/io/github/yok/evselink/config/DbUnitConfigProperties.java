package io.github.yok.evselink.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Holds properties applied to DBUnit's {@code DatabaseConfig}.
 *
 * <ul>
 * <li>{@code dbunit.config.allow-empty-fields}: Whether empty strings are written as-is</li>
 * <li>{@code dbunit.config.batched-statements}: Whether to use batched statement execution</li>
 * <li>{@code dbunit.config.batch-size}: Number of statements per batch</li>
 * <li>{@code dbunit.config.table-types}: JDBC table types DBUnit treats as tables</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "dbunit.config")
@Getter
@Setter
@NoArgsConstructor
public class DbUnitConfigProperties {

    private boolean allowEmptyFields = true;

    private boolean batchedStatements = true;

    private int batchSize = 100;

    // H2 2.x reports ordinary tables as "BASE TABLE"
    private List<String> tableTypes = new ArrayList<>(List.of("TABLE", "BASE TABLE"));
}
