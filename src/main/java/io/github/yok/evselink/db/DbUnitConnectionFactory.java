package io.github.yok.evselink.db;

import io.github.yok.evselink.config.ConnectionConfig;
import io.github.yok.evselink.config.DbUnitConfig;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.dbunit.DatabaseUnitException;
import org.dbunit.database.DatabaseConnection;
import org.dbunit.database.IDatabaseConnection;
import org.springframework.stereotype.Component;

/**
 * Opens the destination connection and wraps it for DBUnit.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DbUnitConnectionFactory {

    private final ConnectionConfig connectionConfig;
    private final DbUnitConfig dbUnitConfig;
    private final DbUnitConfigFactory configFactory;

    /**
     * Opens a JDBC connection from {@code connection.*}.
     *
     * @return open connection, owned by the caller
     * @throws SQLException if the connection cannot be established
     * @throws IllegalStateException if the URL is missing or the driver class cannot be loaded
     */
    public Connection openJdbc() throws SQLException {
        connectionConfig.validate();
        String driverClass = connectionConfig.getDriverClass();
        if (StringUtils.isNotBlank(driverClass)) {
            try {
                Class.forName(driverClass);
            } catch (ClassNotFoundException e) {
                throw new IllegalStateException("JDBC driver not found: " + driverClass, e);
            }
        }
        log.info("Connecting to {}", connectionConfig.getUrl());
        return DriverManager.getConnection(connectionConfig.getUrl(), connectionConfig.getUser(),
                connectionConfig.getPassword());
    }

    /**
     * Wraps a JDBC connection in a configured DBUnit connection.
     *
     * @param jdbc open JDBC connection
     * @return DBUnit connection sharing {@code jdbc}
     * @throws DatabaseUnitException if DBUnit rejects the schema
     */
    public IDatabaseConnection create(Connection jdbc) throws DatabaseUnitException {
        String schema = StringUtils.trimToNull(dbUnitConfig.getSchema());
        DatabaseConnection dbConn =
                schema == null ? new DatabaseConnection(jdbc) : new DatabaseConnection(jdbc, schema);
        configFactory.configure(dbConn.getConfig(), dbUnitConfig.getDataTypeFactoryMode());
        return dbConn;
    }
}
