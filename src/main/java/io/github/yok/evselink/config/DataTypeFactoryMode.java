package io.github.yok.evselink.config;

/**
 * Enumerates the database products the importer can write to.
 *
 * <p>
 * Each constant selects the DBUnit data type factory and the identifier escape pattern used for
 * the destination connection.
 * </p>
 *
 * <ul>
 * <li>MYSQL : MySQL / MariaDB</li>
 * <li>POSTGRESQL : PostgreSQL</li>
 * <li>H2 : H2 (local runs and tests)</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
public enum DataTypeFactoryMode {
    // MySqlDataTypeFactory, backtick escaping
    MYSQL,
    // PostgresqlDataTypeFactory, double-quote escaping
    POSTGRESQL,
    // H2DataTypeFactory, double-quote escaping
    H2
}
