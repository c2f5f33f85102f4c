package io.github.yok.evselink.db;

import io.github.yok.evselink.config.DataTypeFactoryMode;
import io.github.yok.evselink.config.DbUnitConfigProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.dbunit.database.DatabaseConfig;
import org.dbunit.dataset.datatype.IDataTypeFactory;
import org.dbunit.ext.h2.H2DataTypeFactory;
import org.dbunit.ext.mysql.MySqlDataTypeFactory;
import org.dbunit.ext.postgresql.PostgresqlDataTypeFactory;
import org.springframework.stereotype.Component;

/**
 * Factory class that centrally applies application-wide settings to DBUnit's
 * {@link DatabaseConfig}.
 *
 * <p>
 * The data type factory and the identifier escape pattern follow the destination product. The
 * remaining settings come from {@link DbUnitConfigProperties}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DbUnitConfigFactory {

    private final DbUnitConfigProperties props;

    /**
     * Creates a factory with default properties, for use outside the Spring container.
     */
    public DbUnitConfigFactory() {
        this.props = new DbUnitConfigProperties();
    }

    /**
     * Applies the settings for the given product to {@code cfg}.
     *
     * @param cfg DBUnit configuration of a connection
     * @param mode destination database product
     */
    public void configure(DatabaseConfig cfg, DataTypeFactoryMode mode) {
        IDataTypeFactory dataTypeFactory = dataTypeFactory(mode);
        cfg.setProperty(DatabaseConfig.PROPERTY_DATATYPE_FACTORY, dataTypeFactory);
        log.debug("DBUnit: DataTypeFactory set to {}", dataTypeFactory.getClass().getSimpleName());

        // Table names such as "Operator" and "EVSE_tr" are case-sensitive
        String escapePattern = escapePattern(mode);
        cfg.setProperty(DatabaseConfig.PROPERTY_ESCAPE_PATTERN, escapePattern);
        log.debug("DBUnit: escape pattern = {}", escapePattern);

        cfg.setProperty(DatabaseConfig.FEATURE_ALLOW_EMPTY_FIELDS, props.isAllowEmptyFields());
        log.debug("DBUnit: allow empty fields = {}", props.isAllowEmptyFields());

        cfg.setProperty(DatabaseConfig.FEATURE_BATCHED_STATEMENTS, props.isBatchedStatements());
        log.debug("DBUnit: batched statements enabled = {}", props.isBatchedStatements());

        cfg.setProperty(DatabaseConfig.PROPERTY_BATCH_SIZE, props.getBatchSize());
        log.debug("DBUnit: batch size = {}", props.getBatchSize());

        cfg.setProperty(DatabaseConfig.PROPERTY_TABLE_TYPE,
                props.getTableTypes().toArray(new String[0]));
        log.debug("DBUnit: table types = {}", props.getTableTypes());
    }

    /**
     * Returns the DBUnit data type factory for a product.
     *
     * @param mode destination database product
     * @return data type factory
     */
    static IDataTypeFactory dataTypeFactory(DataTypeFactoryMode mode) {
        switch (mode) {
            case MYSQL:
                return new MySqlDataTypeFactory();
            case POSTGRESQL:
                return new PostgresqlDataTypeFactory();
            case H2:
                return new H2DataTypeFactory();
            default:
                throw new IllegalArgumentException("Unsupported data type factory mode: " + mode);
        }
    }

    /**
     * Returns the identifier escape pattern for a product.
     *
     * @param mode destination database product
     * @return DBUnit escape pattern
     */
    static String escapePattern(DataTypeFactoryMode mode) {
        return mode == DataTypeFactoryMode.MYSQL ? "`?`" : "\"?\"";
    }
}
