package io.github.yok.evselink.catalog;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.Validate;
import org.springframework.stereotype.Component;

/**
 * Loads the enum catalog tables into an {@link EnumCatalog} snapshot.
 *
 * <p>
 * The catalog is reference data maintained outside this tool, so the first snapshot is cached
 * and reused by every later run of the same process.
 * </p>
 *
 * <ul>
 * <li>Name-keyed tables are read with {@code SELECT id, name FROM <table>}.</li>
 * <li>{@code ChargingFacility} is read with {@code SELECT id, powerType, power}.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class EnumCatalogLoader {

    private volatile EnumCatalog cached;

    /**
     * Returns the cached snapshot, loading it through {@code jdbc} on first use.
     *
     * @param jdbc JDBC connection to the destination database
     * @return catalog snapshot
     * @throws SQLException if a catalog table cannot be read
     */
    public synchronized EnumCatalog load(Connection jdbc) throws SQLException {
        Validate.isTrue(jdbc != null, "jdbc must not be null.");
        if (cached != null) {
            log.debug("Enum catalog already loaded → reusing cached snapshot");
            return cached;
        }

        EnumCatalog.Builder builder = EnumCatalog.builder();
        for (EnumCategory category : EnumCategory.values()) {
            int rows = category == EnumCategory.CHARGING_FACILITY
                    ? readChargingFacilities(jdbc, builder)
                    : readNames(jdbc, category, builder);
            log.info("Catalog[{}] loaded entries={}", category.getCatalogTable(), rows);
        }
        cached = builder.build();
        return cached;
    }

    /**
     * Drops the cached snapshot so that the next {@link #load} reads the tables again.
     */
    public synchronized void invalidate() {
        cached = null;
    }

    private int readNames(Connection jdbc, EnumCategory category, EnumCatalog.Builder builder)
            throws SQLException {
        String sql = "SELECT id, name FROM " + category.getCatalogTable();
        int rows = 0;
        try (PreparedStatement ps = jdbc.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                builder.add(category, rs.getInt("id"), rs.getString("name"));
                rows++;
            }
        }
        return rows;
    }

    private int readChargingFacilities(Connection jdbc, EnumCatalog.Builder builder)
            throws SQLException {
        String sql = "SELECT id, powerType, power FROM "
                + EnumCategory.CHARGING_FACILITY.getCatalogTable();
        int rows = 0;
        try (PreparedStatement ps = jdbc.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                builder.addChargingFacility(rs.getInt("id"), rs.getString("powerType"),
                        rs.getBigDecimal("power"));
                rows++;
            }
        }
        return rows;
    }
}
