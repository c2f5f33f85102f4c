package io.github.yok.evselink.catalog;

import com.google.common.collect.ImmutableMap;
import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.lang3.Validate;

/**
 * Read-only snapshot of the enum catalog tables.
 *
 * <p>
 * Name-keyed categories map {@code name -> id}. {@link EnumCategory#CHARGING_FACILITY} maps
 * {@link ChargingFacilityKey} {@code -> id}. A snapshot is loaded once and handed explicitly to
 * the components that resolve option names; it is never modified afterwards.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class EnumCatalog {

    private final Map<EnumCategory, Map<String, Integer>> byName;
    private final Map<ChargingFacilityKey, Integer> chargingFacilities;

    private EnumCatalog(Map<EnumCategory, Map<String, Integer>> byName,
            Map<ChargingFacilityKey, Integer> chargingFacilities) {
        ImmutableMap.Builder<EnumCategory, Map<String, Integer>> copy = ImmutableMap.builder();
        byName.forEach((category, entries) -> copy.put(category, ImmutableMap.copyOf(entries)));
        this.byName = copy.build();
        this.chargingFacilities = ImmutableMap.copyOf(chargingFacilities);
    }

    /**
     * Returns the {@code name -> id} map of a name-keyed category.
     *
     * @param category any category except {@link EnumCategory#CHARGING_FACILITY}
     * @return immutable map, empty if the catalog table had no rows
     * @throws IllegalArgumentException for {@link EnumCategory#CHARGING_FACILITY}
     */
    public Map<String, Integer> names(EnumCategory category) {
        Validate.isTrue(category != EnumCategory.CHARGING_FACILITY,
                "ChargingFacility is keyed by power type and power, not by name.");
        return byName.getOrDefault(category, ImmutableMap.of());
    }

    /**
     * Returns the compound-key map of the charging facility catalog.
     *
     * @return immutable map
     */
    public Map<ChargingFacilityKey, Integer> chargingFacilities() {
        return chargingFacilities;
    }

    /**
     * Creates a builder.
     *
     * @return new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Collects catalog entries. The first entry registered for a key wins.
     */
    public static final class Builder {

        private final Map<EnumCategory, Map<String, Integer>> byName =
                new EnumMap<>(EnumCategory.class);
        private final Map<ChargingFacilityKey, Integer> chargingFacilities =
                new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Registers a name-keyed entry.
         *
         * @param category category (not {@link EnumCategory#CHARGING_FACILITY})
         * @param id catalog id
         * @param name catalog name
         * @return this builder
         */
        public Builder add(EnumCategory category, int id, String name) {
            Validate.isTrue(category != EnumCategory.CHARGING_FACILITY,
                    "Use addChargingFacility for ChargingFacility entries.");
            if (name == null) {
                return this;
            }
            byName.computeIfAbsent(category, c -> new LinkedHashMap<>()).putIfAbsent(name, id);
            return this;
        }

        /**
         * Registers a charging facility entry.
         *
         * @param id catalog id
         * @param powerType power type
         * @param power power in kW
         * @return this builder
         */
        public Builder addChargingFacility(int id, String powerType, BigDecimal power) {
            chargingFacilities.putIfAbsent(new ChargingFacilityKey(powerType, power), id);
            return this;
        }

        /**
         * Builds the immutable snapshot.
         *
         * @return snapshot
         */
        public EnumCatalog build() {
            return new EnumCatalog(byName, chargingFacilities);
        }
    }
}
