package io.github.yok.evselink.core;

import io.github.yok.evselink.catalog.ChargingFacilityKey;
import io.github.yok.evselink.catalog.EnumCatalog;
import io.github.yok.evselink.catalog.EnumCategory;
import io.github.yok.evselink.feed.ChargingFacilities;
import io.github.yok.evselink.feed.EvseDataRecord;
import io.github.yok.evselink.feed.OptionNames;
import io.github.yok.evselink.model.EvseEntry;
import io.github.yok.evselink.model.EvseEnumRelation;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.Validate;

/**
 * Resolves the free-text option lists of EVSE records to catalog ids.
 *
 * <p>
 * Each EVSE record lists its options per category by name, e.g. {@code "Type 2 Outlet"} for
 * plugs. The catalog maps each name to an id; the result is an N:M relation:
 * </p>
 *
 * <pre>
 * EVSE (1) --- (N) EVSEPlug (N) --- (1) Plug
 * </pre>
 *
 * <p>
 * Matching is exact. Charging facilities are matched on power type and power together. Names
 * without a catalog entry produce no row; they are counted and reported in the result.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class EnumRelationResolver {

    /**
     * Resolves the join rows of a category using the catalog snapshot.
     *
     * @param category category with a join table
     * @param entries EVSE entries
     * @param catalog catalog snapshot
     * @return join rows and unresolved names
     * @throws IllegalArgumentException if {@code category} has no join table
     */
    public EnumResolution resolve(EnumCategory category, List<EvseEntry> entries,
            EnumCatalog catalog) {
        Validate.isTrue(category.hasJoinTable(),
                "%s is stored inline and has no join table.", category);
        if (category == EnumCategory.CHARGING_FACILITY) {
            return resolve(category, entries, catalog.chargingFacilities(),
                    EnumRelationResolver::chargingFacilityKeys);
        }
        return resolve(category, entries, catalog.names(category), optionNames(category));
    }

    /**
     * Resolves join rows for an arbitrary catalog key type.
     *
     * @param <K> catalog key type
     * @param category category, used for logging and in the result
     * @param entries EVSE entries
     * @param catalogIds catalog key to id
     * @param optionKeys extracts the option keys of a record; may return an empty list
     * @return join rows (each EVSE/id pair once, in input order) and unresolved keys
     */
    public <K> EnumResolution resolve(EnumCategory category, List<EvseEntry> entries,
            Map<K, Integer> catalogIds, Function<EvseDataRecord, List<K>> optionKeys) {
        Set<EvseEnumRelation> rows = new LinkedHashSet<>();
        Map<String, Integer> unresolved = new LinkedHashMap<>();

        for (EvseEntry entry : entries) {
            for (K key : optionKeys.apply(entry.getRecord())) {
                Integer id = key == null ? null : catalogIds.get(key);
                if (id == null) {
                    unresolved.merge(String.valueOf(key), 1, Integer::sum);
                    continue;
                }
                rows.add(new EvseEnumRelation(entry.evseId(), id));
            }
        }

        if (!unresolved.isEmpty()) {
            log.warn("Table[{}] unresolved options dropped: {}", category.getJoinTable(),
                    unresolved);
        }
        log.info("Table[{}] resolved rows={}", category.getJoinTable(), rows.size());
        return new EnumResolution(category, new ArrayList<>(rows), unresolved);
    }

    /**
     * Resolves the inline accessibility id of a record.
     *
     * @param catalog catalog snapshot
     * @param accessibility accessibility name from the feed; may be {@code null}
     * @return catalog id, or {@code null} if the name is missing or unknown
     */
    public static Integer resolveAccessibilityId(EnumCatalog catalog, String accessibility) {
        if (accessibility == null) {
            return null;
        }
        Integer id = catalog.names(EnumCategory.ACCESSIBILITY).get(accessibility);
        if (id == null) {
            log.warn("Unknown accessibility: {}", accessibility);
        }
        return id;
    }

    static Function<EvseDataRecord, List<String>> optionNames(EnumCategory category) {
        switch (category) {
            case AUTHENTICATION_MODE:
                return r -> names(r.getAuthenticationModes());
            case CHARGING_MODE:
                return r -> names(r.getChargingModes());
            case PAYMENT_OPTION:
                return r -> names(r.getPaymentOptions());
            case PLUG:
                return r -> names(r.getPlugs());
            case VALUE_ADDED_SERVICE:
                return r -> names(r.getValueAddedServices());
            default:
                throw new IllegalArgumentException("Not a name-keyed join category: " + category);
        }
    }

    static List<ChargingFacilityKey> chargingFacilityKeys(EvseDataRecord record) {
        ChargingFacilities facilities = record.getChargingFacilities();
        if (facilities == null) {
            return List.of();
        }
        return facilities.getOptions().stream().filter(Objects::nonNull)
                .map(ChargingFacilityKey::of).collect(Collectors.toList());
    }

    private static List<String> names(OptionNames options) {
        return options == null ? List.of() : options.getNames();
    }
}
