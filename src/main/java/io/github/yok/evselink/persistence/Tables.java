package io.github.yok.evselink.persistence;

import io.github.yok.evselink.catalog.EnumCategory;
import io.github.yok.evselink.model.Evse;
import io.github.yok.evselink.model.EvseEnumRelation;
import io.github.yok.evselink.model.EvseTranslation;
import io.github.yok.evselink.model.Operator;
import java.util.List;
import org.apache.commons.lang3.Validate;

/**
 * Layouts of the tables written by the importer.
 *
 * @author Yasuharu.Okawauchi
 */
public final class Tables {

    public static final String OPERATOR_TABLE = "Operator";
    public static final String EVSE_TABLE = "EVSE";
    public static final String EVSE_TR_TABLE = "EVSE_tr";

    public static final TableLayout<Operator> OPERATOR = new TableLayout<>(OPERATOR_TABLE,
            List.of("id", "name", "parentId"),
            o -> new Object[] {o.getId(), o.getName(), o.getParentId()});

    public static final TableLayout<Evse> EVSE = new TableLayout<>(EVSE_TABLE,
            List.of("id", "country", "city", "street", "postalCode", "houseNum", "floor", "region",
                    "timezone", "longitude", "latitude", "entranceLongitude", "entranceLatitude",
                    "maxCapacity", "accessibilityId", "operatorId", "chargingStationId",
                    "chargingStationName", "lastUpdate", "additionalInfo", "isOpen24Hours",
                    "openingTime", "hubOperatorId", "clearinghouseId", "isHubjectCompatible",
                    "dynamicInfoAvailable", "hotlinePhoneNum"),
            e -> new Object[] {e.getId(), e.getCountry(), e.getCity(), e.getStreet(),
                    e.getPostalCode(), e.getHouseNum(), e.getFloor(), e.getRegion(),
                    e.getTimezone(), e.getLongitude(), e.getLatitude(), e.getEntranceLongitude(),
                    e.getEntranceLatitude(), e.getMaxCapacity(), e.getAccessibilityId(),
                    e.getOperatorId(), e.getChargingStationId(), e.getChargingStationName(),
                    e.getLastUpdate(), e.getAdditionalInfo(), e.getIsOpen24Hours(),
                    e.getOpeningTime(), e.getHubOperatorId(), e.getClearinghouseId(),
                    e.getIsHubjectCompatible(), e.getDynamicInfoAvailable(),
                    e.getHotlinePhoneNum()});

    public static final TableLayout<EvseTranslation> EVSE_TR = new TableLayout<>(EVSE_TR_TABLE,
            List.of("evseId", "languageCode", "chargingStationName", "additionalInfo"),
            t -> new Object[] {t.getEvseId(), t.getLanguageCode(), t.getChargingStationName(),
                    t.getAdditionalInfo()});

    private Tables() {
        throw new AssertionError("Tables must not be instantiated.");
    }

    /**
     * Layout of the join table of a category, e.g. {@code EVSEPlug(evseId, plugId)}.
     *
     * @param category category with a join table
     * @return join table layout
     */
    public static TableLayout<EvseEnumRelation> joinTable(EnumCategory category) {
        Validate.isTrue(category.hasJoinTable(), "%s has no join table.", category);
        return new TableLayout<>(category.getJoinTable(),
                List.of("evseId", category.getJoinColumn()),
                r -> new Object[] {r.getEvseId(), r.getEnumId()});
    }
}
