package io.github.yok.evselink.catalog;

/**
 * The seven enumerated categories of an EVSE record.
 *
 * <p>
 * Each constant names its catalog table and, except for {@link #ACCESSIBILITY} which is stored
 * inline on the EVSE row, the join table and the enum column of that join table.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public enum EnumCategory {

    ACCESSIBILITY("Accessibility", null, null),
    AUTHENTICATION_MODE("AuthenticationMode", "EVSEAuthenticationMode", "authenticationModeId"),
    CHARGING_FACILITY("ChargingFacility", "EVSEChargingFacility", "chargingFacilityId"),
    CHARGING_MODE("ChargingMode", "EVSEChargingMode", "chargingModeId"),
    PAYMENT_OPTION("PaymentOption", "EVSEPaymentOption", "paymentOptionId"),
    PLUG("Plug", "EVSEPlug", "plugId"),
    VALUE_ADDED_SERVICE("ValueAddedService", "EVSEValueAddedService", "valueAddedServiceId");

    private final String catalogTable;
    private final String joinTable;
    private final String joinColumn;

    EnumCategory(String catalogTable, String joinTable, String joinColumn) {
        this.catalogTable = catalogTable;
        this.joinTable = joinTable;
        this.joinColumn = joinColumn;
    }

    public String getCatalogTable() {
        return catalogTable;
    }

    /**
     * Returns the join table, or {@code null} for {@link #ACCESSIBILITY}.
     *
     * @return join table name
     */
    public String getJoinTable() {
        return joinTable;
    }

    public String getJoinColumn() {
        return joinColumn;
    }

    /**
     * Whether rows of this category are written to a join table.
     *
     * @return {@code true} unless the category is stored inline
     */
    public boolean hasJoinTable() {
        return joinTable != null;
    }
}
