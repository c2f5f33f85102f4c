package io.github.yok.evselink.feed;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * One EVSE record as published in the feed.
 *
 * <p>
 * Boolean flags arrive as strings ({@code "true"}/{@code "false"}); enumerated options arrive as
 * free-text names wrapped in a list container. {@code EnAdditionalInfo} packs several languages
 * into one delimited string, e.g. {@code DEU:Inhalt|||GBR:Content|||}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Data
public class EvseDataRecord {

    @JsonProperty("EvseId")
    private String evseId;

    @JsonProperty("ChargingStationId")
    private String chargingStationId;

    @JsonProperty("ChargingStationName")
    private String chargingStationName;

    @JsonProperty("EnChargingStationName")
    private String enChargingStationName;

    @JsonProperty("Address")
    private Address address;

    @JsonProperty("GeoCoordinates")
    private GeoCoordinates geoCoordinates;

    @JsonProperty("GeoChargingPointEntrance")
    private GeoCoordinates geoChargingPointEntrance;

    @JsonProperty("MaxCapacity")
    private Integer maxCapacity;

    @JsonProperty("Accessibility")
    private String accessibility;

    @JsonProperty("AuthenticationModes")
    private OptionNames authenticationModes;

    @JsonProperty("ChargingFacilities")
    private ChargingFacilities chargingFacilities;

    @JsonProperty("ChargingModes")
    private OptionNames chargingModes;

    @JsonProperty("PaymentOptions")
    private OptionNames paymentOptions;

    @JsonProperty("Plugs")
    private OptionNames plugs;

    @JsonProperty("ValueAddedServices")
    private OptionNames valueAddedServices;

    @JsonProperty("AdditionalInfo")
    private String additionalInfo;

    @JsonProperty("EnAdditionalInfo")
    private String enAdditionalInfo;

    @JsonProperty("IsOpen24Hours")
    private String isOpen24Hours;

    @JsonProperty("OpeningTime")
    private String openingTime;

    @JsonProperty("HubOperatorID")
    private String hubOperatorId;

    @JsonProperty("ClearinghouseID")
    private String clearinghouseId;

    @JsonProperty("IsHubjectCompatible")
    private String isHubjectCompatible;

    @JsonProperty("DynamicInfoAvailable")
    private String dynamicInfoAvailable;

    @JsonProperty("HotlinePhoneNum")
    private String hotlinePhoneNum;

    @JsonProperty("attributes")
    private Attributes attributes;

    /**
     * Returns the {@code lastUpdate} attribute, or {@code null} if the record carries none.
     *
     * @return last update timestamp as published
     */
    public String lastUpdate() {
        return attributes == null ? null : attributes.getLastUpdate();
    }

    /**
     * Record attributes (XML attributes in the original feed).
     */
    @Data
    public static class Attributes {
        private String lastUpdate;
    }
}
