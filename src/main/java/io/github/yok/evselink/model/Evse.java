package io.github.yok.evselink.model;

import lombok.Builder;
import lombok.Data;

/**
 * Row of the {@code EVSE} table: the flattened form of one feed record.
 *
 * @author Yasuharu.Okawauchi
 */
@Data
@Builder
public class Evse {

    private String id;
    private String country;
    private String city;
    private String street;
    private String postalCode;
    private String houseNum;
    private String floor;
    private String region;
    private String timezone;
    private Double longitude;
    private Double latitude;
    private Double entranceLongitude;
    private Double entranceLatitude;
    private Integer maxCapacity;
    private Integer accessibilityId;
    private String operatorId;
    private String chargingStationId;
    private String chargingStationName;
    private String lastUpdate;
    private String additionalInfo;
    // 1 = true, 0 = false, null = not published
    private Integer isOpen24Hours;
    private String openingTime;
    private String hubOperatorId;
    private String clearinghouseId;
    private Integer isHubjectCompatible;
    private String dynamicInfoAvailable;
    private String hotlinePhoneNum;
}
