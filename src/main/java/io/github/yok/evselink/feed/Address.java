package io.github.yok.evselink.feed;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * Postal address of an EVSE.
 */
@Data
public class Address {

    @JsonProperty("Country")
    private String country;

    @JsonProperty("City")
    private String city;

    @JsonProperty("Street")
    private String street;

    @JsonProperty("PostalCode")
    private String postalCode;

    @JsonProperty("HouseNum")
    private String houseNum;

    @JsonProperty("Floor")
    private String floor;

    @JsonProperty("Region")
    private String region;

    @JsonProperty("TimeZone")
    private String timeZone;
}
