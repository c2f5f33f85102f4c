package io.github.yok.evselink.feed;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * Geo coordinates in one of the supported notations.
 *
 * <ul>
 * <li>{@code Google}: {@code {"Coordinates": "50.931 6.956"}} (latitude first)</li>
 * <li>{@code DecimalDegree}: {@code {"Longitude": "6.956", "Latitude": "50.931"}}</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Data
public class GeoCoordinates {

    @JsonProperty("Google")
    private Google google;

    @JsonProperty("DecimalDegree")
    private DecimalDegree decimalDegree;

    /**
     * Google notation: latitude and longitude separated by whitespace.
     */
    @Data
    public static class Google {
        @JsonProperty("Coordinates")
        private String coordinates;
    }

    /**
     * Decimal degree notation.
     */
    @Data
    public static class DecimalDegree {
        @JsonProperty("Longitude")
        private String longitude;

        @JsonProperty("Latitude")
        private String latitude;
    }
}
