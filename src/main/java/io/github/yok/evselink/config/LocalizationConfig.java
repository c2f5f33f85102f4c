package io.github.yok.evselink.config;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that binds the {@code localization} section in {@code application.yml}.
 *
 * <p>
 * The two anchor codes name the countries whose segment in the packed additional-info field is
 * paired with the scalar station name fields of an EVSE record:
 * </p>
 * <ul>
 * <li>{@code primary-anchor} pairs with {@code ChargingStationName}</li>
 * <li>{@code alternate-anchor} pairs with {@code EnChargingStationName}</li>
 * </ul>
 *
 * <pre>
 * localization:
 *   primary-anchor: DEU
 *   alternate-anchor: GBR
 *   languages:
 *     DEU: de-DE
 *     GBR: en-GB
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "localization")
@Data
public class LocalizationConfig {

    // ISO 3166 alpha-3 code paired with ChargingStationName
    private String primaryAnchor = "DEU";

    // ISO 3166 alpha-3 code paired with EnChargingStationName
    private String alternateAnchor = "GBR";

    // ISO 3166 alpha-3 country code -> language code
    private Map<String, String> languages = new LinkedHashMap<>();
}
