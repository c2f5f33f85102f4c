package io.github.yok.evselink.catalog;

import io.github.yok.evselink.feed.ChargingFacilityOption;
import java.math.BigDecimal;
import lombok.Data;

/**
 * Compound catalog key of a charging facility: power type and power must both match.
 *
 * <p>
 * Power is held without trailing zeros, so {@code 11}, {@code 11.0} and {@code 11.00} are the
 * same key while {@code 3.7} and {@code 3} are not.
 * </p>
 */
@Data
public class ChargingFacilityKey {

    private final String powerType;

    private final BigDecimal power;

    /**
     * Creates a key.
     *
     * @param powerType power type
     * @param power power in kW, may be {@code null}
     */
    public ChargingFacilityKey(String powerType, BigDecimal power) {
        this.powerType = powerType;
        this.power = power == null ? null : power.stripTrailingZeros();
    }

    /**
     * Builds the key of a feed option.
     *
     * @param option charging facility option from the feed
     * @return key made of the option's power type and power
     */
    public static ChargingFacilityKey of(ChargingFacilityOption option) {
        return new ChargingFacilityKey(option.getPowerType(), option.getPower());
    }
}
