package io.github.yok.evselink.feed;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A charging facility option. Identified jointly by power type and power (kW).
 *
 * <p>
 * Power is decimal ({@code 3.7}, {@code 7.4}, {@code 11.0}) and may arrive as a JSON number or
 * as a string.
 * </p>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChargingFacilityOption {

    @JsonProperty("PowerType")
    private String powerType;

    @JsonProperty("Power")
    private BigDecimal power;
}
