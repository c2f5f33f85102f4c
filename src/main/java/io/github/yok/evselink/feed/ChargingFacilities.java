package io.github.yok.evselink.feed;

import com.fasterxml.jackson.annotation.JsonAnySetter;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;

/**
 * Wrapped list of charging facility options, e.g.
 * {@code "ChargingFacilities": {"ChargingFacility": [{"PowerType": "AC_3_PHASE", "Power": 22}]}}.
 */
@Getter
public class ChargingFacilities {

    private final List<ChargingFacilityOption> options = new ArrayList<>();

    /**
     * Creates an empty list.
     */
    public ChargingFacilities() {
    }

    /**
     * Creates a list holding the given options.
     *
     * @param options charging facility options
     */
    public ChargingFacilities(List<ChargingFacilityOption> options) {
        this.options.addAll(options);
    }

    @JsonAnySetter
    void addInner(String element, List<ChargingFacilityOption> values) {
        if (values != null) {
            options.addAll(values);
        }
    }
}
