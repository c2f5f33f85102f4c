package io.github.yok.evselink.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Row of the {@code EVSE_tr} table. Unique per {@code (evseId, languageCode)}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EvseTranslation {

    private String evseId;

    private String languageCode;

    private String chargingStationName;

    private String additionalInfo;
}
