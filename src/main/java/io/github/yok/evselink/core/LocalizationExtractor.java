package io.github.yok.evselink.core;

import io.github.yok.evselink.feed.EvseDataRecord;
import io.github.yok.evselink.lookup.CountryLanguageLookup;
import io.github.yok.evselink.lookup.LanguageLookupException;
import io.github.yok.evselink.model.EvseEntry;
import io.github.yok.evselink.model.EvseTranslation;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

/**
 * Builds the {@code EVSE_tr} rows of a batch.
 *
 * <p>
 * A feed record carries its localized texts in three places:
 * </p>
 * <ul>
 * <li>{@code ChargingStationName}: station name in the primary anchor's language</li>
 * <li>{@code EnChargingStationName}: station name in the alternate (English) anchor's
 * language</li>
 * <li>{@code EnAdditionalInfo}: packed additional info for any number of countries, see
 * {@link PackedInfoTokenizer}</li>
 * </ul>
 *
 * <p>
 * Every packed segment becomes a row. The row of an anchor country also receives the matching
 * station name. If the packed field has no segment for an anchor but the matching name is not
 * blank, a name-only row is added for that anchor (alternate anchor first).
 * </p>
 *
 * <p>
 * Country codes are turned into language codes through {@link CountryLanguageLookup}. When the
 * lookup fails, the country code is used as the language code.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class LocalizationExtractor {

    private final CountryLanguageLookup languageLookup;

    // Country paired with ChargingStationName
    private final String primaryAnchor;

    // Country paired with EnChargingStationName
    private final String alternateAnchor;

    /**
     * Creates an extractor.
     *
     * @param languageLookup country-to-language lookup
     * @param primaryAnchor country code paired with {@code ChargingStationName}
     * @param alternateAnchor country code paired with {@code EnChargingStationName}
     */
    public LocalizationExtractor(CountryLanguageLookup languageLookup, String primaryAnchor,
            String alternateAnchor) {
        Validate.notNull(languageLookup, "languageLookup must not be null.");
        Validate.notBlank(primaryAnchor, "primaryAnchor must not be blank.");
        Validate.notBlank(alternateAnchor, "alternateAnchor must not be blank.");
        this.languageLookup = languageLookup;
        this.primaryAnchor = primaryAnchor;
        this.alternateAnchor = alternateAnchor;
    }

    /**
     * Extracts the translation rows of all entries.
     *
     * @param entries EVSE entries
     * @return rows, grouped by entry in input order
     */
    public List<EvseTranslation> extract(List<EvseEntry> entries) {
        List<EvseTranslation> rows = new ArrayList<>();
        for (EvseEntry entry : entries) {
            rows.addAll(extract(entry.getRecord()));
        }
        log.info("Localization: EVSEs={}, translation rows={}", entries.size(), rows.size());
        return rows;
    }

    /**
     * Extracts the translation rows of one record.
     *
     * @param record feed record
     * @return rows for the packed segments, followed by backfilled anchor rows
     */
    public List<EvseTranslation> extract(EvseDataRecord record) {
        String evseId = record.getEvseId();
        String primaryName = record.getChargingStationName();
        String alternateName = record.getEnChargingStationName();

        List<EvseTranslation> rows = new ArrayList<>();
        boolean hasPrimary = false;
        boolean hasAlternate = false;

        List<LocalizedSegment> segments =
                PackedInfoTokenizer.tokenize(record.getEnAdditionalInfo());
        for (LocalizedSegment segment : segments) {
            String code = segment.getCountryCode();
            String name = null;
            if (code.equals(alternateAnchor)) {
                name = alternateName;
                hasAlternate = true;
            } else if (code.equals(primaryAnchor)) {
                name = primaryName;
                hasPrimary = true;
            }
            rows.add(row(evseId, code, name, segment.getText()));
        }

        if (!hasAlternate && StringUtils.isNotBlank(alternateName)) {
            rows.add(row(evseId, alternateAnchor, alternateName, null));
        }
        if (!hasPrimary && StringUtils.isNotBlank(primaryName)) {
            rows.add(row(evseId, primaryAnchor, primaryName, null));
        }
        return rows;
    }

    private EvseTranslation row(String evseId, String countryCode, String name,
            String additionalInfo) {
        return new EvseTranslation(evseId, languageOf(countryCode), name, additionalInfo);
    }

    private String languageOf(String countryCode) {
        try {
            return languageLookup.languageCodeOf(countryCode);
        } catch (LanguageLookupException e) {
            log.warn("Language lookup failed for {} → using country code. reason={}",
                    countryCode, e.getMessage());
            return countryCode;
        }
    }
}
