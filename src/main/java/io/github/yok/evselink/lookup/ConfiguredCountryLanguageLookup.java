package io.github.yok.evselink.lookup;

import io.github.yok.evselink.config.LocalizationConfig;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * {@link CountryLanguageLookup} backed by {@code localization.languages} in
 * {@code application.yml}.
 *
 * <p>
 * Codes are matched case-insensitively. Blank mappings count as missing.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConfiguredCountryLanguageLookup implements CountryLanguageLookup {

    private final LocalizationConfig localizationConfig;

    /**
     * {@inheritDoc}
     */
    @Override
    public String languageCodeOf(String alpha3) throws LanguageLookupException {
        if (StringUtils.isBlank(alpha3)) {
            throw new LanguageLookupException(alpha3);
        }
        String key = alpha3.trim();
        Map<String, String> languages = localizationConfig.getLanguages();
        String code = languages == null ? null
                : languages.entrySet().stream().filter(e -> key.equalsIgnoreCase(e.getKey()))
                        .map(Map.Entry::getValue).findFirst().orElse(null);
        if (StringUtils.isBlank(code)) {
            throw new LanguageLookupException(alpha3);
        }
        log.debug("Country[{}] → language[{}]", alpha3, code);
        return code;
    }
}
