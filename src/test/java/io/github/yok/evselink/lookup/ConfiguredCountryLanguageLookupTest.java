package io.github.yok.evselink.lookup;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import io.github.yok.evselink.config.LocalizationConfig;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ConfiguredCountryLanguageLookupTest {

    private LocalizationConfig config;
    private ConfiguredCountryLanguageLookup lookup;

    @BeforeEach
    void setup() {
        config = new LocalizationConfig();
        Map<String, String> languages = new LinkedHashMap<>();
        languages.put("DEU", "de-DE");
        languages.put("GBR", "en-GB");
        languages.put("ITA", " ");
        config.setLanguages(languages);
        lookup = new ConfiguredCountryLanguageLookup(config);
    }

    @Test
    void languageCodeOf_正常ケース_登録済みの国コードを指定する_言語コードが返ること() throws Exception {
        assertEquals("de-DE", lookup.languageCodeOf("DEU"));
    }

    @Test
    void languageCodeOf_正常ケース_小文字と空白を含む国コードを指定する_大文字小文字を区別せず解決されること()
            throws Exception {
        assertEquals("en-GB", lookup.languageCodeOf(" gbr "));
    }

    @Test
    void languageCodeOf_異常ケース_未登録の国コードを指定する_LanguageLookupExceptionが送出されること() {
        LanguageLookupException ex =
                assertThrows(LanguageLookupException.class, () -> lookup.languageCodeOf("XYZ"));
        assertEquals("No language code known for country: XYZ", ex.getMessage());
    }

    @Test
    void languageCodeOf_異常ケース_空白の言語コードが登録されている_LanguageLookupExceptionが送出されること() {
        assertThrows(LanguageLookupException.class, () -> lookup.languageCodeOf("ITA"));
    }

    @Test
    void languageCodeOf_異常ケース_空の国コードやマップ未設定_LanguageLookupExceptionが送出されること() {
        assertThrows(LanguageLookupException.class, () -> lookup.languageCodeOf(null));
        assertThrows(LanguageLookupException.class, () -> lookup.languageCodeOf(""));
        config.setLanguages(null);
        assertThrows(LanguageLookupException.class, () -> lookup.languageCodeOf("DEU"));
    }
}
