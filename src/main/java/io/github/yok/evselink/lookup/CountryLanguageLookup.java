package io.github.yok.evselink.lookup;

/**
 * Resolves the language code used for a country in the translation table.
 *
 * @author Yasuharu.Okawauchi
 */
public interface CountryLanguageLookup {

    /**
     * Returns the language code for an ISO 3166 alpha-3 country code.
     *
     * @param alpha3 three-letter country code, e.g. {@code DEU}
     * @return language code, e.g. {@code de-DE}
     * @throws LanguageLookupException if the country cannot be resolved
     */
    String languageCodeOf(String alpha3) throws LanguageLookupException;
}
