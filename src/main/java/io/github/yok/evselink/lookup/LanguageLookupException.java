package io.github.yok.evselink.lookup;

/**
 * Thrown when a country code cannot be mapped to a language code.
 *
 * <p>
 * Callers are expected to recover; a failed lookup never aborts an import.
 * </p>
 */
public class LanguageLookupException extends Exception {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception for the given country code.
     *
     * @param alpha3 country code that could not be resolved
     */
    public LanguageLookupException(String alpha3) {
        super("No language code known for country: " + alpha3);
    }
}
