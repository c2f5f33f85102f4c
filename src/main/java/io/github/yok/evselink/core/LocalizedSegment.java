package io.github.yok.evselink.core;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * One {@code CODE:text} segment of a packed additional-info field.
 */
@Data
@AllArgsConstructor
public class LocalizedSegment {

    // ISO 3166 alpha-3 country code
    private final String countryCode;

    // Segment text, surrounding whitespace stripped
    private final String text;
}
