package io.github.yok.evselink.core;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;

/**
 * Splits a packed multi-language field into {@link LocalizedSegment}s.
 *
 * <p>
 * Format: zero or more {@code CODE:text} segments, each terminated by {@code |||}, e.g.
 * {@code DEU:Inhalt|||GBR:Content|||FRA:Objet|||}.
 * </p>
 *
 * <h2>Rules</h2>
 * <ul>
 * <li>The field is cut at every {@code |||}, scanning left to right. Text after the last
 * delimiter is not terminated and is ignored.</li>
 * <li>Within a token, the segment starts at the leftmost three upper-case letters followed by
 * {@code :} whose remaining text holds no line break. Line breaks are {@code \n}, {@code \r},
 * U+2028 and U+2029 only; U+0085 is ordinary text. Anything before the marker is ignored.</li>
 * <li>A token without such a marker yields nothing.</li>
 * <li>The text keeps any further colons and is stripped of surrounding whitespace, which
 * includes the no-break spaces U+00A0, U+2007 and U+202F and the byte order mark U+FEFF.</li>
 * </ul>
 *
 * <p>
 * The result is the same as a non-greedy global scan for {@code ([A-Z]{3}):(.*?)\|\|\|}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class PackedInfoTokenizer {

    /**
     * Segment terminator.
     */
    public static final String DELIMITER = "|||";

    private static final Pattern SEGMENT =
            Pattern.compile("([A-Z]{3}):([^\\n\\r\\u2028\\u2029]*)\\z");

    private static final String WHITESPACE = "\t\n\u000B\f\r \u00A0\u1680"
            + "\u2000\u2001\u2002\u2003\u2004\u2005\u2006\u2007\u2008\u2009\u200A"
            + "\u2028\u2029\u202F\u205F\u3000\uFEFF";

    private PackedInfoTokenizer() {
        throw new AssertionError("PackedInfoTokenizer must not be instantiated.");
    }

    /**
     * Tokenizes a packed field.
     *
     * @param packed packed field; {@code null} or empty yields an empty list
     * @return segments in field order
     */
    public static List<LocalizedSegment> tokenize(String packed) {
        List<LocalizedSegment> segments = new ArrayList<>();
        if (StringUtils.isEmpty(packed)) {
            return segments;
        }

        int from = 0;
        int end;
        while ((end = packed.indexOf(DELIMITER, from)) >= 0) {
            Matcher m = SEGMENT.matcher(packed.substring(from, end));
            if (m.find()) {
                String text = StringUtils.strip(m.group(2), WHITESPACE);
                segments.add(new LocalizedSegment(m.group(1), text));
            }
            from = end + DELIMITER.length();
        }
        return segments;
    }
}
