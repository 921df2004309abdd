package io.github.nicechester.biblereference.parser;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient integer reading for chapter and verse numbers.
 */
public final class ReferenceNumbers {

    private static final Pattern LEADING_INTEGER = Pattern.compile("^\\s*([+-]?[0-9]+)");

    private ReferenceNumbers() {
    }

    /**
     * Read the integer at the start of {@code text}: "10" is 10, "-5" is -5, "12abc" is 12 and
     * anything without leading digits ("invalid", "", {@code null}) is 0. Values outside the
     * {@code int} range saturate at {@link Integer#MAX_VALUE} or {@link Integer#MIN_VALUE}.
     */
    public static int toInt(String text) {
        if (text == null) {
            return 0;
        }
        Matcher matcher = LEADING_INTEGER.matcher(text);
        if (!matcher.find()) {
            return 0;
        }
        String digits = matcher.group(1);
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            return digits.startsWith("-") ? Integer.MIN_VALUE : Integer.MAX_VALUE;
        }
    }

    /**
     * Number of values in the inclusive range, computed without overflow.
     */
    static long rangeSize(int first, int last) {
        return (long) last - first + 1;
    }
}
