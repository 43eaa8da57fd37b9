package tech.medops.identity.common;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for compact duration strings such as {@code 30s}, {@code 15m},
 * {@code 12h} or {@code 7d}.
 */
public final class CompactDurations {

    private static final Pattern COMPACT = Pattern.compile("^(\\d+)([smhd])$");

    /**
     * Upper bound of ten thousand years; keeps {@code Instant} arithmetic in range.
     */
    static final long MAX_SECONDS = 10_000L * 365 * 86400;

    /**
     * Check whether a value is a well-formed compact duration within {@link #MAX_SECONDS}.
     */
    public static boolean isValid(String value) {
        return toSeconds(value, -1) >= 0;
    }

    /**
     * Parse a compact duration into seconds.
     *
     * @param value    the compact duration
     * @param fallback seconds returned when {@code value} is malformed
     */
    public static long toSeconds(String value, long fallback) {
        if (value == null) {
            return fallback;
        }
        Matcher matcher = COMPACT.matcher(value.trim());
        if (!matcher.matches()) {
            return fallback;
        }
        long amount;
        try {
            amount = Long.parseLong(matcher.group(1));
        } catch (NumberFormatException e) {
            return fallback;
        }
        long seconds;
        try {
            seconds = switch (matcher.group(2)) {
                case "s" -> amount;
                case "m" -> Math.multiplyExact(amount, 60L);
                case "h" -> Math.multiplyExact(amount, 3600L);
                default -> Math.multiplyExact(amount, 86400L);
            };
        } catch (ArithmeticException e) {
            return fallback;
        }
        return seconds > MAX_SECONDS ? fallback : seconds;
    }

    private CompactDurations() {
        // Utility class
    }
}
