package com.sqlframe.macro;

import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Formats and parses short interval tokens such as {@code 5m} or {@code 250ms}.
 */
public final class IntervalFormat {
    private static final Pattern TOKEN = Pattern.compile("^(\\d+)(ms|s|m|h|d|w)$");

    private static final long SECOND = 1000L;
    private static final long MINUTE = 60 * SECOND;
    private static final long HOUR = 60 * MINUTE;
    private static final long DAY = 24 * HOUR;

    private IntervalFormat() {
    }

    /**
     * Formats a duration using the largest unit that divides it exactly; zero is {@code 0ms}.
     */
    public static String format(Duration interval) {
        long ms = interval == null ? 0 : interval.toMillis();
        if (ms == 0) {
            return "0ms";
        }
        if (ms % DAY == 0) {
            return ms / DAY + "d";
        }
        if (ms % HOUR == 0) {
            return ms / HOUR + "h";
        }
        if (ms % MINUTE == 0) {
            return ms / MINUTE + "m";
        }
        if (ms % SECOND == 0) {
            return ms / SECOND + "s";
        }
        return ms + "ms";
    }

    /**
     * Parses a period token.
     *
     * @return the duration, or null if the token is not recognized or does not fit in milliseconds
     */
    public static Duration parse(String token) {
        if (token == null) {
            return null;
        }
        Matcher m = TOKEN.matcher(token.trim());
        if (!m.matches()) {
            return null;
        }
        try {
            Duration d = toDuration(Long.parseLong(m.group(1)), m.group(2));
            // dialects render periods in milliseconds
            d.toMillis();
            return d;
        } catch (NumberFormatException | ArithmeticException e) {
            return null;
        }
    }

    private static Duration toDuration(long n, String unit) {
        switch (unit) {
            case "ms":
                return Duration.ofMillis(n);
            case "s":
                return Duration.ofSeconds(n);
            case "m":
                return Duration.ofMinutes(n);
            case "h":
                return Duration.ofHours(n);
            case "d":
                return Duration.ofDays(n);
            case "w":
                return Duration.ofDays(Math.multiplyExact(7L, n));
            default:
                throw new IllegalStateException("unit not covered by the token pattern: " + unit);
        }
    }
}
