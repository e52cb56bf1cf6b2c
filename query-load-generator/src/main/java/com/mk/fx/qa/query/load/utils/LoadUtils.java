package com.mk.fx.qa.query.load.utils;

import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class LoadUtils {

    private static final Pattern SEGMENT = Pattern.compile("(\\d+)(ms|h|m|s)");

    private LoadUtils() {
        // Utility class, no instantiation
    }

    /**
     * Parses durations such as {@code 250ms}, {@code 90s}, {@code 5m}, {@code 1h} and compound
     * forms like {@code 1h30m}. A bare {@code 0} is accepted as zero.
     *
     * @throws IllegalArgumentException if the value is blank or not a recognised duration
     */
    public static Duration parseDuration(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Duration must not be blank");
        }
        String trimmed = value.trim().toLowerCase();
        if (trimmed.equals("0")) {
            return Duration.ZERO;
        }
        Matcher matcher = SEGMENT.matcher(trimmed);
        Duration total = Duration.ZERO;
        int position = 0;
        while (matcher.find()) {
            if (matcher.start() != position) {
                throw new IllegalArgumentException("Invalid duration: " + value);
            }
            long amount;
            try {
                amount = Long.parseLong(matcher.group(1));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Duration amount out of range in " + value, e);
            }
            try {
                total = total.plus(switch (matcher.group(2)) {
                    case "ms" -> Duration.ofMillis(amount);
                    case "s" -> Duration.ofSeconds(amount);
                    case "m" -> Duration.ofMinutes(amount);
                    case "h" -> Duration.ofHours(amount);
                    default -> throw new IllegalArgumentException("Unrecognised duration unit in " + value);
                });
            } catch (ArithmeticException e) {
                throw new IllegalArgumentException("Duration out of range: " + value, e);
            }
            position = matcher.end();
        }
        if (position == 0 || position != trimmed.length()) {
            throw new IllegalArgumentException("Invalid duration: " + value);
        }
        return total;
    }

    /** Like {@link #parseDuration(String)} but returns {@code fallback} for a blank value. */
    public static Duration parseDuration(String value, Duration fallback) {
        return value == null || value.isBlank() ? fallback : parseDuration(value);
    }
}
