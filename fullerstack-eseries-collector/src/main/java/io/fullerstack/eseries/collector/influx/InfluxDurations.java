package io.fullerstack.eseries.collector.influx;

import lombok.experimental.UtilityClass;

import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * InfluxQL duration literals.
 * <p>
 * Parses both the short form used in statements ({@code 1w}, {@code 5m}) and the form
 * returned by {@code SHOW RETENTION POLICIES} ({@code 168h0m0s}). {@code INF} and
 * {@code 0s} mean infinite and map to {@link Duration#ZERO}.
 */
@UtilityClass
public class InfluxDurations {

    private static final Pattern PART = Pattern.compile("(\\d+)(ns|us|µs|ms|s|m|h|d|w)");

    private static final long MINUTE = 60;
    private static final long HOUR = 60 * MINUTE;
    private static final long DAY = 24 * HOUR;
    private static final long WEEK = 7 * DAY;

    public Duration parse(String literal) {
        if (literal == null || literal.isBlank()) {
            throw new IllegalArgumentException("duration literal cannot be blank");
        }
        String text = literal.trim();
        if ("INF".equalsIgnoreCase(text)) {
            return Duration.ZERO;
        }

        Matcher matcher = PART.matcher(text);
        Duration total = Duration.ZERO;
        int position = 0;
        while (matcher.find()) {
            if (matcher.start() != position) {
                throw new IllegalArgumentException("invalid duration literal: " + literal);
            }
            total = total.plus(unit(Long.parseLong(matcher.group(1)), matcher.group(2)));
            position = matcher.end();
        }
        if (position != text.length() || position == 0) {
            throw new IllegalArgumentException("invalid duration literal: " + literal);
        }
        return total;
    }

    /**
     * Shortest literal in the largest whole unit, {@code INF} for zero.
     */
    public String format(Duration duration) {
        if (duration.isZero()) {
            return "INF";
        }
        long seconds = duration.getSeconds();
        if (seconds % WEEK == 0) {
            return seconds / WEEK + "w";
        }
        if (seconds % DAY == 0) {
            return seconds / DAY + "d";
        }
        if (seconds % HOUR == 0) {
            return seconds / HOUR + "h";
        }
        if (seconds % MINUTE == 0) {
            return seconds / MINUTE + "m";
        }
        return seconds + "s";
    }

    private Duration unit(long amount, String unit) {
        switch (unit) {
            case "w":
                return Duration.ofSeconds(amount * WEEK);
            case "d":
                return Duration.ofDays(amount);
            case "h":
                return Duration.ofHours(amount);
            case "m":
                return Duration.ofMinutes(amount);
            case "s":
                return Duration.ofSeconds(amount);
            case "ms":
                return Duration.ofMillis(amount);
            case "us":
            case "µs":
                return Duration.ofNanos(amount * 1000);
            default:
                return Duration.ofNanos(amount);
        }
    }
}
