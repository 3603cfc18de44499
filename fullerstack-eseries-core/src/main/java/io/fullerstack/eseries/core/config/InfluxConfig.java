package io.fullerstack.eseries.core.config;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * InfluxDB 1.x connection and retention settings.
 *
 * @param url                     Base URL (e.g., "http://influxdb:8086")
 * @param database                Database name
 * @param shortRetention          Full-resolution retention duration (InfluxQL, e.g., "1w")
 * @param longRetention           Downsampled retention duration (e.g., "52w")
 * @param downsampleBucketMinutes Aggregation bucket of the downsample rules
 */
public record InfluxConfig(
        String url,
        String database,
        String shortRetention,
        String longRetention,
        int downsampleBucketMinutes
) {
    private static final Pattern DURATION = Pattern.compile("\\d+[smhdw]|INF");

    public static final String DEFAULT_DATABASE = "eseries";
    public static final String DEFAULT_SHORT_RETENTION = "1w";
    public static final String DEFAULT_LONG_RETENTION = "52w";
    public static final int DEFAULT_BUCKET_MINUTES = 5;

    public InfluxConfig {
        Objects.requireNonNull(url, "url cannot be null");
        Objects.requireNonNull(database, "database cannot be null");
        Objects.requireNonNull(shortRetention, "shortRetention cannot be null");
        Objects.requireNonNull(longRetention, "longRetention cannot be null");

        if (url.isBlank()) {
            throw new IllegalArgumentException("url cannot be blank");
        }
        if (database.isBlank()) {
            throw new IllegalArgumentException("database cannot be blank");
        }
        if (!DURATION.matcher(shortRetention).matches()) {
            throw new IllegalArgumentException("invalid shortRetention: " + shortRetention);
        }
        if (!DURATION.matcher(longRetention).matches()) {
            throw new IllegalArgumentException("invalid longRetention: " + longRetention);
        }
        if (downsampleBucketMinutes <= 0) {
            throw new IllegalArgumentException("downsampleBucketMinutes must be positive");
        }
        if (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
    }
}
