package io.fullerstack.eseries.collector.retention;

import java.time.Duration;
import java.util.Objects;

/**
 * Averages one field of a measurement into the long-term policy.
 * <p>
 * Produces {@code mean(field) AS ds_field} per {@code bucket}, written to the same
 * measurement in {@code targetPolicy}, for data older than {@code olderThan}.
 *
 * @param name         Rule name, {@code downsample_<measurement>_<field>}
 * @param measurement  Source and target measurement
 * @param field        Averaged field
 * @param targetPolicy Retention policy receiving the averages
 * @param bucket       Aggregation bucket width
 * @param olderThan    Only data older than this is averaged
 */
public record DownsampleRule(
    String name,
    String measurement,
    String field,
    String targetPolicy,
    Duration bucket,
    Duration olderThan
) {
    public static final String ALIAS_PREFIX = "ds_";

    public DownsampleRule {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(measurement, "measurement cannot be null");
        Objects.requireNonNull(field, "field cannot be null");
        Objects.requireNonNull(targetPolicy, "targetPolicy cannot be null");
        Objects.requireNonNull(bucket, "bucket cannot be null");
        Objects.requireNonNull(olderThan, "olderThan cannot be null");
        if (bucket.isZero() || bucket.isNegative()) {
            throw new IllegalArgumentException("bucket must be positive");
        }
    }

    public static DownsampleRule of(String measurement, String field, String targetPolicy,
                                    Duration bucket, Duration olderThan) {
        return new DownsampleRule(nameFor(measurement, field), measurement, field, targetPolicy, bucket, olderThan);
    }

    public static String nameFor(String measurement, String field) {
        return "downsample_" + measurement + "_" + field;
    }

    public String alias() {
        return ALIAS_PREFIX + field;
    }
}
