package io.fullerstack.eseries.collector.retention;

import java.time.Duration;
import java.util.Objects;

/**
 * A retention policy of the metrics database.
 *
 * @param name        Policy name
 * @param duration    How long data is kept, {@link Duration#ZERO} for infinite
 * @param replication Replication factor
 * @param isDefault   Whether writes without an explicit policy land here
 */
public record RetentionPolicy(
    String name,
    Duration duration,
    int replication,
    boolean isDefault
) {
    public static final String SHORT_TERM = "default_retention";
    public static final String LONG_TERM = "downsample_retention";

    public RetentionPolicy {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(duration, "duration cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name cannot be blank");
        }
        if (duration.isNegative()) {
            throw new IllegalArgumentException("duration cannot be negative");
        }
        if (replication < 1) {
            throw new IllegalArgumentException("replication must be at least 1");
        }
    }
}
