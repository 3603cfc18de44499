package io.fullerstack.eseries.core.delta;

import io.fullerstack.eseries.core.catalog.FieldSpec;
import io.fullerstack.eseries.core.model.CounterKey;
import io.fullerstack.eseries.core.model.CounterSample;
import io.fullerstack.eseries.core.model.FieldValue;
import io.fullerstack.eseries.core.model.Point;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Converts cumulative counters into per-second rates across polling cycles.
 * <p>
 * Keeps the last {@link CounterSample} per {@link CounterKey}. For every new sample:
 * <ul>
 *   <li>first sample for a key: stored as baseline, nothing emitted</li>
 *   <li>any counter lower than before (controller reboot, counter wrap): stored as new
 *       baseline, nothing emitted, logged at INFO</li>
 *   <li>non-positive elapsed time: stored, nothing emitted, logged at WARN</li>
 *   <li>otherwise: {@code (new - old) / elapsedSeconds} for every counter field, using the
 *       observed wall-clock gap rather than the nominal interval</li>
 * </ul>
 * The cached sample is replaced on every call.
 * <p>
 * <b>Thread safety:</b> updates for one key are linearized through
 * {@link ConcurrentHashMap#compute}; different keys do not contend.
 * <p>
 * <b>Bounds:</b> at most {@code maxEntries} keys are cached. On overflow the entry with the
 * oldest observation is evicted, and {@link #evictOlderThan(Instant)} removes entities that
 * stopped reporting (deleted volumes, replaced drives).
 */
public class DeltaRateEngine {
    private static final Logger logger = LoggerFactory.getLogger(DeltaRateEngine.class);

    public static final int DEFAULT_MAX_ENTRIES = 10_000;

    private final Map<CounterKey, CounterSample> cache = new ConcurrentHashMap<>();
    private final int maxEntries;

    public DeltaRateEngine() {
        this(DEFAULT_MAX_ENTRIES);
    }

    public DeltaRateEngine(int maxEntries) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive, got: " + maxEntries);
        }
        this.maxEntries = maxEntries;
    }

    /**
     * Record a new sample and compute rates against the previous one.
     *
     * @param sample   Raw cumulative counters of the current cycle
     * @param observed Mapped point of the current cycle; supplies tags, timestamp and
     *                 non-counter fields of the emitted point
     * @return Point whose counter fields hold per-second rates, or empty if no rate can be
     *         computed this cycle
     */
    public Optional<Point> update(CounterSample sample, Point observed) {
        Objects.requireNonNull(sample, "sample cannot be null");
        Objects.requireNonNull(observed, "observed cannot be null");

        Point[] emitted = new Point[1];
        cache.compute(sample.key(), (key, previous) -> {
            emitted[0] = computeRates(previous, sample, observed);
            return sample;
        });

        if (cache.size() > maxEntries) {
            evictOldest();
        }
        return Optional.ofNullable(emitted[0]);
    }

    private Point computeRates(CounterSample previous, CounterSample current, Point observed) {
        CounterKey key = current.key();
        if (previous == null) {
            logger.debug("Cache initialization for {}", key);
            return null;
        }

        for (Map.Entry<String, Double> entry : current.values().entrySet()) {
            Double old = previous.values().get(entry.getKey());
            if (old != null && entry.getValue() < old) {
                logger.info("Counter reset on {} field {} ({} -> {}), re-baselining",
                        key, entry.getKey(), old, entry.getValue());
                return null;
            }
        }

        Duration elapsed = Duration.between(previous.observedAt(), current.observedAt());
        if (elapsed.isNegative() || elapsed.isZero()) {
            logger.warn("Non-positive elapsed time {} for {}, skipping rate computation", elapsed, key);
            return null;
        }
        double seconds = elapsed.toMillis() / 1000.0;

        Map<String, FieldValue> rates = new LinkedHashMap<>();
        for (FieldSpec spec : key.metricClass().catalog().counterFields()) {
            Double newValue = current.values().get(spec.name());
            Double oldValue = previous.values().get(spec.name());
            if (newValue == null || oldValue == null) {
                rates.put(spec.name(), FieldValue.absent());
            } else {
                rates.put(spec.name(), FieldValue.of((newValue - oldValue) / seconds));
            }
        }
        return observed.withFields(rates);
    }

    private void evictOldest() {
        cache.entrySet().stream()
                .min(Comparator.comparing(e -> e.getValue().observedAt()))
                .ifPresent(oldest -> {
                    if (cache.remove(oldest.getKey(), oldest.getValue())) {
                        logger.debug("Counter cache full ({} entries), evicted {}", maxEntries, oldest.getKey());
                    }
                });
    }

    /**
     * Remove every key whose last observation is older than the cutoff.
     *
     * @param cutoff Entries observed strictly before this instant are removed
     * @return Number of removed entries
     */
    public int evictOlderThan(Instant cutoff) {
        Objects.requireNonNull(cutoff, "cutoff cannot be null");
        int removed = 0;
        for (Map.Entry<CounterKey, CounterSample> entry : cache.entrySet()) {
            if (entry.getValue().observedAt().isBefore(cutoff)
                    && cache.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            logger.info("Evicted {} stale counter entries observed before {}", removed, cutoff);
        }
        return removed;
    }

    /**
     * Last stored sample for a key.
     */
    public Optional<CounterSample> lastSample(CounterKey key) {
        return Optional.ofNullable(cache.get(key));
    }

    public int size() {
        return cache.size();
    }

    public int maxEntries() {
        return maxEntries;
    }
}
