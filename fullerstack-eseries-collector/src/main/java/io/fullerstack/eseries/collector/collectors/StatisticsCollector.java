package io.fullerstack.eseries.collector.collectors;

import com.fasterxml.jackson.databind.JsonNode;
import io.fullerstack.eseries.collector.client.ApiClient;
import io.fullerstack.eseries.collector.client.ApiPaths;
import io.fullerstack.eseries.collector.scheduler.CollectionTask;
import io.fullerstack.eseries.core.catalog.MetricCatalog;
import io.fullerstack.eseries.core.config.CounterMode;
import io.fullerstack.eseries.core.delta.DeltaRateEngine;
import io.fullerstack.eseries.core.mapper.PointMapper;
import io.fullerstack.eseries.core.mapper.TagExtractor;
import io.fullerstack.eseries.core.model.CounterKey;
import io.fullerstack.eseries.core.model.CounterSample;
import io.fullerstack.eseries.core.model.MetricClass;
import io.fullerstack.eseries.core.model.Point;
import io.fullerstack.eseries.core.model.StorageSystem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Collects one statistics class (volume, interface, system, controller, drive) of a system.
 * <p>
 * In {@link CounterMode#ANALYSED} mode the array's {@code analysed-*-statistics} resource
 * already reports rates and values are passed through. In {@link CounterMode#CUMULATIVE}
 * mode the raw {@code *-statistics} resource is read and counter fields are converted to
 * per-second rates by the {@link DeltaRateEngine}; the first cycle of an entity and
 * cycles after a counter reset produce no point for it.
 */
public class StatisticsCollector implements CollectionTask {
    private static final Logger logger = LoggerFactory.getLogger(StatisticsCollector.class);

    protected final StorageSystem system;
    protected final MetricClass metricClass;
    protected final ApiClient apiClient;
    protected final Duration timeout;
    private final PointMapper mapper;
    private final DeltaRateEngine deltaEngine;
    private final CounterMode counterMode;
    private final Clock clock;

    public StatisticsCollector(
        StorageSystem system,
        MetricClass metricClass,
        ApiClient apiClient,
        PointMapper mapper,
        DeltaRateEngine deltaEngine,
        CounterMode counterMode,
        Duration timeout,
        Clock clock
    ) {
        this.system = Objects.requireNonNull(system, "system cannot be null");
        this.metricClass = Objects.requireNonNull(metricClass, "metricClass cannot be null");
        this.apiClient = Objects.requireNonNull(apiClient, "apiClient cannot be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper cannot be null");
        this.deltaEngine = Objects.requireNonNull(deltaEngine, "deltaEngine cannot be null");
        this.counterMode = Objects.requireNonNull(counterMode, "counterMode cannot be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        // Fails fast for classes without a statistics resource
        resource(metricClass, counterMode);
    }

    /**
     * Statistics resource of a class, e.g. {@code analysed-volume-statistics} or
     * {@code volume-statistics}. The system class only exists in analysed form.
     */
    public static String resource(MetricClass metricClass, CounterMode mode) {
        String base;
        switch (metricClass) {
            case DRIVE -> base = "drive";
            case INTERFACE -> base = "interface";
            case SYSTEM -> base = "system";
            case VOLUME -> base = "volume";
            case CONTROLLER -> base = "controller";
            default -> throw new IllegalArgumentException(metricClass + " has no statistics resource");
        }
        boolean analysed = mode == CounterMode.ANALYSED || metricClass == MetricClass.SYSTEM;
        return (analysed ? "analysed-" : "") + base + "-statistics";
    }

    @Override
    public StorageSystem system() {
        return system;
    }

    @Override
    public MetricClass metricClass() {
        return metricClass;
    }

    @Override
    public List<Point> collect() {
        String path = ApiPaths.statistics(system.sysId(), resource(metricClass, counterMode));
        List<JsonNode> records = enrich(SystemTags.records(apiClient.get(path, timeout)));
        TagExtractor tagExtractor = cycleTags(records);
        Instant now = clock.instant();
        boolean rates = usesRates();

        List<Point> points = new ArrayList<>();
        for (JsonNode record : records) {
            try {
                Point observed = mapper.map(metricClass, record, tagExtractor, now);
                if (rates) {
                    toRate(record, observed, now).ifPresent(points::add);
                } else {
                    points.add(observed);
                }
            } catch (RuntimeException e) {
                // Don't let one record stop collection
                logger.error("Failed to map {} record of {}", metricClass, system.sysName(), e);
            }
        }

        logger.debug("Collected {} {} points from {} records of {}",
            points.size(), metricClass, records.size(), system.sysName());
        return points;
    }

    private boolean usesRates() {
        return counterMode == CounterMode.CUMULATIVE
            && metricClass != MetricClass.SYSTEM
            && !metricClass.catalog().counterFields().isEmpty();
    }

    private Optional<Point> toRate(JsonNode record, Point observed, Instant now) {
        CounterKey key = new CounterKey(system.sysId(), entityId(record), metricClass);
        return deltaEngine.update(CounterSample.fromPoint(key, observed, now), observed);
    }

    /**
     * Entity identity of a record from the catalog's entity key, the system id when the
     * class has none or the record lacks it.
     */
    String entityId(JsonNode record) {
        MetricCatalog catalog = metricClass.catalog();
        String id = catalog.entityKey()
            .map(key -> SystemTags.text(record, key))
            .orElse(null);
        return id == null || id.isBlank() ? system.sysId() : id;
    }

    /**
     * Adjust this cycle's records before mapping. The default is identity.
     */
    protected List<JsonNode> enrich(List<JsonNode> records) {
        return records;
    }

    /**
     * Tag extractor for this cycle. Called once per cycle after {@link #enrich(List)}.
     */
    protected TagExtractor cycleTags(List<JsonNode> records) {
        return this::tags;
    }

    protected Map<String, String> tags(JsonNode record) {
        Map<String, String> tags = SystemTags.base(system);
        switch (metricClass) {
            case VOLUME -> tags.put("vol_name", SystemTags.text(record, "volumeName"));
            case INTERFACE -> {
                tags.put("interface_id", SystemTags.text(record, "interfaceId"));
                tags.put("channel_type", SystemTags.text(record, "channelType"));
            }
            case CONTROLLER -> tags.put("controller_id", SystemTags.text(record, "controllerId"));
            default -> {
            }
        }
        return tags;
    }
}
