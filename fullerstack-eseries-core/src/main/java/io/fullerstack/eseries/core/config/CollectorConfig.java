package io.fullerstack.eseries.core.config;

import io.fullerstack.eseries.core.model.MetricClass;
import io.fullerstack.eseries.core.model.StorageSystem;

import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Resolved configuration of a collector process.
 * <p>
 * Immutable; built once at startup by {@link #from(HierarchicalConfig)} and passed to the
 * components that need it. Any invalid value raises {@link ConfigurationException}.
 * <p>
 * Example {@code collector.properties}:
 * <pre>
 * eseries.api.endpoints=https://10.0.0.10:8443,https://10.0.0.11:8443
 * eseries.api.username=monitor
 * eseries.systems=600A098000F63714000000005E79C17C:dc1r226-elk
 * collector.interval-seconds=60
 * influx.url=http://influxdb:8086
 * output.targets=influx
 * </pre>
 *
 * @param api                       API connection settings
 * @param systems                   Monitored storage systems
 * @param intervalSeconds           Performance polling interval (60, 120, 300 or 600)
 * @param driveIntervalSeconds      Drive statistics interval (default one week)
 * @param controllerIntervalSeconds Controller statistics interval (default one hour)
 * @param configIntervalSeconds     Inventory interval of the configuration classes (default one day)
 * @param poolSize                  Worker threads for collection tasks
 * @param counterMode               Whether statistics are rates or cumulative totals
 * @param melPageSize               Events requested per MEL call
 * @param counterCacheSize          Maximum entries of the counter cache
 * @param healthPoints              Write a {@code collector_health} point every tick
 * @param influx                    InfluxDB settings
 * @param outputTargets             Where batches are written
 * @param jsonDir                   Output directory of the JSON target
 * @param prometheusPort            Port of the Prometheus scrape endpoint
 */
public record CollectorConfig(
        ApiConfig api,
        List<StorageSystem> systems,
        long intervalSeconds,
        long driveIntervalSeconds,
        long controllerIntervalSeconds,
        long configIntervalSeconds,
        int poolSize,
        CounterMode counterMode,
        int melPageSize,
        int counterCacheSize,
        boolean healthPoints,
        InfluxConfig influx,
        Set<OutputTarget> outputTargets,
        Path jsonDir,
        int prometheusPort
) {
    /**
     * Performance intervals accepted by the analysed statistics endpoints.
     */
    public static final Set<Long> SUPPORTED_INTERVALS = Set.of(60L, 120L, 300L, 600L);

    public static final long DEFAULT_INTERVAL_SECONDS = 60;
    public static final long DEFAULT_DRIVE_INTERVAL_SECONDS = 604_800;
    public static final long DEFAULT_CONTROLLER_INTERVAL_SECONDS = 3_600;
    public static final long DEFAULT_CONFIG_INTERVAL_SECONDS = 86_400;
    public static final int DEFAULT_POOL_SIZE = 8;
    public static final int DEFAULT_MEL_PAGE_SIZE = 8192;
    public static final int DEFAULT_COUNTER_CACHE_SIZE = 10_000;
    public static final int DEFAULT_PROMETHEUS_PORT = 8000;

    /**
     * Connect timeout of API and backend requests.
     */
    public static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(6);

    /**
     * Compact constructor with validation.
     */
    public CollectorConfig {
        Objects.requireNonNull(api, "api cannot be null");
        Objects.requireNonNull(systems, "systems cannot be null");
        Objects.requireNonNull(counterMode, "counterMode cannot be null");
        Objects.requireNonNull(influx, "influx cannot be null");
        Objects.requireNonNull(outputTargets, "outputTargets cannot be null");
        Objects.requireNonNull(jsonDir, "jsonDir cannot be null");

        if (systems.isEmpty()) {
            throw new IllegalArgumentException("at least one storage system is required");
        }
        if (!SUPPORTED_INTERVALS.contains(intervalSeconds)) {
            throw new IllegalArgumentException(
                    "intervalSeconds must be one of " + SUPPORTED_INTERVALS + ", got: " + intervalSeconds);
        }
        if (driveIntervalSeconds <= 0 || controllerIntervalSeconds <= 0 || configIntervalSeconds <= 0) {
            throw new IllegalArgumentException("class intervals must be positive");
        }
        if (poolSize <= 0) {
            throw new IllegalArgumentException("poolSize must be positive");
        }
        if (melPageSize <= 0) {
            throw new IllegalArgumentException("melPageSize must be positive");
        }
        if (counterCacheSize <= 0) {
            throw new IllegalArgumentException("counterCacheSize must be positive");
        }
        if (outputTargets.isEmpty()) {
            throw new IllegalArgumentException("at least one output target is required");
        }
        if (prometheusPort < 0 || prometheusPort > 65_535) {
            throw new IllegalArgumentException("prometheusPort out of range: " + prometheusPort);
        }
        systems = List.copyOf(systems);
        outputTargets = Set.copyOf(outputTargets);
    }

    /**
     * Resolve the configuration from properties.
     *
     * @param config Property source
     * @return Validated configuration
     * @throws ConfigurationException if a required key is missing or a value is invalid
     */
    public static CollectorConfig from(HierarchicalConfig config) {
        Objects.requireNonNull(config, "config cannot be null");
        try {
            ApiConfig api = new ApiConfig(
                    config.getList("eseries.api.endpoints", List.of()),
                    config.getString("eseries.api.username"),
                    config.getString("eseries.api.password", ""),
                    config.getBoolean("eseries.api.insecure-tls", false));

            List<StorageSystem> systems = config.getList("eseries.systems", List.of()).stream()
                    .map(StorageSystem::parse)
                    .toList();

            InfluxConfig influx = new InfluxConfig(
                    config.getString("influx.url", "http://localhost:8086"),
                    config.getString("influx.database", InfluxConfig.DEFAULT_DATABASE),
                    config.getString("influx.retention.short", InfluxConfig.DEFAULT_SHORT_RETENTION),
                    config.getString("influx.retention.long", InfluxConfig.DEFAULT_LONG_RETENTION),
                    config.getInt("influx.downsample.bucket-minutes", InfluxConfig.DEFAULT_BUCKET_MINUTES));

            Set<OutputTarget> targets = EnumSet.noneOf(OutputTarget.class);
            config.getList("output.targets", List.of("influx")).forEach(t -> targets.add(OutputTarget.parse(t)));

            return new CollectorConfig(
                    api,
                    systems,
                    config.getLong("collector.interval-seconds", DEFAULT_INTERVAL_SECONDS),
                    config.getLong("collector.drive-interval-seconds", DEFAULT_DRIVE_INTERVAL_SECONDS),
                    config.getLong("collector.controller-interval-seconds", DEFAULT_CONTROLLER_INTERVAL_SECONDS),
                    config.getLong("collector.config-interval-seconds", DEFAULT_CONFIG_INTERVAL_SECONDS),
                    config.getInt("collector.pool-size", DEFAULT_POOL_SIZE),
                    parseCounterMode(config.getString("collector.counter-mode", CounterMode.ANALYSED.name())),
                    config.getInt("collector.mel-page-size", DEFAULT_MEL_PAGE_SIZE),
                    config.getInt("collector.counter-cache-size", DEFAULT_COUNTER_CACHE_SIZE),
                    config.getBoolean("collector.health-points", false),
                    influx,
                    targets,
                    Path.of(config.getString("output.json-dir", "json-output")),
                    config.getInt("output.prometheus-port", DEFAULT_PROMETHEUS_PORT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid configuration in " + config.context() + ": " + e.getMessage(), e);
        }
    }

    private static CounterMode parseCounterMode(String value) {
        try {
            return CounterMode.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown counter mode: " + value, e);
        }
    }

    /**
     * Polling interval of a metric class.
     */
    public Duration intervalFor(MetricClass metricClass) {
        if (metricClass.configuration()) {
            return Duration.ofSeconds(configIntervalSeconds);
        }
        return switch (metricClass) {
            case DRIVE -> Duration.ofSeconds(driveIntervalSeconds);
            case CONTROLLER -> Duration.ofSeconds(controllerIntervalSeconds);
            default -> Duration.ofSeconds(intervalSeconds);
        };
    }

    /**
     * Scheduler tick: the shortest configured interval.
     */
    public Duration tickInterval() {
        long shortest = Math.min(Math.min(intervalSeconds, configIntervalSeconds),
                Math.min(driveIntervalSeconds, controllerIntervalSeconds));
        return Duration.ofSeconds(shortest);
    }

    /**
     * Read timeout of a single request: twice the performance interval.
     */
    public Duration requestTimeout() {
        return Duration.ofSeconds(intervalSeconds * 2);
    }

    /**
     * Deadline of one tick's collection tasks: twice the tick.
     */
    public Duration taskTimeout() {
        return tickInterval().multipliedBy(2);
    }
}
