package io.fullerstack.eseries.collector.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.fullerstack.eseries.collector.client.ApiClient;
import io.fullerstack.eseries.collector.client.HttpApiClient;
import io.fullerstack.eseries.collector.collectors.CollectionTaskFactory;
import io.fullerstack.eseries.collector.influx.InfluxFailureStateStore;
import io.fullerstack.eseries.collector.influx.InfluxMelCursorStore;
import io.fullerstack.eseries.collector.influx.InfluxQlRetentionBackend;
import io.fullerstack.eseries.collector.influx.InfluxQueryClient;
import io.fullerstack.eseries.collector.location.HardwareInventoryLocationResolver;
import io.fullerstack.eseries.collector.retention.RetentionPlanner;
import io.fullerstack.eseries.collector.scheduler.TieredScheduler;
import io.fullerstack.eseries.collector.sink.FanOutSink;
import io.fullerstack.eseries.collector.sink.InfluxLineProtocolSink;
import io.fullerstack.eseries.collector.sink.JsonFileSink;
import io.fullerstack.eseries.collector.sink.LoggingSink;
import io.fullerstack.eseries.collector.sink.MetricsSink;
import io.fullerstack.eseries.collector.sink.PrometheusSink;
import io.fullerstack.eseries.core.config.CollectorConfig;
import io.fullerstack.eseries.core.config.ConfigurationException;
import io.fullerstack.eseries.core.config.HierarchicalConfig;
import io.fullerstack.eseries.core.config.OutputTarget;
import io.fullerstack.eseries.core.delta.DeltaRateEngine;
import io.fullerstack.eseries.core.failures.ChecksumGuard;
import io.fullerstack.eseries.core.failures.FailureReconciler;
import io.fullerstack.eseries.core.failures.FailureStateStore;
import io.fullerstack.eseries.core.mapper.PointMapper;
import io.fullerstack.eseries.core.mel.MelCursorStore;
import io.fullerstack.eseries.core.mel.MelCursorTracker;
import io.fullerstack.eseries.core.model.MetricClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * E-Series metrics collector.
 * <p>
 * Configuration comes from {@code collector.properties} on the classpath, overlaid by
 * {@code collector_<profile>.properties} when the {@code eseries.profile} system property
 * or the {@code ESERIES_PROFILE} environment variable names a profile. Every key can be
 * overridden with a system property of the same name.
 * <p>
 * Startup: load configuration, wait for InfluxDB (3 attempts), apply retention policies and
 * downsample rules, wire the collectors and start the scheduler. Invalid configuration or
 * an unreachable backend exits with status 1.
 */
public class CollectorApplication {
    private static final Logger logger = LoggerFactory.getLogger(CollectorApplication.class);

    public static final String PROFILE_PROPERTY = "eseries.profile";
    public static final String PROFILE_ENV = "ESERIES_PROFILE";

    private final CollectorConfig config;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private TieredScheduler scheduler;
    private PrometheusSink prometheusSink;

    public CollectorApplication(CollectorConfig config, ObjectMapper objectMapper, Clock clock) {
        this.config = config;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public static void main(String[] args) {
        CollectorConfig config;
        try {
            config = CollectorConfig.from(loadConfig());
        } catch (ConfigurationException e) {
            logger.error("Invalid configuration: {}", e.getMessage(), e);
            System.exit(1);
            return;
        }

        CollectorApplication application = new CollectorApplication(config, new ObjectMapper(), Clock.systemUTC());
        try {
            application.start();
        } catch (RuntimeException e) {
            logger.error("Collector could not start: {}", e.getMessage(), e);
            application.stop();
            System.exit(1);
            return;
        }

        Runtime.getRuntime().addShutdownHook(new Thread(application::stop, "shutdown-hook"));
    }

    static HierarchicalConfig loadConfig() {
        String profile = System.getProperty(PROFILE_PROPERTY, System.getenv(PROFILE_ENV));
        if (profile == null || profile.isBlank()) {
            return HierarchicalConfig.global();
        }
        logger.info("Using configuration profile {}", profile);
        return HierarchicalConfig.forProfile(profile.trim());
    }

    /**
     * Prepare the backend, wire every component and start polling.
     */
    public void start() {
        logger.info("Starting E-Series collector for {} systems: {}", config.systems().size(), config.systems());
        logger.info("API endpoints: {}", config.api());
        logger.info("Output targets: {}, counter mode {}", config.outputTargets(), config.counterMode());

        boolean influx = config.outputTargets().contains(OutputTarget.INFLUX);
        InfluxQueryClient queryClient = null;
        if (influx) {
            queryClient = new InfluxQueryClient(config.influx(), objectMapper, config.requestTimeout());
            InfluxQueryClient pinged = queryClient;
            new StartupRetry().run("InfluxDB connection to " + config.influx().url(), pinged::ping);

            InfluxQlRetentionBackend retentionBackend = new InfluxQlRetentionBackend(queryClient);
            new RetentionPlanner(retentionBackend).plan(config.influx());
        }

        // State stores are only backed by InfluxDB when it is an output
        FailureStateStore failureStore = influx ? new InfluxFailureStateStore(queryClient) : FailureStateStore.empty();
        MelCursorStore melStore = influx ? new InfluxMelCursorStore(queryClient) : MelCursorStore.none();

        ApiClient apiClient = new HttpApiClient(config.api(), objectMapper);
        DeltaRateEngine deltaEngine = new DeltaRateEngine(config.counterCacheSize());
        CollectionTaskFactory taskFactory = new CollectionTaskFactory(
            apiClient,
            new PointMapper(clock),
            deltaEngine,
            new FailureReconciler(failureStore, new ChecksumGuard(), clock),
            new MelCursorTracker(melStore, config.melPageSize()),
            new HardwareInventoryLocationResolver(apiClient, config.requestTimeout()),
            config.counterMode(),
            config.requestTimeout(),
            clock);

        scheduler = TieredScheduler.fromConfig(config, taskFactory, createSink());
        if (prometheusSink != null) {
            prometheusSink.start();
        }

        // Entities not seen for two of the longest intervals are gone (e.g. deleted volumes)
        Duration staleAfter = Arrays.stream(MetricClass.values())
            .map(config::intervalFor)
            .max(Duration::compareTo)
            .orElseThrow()
            .multipliedBy(2);
        scheduler.addTickListener(report -> {
            int evicted = deltaEngine.evictOlderThan(clock.instant().minus(staleAfter));
            if (evicted > 0) {
                logger.info("Evicted {} stale counter baselines", evicted);
            }
        });

        scheduler.start();
        logger.info("E-Series collector started");
    }

    MetricsSink createSink() {
        List<MetricsSink> sinks = new ArrayList<>();
        for (OutputTarget target : config.outputTargets()) {
            switch (target) {
                case INFLUX -> sinks.add(new InfluxLineProtocolSink(config.influx(), config.requestTimeout()));
                case JSON -> sinks.add(new JsonFileSink(config.jsonDir(), objectMapper, clock));
                case LOG -> sinks.add(new LoggingSink());
                case PROMETHEUS -> {
                    prometheusSink = new PrometheusSink(config.prometheusPort());
                    sinks.add(prometheusSink);
                }
            }
        }
        return sinks.size() == 1 ? sinks.get(0) : new FanOutSink(sinks);
    }

    public void stop() {
        if (scheduler != null) {
            scheduler.shutdown();
        }
        if (prometheusSink != null) {
            prometheusSink.stop();
        }
        logger.info("E-Series collector stopped");
    }
}
