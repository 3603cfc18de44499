package io.fullerstack.eseries.collector.collectors;

import com.fasterxml.jackson.databind.JsonNode;
import io.fullerstack.eseries.collector.client.ApiClient;
import io.fullerstack.eseries.collector.client.ApiException;
import io.fullerstack.eseries.collector.client.ApiPaths;
import io.fullerstack.eseries.collector.scheduler.CollectionTask;
import io.fullerstack.eseries.core.mapper.PointMapper;
import io.fullerstack.eseries.core.mapper.PowerPayload;
import io.fullerstack.eseries.core.model.MetricClass;
import io.fullerstack.eseries.core.model.Point;
import io.fullerstack.eseries.core.model.StorageSystem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Total power consumption (W) reported by the power supplies.
 */
public class PowerCollector implements CollectionTask {
    private static final Logger logger = LoggerFactory.getLogger(PowerCollector.class);

    static final Map<String, String> SYMBOL_PARAMS = Map.of("controller", "auto", "verboseErrorResponse", "false");

    private final StorageSystem system;
    private final ApiClient apiClient;
    private final PointMapper mapper;
    private final Duration timeout;

    public PowerCollector(StorageSystem system, ApiClient apiClient, PointMapper mapper, Duration timeout) {
        this.system = Objects.requireNonNull(system, "system cannot be null");
        this.apiClient = Objects.requireNonNull(apiClient, "apiClient cannot be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper cannot be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout cannot be null");
    }

    @Override
    public StorageSystem system() {
        return system;
    }

    @Override
    public MetricClass metricClass() {
        return MetricClass.POWER;
    }

    @Override
    public List<Point> collect() {
        JsonNode response = apiClient.get(ApiPaths.energyStarData(system.sysId()), SYMBOL_PARAMS, timeout);
        PowerPayload payload;
        try {
            payload = PowerPayload.from(response);
        } catch (IllegalArgumentException e) {
            throw ApiException.payload("Power data of " + system.sysName() + ": " + e.getMessage());
        }

        Optional<JsonNode> record = payload.energyRecord();
        if (record.isEmpty()) {
            logger.warn("Empty power data for {}", system.sysName());
            return List.of();
        }
        Point point = mapper.map(MetricClass.POWER, record.get(), r -> SystemTags.base(system));
        logger.debug("Power of {}: {}", system.sysName(), point.field("totalPower"));
        return List.of(point);
    }
}
