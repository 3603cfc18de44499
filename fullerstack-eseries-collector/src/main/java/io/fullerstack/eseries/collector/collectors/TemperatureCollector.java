package io.fullerstack.eseries.collector.collectors;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.fullerstack.eseries.collector.client.ApiClient;
import io.fullerstack.eseries.collector.client.ApiException;
import io.fullerstack.eseries.collector.client.ApiPaths;
import io.fullerstack.eseries.collector.scheduler.CollectionTask;
import io.fullerstack.eseries.core.mapper.PointMapper;
import io.fullerstack.eseries.core.mapper.SensorPayload;
import io.fullerstack.eseries.core.model.MetricClass;
import io.fullerstack.eseries.core.model.Point;
import io.fullerstack.eseries.core.model.StorageSystem;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Enclosure temperature sensors, one {@code temp} point per sensor.
 * <p>
 * Readings are ordered by sensor reference, so {@code sensor_seq} stays stable between cycles.
 */
public class TemperatureCollector implements CollectionTask {

    private final StorageSystem system;
    private final ApiClient apiClient;
    private final PointMapper mapper;
    private final Duration timeout;

    public TemperatureCollector(StorageSystem system, ApiClient apiClient, PointMapper mapper, Duration timeout) {
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
        return MetricClass.TEMPERATURE;
    }

    @Override
    public List<Point> collect() {
        JsonNode response = apiClient.get(ApiPaths.enclosureTemperatures(system.sysId()),
            PowerCollector.SYMBOL_PARAMS, timeout);
        List<JsonNode> readings;
        try {
            readings = SensorPayload.from(response).readings();
        } catch (IllegalArgumentException e) {
            throw ApiException.payload("Sensor data of " + system.sysName() + ": " + e.getMessage());
        }

        List<Point> points = new ArrayList<>(readings.size());
        for (int i = 0; i < readings.size(); i++) {
            ObjectNode reading = ((ObjectNode) readings.get(i)).deepCopy();
            JsonNode current = reading.get("currentTemp");
            if (current != null) {
                reading.set("temp", current);
            }
            String sequence = "sensor_" + i;
            points.add(mapper.map(MetricClass.TEMPERATURE, reading, record -> {
                Map<String, String> tags = SystemTags.base(system);
                tags.put("sensor", SystemTags.text(record, "thermalSensorRef"));
                tags.put("sensor_seq", sequence);
                return tags;
            }));
        }
        return points;
    }
}
