package io.fullerstack.eseries.core.mapper;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Enclosure temperature response in one of its two upstream shapes.
 * <p>
 * Depending on firmware the {@code getEnclosureTemperatures} call returns either a bare
 * list of sensor readings or an object carrying the list under {@code thermalSensorData}.
 * {@link #readings()} unifies both into the same ordered list.
 */
public sealed interface SensorPayload permits SensorPayload.Readings, SensorPayload.Envelope {

    String ENVELOPE_FIELD = "thermalSensorData";
    String SENSOR_REF_FIELD = "thermalSensorRef";

    /**
     * Bare list of sensor readings.
     */
    record Readings(List<JsonNode> sensors) implements SensorPayload {
        public Readings {
            sensors = List.copyOf(Objects.requireNonNull(sensors, "sensors cannot be null"));
        }
    }

    /**
     * Object wrapping the readings list.
     */
    record Envelope(JsonNode body) implements SensorPayload {
        public Envelope {
            Objects.requireNonNull(body, "body cannot be null");
        }
    }

    /**
     * Classify a raw response.
     *
     * @param response Parsed JSON response
     * @return Matching payload shape
     * @throws IllegalArgumentException if the response is neither a list nor an object
     */
    static SensorPayload from(JsonNode response) {
        Objects.requireNonNull(response, "response cannot be null");
        if (response.isArray()) {
            List<JsonNode> sensors = new ArrayList<>();
            response.forEach(sensors::add);
            return new Readings(sensors);
        }
        if (response.isObject()) {
            return new Envelope(response);
        }
        throw new IllegalArgumentException("Unsupported sensor payload: " + response.getNodeType());
    }

    /**
     * Sensor readings ordered by ascending {@code thermalSensorRef}, so the n-th reading
     * gets the same {@code sensor_seq} tag every cycle.
     */
    default List<JsonNode> readings() {
        List<JsonNode> sensors = new ArrayList<>();
        if (this instanceof Readings list) {
            sensors.addAll(list.sensors());
        } else if (this instanceof Envelope envelope) {
            JsonNode data = envelope.body().path(ENVELOPE_FIELD);
            if (data.isArray()) {
                data.forEach(sensors::add);
            }
        }
        sensors.removeIf(node -> !node.isObject());
        sensors.sort(Comparator.comparing(node -> node.path(SENSOR_REF_FIELD).asText("")));
        return sensors;
    }
}
