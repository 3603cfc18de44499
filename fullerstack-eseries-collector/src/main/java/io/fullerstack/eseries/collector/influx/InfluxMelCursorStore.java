package io.fullerstack.eseries.collector.influx;

import com.fasterxml.jackson.databind.JsonNode;
import io.fullerstack.eseries.core.mel.MelCursorStore;
import io.fullerstack.eseries.core.model.MetricClass;

import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Highest MEL sequence number already written for a system.
 */
public class InfluxMelCursorStore implements MelCursorStore {

    private final InfluxQueryClient client;

    public InfluxMelCursorStore(InfluxQueryClient client) {
        this.client = Objects.requireNonNull(client, "client cannot be null");
    }

    @Override
    public OptionalLong lastSequence(String sysId) {
        JsonNode result = client.query("SELECT max(\"sequenceNumber\") FROM "
            + InfluxQueryClient.identifier(MetricClass.MEL.measurement())
            + " WHERE \"sys_id\"=" + InfluxQueryClient.literal(sysId));
        List<JsonNode> series = InfluxQueryClient.series(result);
        if (series.isEmpty()) {
            return OptionalLong.empty();
        }
        JsonNode value = series.get(0).path("values").path(0).path(1);
        return value.isNumber() ? OptionalLong.of(value.asLong()) : OptionalLong.empty();
    }
}
