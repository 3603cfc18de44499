package io.fullerstack.eseries.collector.influx;

import com.fasterxml.jackson.databind.JsonNode;
import io.fullerstack.eseries.core.failures.FailureStateStore;
import io.fullerstack.eseries.core.model.FailureRecord;
import io.fullerstack.eseries.core.model.MetricClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Last written state of every failure tuple of a system, read back from the
 * {@code failures} measurement.
 * <p>
 * Grouping by the tuple tags and the {@code active} tag returns one series per
 * (tuple, active) combination with its latest time; the reconciler keeps the most recent
 * of the two for each tuple.
 */
public class InfluxFailureStateStore implements FailureStateStore {
    private static final Logger logger = LoggerFactory.getLogger(InfluxFailureStateStore.class);

    private final InfluxQueryClient client;

    public InfluxFailureStateStore(InfluxQueryClient client) {
        this.client = Objects.requireNonNull(client, "client cannot be null");
    }

    @Override
    public List<FailureRecord> lastKnownFailures(String sysId) {
        String statement = "SELECT last(\"type_of\") FROM "
            + InfluxQueryClient.identifier(MetricClass.FAILURE.measurement())
            + " WHERE \"sys_id\"=" + InfluxQueryClient.literal(sysId)
            + " GROUP BY \"failure_type\",\"object_ref\",\"object_type\",\"active\"";
        JsonNode result = client.query(statement);

        List<FailureRecord> records = new ArrayList<>();
        for (JsonNode series : InfluxQueryClient.series(result)) {
            JsonNode tags = series.path("tags");
            String failureType = tags.path("failure_type").asText("");
            if (failureType.isEmpty()) {
                continue;
            }
            JsonNode row = series.path("values").path(0);
            if (!row.path(0).isNumber()) {
                continue;
            }
            records.add(new FailureRecord(
                sysId,
                failureType,
                tags.path("object_ref").asText(""),
                tags.path("object_type").asText(""),
                FailureRecord.parseActive(tags.path("active").asText(null)),
                Instant.ofEpochSecond(row.path(0).asLong())));
        }
        logger.debug("Loaded {} failure states of {} from the backend", records.size(), sysId);
        return records;
    }
}
