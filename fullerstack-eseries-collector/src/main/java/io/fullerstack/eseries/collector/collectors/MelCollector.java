package io.fullerstack.eseries.collector.collectors;

import com.fasterxml.jackson.databind.JsonNode;
import io.fullerstack.eseries.collector.client.ApiClient;
import io.fullerstack.eseries.collector.client.ApiPaths;
import io.fullerstack.eseries.collector.scheduler.BatchOutcome;
import io.fullerstack.eseries.collector.scheduler.CollectionTask;
import io.fullerstack.eseries.core.mapper.PointMapper;
import io.fullerstack.eseries.core.mel.MelCursorTracker;
import io.fullerstack.eseries.core.model.MelQuery;
import io.fullerstack.eseries.core.model.MetricClass;
import io.fullerstack.eseries.core.model.Point;
import io.fullerstack.eseries.core.model.StorageSystem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Ingests the major event log page by page.
 * <p>
 * Each cycle asks for events after the cursor. Points carry the event's own timestamp, so
 * a page that is fetched twice overwrites itself in the backend. The cursor only advances
 * after the page was written.
 */
public class MelCollector implements CollectionTask {
    private static final Logger logger = LoggerFactory.getLogger(MelCollector.class);

    private static final long NONE = Long.MIN_VALUE;

    private final StorageSystem system;
    private final ApiClient apiClient;
    private final MelCursorTracker cursorTracker;
    private final PointMapper mapper;
    private final Duration timeout;
    private final Clock clock;

    private volatile long pendingMax = NONE;

    public MelCollector(
        StorageSystem system,
        ApiClient apiClient,
        MelCursorTracker cursorTracker,
        PointMapper mapper,
        Duration timeout,
        Clock clock
    ) {
        this.system = Objects.requireNonNull(system, "system cannot be null");
        this.apiClient = Objects.requireNonNull(apiClient, "apiClient cannot be null");
        this.cursorTracker = Objects.requireNonNull(cursorTracker, "cursorTracker cannot be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper cannot be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    @Override
    public StorageSystem system() {
        return system;
    }

    @Override
    public MetricClass metricClass() {
        return MetricClass.MEL;
    }

    @Override
    public List<Point> collect() {
        pendingMax = NONE;
        MelQuery query = cursorTracker.nextQuery(system.sysId());

        Map<String, String> params = new LinkedHashMap<>();
        params.put("count", Integer.toString(query.count()));
        params.put("startSequenceNumber", Long.toString(query.startSequence()));
        JsonNode response = apiClient.get(ApiPaths.melEvents(system.sysId()), params, timeout);

        List<JsonNode> events = SystemTags.records(response);
        List<Point> points = new ArrayList<>();
        long max = NONE;
        for (JsonNode event : events) {
            try {
                points.add(mapper.map(MetricClass.MEL, event, this::tags, eventTime(event)));
                OptionalLong sequence = sequenceNumber(event);
                if (sequence.isPresent()) {
                    max = Math.max(max, sequence.getAsLong());
                }
            } catch (RuntimeException e) {
                logger.error("Failed to map MEL event of {}", system.sysName(), e);
            }
        }
        pendingMax = max;
        if (max == NONE && !events.isEmpty()) {
            logger.warn("None of {} MEL events of {} carries a readable sequenceNumber; "
                + "the cursor cannot advance and the page will be fetched again", events.size(), system.sysName());
        }

        logger.info("Fetched {} MEL events of {} starting at {}", points.size(), system.sysName(),
            query.fromBeginning() ? "the beginning" : query.startSequence());
        return points;
    }

    @Override
    public void onBatchOutcome(BatchOutcome outcome) {
        long max = pendingMax;
        pendingMax = NONE;
        if (max == NONE) {
            return;
        }
        if (outcome == BatchOutcome.WRITTEN) {
            cursorTracker.advance(system.sysId(), max);
        } else {
            logger.warn("MEL page of {} up to sequence {} not written ({}); it will be fetched again",
                system.sysName(), max, outcome);
        }
    }

    private Map<String, String> tags(JsonNode event) {
        Map<String, String> tags = SystemTags.base(system);
        tags.put("event_type", SystemTags.text(event, "eventType"));
        tags.put("time_stamp", SystemTags.text(event, "timeStamp"));
        tags.put("category", SystemTags.text(event, "category"));
        tags.put("priority", SystemTags.text(event, "priority"));
        tags.put("critical", SystemTags.text(event, "critical"));
        tags.put("asc", SystemTags.text(event, "asc"));
        tags.put("ascq", SystemTags.text(event, "ascq"));
        return tags;
    }

    /**
     * Event time from {@code timeStamp} (epoch seconds), the current time if missing.
     */
    Instant eventTime(JsonNode event) {
        OptionalLong seconds = longValue(event.get("timeStamp"));
        if (seconds.isPresent()) {
            return Instant.ofEpochSecond(seconds.getAsLong());
        }
        logger.warn("MEL event {} of {} has no usable timeStamp; using current time",
            SystemTags.text(event, "sequenceNumber"), system.sysName());
        return clock.instant();
    }

    static OptionalLong sequenceNumber(JsonNode event) {
        return longValue(event.get("sequenceNumber"));
    }

    private static OptionalLong longValue(JsonNode node) {
        if (node == null || node.isNull()) {
            return OptionalLong.empty();
        }
        if (node.isIntegralNumber()) {
            return OptionalLong.of(node.asLong());
        }
        if (node.isTextual()) {
            try {
                return OptionalLong.of(Long.parseLong(node.asText().trim()));
            } catch (NumberFormatException e) {
                return OptionalLong.empty();
            }
        }
        return OptionalLong.empty();
    }
}
