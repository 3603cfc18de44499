package io.fullerstack.eseries.collector.sink;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.fullerstack.eseries.core.model.FieldValue;
import io.fullerstack.eseries.core.model.Point;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Writes every batch as a JSON array file in a directory, for debugging and replay.
 * <p>
 * File names are {@code <measurement>-<epochMillis>-<seq>.json}. Absent fields are
 * written as JSON null so the file shows the full schema.
 */
public class JsonFileSink implements MetricsSink {
    private static final Logger logger = LoggerFactory.getLogger(JsonFileSink.class);

    private final Path directory;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong();

    public JsonFileSink(Path directory, ObjectMapper objectMapper) {
        this(directory, objectMapper, Clock.systemUTC());
    }

    public JsonFileSink(Path directory, ObjectMapper objectMapper, Clock clock) {
        this.directory = Objects.requireNonNull(directory, "directory cannot be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    @Override
    public void write(List<Point> batch) {
        if (batch.isEmpty()) {
            return;
        }
        ArrayNode array = objectMapper.createArrayNode();
        for (Point point : batch) {
            array.add(toJson(point));
        }

        Path file = directory.resolve(batch.get(0).measurement() + "-" + clock.millis()
            + "-" + sequence.incrementAndGet() + ".json");
        try {
            Files.createDirectories(directory);
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), array);
        } catch (IOException e) {
            throw new SinkException("Could not write " + file + ": " + e.getMessage(), e);
        }
        logger.debug("Wrote {} points to {}", batch.size(), file);
    }

    ObjectNode toJson(Point point) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("measurement", point.measurement());
        ObjectNode tags = node.putObject("tags");
        point.tags().forEach(tags::put);
        ObjectNode fields = node.putObject("fields");
        point.fields().forEach((name, value) -> putField(fields, name, value));
        node.put("time", point.timestamp().getEpochSecond());
        return node;
    }

    private static void putField(ObjectNode fields, String name, FieldValue value) {
        if (value instanceof FieldValue.FloatValue f) {
            fields.put(name, f.value());
        } else if (value instanceof FieldValue.IntegerValue i) {
            fields.put(name, i.value());
        } else if (value instanceof FieldValue.BoolValue b) {
            fields.put(name, b.value());
        } else if (value instanceof FieldValue.TextValue t) {
            fields.put(name, t.value());
        } else {
            fields.putNull(name);
        }
    }

    @Override
    public String name() {
        return "json";
    }
}
