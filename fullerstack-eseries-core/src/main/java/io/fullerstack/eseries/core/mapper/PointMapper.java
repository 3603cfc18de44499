package io.fullerstack.eseries.core.mapper;

import com.fasterxml.jackson.databind.JsonNode;
import io.fullerstack.eseries.core.catalog.FieldSpec;
import io.fullerstack.eseries.core.catalog.MetricCatalog;
import io.fullerstack.eseries.core.model.FieldValue;
import io.fullerstack.eseries.core.model.MetricClass;
import io.fullerstack.eseries.core.model.Point;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Converts raw upstream records into normalized {@link Point}s.
 * <p>
 * Guarantees:
 * <ul>
 *   <li>every catalog field of the class is present in the point, missing values
 *       become {@link FieldValue#absent()}</li>
 *   <li>coercion never throws; unparseable values become absent and are logged at WARN</li>
 *   <li>tags follow the catalog order, extra tags follow alphabetically, blank tags are dropped</li>
 *   <li>timestamps are truncated to whole seconds</li>
 * </ul>
 * Stateless and thread-safe.
 */
public class PointMapper {
    private static final Logger logger = LoggerFactory.getLogger(PointMapper.class);

    private final Clock clock;

    public PointMapper() {
        this(Clock.systemUTC());
    }

    public PointMapper(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    /**
     * Map a record using the current time as the point timestamp.
     */
    public Point map(MetricClass metricClass, JsonNode record, TagExtractor tagExtractor) {
        return map(metricClass, record, tagExtractor, clock.instant());
    }

    /**
     * Map one raw record of the given class into a point.
     *
     * @param metricClass  Class of the record
     * @param record       Raw JSON object from the API; a null or non-object record yields
     *                     a point with every field absent
     * @param tagExtractor Derives the tags from the record
     * @param timestamp    Point time
     * @return Normalized point
     */
    public Point map(MetricClass metricClass, JsonNode record, TagExtractor tagExtractor, Instant timestamp) {
        Objects.requireNonNull(metricClass, "metricClass cannot be null");
        Objects.requireNonNull(tagExtractor, "tagExtractor cannot be null");
        Objects.requireNonNull(timestamp, "timestamp cannot be null");

        MetricCatalog catalog = metricClass.catalog();
        Map<String, FieldValue> fields = new LinkedHashMap<>();
        for (FieldSpec spec : catalog.fields()) {
            JsonNode raw = record == null ? null : record.get(spec.name());
            fields.put(spec.name(), coerce(metricClass, spec, raw));
        }

        Map<String, String> tags = orderTags(catalog, tagExtractor.tags(record));
        return new Point(catalog.measurement(), tags, fields, timestamp);
    }

    /**
     * Order tags by the catalog's declared keys, then remaining keys alphabetically.
     * Null and blank values are dropped.
     */
    static Map<String, String> orderTags(MetricCatalog catalog, Map<String, String> extracted) {
        Map<String, String> ordered = new LinkedHashMap<>();
        if (extracted == null) {
            return ordered;
        }
        for (String key : catalog.tagKeys()) {
            String value = extracted.get(key);
            if (value != null && !value.isBlank()) {
                ordered.put(key, value);
            }
        }
        Map<String, String> extras = new TreeMap<>();
        extracted.forEach((key, value) -> {
            if (!ordered.containsKey(key) && !catalog.tagKeys().contains(key)
                    && value != null && !value.isBlank()) {
                extras.put(key, value);
            }
        });
        ordered.putAll(extras);
        return ordered;
    }

    /**
     * Coerce a raw JSON value to the declared field type.
     */
    static FieldValue coerce(MetricClass metricClass, FieldSpec spec, JsonNode raw) {
        if (raw == null || raw.isNull() || raw.isMissingNode()) {
            logger.debug("{}.{} missing from payload", metricClass, spec.name());
            return FieldValue.absent();
        }

        FieldValue value = switch (spec.type()) {
            case FLOAT -> toFloat(raw);
            case INTEGER -> toInteger(raw);
            case STRING -> toText(raw);
            case BOOLEAN -> toBool(raw);
        };

        if (!value.isPresent()) {
            logger.warn("Cannot coerce {}.{} value '{}' to {}", metricClass, spec.name(), raw, spec.type());
        }
        return value;
    }

    private static FieldValue toFloat(JsonNode raw) {
        double parsed;
        if (raw.isNumber()) {
            parsed = raw.doubleValue();
        } else if (raw.isTextual()) {
            try {
                parsed = Double.parseDouble(raw.textValue().trim());
            } catch (NumberFormatException e) {
                return FieldValue.absent();
            }
        } else {
            return FieldValue.absent();
        }
        return Double.isFinite(parsed) ? FieldValue.of(parsed) : FieldValue.absent();
    }

    private static FieldValue toInteger(JsonNode raw) {
        if (raw.isIntegralNumber() && raw.canConvertToLong()) {
            return FieldValue.of(raw.longValue());
        }
        if (raw.isNumber()) {
            double d = raw.doubleValue();
            return Double.isFinite(d) ? FieldValue.of(Math.round(d)) : FieldValue.absent();
        }
        if (raw.isTextual()) {
            String text = raw.textValue().trim();
            try {
                return FieldValue.of(Long.parseLong(text));
            } catch (NumberFormatException e) {
                try {
                    double d = Double.parseDouble(text);
                    return Double.isFinite(d) ? FieldValue.of(Math.round(d)) : FieldValue.absent();
                } catch (NumberFormatException ignored) {
                    return FieldValue.absent();
                }
            }
        }
        return FieldValue.absent();
    }

    private static FieldValue toText(JsonNode raw) {
        if (raw.isValueNode()) {
            return FieldValue.of(raw.asText());
        }
        return FieldValue.absent();
    }

    private static FieldValue toBool(JsonNode raw) {
        if (raw.isBoolean()) {
            return FieldValue.of(raw.booleanValue());
        }
        if (raw.isNumber()) {
            return FieldValue.of(raw.doubleValue() != 0.0);
        }
        if (raw.isTextual()) {
            String text = raw.textValue().trim().toLowerCase(Locale.ROOT);
            if (text.equals("true") || text.equals("1") || text.equals("yes")) {
                return FieldValue.of(true);
            }
            if (text.equals("false") || text.equals("0") || text.equals("no")) {
                return FieldValue.of(false);
            }
        }
        return FieldValue.absent();
    }
}
