package io.fullerstack.eseries.core.mapper;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Derives the tag set of a point from one raw upstream record.
 * <p>
 * Implementations may return tags in any order and may include null or blank values;
 * {@link PointMapper} orders them and drops the empty ones.
 */
@FunctionalInterface
public interface TagExtractor {

    Map<String, String> tags(JsonNode record);
}
