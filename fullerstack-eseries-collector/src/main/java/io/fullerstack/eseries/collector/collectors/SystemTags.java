package io.fullerstack.eseries.collector.collectors;

import com.fasterxml.jackson.databind.JsonNode;
import io.fullerstack.eseries.core.model.StorageSystem;
import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tag helpers shared by the collectors.
 */
@UtilityClass
class SystemTags {

    /**
     * Mutable map holding {@code sys_id} and {@code sys_name}.
     */
    Map<String, String> base(StorageSystem system) {
        Map<String, String> tags = new LinkedHashMap<>();
        tags.put("sys_id", system.sysId());
        tags.put("sys_name", system.sysName());
        return tags;
    }

    /**
     * Text of a scalar record value, null when missing, JSON null or not a scalar.
     */
    String text(JsonNode record, String field) {
        if (record == null) {
            return null;
        }
        JsonNode value = record.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) {
            return null;
        }
        return value.asText();
    }

    /**
     * Elements of an array response; an object response is a single record.
     */
    List<JsonNode> records(JsonNode response) {
        List<JsonNode> records = new ArrayList<>();
        if (response == null) {
            return records;
        }
        if (response.isArray()) {
            response.forEach(records::add);
        } else if (response.isObject()) {
            records.add(response);
        }
        return records;
    }
}
