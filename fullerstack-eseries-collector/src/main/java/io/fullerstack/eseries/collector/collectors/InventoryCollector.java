package io.fullerstack.eseries.collector.collectors;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.fullerstack.eseries.collector.client.ApiClient;
import io.fullerstack.eseries.collector.client.ApiException;
import io.fullerstack.eseries.collector.client.ApiPaths;
import io.fullerstack.eseries.collector.scheduler.CollectionTask;
import io.fullerstack.eseries.core.mapper.PointMapper;
import io.fullerstack.eseries.core.model.MetricClass;
import io.fullerstack.eseries.core.model.Point;
import io.fullerstack.eseries.core.model.StorageSystem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Collects one inventory class (storage pools, volumes, hosts, host groups, volume
 * mappings, trays, interfaces) of a system.
 * <p>
 * Inventory points carry identity and capacity attributes rather than rates. A few
 * fields are derived before mapping:
 * <ul>
 *   <li>{@code initiatorCount} of a host, from its initiator list</li>
 *   <li>{@code hostCount} of a host group, from the hosts resource</li>
 *   <li>interface details nested under {@code ioInterfaceTypeData.<type>}, lifted to the record</li>
 * </ul>
 */
public class InventoryCollector implements CollectionTask {
    private static final Logger logger = LoggerFactory.getLogger(InventoryCollector.class);

    private final StorageSystem system;
    private final MetricClass metricClass;
    private final ApiClient apiClient;
    private final PointMapper mapper;
    private final Duration timeout;
    private final Clock clock;

    public InventoryCollector(
        StorageSystem system,
        MetricClass metricClass,
        ApiClient apiClient,
        PointMapper mapper,
        Duration timeout,
        Clock clock
    ) {
        this.system = Objects.requireNonNull(system, "system cannot be null");
        this.metricClass = Objects.requireNonNull(metricClass, "metricClass cannot be null");
        this.apiClient = Objects.requireNonNull(apiClient, "apiClient cannot be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper cannot be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        resource(metricClass);
    }

    /**
     * Inventory resource of a configuration class.
     */
    public static String resource(MetricClass metricClass) {
        switch (metricClass) {
            case STORAGE_POOL:
                return "storage-pools";
            case VOLUME_CONFIG:
                return "volumes";
            case HOST:
                return "hosts";
            case HOST_GROUP:
                return "host-groups";
            case VOLUME_MAPPING:
                return "volume-mappings";
            case TRAY:
                return "tray";
            case INTERFACE_CONFIG:
                return "interfaces";
            default:
                throw new IllegalArgumentException(metricClass + " has no inventory resource");
        }
    }

    @Override
    public StorageSystem system() {
        return system;
    }

    @Override
    public MetricClass metricClass() {
        return metricClass;
    }

    @Override
    public List<Point> collect() {
        String path = ApiPaths.configuration(system.sysId(), resource(metricClass));
        List<JsonNode> records = SystemTags.records(apiClient.get(path, timeout));
        Map<String, Integer> hostsPerGroup = metricClass == MetricClass.HOST_GROUP ? hostsPerGroup() : Map.of();
        Instant now = clock.instant();

        List<Point> points = new ArrayList<>();
        for (JsonNode record : records) {
            try {
                JsonNode enriched = enrich(record, hostsPerGroup);
                points.add(mapper.map(metricClass, enriched, this::tags, now));
            } catch (RuntimeException e) {
                logger.error("Failed to map {} record of {}", metricClass, system.sysName(), e);
            }
        }

        logger.info("Collected {} {} records of {}", points.size(), metricClass, system.sysName());
        return points;
    }

    JsonNode enrich(JsonNode record, Map<String, Integer> hostsPerGroup) {
        if (!record.isObject()) {
            return record;
        }
        ObjectNode copy = ((ObjectNode) record).deepCopy();
        switch (metricClass) {
            case HOST -> {
                JsonNode initiators = record.path("initiators");
                if (initiators.isArray()) {
                    copy.put("initiatorCount", initiators.size());
                }
            }
            case HOST_GROUP -> {
                String ref = SystemTags.text(record, "clusterRef");
                if (ref != null && !hostsPerGroup.isEmpty()) {
                    copy.put("hostCount", hostsPerGroup.getOrDefault(ref, 0));
                }
            }
            case INTERFACE_CONFIG -> liftInterfaceDetails(copy);
            default -> {
            }
        }
        return copy;
    }

    /**
     * Copies scalar values of {@code ioInterfaceTypeData.<interfaceType>} onto the record
     * without replacing keys it already has.
     */
    private static void liftInterfaceDetails(ObjectNode record) {
        JsonNode typeData = record.path("ioInterfaceTypeData");
        String type = SystemTags.text(typeData, "interfaceType");
        if (type == null) {
            return;
        }
        JsonNode details = typeData.path(type);
        Iterator<Map.Entry<String, JsonNode>> entries = details.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            if (entry.getValue().isValueNode() && !record.has(entry.getKey())) {
                record.set(entry.getKey(), entry.getValue());
            }
        }
    }

    /**
     * Number of hosts per host group ref; empty when the hosts resource cannot be read, in
     * which case {@code hostCount} stays absent.
     */
    Map<String, Integer> hostsPerGroup() {
        Map<String, Integer> counts = new HashMap<>();
        try {
            JsonNode hosts = apiClient.get(ApiPaths.configuration(system.sysId(), resource(MetricClass.HOST)), timeout);
            for (JsonNode host : SystemTags.records(hosts)) {
                String ref = SystemTags.text(host, "clusterRef");
                if (ref != null) {
                    counts.merge(ref, 1, Integer::sum);
                }
            }
        } catch (ApiException e) {
            logger.warn("Could not count hosts per group of {}: {}", system.sysName(), e.getMessage());
        }
        return counts;
    }

    Map<String, String> tags(JsonNode record) {
        Map<String, String> tags = SystemTags.base(system);
        switch (metricClass) {
            case STORAGE_POOL -> {
                tags.put("pool_id", firstText(record, "volumeGroupRef", "id"));
                tags.put("pool_name", firstText(record, "label", "name"));
                tags.put("raid_level", SystemTags.text(record, "raidLevel"));
            }
            case VOLUME_CONFIG -> {
                tags.put("volume_id", firstText(record, "volumeRef", "id"));
                tags.put("volume_name", firstText(record, "label", "name"));
                tags.put("pool_id", SystemTags.text(record, "volumeGroupRef"));
            }
            case HOST -> {
                tags.put("host_id", firstText(record, "hostRef", "id"));
                tags.put("host_name", firstText(record, "label", "name"));
            }
            case HOST_GROUP -> {
                tags.put("host_group_id", firstText(record, "clusterRef", "id"));
                tags.put("host_group_name", firstText(record, "label", "name"));
            }
            case VOLUME_MAPPING -> {
                tags.put("mapping_id", firstText(record, "lunMappingRef", "id"));
                tags.put("map_type", SystemTags.text(record, "type"));
            }
            case TRAY -> {
                tags.put("tray_id", SystemTags.text(record, "trayId"));
                tags.put("serial_number", SystemTags.text(record, "serialNumber"));
            }
            case INTERFACE_CONFIG -> {
                tags.put("interface_id", firstText(record, "interfaceRef", "id"));
                tags.put("channel_type", SystemTags.text(record, "channelType"));
                tags.put("interface_type", SystemTags.text(record.path("ioInterfaceTypeData"), "interfaceType"));
            }
            default -> {
            }
        }
        return tags;
    }

    private static String firstText(JsonNode record, String key, String fallback) {
        String value = SystemTags.text(record, key);
        return value == null || value.isBlank() ? SystemTags.text(record, fallback) : value;
    }
}
