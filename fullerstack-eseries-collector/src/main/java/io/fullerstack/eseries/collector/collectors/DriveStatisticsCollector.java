package io.fullerstack.eseries.collector.collectors;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.fullerstack.eseries.collector.client.ApiClient;
import io.fullerstack.eseries.collector.client.ApiException;
import io.fullerstack.eseries.collector.client.ApiPaths;
import io.fullerstack.eseries.collector.location.DiskLocationResolver;
import io.fullerstack.eseries.core.config.CounterMode;
import io.fullerstack.eseries.core.delta.DeltaRateEngine;
import io.fullerstack.eseries.core.mapper.PointMapper;
import io.fullerstack.eseries.core.mapper.TagExtractor;
import io.fullerstack.eseries.core.model.DriveLocation;
import io.fullerstack.eseries.core.model.MetricClass;
import io.fullerstack.eseries.core.model.StorageSystem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Drive statistics tagged with tray and slot, enriched with SSD wear.
 * <p>
 * Locations come from the hardware inventory once per cycle; a drive without a location
 * is tagged {@link DriveLocation#UNKNOWN}. SSD wear ({@code spareBlocksRemainingPercent})
 * is read from the drive health history when the management firmware is 11.80 or newer
 * and matched on volume group name plus the last 12 characters of the drive WWN.
 */
public class DriveStatisticsCollector extends StatisticsCollector {
    private static final Logger logger = LoggerFactory.getLogger(DriveStatisticsCollector.class);

    static final int WEAR_MIN_MINOR_VERSION = 80;
    static final String WEAR_FIELD = "spareBlocksRemainingPercent";
    private static final int WWN_SUFFIX = 12;

    private final DiskLocationResolver locationResolver;

    public DriveStatisticsCollector(
        StorageSystem system,
        ApiClient apiClient,
        PointMapper mapper,
        DeltaRateEngine deltaEngine,
        DiskLocationResolver locationResolver,
        CounterMode counterMode,
        Duration timeout,
        Clock clock
    ) {
        super(system, MetricClass.DRIVE, apiClient, mapper, deltaEngine, counterMode, timeout, clock);
        this.locationResolver = Objects.requireNonNull(locationResolver, "locationResolver cannot be null");
    }

    @Override
    protected List<JsonNode> enrich(List<JsonNode> records) {
        Map<String, JsonNode> wear = wearByDrive();
        if (wear.isEmpty()) {
            return records;
        }

        List<JsonNode> enriched = new ArrayList<>(records.size());
        for (JsonNode record : records) {
            String key = wearKey(SystemTags.text(record, "volGroupName"), SystemTags.text(record, "diskId"));
            JsonNode spare = key == null ? null : wear.get(key);
            if (spare != null && record.isObject()) {
                ObjectNode copy = ((ObjectNode) record).deepCopy();
                copy.set(WEAR_FIELD, spare);
                enriched.add(copy);
                logger.debug("SSD wear of drive {}: {}%", SystemTags.text(record, "diskId"), spare.asText());
            } else {
                enriched.add(record);
            }
        }
        return enriched;
    }

    @Override
    protected TagExtractor cycleTags(List<JsonNode> records) {
        Map<String, DriveLocation> locations = locationResolver.locate(system.sysId());
        return record -> {
            Map<String, String> tags = SystemTags.base(system);
            String diskId = SystemTags.text(record, "diskId");
            DriveLocation location = diskId == null ? null : locations.get(diskId);
            if (location == null) {
                logger.warn("Could not find location for drive {} of {}", diskId, system.sysName());
                location = DriveLocation.UNKNOWN;
            }
            tags.put("sys_tray", location.trayTag());
            tags.put("sys_tray_slot", location.slotTag());
            return tags;
        };
    }

    /**
     * Spare block percentage per {@code volumeGroupName#wwnSuffix}, empty when the firmware
     * does not report wear or the lookup failed.
     */
    Map<String, JsonNode> wearByDrive() {
        Map<String, JsonNode> wear = new HashMap<>();
        try {
            int minor = managementMinorVersion();
            if (minor < WEAR_MIN_MINOR_VERSION) {
                logger.warn("SSD wear level ignored for {}: management firmware minor version {}",
                    system.sysName(), minor);
                return wear;
            }

            JsonNode history = apiClient.get(ApiPaths.driveHealthHistory(system.sysId()),
                Map.of("all-history", "false"), timeout);
            JsonNode stats = history.path("collections").path(0).path("ssdDriveWearStatistics");
            for (JsonNode stat : stats) {
                JsonNode spare = stat.get("spareBlockRemainingPercentage");
                String key = wearKey(SystemTags.text(stat, "volumeGroupName"), SystemTags.text(stat, "driveWwn"));
                if (key != null && spare != null && !spare.isNull()) {
                    wear.put(key, spare);
                }
            }
            logger.info("Found SSD wear data for {} drives of {}", wear.size(), system.sysName());
        } catch (ApiException e) {
            logger.warn("Could not retrieve SSD wear statistics for {}: {}", system.sysName(), e.getMessage());
        }
        return wear;
    }

    private int managementMinorVersion() {
        JsonNode versions = apiClient.get(ApiPaths.firmwareVersions(system.sysId()), timeout);
        for (JsonNode module : versions.path("codeVersions")) {
            if ("management".equals(module.path("codeModule").asText())) {
                return minorVersion(module.path("versionString").asText());
            }
        }
        return 0;
    }

    /**
     * Minor component of a version like {@code 11.80.0R2}, 0 if it cannot be parsed.
     */
    static int minorVersion(String versionString) {
        String[] parts = versionString.split("\\.");
        if (parts.length < 2) {
            return 0;
        }
        String digits = parts[1].replaceAll("\\D.*$", "");
        try {
            return digits.isEmpty() ? 0 : Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    static String wearKey(String volumeGroup, String wwn) {
        if (volumeGroup == null || volumeGroup.isBlank() || wwn == null || wwn.length() < WWN_SUFFIX) {
            return null;
        }
        return volumeGroup + "#" + wwn.substring(wwn.length() - WWN_SUFFIX);
    }
}
