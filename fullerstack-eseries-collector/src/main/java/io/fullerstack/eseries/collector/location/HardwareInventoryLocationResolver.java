package io.fullerstack.eseries.collector.location;

import com.fasterxml.jackson.databind.JsonNode;
import io.fullerstack.eseries.collector.client.ApiClient;
import io.fullerstack.eseries.collector.client.ApiPaths;
import io.fullerstack.eseries.core.model.DriveLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Resolves drive locations from the {@code hardware-inventory} resource.
 * <p>
 * Trays are listed with their {@code trayRef} and numeric {@code trayId}; drives carry the
 * {@code trayRef} and slot under {@code physicalLocation}. Drives whose tray cannot be
 * matched are left out and logged.
 */
public class HardwareInventoryLocationResolver implements DiskLocationResolver {
    private static final Logger logger = LoggerFactory.getLogger(HardwareInventoryLocationResolver.class);

    private final ApiClient apiClient;
    private final Duration timeout;

    public HardwareInventoryLocationResolver(ApiClient apiClient, Duration timeout) {
        this.apiClient = Objects.requireNonNull(apiClient, "apiClient cannot be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout cannot be null");
    }

    @Override
    public Map<String, DriveLocation> locate(String sysId) {
        JsonNode inventory = apiClient.get(ApiPaths.hardwareInventory(sysId), timeout);

        Map<String, Integer> trayIds = new HashMap<>();
        for (JsonNode tray : inventory.path("trays")) {
            JsonNode trayId = tray.get("trayId");
            if (tray.hasNonNull("trayRef") && trayId != null && trayId.canConvertToInt()) {
                trayIds.put(tray.get("trayRef").asText(), trayId.asInt());
            }
        }

        Map<String, DriveLocation> locations = new HashMap<>();
        for (JsonNode drive : inventory.path("drives")) {
            String driveRef = drive.path("driveRef").asText(null);
            JsonNode physical = drive.path("physicalLocation");
            Integer trayId = trayIds.get(physical.path("trayRef").asText(""));
            JsonNode slot = physical.get("slot");

            if (driveRef == null || trayId == null || slot == null || !slot.canConvertToInt()) {
                logger.warn("Cannot match drive {} to a tray on {}", driveRef, sysId);
                continue;
            }
            locations.put(driveRef, new DriveLocation(trayId, slot.asInt()));
        }

        logger.debug("Resolved {} drive locations on {}", locations.size(), sysId);
        return locations;
    }
}
