package io.fullerstack.eseries.collector.client;

import lombok.experimental.UtilityClass;

/**
 * Management API paths used by the collectors.
 */
@UtilityClass
public class ApiPaths {

    public static final String STORAGE_SYSTEMS = "/devmgr/v2/storage-systems";

    public static String system(String sysId) {
        return STORAGE_SYSTEMS + "/" + sysId;
    }

    /**
     * Statistics resource of a system, e.g. {@code analysed-volume-statistics}.
     */
    public static String statistics(String sysId, String resource) {
        return system(sysId) + "/" + resource;
    }

    /**
     * Inventory resource of a system, e.g. {@code storage-pools} or {@code host-groups}.
     */
    public static String configuration(String sysId, String resource) {
        return system(sysId) + "/" + resource;
    }

    public static String hardwareInventory(String sysId) {
        return system(sysId) + "/hardware-inventory";
    }

    public static String failures(String sysId) {
        return system(sysId) + "/failures";
    }

    public static String melEvents(String sysId) {
        return system(sysId) + "/mel-events";
    }

    public static String energyStarData(String sysId) {
        return system(sysId) + "/symbol/getEnergyStarData";
    }

    public static String enclosureTemperatures(String sysId) {
        return system(sysId) + "/symbol/getEnclosureTemperatures";
    }

    public static String driveHealthHistory(String sysId) {
        return system(sysId) + "/drives/drive-health-history";
    }

    public static String firmwareVersions(String sysId) {
        return "/devmgr/v2/firmware/embedded-firmware/" + sysId + "/versions";
    }
}
