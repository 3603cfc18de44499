package io.fullerstack.eseries.collector.location;

import io.fullerstack.eseries.core.model.DriveLocation;

import java.util.Map;

/**
 * Resolves the physical location of every drive of a system.
 */
@FunctionalInterface
public interface DiskLocationResolver {

    /**
     * @param sysId Storage system WWN
     * @return Drive reference to tray id and slot
     */
    Map<String, DriveLocation> locate(String sysId);
}
