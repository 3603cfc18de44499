package io.fullerstack.eseries.core.mel;

import java.util.OptionalLong;

/**
 * Durable source of the last ingested MEL sequence number, consulted once per system when
 * the in-memory cursor is cold.
 */
@FunctionalInterface
public interface MelCursorStore {

    /**
     * @param sysId Storage system WWN
     * @return Highest sequence number already written for the system, empty if none
     */
    OptionalLong lastSequence(String sysId);

    static MelCursorStore none() {
        return sysId -> OptionalLong.empty();
    }
}
