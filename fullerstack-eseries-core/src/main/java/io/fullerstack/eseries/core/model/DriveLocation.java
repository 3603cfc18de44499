package io.fullerstack.eseries.core.model;

import java.util.Locale;

/**
 * Physical location of a drive: tray id and slot within the tray.
 */
public record DriveLocation(
        int trayId,
        int slot
) {
    /**
     * Used when a drive cannot be matched to a tray.
     */
    public static final DriveLocation UNKNOWN = new DriveLocation(99, 999);

    /**
     * Tray tag value, zero padded to two digits.
     */
    public String trayTag() {
        return String.format(Locale.ROOT, "%02d", trayId);
    }

    /**
     * Slot tag value, zero padded to three digits.
     */
    public String slotTag() {
        return String.format(Locale.ROOT, "%03d", slot);
    }
}
