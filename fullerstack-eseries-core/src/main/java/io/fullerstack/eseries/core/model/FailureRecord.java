package io.fullerstack.eseries.core.model;

import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

/**
 * Last known state of one failure tuple on one system.
 *
 * @param sysId          Storage system WWN
 * @param failureType    Failure type reported by the array (e.g., "driveFailed")
 * @param objectRef      Reference of the affected object
 * @param objectType     Type of the affected object (e.g., "drive")
 * @param active         Whether the failure is currently active
 * @param lastTransition Time of the last activation or resolution
 */
public record FailureRecord(
        String sysId,
        String failureType,
        String objectRef,
        String objectType,
        boolean active,
        Instant lastTransition
) {
    public FailureRecord {
        Objects.requireNonNull(sysId, "sysId cannot be null");
        Objects.requireNonNull(failureType, "failureType cannot be null");
        Objects.requireNonNull(lastTransition, "lastTransition cannot be null");
        objectRef = objectRef == null ? "" : objectRef;
        objectType = objectType == null ? "" : objectType;
    }

    public FailureKey key() {
        return new FailureKey(failureType, objectRef, objectType);
    }

    public FailureRecord withActive(boolean nowActive, Instant at) {
        return new FailureRecord(sysId, failureType, objectRef, objectType, nowActive, at);
    }

    /**
     * Normalize the stored representation of the active flag.
     * <p>
     * Earlier writers stored the flag as a boolean field or as the tag strings
     * "True"/"False"; both must compare equal.
     *
     * @param raw Boolean, String or Number as read back from the store, may be null
     * @return true for {@code true}, "true" (any case), "1", "yes" or a non-zero number
     */
    public static boolean parseActive(Object raw) {
        if (raw == null) {
            return false;
        }
        if (raw instanceof Boolean flag) {
            return flag;
        }
        if (raw instanceof Number number) {
            return number.doubleValue() != 0.0;
        }
        String text = raw.toString().trim().toLowerCase(Locale.ROOT);
        return text.equals("true") || text.equals("1") || text.equals("yes");
    }
}
