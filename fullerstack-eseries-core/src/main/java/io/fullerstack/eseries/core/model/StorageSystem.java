package io.fullerstack.eseries.core.model;

import java.util.Objects;

/**
 * A monitored E-Series storage system.
 * <p>
 * Immutable for the lifetime of the process. The identifier is the array's WWN
 * as reported by the management API and is used as the {@code sys_id} tag on every
 * point written for the system.
 *
 * @param sysId   Storage system WWN (e.g., "600A098000F63714000000005E79C17C")
 * @param sysName User-configured array name (e.g., "dc1r226-elk")
 */
public record StorageSystem(
        String sysId,
        String sysName
) {
    /**
     * Compact constructor with validation.
     */
    public StorageSystem {
        Objects.requireNonNull(sysId, "sysId cannot be null");
        Objects.requireNonNull(sysName, "sysName cannot be null");

        if (sysId.isBlank()) {
            throw new IllegalArgumentException("sysId cannot be blank");
        }
    }

    /**
     * Parse a {@code wwn:name} pair as used in the {@code eseries.systems} property.
     * <p>
     * A bare WWN uses the WWN as the name.
     *
     * @param spec System specification (e.g., "600A0980...:dc1r226-elk")
     * @return Parsed storage system
     */
    public static StorageSystem parse(String spec) {
        Objects.requireNonNull(spec, "spec cannot be null");
        String trimmed = spec.trim();
        int colon = trimmed.indexOf(':');
        if (colon < 0) {
            return new StorageSystem(trimmed, trimmed);
        }
        return new StorageSystem(trimmed.substring(0, colon).trim(), trimmed.substring(colon + 1).trim());
    }
}
