package io.fullerstack.eseries.core.model;

import io.fullerstack.eseries.core.catalog.MetricCatalog;

/**
 * Classes of data collected from a storage system.
 * <p>
 * Each class maps to one measurement in the metrics backend, has its own catalog of
 * fields and tag keys ({@link MetricCatalog}) and its own polling interval.
 * <p>
 * Configuration classes describe the array's inventory (pools, volumes, hosts, mappings,
 * trays, interfaces). They change rarely and share one long interval.
 */
public enum MetricClass {
    DRIVE("disks", true),
    INTERFACE("interface", true),
    SYSTEM("systems", true),
    VOLUME("volumes", true),
    CONTROLLER("controllers", true),
    MEL("major_event_log", false),
    FAILURE("failures", false),
    POWER("power", true),
    // averaging readings of distinct sensors into one series is meaningless
    TEMPERATURE("temp", false),
    STORAGE_POOL("config_storage_pools", false, true),
    VOLUME_CONFIG("config_volumes", false, true),
    HOST("config_hosts", false, true),
    HOST_GROUP("config_host_groups", false, true),
    VOLUME_MAPPING("config_volume_mappings", false, true),
    TRAY("config_trays", false, true),
    INTERFACE_CONFIG("config_interfaces", false, true);

    private final String measurement;
    private final boolean downsampled;
    private final boolean configuration;

    MetricClass(String measurement, boolean downsampled) {
        this(measurement, downsampled, false);
    }

    MetricClass(String measurement, boolean downsampled, boolean configuration) {
        this.measurement = measurement;
        this.downsampled = downsampled;
        this.configuration = configuration;
    }

    /**
     * Measurement name written to the backend.
     */
    public String measurement() {
        return measurement;
    }

    /**
     * Whether long-term downsample rules are declared for this class.
     */
    public boolean downsampled() {
        return downsampled;
    }

    /**
     * Whether the class is inventory collected at the configuration interval.
     */
    public boolean configuration() {
        return configuration;
    }

    /**
     * Static catalog of fields and tag keys for this class.
     */
    public MetricCatalog catalog() {
        return MetricCatalog.of(this);
    }
}
