package io.fullerstack.eseries.core.catalog;

import io.fullerstack.eseries.core.model.MetricClass;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static io.fullerstack.eseries.core.catalog.FieldSpec.counter;
import static io.fullerstack.eseries.core.catalog.FieldSpec.flag;
import static io.fullerstack.eseries.core.catalog.FieldSpec.gauge;
import static io.fullerstack.eseries.core.catalog.FieldSpec.integer;
import static io.fullerstack.eseries.core.catalog.FieldSpec.text;

/**
 * Static schema of one metric class: the fields extracted from each upstream record
 * and the order tag keys are written in.
 * <p>
 * Field order here is the order fields appear in every point of the class, so points
 * built from identical input serialize identically.
 * <p>
 * Per-core CPU arrays reported by controllers are not part of the schema; they are
 * lists, not scalars.
 */
public final class MetricCatalog {

    private static final Map<MetricClass, MetricCatalog> CATALOGS = new EnumMap<>(MetricClass.class);

    static {
        register(new MetricCatalog(MetricClass.DRIVE, "diskId",
                List.of("sys_id", "sys_name", "sys_tray", "sys_tray_slot"),
                List.of(
                        gauge("averageReadOpSize"),
                        gauge("averageWriteOpSize"),
                        counter("combinedIOps"),
                        gauge("combinedResponseTime"),
                        counter("combinedThroughput"),
                        counter("otherIOps"),
                        counter("readIOps"),
                        counter("readOps"),
                        counter("readPhysicalIOps"),
                        gauge("readResponseTime"),
                        counter("readThroughput"),
                        counter("writeIOps"),
                        counter("writeOps"),
                        counter("writePhysicalIOps"),
                        gauge("writeResponseTime"),
                        counter("writeThroughput"),
                        gauge("spareBlocksRemainingPercent"))));

        register(new MetricCatalog(MetricClass.INTERFACE, "interfaceId",
                List.of("sys_id", "sys_name", "interface_id", "channel_type"),
                List.of(
                        counter("readIOps"),
                        counter("writeIOps"),
                        counter("otherIOps"),
                        counter("combinedIOps"),
                        counter("readThroughput"),
                        counter("writeThroughput"),
                        counter("combinedThroughput"),
                        gauge("readResponseTime"),
                        gauge("writeResponseTime"),
                        gauge("combinedResponseTime"),
                        gauge("averageReadOpSize"),
                        gauge("averageWriteOpSize"),
                        counter("readOps"),
                        counter("writeOps"),
                        gauge("queueDepthTotal"),
                        gauge("queueDepthMax"),
                        counter("channelErrorCounts"))));

        register(new MetricCatalog(MetricClass.SYSTEM, null,
                List.of("sys_id", "sys_name"),
                List.of(
                        gauge("maxCpuUtilization"),
                        gauge("cpuAvgUtilization"))));

        register(new MetricCatalog(MetricClass.VOLUME, "volumeName",
                List.of("sys_id", "sys_name", "vol_name"),
                List.of(
                        gauge("averageReadOpSize"),
                        gauge("averageWriteOpSize"),
                        counter("combinedIOps"),
                        gauge("combinedResponseTime"),
                        counter("combinedThroughput"),
                        gauge("flashCacheHitPct"),
                        counter("flashCacheReadHitBytes"),
                        counter("flashCacheReadHitOps"),
                        gauge("flashCacheReadResponseTime"),
                        gauge("flashCacheReadThroughput"),
                        counter("otherIOps"),
                        gauge("queueDepthMax"),
                        gauge("queueDepthTotal"),
                        gauge("readCacheUtilization"),
                        counter("readHitBytes"),
                        counter("readHitOps"),
                        counter("readIOps"),
                        counter("readOps"),
                        counter("readPhysicalIOps"),
                        gauge("readResponseTime"),
                        counter("readThroughput"),
                        gauge("writeCacheUtilization"),
                        counter("writeHitBytes"),
                        counter("writeHitOps"),
                        counter("writeIOps"),
                        counter("writeOps"),
                        counter("writePhysicalIOps"),
                        gauge("writeResponseTime"),
                        counter("writeThroughput"))));

        register(new MetricCatalog(MetricClass.CONTROLLER, "controllerId",
                List.of("sys_id", "sys_name", "controller_id"),
                List.of(
                        text("observedTime"),
                        integer("observedTimeInMS"),
                        counter("readIOps"),
                        counter("writeIOps"),
                        counter("otherIOps"),
                        counter("combinedIOps"),
                        counter("readThroughput"),
                        counter("writeThroughput"),
                        counter("combinedThroughput"),
                        gauge("readResponseTime"),
                        gauge("readResponseTimeStdDev"),
                        gauge("writeResponseTime"),
                        gauge("writeResponseTimeStdDev"),
                        gauge("combinedResponseTime"),
                        gauge("combinedResponseTimeStdDev"),
                        gauge("averageReadOpSize"),
                        gauge("averageWriteOpSize"),
                        counter("readOps"),
                        counter("writeOps"),
                        counter("readPhysicalIOps"),
                        counter("writePhysicalIOps"),
                        gauge("cacheHitBytesPercent"),
                        gauge("randomIosPercent"),
                        gauge("mirrorBytesPercent"),
                        gauge("fullStripeWritesBytesPercent"),
                        gauge("maxCpuUtilization"),
                        gauge("cpuAvgUtilization"),
                        gauge("raid0BytesPercent"),
                        gauge("raid1BytesPercent"),
                        gauge("raid5BytesPercent"),
                        gauge("raid6BytesPercent"),
                        gauge("ddpBytesPercent"),
                        gauge("readHitResponseTime"),
                        gauge("readHitResponseTimeStdDev"),
                        gauge("writeHitResponseTime"),
                        gauge("writeHitResponseTimeStdDev"),
                        gauge("combinedHitResponseTime"),
                        gauge("combinedHitResponseTimeStdDev"))));

        register(new MetricCatalog(MetricClass.MEL, "sequenceNumber",
                List.of("sys_id", "sys_name", "event_type", "time_stamp", "category",
                        "priority", "critical", "asc", "ascq"),
                List.of(
                        text("id"),
                        text("description"),
                        text("location"),
                        integer("sequenceNumber"))));

        register(new MetricCatalog(MetricClass.FAILURE, null,
                List.of("sys_id", "sys_name", "failure_type", "object_ref", "object_type", "active"),
                List.of(
                        text("name_of"),
                        text("type_of"))));

        register(new MetricCatalog(MetricClass.POWER, null,
                List.of("sys_id", "sys_name"),
                List.of(gauge("totalPower"))));

        register(new MetricCatalog(MetricClass.TEMPERATURE, "thermalSensorRef",
                List.of("sys_id", "sys_name", "sensor", "sensor_seq"),
                List.of(gauge("temp"))));

        // Inventory; byte sizes arrive as decimal strings
        register(new MetricCatalog(MetricClass.STORAGE_POOL, "volumeGroupRef",
                List.of("sys_id", "sys_name", "pool_id", "pool_name", "raid_level"),
                List.of(
                        integer("totalRaidedSpace"),
                        integer("usedSpace"),
                        integer("freeSpace"),
                        integer("sequenceNum"),
                        text("state"),
                        text("raidStatus"),
                        flag("diskPool"),
                        flag("offline"))));

        register(new MetricCatalog(MetricClass.VOLUME_CONFIG, "volumeRef",
                List.of("sys_id", "sys_name", "volume_id", "volume_name", "pool_id"),
                List.of(
                        integer("capacity"),
                        integer("totalSizeInBytes"),
                        integer("segmentSize"),
                        text("raidLevel"),
                        text("status"),
                        text("wwn"),
                        text("currentManager"),
                        flag("mapped"))));

        register(new MetricCatalog(MetricClass.HOST, "hostRef",
                List.of("sys_id", "sys_name", "host_id", "host_name"),
                List.of(
                        integer("hostTypeIndex"),
                        text("clusterRef"),
                        integer("initiatorCount"),
                        flag("isLargeBlockFormatHost"))));

        register(new MetricCatalog(MetricClass.HOST_GROUP, "clusterRef",
                List.of("sys_id", "sys_name", "host_group_id", "host_group_name"),
                List.of(
                        integer("hostCount"),
                        flag("isSAControlled"),
                        flag("confirmLUNMappingCreation"))));

        register(new MetricCatalog(MetricClass.VOLUME_MAPPING, "lunMappingRef",
                List.of("sys_id", "sys_name", "mapping_id", "map_type"),
                List.of(
                        integer("lun"),
                        text("volumeRef"),
                        text("mapRef"),
                        integer("perms"))));

        register(new MetricCatalog(MetricClass.TRAY, "trayRef",
                List.of("sys_id", "sys_name", "tray_id", "serial_number"),
                List.of(
                        integer("trayId"),
                        text("partNumber"),
                        text("manufacturer"),
                        text("status"))));

        register(new MetricCatalog(MetricClass.INTERFACE_CONFIG, "interfaceRef",
                List.of("sys_id", "sys_name", "interface_id", "channel_type", "interface_type"),
                List.of(
                        text("controllerRef"),
                        integer("channel"),
                        integer("revision"),
                        text("linkStatus"),
                        text("currentInterfaceSpeed"),
                        flag("isDegraded"))));
    }

    private final MetricClass metricClass;
    private final String entityKey;
    private final List<String> tagKeys;
    private final List<FieldSpec> fields;
    private final List<FieldSpec> counterFields;

    private MetricCatalog(MetricClass metricClass, String entityKey, List<String> tagKeys, List<FieldSpec> fields) {
        this.metricClass = metricClass;
        this.entityKey = entityKey;
        this.tagKeys = List.copyOf(tagKeys);
        this.fields = List.copyOf(fields);
        this.counterFields = fields.stream()
                .filter(f -> f.kind() == FieldKind.COUNTER)
                .toList();
    }

    private static void register(MetricCatalog catalog) {
        CATALOGS.put(catalog.metricClass, catalog);
    }

    /**
     * Catalog for a metric class.
     *
     * @param metricClass Metric class
     * @return Catalog, never null
     */
    public static MetricCatalog of(MetricClass metricClass) {
        Objects.requireNonNull(metricClass, "metricClass cannot be null");
        return CATALOGS.get(metricClass);
    }

    public MetricClass metricClass() {
        return metricClass;
    }

    public String measurement() {
        return metricClass.measurement();
    }

    /**
     * Upstream record key identifying one entity of the class (volume name, interface id,
     * ...), empty for classes with one entity per system.
     */
    public Optional<String> entityKey() {
        return Optional.ofNullable(entityKey);
    }

    /**
     * Tag keys in the order they are written.
     */
    public List<String> tagKeys() {
        return tagKeys;
    }

    public List<FieldSpec> fields() {
        return fields;
    }

    public List<String> fieldNames() {
        return fields.stream().map(FieldSpec::name).toList();
    }

    public List<FieldSpec> counterFields() {
        return counterFields;
    }

    /**
     * Fields a downsample rule can average.
     */
    public List<FieldSpec> aggregatableFields() {
        return fields.stream().filter(FieldSpec::aggregatable).toList();
    }

    public Optional<FieldSpec> field(String name) {
        return fields.stream().filter(f -> f.name().equals(name)).findFirst();
    }

    @Override
    public String toString() {
        return "MetricCatalog[" + metricClass + ", " + fields.size() + " fields]";
    }
}
