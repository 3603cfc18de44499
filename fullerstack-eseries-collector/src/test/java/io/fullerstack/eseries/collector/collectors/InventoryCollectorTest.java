package io.fullerstack.eseries.collector.collectors;

import io.fullerstack.eseries.collector.client.ApiException;
import io.fullerstack.eseries.core.mapper.PointMapper;
import io.fullerstack.eseries.core.model.FieldValue;
import io.fullerstack.eseries.core.model.MetricClass;
import io.fullerstack.eseries.core.model.Point;
import io.fullerstack.eseries.core.model.StorageSystem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for InventoryCollector.
 */
class InventoryCollectorTest {

    private static final StorageSystem SYSTEM = new StorageSystem("wwn1", "array1");
    private static final String BASE = "/devmgr/v2/storage-systems/wwn1/";
    private static final Duration TIMEOUT = Duration.ofSeconds(120);
    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    private FakeApiClient api;
    private PointMapper mapper;

    @BeforeEach
    void setUp() {
        api = new FakeApiClient();
        mapper = new PointMapper(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private InventoryCollector collector(MetricClass metricClass) {
        return new InventoryCollector(SYSTEM, metricClass, api, mapper, TIMEOUT, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    // =========================================================================
    // Pools and volumes
    // =========================================================================

    @Test
    void collect_shouldMapStoragePoolsWithCapacityAsIntegers() {
        api.respond(BASE + "storage-pools", """
            [{"volumeGroupRef": "0400000060", "label": "pool_ssd", "raidLevel": "raidDiskPool",
              "totalRaidedSpace": "23991808835584", "usedSpace": "10995116277760", "freeSpace": "12996692557824",
              "sequenceNum": 7, "state": "complete", "raidStatus": "optimal", "diskPool": true, "offline": false}]
            """);

        List<Point> points = collector(MetricClass.STORAGE_POOL).collect();

        assertThat(points).singleElement().satisfies(point -> {
            assertThat(point.measurement()).isEqualTo("config_storage_pools");
            assertThat(point.tags().keySet())
                .containsExactly("sys_id", "sys_name", "pool_id", "pool_name", "raid_level");
            assertThat(point.tags())
                .containsEntry("pool_id", "0400000060")
                .containsEntry("pool_name", "pool_ssd")
                .containsEntry("raid_level", "raidDiskPool");
            assertThat(point.field("totalRaidedSpace")).isEqualTo(FieldValue.of(23_991_808_835_584L));
            assertThat(point.field("diskPool")).isEqualTo(FieldValue.of(true));
            assertThat(point.field("raidStatus")).isEqualTo(FieldValue.of("optimal"));
            assertThat(point.timestamp()).isEqualTo(NOW);
        });
    }

    @Test
    void collect_shouldFallBackToIdAndName_whenRefAndLabelMissing() {
        api.respond(BASE + "volumes", """
            [{"id": "0200000060", "name": "vol_db", "volumeGroupRef": "0400000060", "capacity": "1073741824",
              "mapped": true}]
            """);

        List<Point> points = collector(MetricClass.VOLUME_CONFIG).collect();

        assertThat(points).singleElement().satisfies(point -> {
            assertThat(point.tags())
                .containsEntry("volume_id", "0200000060")
                .containsEntry("volume_name", "vol_db")
                .containsEntry("pool_id", "0400000060");
            assertThat(point.field("capacity")).isEqualTo(FieldValue.of(1_073_741_824L));
            assertThat(point.field("mapped")).isEqualTo(FieldValue.of(true));
        });
    }

    // =========================================================================
    // Hosts and groups
    // =========================================================================

    @Test
    void collect_shouldCountHostInitiators() {
        api.respond(BASE + "hosts", """
            [{"hostRef": "8400000060", "label": "esx01", "clusterRef": "8500000060", "hostTypeIndex": 10,
              "initiators": [{"label": "iqn-a"}, {"label": "iqn-b"}]}]
            """);

        List<Point> points = collector(MetricClass.HOST).collect();

        assertThat(points).singleElement().satisfies(point -> {
            assertThat(point.tags()).containsEntry("host_name", "esx01");
            assertThat(point.field("initiatorCount")).isEqualTo(FieldValue.of(2L));
            assertThat(point.field("hostTypeIndex")).isEqualTo(FieldValue.of(10L));
        });
    }

    @Test
    void collect_shouldCountHostsPerGroup() {
        api.respond(BASE + "host-groups", """
            [{"clusterRef": "8500000060", "label": "esx_cluster"},
             {"clusterRef": "8500000061", "label": "empty_cluster"}]
            """);
        api.respond(BASE + "hosts", """
            [{"hostRef": "h1", "clusterRef": "8500000060"},
             {"hostRef": "h2", "clusterRef": "8500000060"},
             {"hostRef": "h3", "clusterRef": "0000000000000000000000000000000000000000"}]
            """);

        List<Point> points = collector(MetricClass.HOST_GROUP).collect();

        assertThat(points).extracting(p -> p.tags().get("host_group_name"))
            .containsExactly("esx_cluster", "empty_cluster");
        assertThat(points.get(0).field("hostCount")).isEqualTo(FieldValue.of(2L));
        assertThat(points.get(1).field("hostCount")).isEqualTo(FieldValue.of(0L));
    }

    @Test
    void collect_shouldLeaveHostCountAbsent_whenHostsCannotBeRead() {
        api.respond(BASE + "host-groups", "[{\"clusterRef\": \"8500000060\", \"label\": \"esx_cluster\"}]");
        api.fail(BASE + "hosts", ApiException.status(503, BASE + "hosts"));

        List<Point> points = collector(MetricClass.HOST_GROUP).collect();

        assertThat(points).singleElement()
            .satisfies(point -> assertThat(point.field("hostCount").isPresent()).isFalse());
    }

    // =========================================================================
    // Interfaces, trays, mappings
    // =========================================================================

    @Test
    void collect_shouldLiftNestedInterfaceDetails() {
        api.respond(BASE + "interfaces", """
            [{"interfaceRef": "2201000060", "channelType": "hostside", "controllerRef": "070000000000",
              "ioInterfaceTypeData": {"interfaceType": "fc",
                "fc": {"channel": 1, "linkStatus": "up", "currentInterfaceSpeed": "speed32gig",
                       "isDegraded": false, "controllerRef": "ignored"}}}]
            """);

        List<Point> points = collector(MetricClass.INTERFACE_CONFIG).collect();

        assertThat(points).singleElement().satisfies(point -> {
            assertThat(point.tags())
                .containsEntry("interface_id", "2201000060")
                .containsEntry("channel_type", "hostside")
                .containsEntry("interface_type", "fc");
            assertThat(point.field("channel")).isEqualTo(FieldValue.of(1L));
            assertThat(point.field("linkStatus")).isEqualTo(FieldValue.of("up"));
            assertThat(point.field("isDegraded")).isEqualTo(FieldValue.of(false));
            assertThat(point.field("controllerRef")).isEqualTo(FieldValue.of("070000000000"));
        });
    }

    @Test
    void collect_shouldMapTraysAndMappings() {
        api.respond(BASE + "tray", """
            [{"trayRef": "0E00000060", "trayId": 99, "serialNumber": "SHG1234", "partNumber": "E-X5730A"}]
            """);
        api.respond(BASE + "volume-mappings", """
            [{"lunMappingRef": "8800000060", "lun": 3, "type": "cluster", "volumeRef": "0200000060",
              "mapRef": "8500000060", "perms": 15}]
            """);

        Point tray = collector(MetricClass.TRAY).collect().get(0);
        Point mapping = collector(MetricClass.VOLUME_MAPPING).collect().get(0);

        assertThat(tray.tags()).containsEntry("tray_id", "99").containsEntry("serial_number", "SHG1234");
        assertThat(tray.field("partNumber")).isEqualTo(FieldValue.of("E-X5730A"));
        assertThat(mapping.tags()).containsEntry("map_type", "cluster");
        assertThat(mapping.field("lun")).isEqualTo(FieldValue.of(3L));
    }

    // =========================================================================
    // Errors
    // =========================================================================

    @Test
    void collect_shouldPropagateApiFailure() {
        api.fail(BASE + "storage-pools", ApiException.status(500, BASE + "storage-pools"));

        assertThatThrownBy(() -> collector(MetricClass.STORAGE_POOL).collect())
            .isInstanceOf(ApiException.class);
    }

    @Test
    void constructor_shouldRejectPerformanceClass() {
        assertThatThrownBy(() -> collector(MetricClass.VOLUME))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("inventory");
    }
}
