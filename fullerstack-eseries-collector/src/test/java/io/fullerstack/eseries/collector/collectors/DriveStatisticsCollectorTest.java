package io.fullerstack.eseries.collector.collectors;

import io.fullerstack.eseries.collector.client.ApiException;
import io.fullerstack.eseries.collector.location.DiskLocationResolver;
import io.fullerstack.eseries.core.config.CounterMode;
import io.fullerstack.eseries.core.delta.DeltaRateEngine;
import io.fullerstack.eseries.core.mapper.PointMapper;
import io.fullerstack.eseries.core.model.DriveLocation;
import io.fullerstack.eseries.core.model.FieldValue;
import io.fullerstack.eseries.core.model.Point;
import io.fullerstack.eseries.core.model.StorageSystem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests for drive location tags and SSD wear enrichment.
 */
class DriveStatisticsCollectorTest {

    private static final StorageSystem SYSTEM = new StorageSystem("wwn1", "array1");
    private static final String STATS = "/devmgr/v2/storage-systems/wwn1/analysed-drive-statistics";
    private static final String FIRMWARE = "/devmgr/v2/firmware/embedded-firmware/wwn1/versions";
    private static final String HEALTH = "/devmgr/v2/storage-systems/wwn1/drives/drive-health-history";
    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    private static final String DRIVES = """
        [
          {"diskId": "01000000500003960C8A2F410000000000000001", "volGroupName": "DG1", "readIOps": 10.0},
          {"diskId": "01000000500003960C8A2F410000000000000002", "volGroupName": "DG1", "readIOps": 20.0}
        ]
        """;

    private FakeApiClient api;
    private DiskLocationResolver locations;
    private DriveStatisticsCollector collector;

    @BeforeEach
    void setUp() {
        api = new FakeApiClient();
        locations = mock(DiskLocationResolver.class);
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        collector = new DriveStatisticsCollector(SYSTEM, api, new PointMapper(clock), new DeltaRateEngine(),
            locations, CounterMode.ANALYSED, Duration.ofSeconds(120), clock);
        api.respond(STATS, DRIVES);
    }

    private void firmware(String version) {
        api.respond(FIRMWARE, "{\"codeVersions\": [{\"codeModule\": \"bundle\", \"versionString\": \"08.80.00.00\"},"
            + " {\"codeModule\": \"management\", \"versionString\": \"" + version + "\"}]}");
    }

    @Test
    void collect_shouldTagTrayAndSlot() {
        firmware("11.70.1R1");
        when(locations.locate("wwn1")).thenReturn(Map.of(
            "01000000500003960C8A2F410000000000000001", new DriveLocation(0, 7)));

        List<Point> points = collector.collect();

        assertThat(points).hasSize(2);
        assertThat(points.get(0).tags()).containsExactly(
            entry("sys_id", "wwn1"), entry("sys_name", "array1"),
            entry("sys_tray", "00"), entry("sys_tray_slot", "007"));
        assertThat(points.get(1).tags())
            .containsEntry("sys_tray", "99")
            .containsEntry("sys_tray_slot", "999");
    }

    @Test
    void collect_shouldInjectSsdWear_whenFirmwareSupportsIt() {
        firmware("11.80.0R2");
        when(locations.locate("wwn1")).thenReturn(Map.of());
        api.respond(HEALTH, """
            {"collections": [{"ssdDriveWearStatistics": [
              {"volumeGroupName": "DG1", "driveWwn": "500003960C8A2F410000000000000001", "spareBlockRemainingPercentage": 97}
            ]}]}
            """);

        List<Point> points = collector.collect();

        assertThat(points.get(0).field("spareBlocksRemainingPercent")).isEqualTo(FieldValue.of(97.0));
        assertThat(points.get(1).field("spareBlocksRemainingPercent")).isEqualTo(FieldValue.absent());
        assertThat(api.lastCall(HEALTH).params()).containsEntry("all-history", "false");
    }

    @Test
    void collect_shouldSkipWear_whenFirmwareIsOlder() {
        firmware("11.70.1R1");
        when(locations.locate("wwn1")).thenReturn(Map.of());

        List<Point> points = collector.collect();

        assertThat(points).allSatisfy(p ->
            assertThat(p.field("spareBlocksRemainingPercent")).isEqualTo(FieldValue.absent()));
        assertThat(api.calls).extracting(FakeApiClient.Call::path).doesNotContain(HEALTH);
    }

    @Test
    void collect_shouldStillCollect_whenWearLookupFails() {
        api.fail(FIRMWARE, ApiException.status(500, FIRMWARE));
        when(locations.locate("wwn1")).thenReturn(Map.of());

        assertThat(collector.collect()).hasSize(2);
    }

    @Test
    void minorVersion_shouldParseManagementVersions() {
        assertThat(DriveStatisticsCollector.minorVersion("11.80.0R2")).isEqualTo(80);
        assertThat(DriveStatisticsCollector.minorVersion("11.90R1")).isEqualTo(90);
        assertThat(DriveStatisticsCollector.minorVersion("garbage")).isZero();
    }

    @Test
    void wearKey_shouldUseLastTwelveCharacters() {
        assertThat(DriveStatisticsCollector.wearKey("DG1", "5000CCA25D0F4A7C0000000000000000"))
            .isEqualTo("DG1#000000000000");
        assertThat(DriveStatisticsCollector.wearKey("DG1", "short")).isNull();
        assertThat(DriveStatisticsCollector.wearKey(null, "5000CCA25D0F4A7C0000000000000000")).isNull();
    }
}
