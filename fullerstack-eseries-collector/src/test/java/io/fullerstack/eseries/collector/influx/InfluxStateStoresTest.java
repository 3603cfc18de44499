package io.fullerstack.eseries.collector.influx;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.fullerstack.eseries.core.model.FailureRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests for the Influx-backed failure and MEL cursor stores.
 */
class InfluxStateStoresTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private InfluxQueryClient client;

    @BeforeEach
    void setUp() {
        client = mock(InfluxQueryClient.class);
    }

    // =========================================================================
    // Failures
    // =========================================================================

    @Test
    void lastKnownFailures_shouldReadOneRecordPerSeries() throws Exception {
        when(client.query(anyString())).thenReturn(objectMapper.readTree("""
            {"statement_id":0,"series":[
              {"name":"failures","tags":{"failure_type":"failedDrive","object_ref":"0100","object_type":"drive","active":"true"},
               "columns":["time","last"],"values":[[1700000000,"failedDrive"]]},
              {"name":"failures","tags":{"failure_type":"failedDrive","object_ref":"0100","object_type":"drive","active":"false"},
               "columns":["time","last"],"values":[[1700000600,"failedDrive"]]},
              {"name":"failures","tags":{"failure_type":"","object_ref":"","object_type":"","active":"true"},
               "columns":["time","last"],"values":[[1700000000,"x"]]}]}
            """));

        List<FailureRecord> records = new InfluxFailureStateStore(client).lastKnownFailures("wwn1");

        assertThat(records).containsExactly(
            new FailureRecord("wwn1", "failedDrive", "0100", "drive", true, Instant.ofEpochSecond(1_700_000_000L)),
            new FailureRecord("wwn1", "failedDrive", "0100", "drive", false, Instant.ofEpochSecond(1_700_000_600L)));
        verify(client).query("SELECT last(\"type_of\") FROM \"failures\" WHERE \"sys_id\"='wwn1'"
            + " GROUP BY \"failure_type\",\"object_ref\",\"object_type\",\"active\"");
    }

    @Test
    void lastKnownFailures_shouldBeEmpty_whenNothingWritten() throws Exception {
        when(client.query(anyString())).thenReturn(objectMapper.readTree("{\"statement_id\":0}"));

        assertThat(new InfluxFailureStateStore(client).lastKnownFailures("wwn1")).isEmpty();
    }

    // =========================================================================
    // MEL cursor
    // =========================================================================

    @Test
    void lastSequence_shouldReadMaximum() throws Exception {
        when(client.query(anyString())).thenReturn(objectMapper.readTree("""
            {"statement_id":0,"series":[{"name":"major_event_log","columns":["time","max"],"values":[[0,5000]]}]}
            """));

        assertThat(new InfluxMelCursorStore(client).lastSequence("wwn1")).hasValue(5000L);
        verify(client).query("SELECT max(\"sequenceNumber\") FROM \"major_event_log\" WHERE \"sys_id\"='wwn1'");
    }

    @Test
    void lastSequence_shouldBeEmpty_whenNoEvents() throws Exception {
        when(client.query(anyString())).thenReturn(objectMapper.readTree("{\"statement_id\":0}"));

        assertThat(new InfluxMelCursorStore(client).lastSequence("wwn1")).isEmpty();
    }

    @Test
    void literal_shouldEscapeQuotes() {
        assertThat(InfluxQueryClient.literal("o'brien")).isEqualTo("'o\\'brien'");
        assertThat(InfluxQueryClient.identifier("a\"b")).isEqualTo("\"a\\\"b\"");
    }
}
