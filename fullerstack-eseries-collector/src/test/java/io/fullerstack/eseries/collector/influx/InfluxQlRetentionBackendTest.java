package io.fullerstack.eseries.collector.influx;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fullerstack.eseries.collector.retention.DownsampleRule;
import io.fullerstack.eseries.collector.retention.RetentionPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests for InfluxQlRetentionBackend statement building and parsing.
 */
class InfluxQlRetentionBackendTest {

    private static final DownsampleRule READ_IOPS = DownsampleRule.of("volumes", "readIOps",
        RetentionPolicy.LONG_TERM, Duration.ofMinutes(5), Duration.ofDays(7));

    private final ObjectMapper objectMapper = new ObjectMapper();
    private InfluxQueryClient client;
    private InfluxQlRetentionBackend backend;

    @BeforeEach
    void setUp() {
        client = mock(InfluxQueryClient.class);
        when(client.database()).thenReturn("eseries");
        backend = new InfluxQlRetentionBackend(client);
    }

    private JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text);
    }

    // =========================================================================
    // Retention policies
    // =========================================================================

    @Test
    void policyClause_shouldRenderDefaultPolicy() {
        RetentionPolicy policy = new RetentionPolicy(RetentionPolicy.SHORT_TERM, Duration.ofDays(7), 1, true);

        assertThat(backend.policyClause(policy))
            .isEqualTo("RETENTION POLICY \"default_retention\" ON \"eseries\" DURATION 1w REPLICATION 1 DEFAULT");
    }

    @Test
    void createAndAlterPolicy_shouldExecuteStatements() {
        RetentionPolicy policy = new RetentionPolicy(RetentionPolicy.LONG_TERM, Duration.ZERO, 1, false);

        backend.createPolicy(policy);
        backend.alterPolicy(policy);

        verify(client).execute("CREATE RETENTION POLICY \"downsample_retention\" ON \"eseries\" DURATION INF REPLICATION 1");
        verify(client).execute("ALTER RETENTION POLICY \"downsample_retention\" ON \"eseries\" DURATION INF REPLICATION 1");
    }

    @Test
    void listPolicies_shouldParseShowOutput() throws Exception {
        when(client.query("SHOW RETENTION POLICIES ON \"eseries\"")).thenReturn(json("""
            {"statement_id":0,"series":[{"columns":["name","duration","shardGroupDuration","replicaN","default"],
             "values":[["autogen","0s","168h0m0s",1,false],
                       ["default_retention","168h0m0s","24h0m0s",1,true]]}]}
            """));

        List<RetentionPolicy> policies = backend.listPolicies();

        assertThat(policies).containsExactly(
            new RetentionPolicy("autogen", Duration.ZERO, 1, false),
            new RetentionPolicy(RetentionPolicy.SHORT_TERM, Duration.ofDays(7), 1, true));
    }

    // =========================================================================
    // Downsample rules
    // =========================================================================

    @Test
    void createStatement_shouldRenderContinuousQuery() {
        assertThat(backend.createStatement(READ_IOPS)).isEqualTo(
            "CREATE CONTINUOUS QUERY \"downsample_volumes_readIOps\" ON \"eseries\" BEGIN "
                + "SELECT mean(\"readIOps\") AS \"ds_readIOps\" "
                + "INTO \"eseries\".\"downsample_retention\".\"volumes\" FROM \"volumes\" "
                + "WHERE (time < now()-1w) GROUP BY time(5m) END");
    }

    @Test
    void createStatement_shouldOmitWhere_whenRetentionInfinite() {
        DownsampleRule rule = DownsampleRule.of("volumes", "readIOps", RetentionPolicy.LONG_TERM,
            Duration.ofMinutes(5), Duration.ZERO);

        assertThat(backend.createStatement(rule)).doesNotContain("WHERE").contains("GROUP BY time(5m)");
    }

    @Test
    void parseRule_shouldReadOwnStatement() {
        assertThat(InfluxQlRetentionBackend.parseRule(READ_IOPS.name(), backend.createStatement(READ_IOPS)))
            .hasValue(READ_IOPS);
    }

    @Test
    void parseRule_shouldReadNormalizedBackendText() {
        String stored = "CREATE CONTINUOUS QUERY downsample_volumes_readIOps ON eseries BEGIN "
            + "SELECT mean(readIOps) AS ds_readIOps INTO eseries.downsample_retention.volumes "
            + "FROM eseries.default_retention.volumes WHERE time < now() - 1w GROUP BY time(5m) END";

        assertThat(InfluxQlRetentionBackend.parseRule("downsample_volumes_readIOps", stored)).hasValue(READ_IOPS);
    }

    @Test
    void parseRule_shouldIgnoreForeignQueries() {
        Optional<DownsampleRule> rule = InfluxQlRetentionBackend.parseRule("cq_max",
            "CREATE CONTINUOUS QUERY cq_max ON eseries BEGIN SELECT max(readIOps) AS peak INTO eseries.autogen.volumes_peak "
                + "FROM eseries.autogen.volumes GROUP BY time(1h) END");

        assertThat(rule).isEmpty();
    }

    @Test
    void listRules_shouldKeepOnlyRulesOfDatabase() throws Exception {
        String query = backend.createStatement(READ_IOPS).replace("\"", "\\\"");
        when(client.query("SHOW CONTINUOUS QUERIES")).thenReturn(json("""
            {"statement_id":0,"series":[
              {"name":"_internal","columns":["name","query"],"values":[]},
              {"name":"eseries","columns":["name","query"],"values":[["downsample_volumes_readIOps","%s"]]}]}
            """.formatted(query)));

        assertThat(backend.listRules()).containsExactly(READ_IOPS);
    }

    @Test
    void replaceRule_shouldDropThenCreate() {
        backend.replaceRule(READ_IOPS);

        InOrder order = inOrder(client);
        order.verify(client).execute("DROP CONTINUOUS QUERY \"downsample_volumes_readIOps\" ON \"eseries\"");
        order.verify(client).execute(backend.createStatement(READ_IOPS));
    }
}
