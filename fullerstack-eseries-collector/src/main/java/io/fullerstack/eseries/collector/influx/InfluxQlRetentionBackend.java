package io.fullerstack.eseries.collector.influx;

import com.fasterxml.jackson.databind.JsonNode;
import io.fullerstack.eseries.collector.retention.DownsampleRule;
import io.fullerstack.eseries.collector.retention.RetentionBackend;
import io.fullerstack.eseries.collector.retention.RetentionPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Retention policies and continuous queries through InfluxQL.
 * <p>
 * InfluxDB rewrites the text of stored continuous queries (quoting, fully qualified
 * sources, normalized durations), so existing rules are parsed back into
 * {@link DownsampleRule}s and compared structurally. Continuous queries cannot be altered;
 * replacing one drops and recreates it.
 */
public class InfluxQlRetentionBackend implements RetentionBackend {
    private static final Logger logger = LoggerFactory.getLogger(InfluxQlRetentionBackend.class);

    private static final String NAME = "\"?([^\".\\s]+)\"?";

    private static final Pattern RULE = Pattern.compile(
        "SELECT\\s+mean\\(\\s*" + NAME + "\\s*\\)\\s+AS\\s+" + NAME
            + "\\s+INTO\\s+(?:" + NAME + "\\.)?" + NAME + "\\." + NAME
            + "\\s+FROM\\s+(?:" + NAME + "\\.){0,2}" + NAME
            + "(?:\\s+WHERE\\s+\\(?\\s*time\\s*<\\s*now\\(\\)\\s*-\\s*([0-9a-zµ]+)\\s*\\)?)?"
            + "\\s+GROUP\\s+BY\\s+time\\(\\s*([0-9a-zµ]+)\\s*\\)",
        Pattern.CASE_INSENSITIVE);

    private final InfluxQueryClient client;
    private final String database;

    public InfluxQlRetentionBackend(InfluxQueryClient client) {
        this.client = Objects.requireNonNull(client, "client cannot be null");
        this.database = client.database();
    }

    @Override
    public List<RetentionPolicy> listPolicies() {
        JsonNode result = client.query("SHOW RETENTION POLICIES ON " + InfluxQueryClient.identifier(database));
        List<RetentionPolicy> policies = new ArrayList<>();
        for (JsonNode series : InfluxQueryClient.series(result)) {
            List<String> columns = columns(series);
            int name = columns.indexOf("name");
            int duration = columns.indexOf("duration");
            int replication = columns.indexOf("replicaN");
            int isDefault = columns.indexOf("default");
            for (JsonNode row : series.path("values")) {
                policies.add(new RetentionPolicy(
                    row.path(name).asText(),
                    InfluxDurations.parse(row.path(duration).asText()),
                    replication < 0 ? 1 : row.path(replication).asInt(1),
                    isDefault >= 0 && row.path(isDefault).asBoolean(false)));
            }
        }
        return policies;
    }

    @Override
    public void createPolicy(RetentionPolicy policy) {
        client.execute("CREATE " + policyClause(policy));
    }

    @Override
    public void alterPolicy(RetentionPolicy policy) {
        client.execute("ALTER " + policyClause(policy));
    }

    String policyClause(RetentionPolicy policy) {
        return "RETENTION POLICY " + InfluxQueryClient.identifier(policy.name())
            + " ON " + InfluxQueryClient.identifier(database)
            + " DURATION " + InfluxDurations.format(policy.duration())
            + " REPLICATION " + policy.replication()
            + (policy.isDefault() ? " DEFAULT" : "");
    }

    @Override
    public List<DownsampleRule> listRules() {
        JsonNode result = client.query("SHOW CONTINUOUS QUERIES");
        List<DownsampleRule> rules = new ArrayList<>();
        for (JsonNode series : InfluxQueryClient.series(result)) {
            if (!database.equals(series.path("name").asText())) {
                continue;
            }
            List<String> columns = columns(series);
            int name = columns.indexOf("name");
            int query = columns.indexOf("query");
            for (JsonNode row : series.path("values")) {
                String ruleName = row.path(name).asText();
                Optional<DownsampleRule> rule = parseRule(ruleName, row.path(query).asText());
                if (rule.isPresent()) {
                    rules.add(rule.get());
                } else {
                    logger.debug("Ignoring continuous query {}: not a downsample rule", ruleName);
                }
            }
        }
        return rules;
    }

    @Override
    public void createRule(DownsampleRule rule) {
        client.execute(createStatement(rule));
    }

    @Override
    public void replaceRule(DownsampleRule rule) {
        client.execute("DROP CONTINUOUS QUERY " + InfluxQueryClient.identifier(rule.name())
            + " ON " + InfluxQueryClient.identifier(database));
        client.execute(createStatement(rule));
    }

    String createStatement(DownsampleRule rule) {
        StringBuilder select = new StringBuilder()
            .append("SELECT mean(").append(InfluxQueryClient.identifier(rule.field())).append(")")
            .append(" AS ").append(InfluxQueryClient.identifier(rule.alias()))
            .append(" INTO ").append(InfluxQueryClient.identifier(database))
            .append('.').append(InfluxQueryClient.identifier(rule.targetPolicy()))
            .append('.').append(InfluxQueryClient.identifier(rule.measurement()))
            .append(" FROM ").append(InfluxQueryClient.identifier(rule.measurement()));
        if (!rule.olderThan().isZero()) {
            select.append(" WHERE (time < now()-").append(InfluxDurations.format(rule.olderThan())).append(')');
        }
        select.append(" GROUP BY time(").append(InfluxDurations.format(rule.bucket())).append(')');

        return "CREATE CONTINUOUS QUERY " + InfluxQueryClient.identifier(rule.name())
            + " ON " + InfluxQueryClient.identifier(database)
            + " BEGIN " + select + " END";
    }

    /**
     * Parse the text of a stored continuous query, empty if it is not a downsample rule.
     */
    static Optional<DownsampleRule> parseRule(String name, String query) {
        Matcher matcher = RULE.matcher(query);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String field = matcher.group(1);
        String alias = matcher.group(2);
        String targetPolicy = matcher.group(4);
        String measurement = matcher.group(5);
        String olderThan = matcher.group(8);
        String bucket = matcher.group(9);
        if (!alias.equals(DownsampleRule.ALIAS_PREFIX + field)) {
            return Optional.empty();
        }
        try {
            return Optional.of(new DownsampleRule(name, measurement, field, targetPolicy,
                InfluxDurations.parse(bucket),
                olderThan == null ? Duration.ZERO : InfluxDurations.parse(olderThan)));
        } catch (IllegalArgumentException e) {
            logger.warn("Continuous query {} has an unreadable duration: {}", name, e.getMessage());
            return Optional.empty();
        }
    }

    private static List<String> columns(JsonNode series) {
        List<String> columns = new ArrayList<>();
        series.path("columns").forEach(column -> columns.add(column.asText()));
        return columns;
    }
}
