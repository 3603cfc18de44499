package io.fullerstack.eseries.collector.retention;

import io.fullerstack.eseries.collector.influx.InfluxDurations;
import io.fullerstack.eseries.core.catalog.FieldSpec;
import io.fullerstack.eseries.core.config.InfluxConfig;
import io.fullerstack.eseries.core.model.MetricClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Brings retention policies and downsample rules to the desired state.
 * <p>
 * Reads the existing state once, creates what is missing and alters what differs. A create
 * that races with another writer and fails with "already exists" becomes an alter. Running
 * it twice with the same desired state changes nothing the second time.
 */
public class RetentionPlanner {
    private static final Logger logger = LoggerFactory.getLogger(RetentionPlanner.class);

    private final RetentionBackend backend;

    public RetentionPlanner(RetentionBackend backend) {
        this.backend = Objects.requireNonNull(backend, "backend cannot be null");
    }

    /**
     * Short-term default policy and long-term downsample policy.
     */
    public static List<RetentionPolicy> desiredPolicies(InfluxConfig config) {
        return List.of(
            new RetentionPolicy(RetentionPolicy.SHORT_TERM, InfluxDurations.parse(config.shortRetention()), 1, true),
            new RetentionPolicy(RetentionPolicy.LONG_TERM, InfluxDurations.parse(config.longRetention()), 1, false));
    }

    /**
     * One rule per float field of every downsampled class. Temperature is left out since
     * averaging distinct sensors is meaningless; text, integer and boolean fields have no mean.
     */
    public static List<DownsampleRule> desiredRules(InfluxConfig config) {
        Duration bucket = Duration.ofMinutes(config.downsampleBucketMinutes());
        Duration olderThan = InfluxDurations.parse(config.shortRetention());
        List<DownsampleRule> rules = new ArrayList<>();
        for (MetricClass metricClass : MetricClass.values()) {
            if (!metricClass.downsampled() || metricClass == MetricClass.TEMPERATURE) {
                continue;
            }
            for (FieldSpec field : metricClass.catalog().aggregatableFields()) {
                rules.add(DownsampleRule.of(metricClass.measurement(), field.name(), RetentionPolicy.LONG_TERM,
                    bucket, olderThan));
            }
        }
        return rules;
    }

    public PlanResult plan(InfluxConfig config) {
        return apply(desiredPolicies(config), desiredRules(config));
    }

    public PlanResult apply(List<RetentionPolicy> policies, List<DownsampleRule> rules) {
        List<String> created = new ArrayList<>();
        List<String> altered = new ArrayList<>();
        List<String> unchanged = new ArrayList<>();

        Map<String, RetentionPolicy> existingPolicies = byName(backend.listPolicies(), RetentionPolicy::name);
        for (RetentionPolicy policy : policies) {
            RetentionPolicy existing = existingPolicies.get(policy.name());
            if (policy.equals(existing)) {
                unchanged.add(policy.name());
            } else if (existing != null) {
                logger.info("Updating retention policy {} to {}", policy.name(), InfluxDurations.format(policy.duration()));
                backend.alterPolicy(policy);
                altered.add(policy.name());
            } else {
                try {
                    backend.createPolicy(policy);
                    logger.info("Created retention policy {} ({})", policy.name(), InfluxDurations.format(policy.duration()));
                    created.add(policy.name());
                } catch (AlreadyExistsException e) {
                    logger.info("Retention policy {} already exists, updating it", policy.name());
                    backend.alterPolicy(policy);
                    altered.add(policy.name());
                }
            }
        }

        Map<String, DownsampleRule> existingRules = byName(backend.listRules(), DownsampleRule::name);
        for (DownsampleRule rule : rules) {
            DownsampleRule existing = existingRules.get(rule.name());
            if (rule.equals(existing)) {
                unchanged.add(rule.name());
            } else if (existing != null) {
                logger.info("Replacing downsample rule {}", rule.name());
                backend.replaceRule(rule);
                altered.add(rule.name());
            } else {
                try {
                    backend.createRule(rule);
                    created.add(rule.name());
                } catch (AlreadyExistsException e) {
                    logger.info("Downsample rule {} already exists, replacing it", rule.name());
                    backend.replaceRule(rule);
                    altered.add(rule.name());
                }
            }
        }

        PlanResult result = new PlanResult(created, altered, unchanged);
        logger.info("Retention plan applied: {} created, {} altered, {} unchanged",
            created.size(), altered.size(), unchanged.size());
        return result;
    }

    private static <T> Map<String, T> byName(List<T> items, Function<T, String> name) {
        return items.stream().collect(Collectors.toMap(name, Function.identity(), (a, b) -> a));
    }
}
