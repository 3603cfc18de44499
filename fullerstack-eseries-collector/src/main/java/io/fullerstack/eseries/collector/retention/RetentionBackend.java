package io.fullerstack.eseries.collector.retention;

import java.util.List;

/**
 * Retention policies and downsample rules of the metrics database.
 * <p>
 * Create operations throw {@link AlreadyExistsException} when the name is taken.
 */
public interface RetentionBackend {

    List<RetentionPolicy> listPolicies();

    void createPolicy(RetentionPolicy policy);

    void alterPolicy(RetentionPolicy policy);

    List<DownsampleRule> listRules();

    void createRule(DownsampleRule rule);

    /**
     * Replace an existing rule of the same name.
     */
    void replaceRule(DownsampleRule rule);
}
