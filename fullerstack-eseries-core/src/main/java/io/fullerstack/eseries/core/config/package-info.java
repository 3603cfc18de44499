/**
 * Collector configuration.
 * <p>
 * {@link io.fullerstack.eseries.core.config.HierarchicalConfig} reads
 * {@code collector.properties} (with optional profile overrides and system-property
 * overrides); {@link io.fullerstack.eseries.core.config.CollectorConfig} turns it into a
 * validated, immutable record.
 */
package io.fullerstack.eseries.core.config;
