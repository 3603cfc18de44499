/**
 * Idempotent setup of retention policies and downsample rules.
 */
package io.fullerstack.eseries.collector.retention;
