/**
 * Tiered polling.
 * <p>
 * The {@link io.fullerstack.eseries.collector.scheduler.TieredScheduler} runs one
 * coordinating loop that dispatches due (system, class) tasks to a worker pool, joins them,
 * writes their batches and reports each {@link io.fullerstack.eseries.collector.scheduler.BatchOutcome}
 * back to the task.
 */
package io.fullerstack.eseries.collector.scheduler;
