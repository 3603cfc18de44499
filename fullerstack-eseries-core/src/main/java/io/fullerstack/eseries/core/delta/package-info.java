/**
 * Rate computation over cumulative counters.
 * <p>
 * Some firmware modes expose totals (operations, bytes) rather than rates. The
 * {@link io.fullerstack.eseries.core.delta.DeltaRateEngine} keeps one baseline sample per
 * (system, entity, class) and turns consecutive samples into per-second rates,
 * re-baselining on counter resets.
 */
package io.fullerstack.eseries.core.delta;
