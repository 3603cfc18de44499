/**
 * Failure state reconciliation.
 * <p>
 * The array reports its currently active failures as a snapshot. The
 * {@link io.fullerstack.eseries.core.failures.FailureReconciler} compares each snapshot with
 * the last known state and emits only activations and resolutions. A
 * {@link io.fullerstack.eseries.core.failures.ChecksumGuard} short-circuits unchanged
 * payloads, and a {@link io.fullerstack.eseries.core.failures.FailureStateStore} restores
 * known state after a restart.
 */
package io.fullerstack.eseries.core.failures;
