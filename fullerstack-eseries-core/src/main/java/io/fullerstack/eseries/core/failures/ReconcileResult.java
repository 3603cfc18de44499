package io.fullerstack.eseries.core.failures;

import io.fullerstack.eseries.core.model.FailureTransition;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of one reconciliation cycle.
 *
 * @param transitions Failures that changed state, activations first
 * @param skipped     True if the payload hash matched the previous cycle and no comparison ran
 */
public record ReconcileResult(
        List<FailureTransition> transitions,
        boolean skipped
) {
    public ReconcileResult {
        transitions = List.copyOf(Objects.requireNonNull(transitions, "transitions cannot be null"));
    }

    public static ReconcileResult unchanged() {
        return new ReconcileResult(List.of(), true);
    }

    public boolean hasTransitions() {
        return !transitions.isEmpty();
    }
}
