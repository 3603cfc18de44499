package io.fullerstack.eseries.core.model;

import java.util.Objects;

/**
 * Identity of a reported failure. Two failures are the same failure when all three
 * parts match.
 */
public record FailureKey(
        String failureType,
        String objectRef,
        String objectType
) {
    public FailureKey {
        Objects.requireNonNull(failureType, "failureType cannot be null");
        objectRef = objectRef == null ? "" : objectRef;
        objectType = objectType == null ? "" : objectType;
    }
}
