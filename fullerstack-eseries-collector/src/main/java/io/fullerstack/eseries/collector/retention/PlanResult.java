package io.fullerstack.eseries.collector.retention;

import java.util.List;
import java.util.Objects;

/**
 * Changes made by one {@link RetentionPlanner} run, by policy or rule name.
 */
public record PlanResult(
    List<String> created,
    List<String> altered,
    List<String> unchanged
) {
    public PlanResult {
        created = List.copyOf(Objects.requireNonNull(created, "created cannot be null"));
        altered = List.copyOf(Objects.requireNonNull(altered, "altered cannot be null"));
        unchanged = List.copyOf(Objects.requireNonNull(unchanged, "unchanged cannot be null"));
    }

    public int changes() {
        return created.size() + altered.size();
    }
}
