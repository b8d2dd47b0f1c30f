package org.neuralchilli.depgraph.domain;

import java.util.List;

/**
 * Successful removal. When {@code existed} is false the edge was absent and
 * nothing was written.
 */
public record RemoveOutcome(
        String taskId,
        String dependsOnId,
        boolean existed,
        boolean forced,
        int remainingDependencies,
        RemovalImpact impact,
        List<CascadeRemoval> cascadeRemovals,
        int totalDependencies
) {
    public RemoveOutcome {
        impact = impact != null ? impact : RemovalImpact.none();
        cascadeRemovals = cascadeRemovals != null ? List.copyOf(cascadeRemovals) : List.of();
    }

    public static RemoveOutcome absent(String taskId, String dependsOnId, int remaining, int totalDependencies) {
        return new RemoveOutcome(taskId, dependsOnId, false, false, remaining,
                RemovalImpact.none(), List.of(), totalDependencies);
    }

    public List<String> warnings() {
        return impact.warningMessages();
    }
}
