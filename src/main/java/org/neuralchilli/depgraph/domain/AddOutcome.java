package org.neuralchilli.depgraph.domain;

import java.util.List;

/**
 * Successful add. When {@code alreadyExists} is set nothing was written and
 * {@code impact} is null.
 */
public record AddOutcome(
        String taskId,
        String dependsOnId,
        String type,
        String reason,
        boolean alreadyExists,
        boolean forcedCycle,
        List<String> cyclePath,
        List<String> warnings,
        int totalDependencies,
        ImpactSummary impact
) {
    public AddOutcome {
        cyclePath = cyclePath != null ? List.copyOf(cyclePath) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public static AddOutcome alreadyPresent(String taskId, String dependsOnId, String type, int totalDependencies) {
        return new AddOutcome(taskId, dependsOnId, type, null, true, false,
                List.of(), List.of(), totalDependencies, null);
    }
}
