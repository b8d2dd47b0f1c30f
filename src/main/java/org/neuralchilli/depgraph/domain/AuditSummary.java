package org.neuralchilli.depgraph.domain;

/**
 * Numeric roll-up of an audit. Issue counts are taken after severity filtering.
 */
public record AuditSummary(
        int totalTasks,
        int tasksWithDependencies,
        int totalDependencies,
        int cyclesFound,
        int orphanedTasks,
        int redundantDependencies,
        int missingReferences,
        int critical,
        int warning,
        int info
) {
    public int totalIssues() {
        return critical + warning + info;
    }

    public boolean isClean() {
        return totalIssues() == 0;
    }
}
