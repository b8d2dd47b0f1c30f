package org.neuralchilli.depgraph.domain;

/**
 * What an added edge touches.
 *
 * @param dependentCount tasks that currently depend on the dependent task
 * @param chainSize      distinct tasks in the depended-on task's own dependency chain
 * @param onCriticalPath either endpoint satisfies the critical-path heuristic
 */
public record ImpactSummary(
        int dependentCount,
        int chainSize,
        boolean onCriticalPath
) {
    public int affectedTasks() {
        return dependentCount + chainSize;
    }
}
