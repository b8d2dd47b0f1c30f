package org.neuralchilli.depgraph.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Whole-collection dependency metrics attached to an audit report.
 *
 * @param dependencyDistribution dependency count per task -> number of tasks with that count
 * @param dagStatistics          present only for acyclic graphs without dangling edges
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DependencyMetrics(
        int totalTasks,
        int tasksWithDependencies,
        int totalDependencies,
        double averageDependenciesPerTask,
        int maxDependencies,
        int tasksWithNoDependencies,
        int tasksWithNoDependents,
        int longestDependencyChain,
        SortedMap<Integer, Integer> dependencyDistribution,
        DagStatistics dagStatistics
) {
    public DependencyMetrics {
        dependencyDistribution = dependencyDistribution != null
                ? new TreeMap<>(dependencyDistribution)
                : new TreeMap<>();
    }
}
