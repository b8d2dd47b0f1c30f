package org.neuralchilli.depgraph.domain;

/**
 * Shape of an acyclic dependency graph, as reported in audit metrics.
 *
 * @param totalTasks      vertices in the graph
 * @param rootTasks       tasks with no dependencies, where work can start
 * @param leafTasks       tasks nothing else waits on
 * @param executionLevels length of the longest dependency chain, in levels
 * @param maxParallelism  size of the widest level
 */
public record DagStatistics(
        int totalTasks,
        int rootTasks,
        int leafTasks,
        int executionLevels,
        int maxParallelism
) {
    public DagStatistics {
        requireCount(totalTasks, "totalTasks");
        requireCount(rootTasks, "rootTasks");
        requireCount(leafTasks, "leafTasks");
        requireCount(executionLevels, "executionLevels");
        requireCount(maxParallelism, "maxParallelism");
        if (executionLevels > totalTasks || maxParallelism > totalTasks) {
            throw new IllegalArgumentException(
                    "Levels and parallelism cannot exceed the task count (" + totalTasks + ")");
        }
    }

    /**
     * Whether some level holds two or more independent tasks
     */
    public boolean hasParallelism() {
        return maxParallelism > 1;
    }

    /**
     * Every level holds exactly one task, so the graph is a single chain
     */
    public boolean isLinear() {
        return totalTasks > 0 && executionLevels == totalTasks;
    }

    /**
     * Mean number of tasks per level, 0 for an empty graph
     */
    public double averageLevelWidth() {
        return executionLevels == 0 ? 0.0 : (double) totalTasks / executionLevels;
    }

    private static void requireCount(int value, String name) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " cannot be negative: " + value);
        }
    }

    @Override
    public String toString() {
        return "DagStatistics[" + totalTasks + " tasks in " + executionLevels + " levels, widest "
                + maxParallelism + ", " + rootTasks + " roots, " + leafTasks + " leaves]";
    }
}
