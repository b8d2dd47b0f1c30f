package org.neuralchilli.depgraph.core;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.depgraph.domain.TaskPriority;

/**
 * Cheap stand-ins for critical-path analysis. These flag tasks likely to
 * delay the project if disrupted; they do not compute a schedule.
 */
@ApplicationScoped
public class CriticalPathHeuristics {

    /**
     * High priority and connected: at least one dependency or one dependent.
     * Unknown tasks are never on the critical path.
     */
    public boolean isOnCriticalPath(TaskGraph graph, String taskId) {
        return graph.task(taskId)
                .filter(task -> task.hasPriority(TaskPriority.HIGH))
                .map(task -> !task.dependencies().isEmpty() || graph.hasDependents(taskId))
                .orElse(false);
    }

    /**
     * Too many tasks wait directly on this one
     */
    public boolean isBottleneck(TaskGraph graph, String taskId, int threshold) {
        return graph.dependents(taskId).size() >= threshold;
    }
}
