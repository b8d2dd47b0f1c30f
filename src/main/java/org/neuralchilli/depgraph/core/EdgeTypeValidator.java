package org.neuralchilli.depgraph.core;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.depgraph.domain.DependencyType;
import org.neuralchilli.depgraph.domain.Task;
import org.neuralchilli.depgraph.domain.TaskPriority;
import org.neuralchilli.depgraph.domain.TaskStatus;

import java.util.Optional;

/**
 * Applies the status and priority rule of each dependency type to a proposed
 * edge. The verdict is advisory: callers may force a rejected edge through.
 */
@ApplicationScoped
public class EdgeTypeValidator {

    /**
     * Validate {@code task -> dependency} under the given type.
     *
     * @param task       the dependent task
     * @param dependency the task depended on
     * @param type       dependency type as supplied by the caller
     */
    public TypeValidation validate(Task task, Task dependency, String type) {
        Optional<DependencyType> parsed = DependencyType.fromString(type);
        if (parsed.isEmpty()) {
            return TypeValidation.rejected("Unknown dependency type: " + type);
        }

        return switch (parsed.get()) {
            case BLOCKING -> task.hasPriority(TaskPriority.HIGH) && dependency.hasPriority(TaskPriority.LOW)
                    ? TypeValidation.rejected("High priority task should not be blocked by low priority task")
                    : TypeValidation.ok();

            case FINISH_TO_START -> dependency.hasStatus(TaskStatus.PENDING) && task.hasStatus(TaskStatus.COMPLETED)
                    ? TypeValidation.rejected("Cannot create finish-to-start dependency: " +
                    "dependent task is completed while dependency is pending")
                    : TypeValidation.ok();

            case START_TO_START -> !task.hasStatus(TaskStatus.PENDING) && dependency.hasStatus(TaskStatus.PENDING)
                    ? TypeValidation.rejected("Cannot create start-to-start dependency: " +
                    "task has started but dependency has not")
                    : TypeValidation.ok();

            case FINISH_TO_FINISH -> task.hasStatus(TaskStatus.COMPLETED) && !dependency.hasStatus(TaskStatus.COMPLETED)
                    ? TypeValidation.rejected("Cannot create finish-to-finish dependency: " +
                    "task is completed but dependency is not")
                    : TypeValidation.ok();

            case START_TO_FINISH -> task.hasStatus(TaskStatus.COMPLETED) && dependency.hasStatus(TaskStatus.PENDING)
                    ? TypeValidation.rejected("Cannot create start-to-finish dependency: " +
                    "task is completed but dependency has not started")
                    : TypeValidation.ok();

            // informational only
            case RELATED, OPTIONAL -> TypeValidation.ok();
        };
    }
}
