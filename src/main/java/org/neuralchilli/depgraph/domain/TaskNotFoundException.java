package org.neuralchilli.depgraph.domain;

/**
 * Thrown when an operation names a task the collection does not contain.
 */
public class TaskNotFoundException extends DependencyException {

    private final String missingId;

    public TaskNotFoundException(String missingId, String taskId, String dependsOnId) {
        super("Task not found: " + missingId, taskId, dependsOnId);
        this.missingId = missingId;
    }

    public TaskNotFoundException(String missingId) {
        this(missingId, missingId, null);
    }

    public String missingId() {
        return missingId;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.TASK_NOT_FOUND;
    }
}
