package org.neuralchilli.depgraph.domain;

import java.util.List;

/**
 * Base of all domain failures raised inside the engine.
 * Unchecked, like the other validation errors here: the mutation service
 * catches these at its boundary and turns them into a {@link DependencyError}.
 */
public abstract class DependencyException extends RuntimeException {

    private final String taskId;
    private final String dependsOnId;

    protected DependencyException(String message, String taskId, String dependsOnId) {
        super(message);
        this.taskId = taskId;
        this.dependsOnId = dependsOnId;
    }

    public abstract ErrorKind kind();

    public String taskId() {
        return taskId;
    }

    public String dependsOnId() {
        return dependsOnId;
    }

    /**
     * Structured form for callers that must not see exceptions
     */
    public DependencyError toError() {
        return new DependencyError(kind(), getMessage(), taskId, dependsOnId, List.of(), null, List.of());
    }
}
