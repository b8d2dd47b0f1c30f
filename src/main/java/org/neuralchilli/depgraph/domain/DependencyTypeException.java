package org.neuralchilli.depgraph.domain;

import java.util.List;

/**
 * Thrown when an edge violates the rule of its dependency type.
 */
public class DependencyTypeException extends DependencyException {

    private final String type;
    private final String reason;

    public DependencyTypeException(String taskId, String dependsOnId, String type, String reason) {
        super("Cannot add " + type + " dependency: " + reason, taskId, dependsOnId);
        this.type = type;
        this.reason = reason;
    }

    public String type() {
        return type;
    }

    public String reason() {
        return reason;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.DEPENDENCY_TYPE;
    }

    @Override
    public DependencyError toError() {
        return new DependencyError(kind(), getMessage(), taskId(), dependsOnId(), List.of(), reason, List.of());
    }
}
