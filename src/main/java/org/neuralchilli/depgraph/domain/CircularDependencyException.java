package org.neuralchilli.depgraph.domain;

import java.util.List;

/**
 * Thrown when an edge would close a cycle, or when an ordering is requested
 * for a graph that already contains one.
 */
public class CircularDependencyException extends DependencyException {

    private final List<String> cyclePath;

    public CircularDependencyException(String taskId, String dependsOnId, List<String> cyclePath) {
        super("Would create a circular dependency: " + String.join(" → ", cyclePath), taskId, dependsOnId);
        this.cyclePath = List.copyOf(cyclePath);
    }

    public CircularDependencyException(String message, List<String> cyclePath) {
        super(message, null, null);
        this.cyclePath = List.copyOf(cyclePath);
    }

    public List<String> cyclePath() {
        return cyclePath;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.CIRCULAR_DEPENDENCY;
    }

    @Override
    public DependencyError toError() {
        return new DependencyError(kind(), getMessage(), taskId(), dependsOnId(), cyclePath, null, List.of());
    }
}
