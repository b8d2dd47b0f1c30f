package org.neuralchilli.depgraph.domain;

/**
 * Thrown when a task is asked to depend on itself. Never overridable.
 */
public class SelfDependencyException extends DependencyException {

    public SelfDependencyException(String taskId) {
        super("A task cannot depend on itself: " + taskId, taskId, taskId);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.SELF_DEPENDENCY;
    }
}
