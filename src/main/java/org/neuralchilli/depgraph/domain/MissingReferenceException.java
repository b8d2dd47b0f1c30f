package org.neuralchilli.depgraph.domain;

/**
 * Thrown when a graph structure is requested over an edge whose target does
 * not exist. Audits report these as issues instead.
 */
public class MissingReferenceException extends DependencyException {

    public MissingReferenceException(String taskId, String dependsOnId) {
        super("Task '" + taskId + "' depends on '" + dependsOnId + "' which does not exist", taskId, dependsOnId);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.MISSING_REFERENCE;
    }
}
