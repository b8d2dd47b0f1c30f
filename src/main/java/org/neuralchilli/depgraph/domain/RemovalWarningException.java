package org.neuralchilli.depgraph.domain;

import java.util.List;

/**
 * Thrown when removal impact analysis finds blocking warnings.
 */
public class RemovalWarningException extends DependencyException {

    private final List<String> warnings;

    public RemovalWarningException(String taskId, String dependsOnId, List<String> warnings) {
        super("Cannot remove dependency due to potential issues: " + String.join("; ", warnings),
                taskId, dependsOnId);
        this.warnings = List.copyOf(warnings);
    }

    public List<String> warnings() {
        return warnings;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.REMOVAL_WARNING;
    }

    @Override
    public DependencyError toError() {
        return new DependencyError(kind(), getMessage(), taskId(), dependsOnId(), List.of(), null, warnings);
    }
}
