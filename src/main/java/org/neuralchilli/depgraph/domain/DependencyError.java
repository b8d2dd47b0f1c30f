package org.neuralchilli.depgraph.domain;

import java.util.List;

/**
 * Structured failure returned from a mutation.
 *
 * @param kind        failure category
 * @param message     human-readable summary
 * @param taskId      the dependent task of the edge under change
 * @param dependsOnId the task depended on
 * @param cyclePath   cycle that would be closed, empty unless CIRCULAR_DEPENDENCY
 * @param reason      type-rule reason, null unless DEPENDENCY_TYPE
 * @param warnings    removal warnings, empty unless REMOVAL_WARNING
 */
public record DependencyError(
        ErrorKind kind,
        String message,
        String taskId,
        String dependsOnId,
        List<String> cyclePath,
        String reason,
        List<String> warnings
) {
    public DependencyError {
        if (kind == null) {
            throw new IllegalArgumentException("Error kind cannot be null");
        }
        cyclePath = cyclePath != null ? List.copyOf(cyclePath) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }
}
