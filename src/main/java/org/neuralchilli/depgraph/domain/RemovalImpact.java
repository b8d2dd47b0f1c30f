package org.neuralchilli.depgraph.domain;

import java.util.List;

/**
 * Result of analyzing what removing one edge would do.
 *
 * @param warnings          findings in detection order
 * @param orphanedTasks     dependents of the task that lose every path to the removed dependency
 * @param cascadeCandidates tasks that depend on both endpoints directly
 * @param sharedSkills      skills both endpoints require
 */
public record RemovalImpact(
        List<RemovalWarning> warnings,
        List<String> orphanedTasks,
        List<String> cascadeCandidates,
        List<String> sharedSkills
) {
    public RemovalImpact {
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
        orphanedTasks = orphanedTasks != null ? List.copyOf(orphanedTasks) : List.of();
        cascadeCandidates = cascadeCandidates != null ? List.copyOf(cascadeCandidates) : List.of();
        sharedSkills = sharedSkills != null ? List.copyOf(sharedSkills) : List.of();
    }

    public static RemovalImpact none() {
        return new RemovalImpact(List.of(), List.of(), List.of(), List.of());
    }

    public boolean hasBlockingWarnings() {
        return warnings.stream().anyMatch(RemovalWarning::blocking);
    }

    public List<String> warningMessages() {
        return warnings.stream().map(RemovalWarning::message).toList();
    }
}
