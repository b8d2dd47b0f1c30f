package org.neuralchilli.depgraph.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.depgraph.core.CriticalPathHeuristics;
import org.neuralchilli.depgraph.core.KeywordHeuristics;
import org.neuralchilli.depgraph.core.ReachabilityAnalyzer;
import org.neuralchilli.depgraph.core.TaskGraph;
import org.neuralchilli.depgraph.domain.RemovalImpact;
import org.neuralchilli.depgraph.domain.RemovalWarning;
import org.neuralchilli.depgraph.domain.Task;
import org.neuralchilli.depgraph.domain.TaskStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Works out what removing {@code task -> dependency} would do before anything
 * is written.
 */
@ApplicationScoped
public class RemovalImpactAnalyzer {

    @Inject
    KeywordHeuristics keywordHeuristics;

    @Inject
    CriticalPathHeuristics criticalPathHeuristics;

    @Inject
    ReachabilityAnalyzer reachabilityAnalyzer;

    public RemovalImpact analyze(TaskGraph graph, Task task, Task dependency) {
        List<RemovalWarning> warnings = new ArrayList<>();

        if ((task.hasStatus(TaskStatus.PENDING) || task.hasStatus(TaskStatus.BLOCKED))
                && !dependency.hasStatus(TaskStatus.COMPLETED)) {
            warnings.add(new RemovalWarning(
                    RemovalWarning.Code.PREMATURE_UNBLOCK,
                    "Task \"" + task.displayName() + "\" may become unblocked before \""
                            + dependency.displayName() + "\" is completed",
                    true
            ));
        }

        keywordHeuristics.inferLogicalDependency(task, dependency)
                .ifPresent(reason -> warnings.add(
                        new RemovalWarning(RemovalWarning.Code.LOGICAL_DEPENDENCY, reason, false)));

        if (criticalPathHeuristics.isOnCriticalPath(graph, task.id())
                && criticalPathHeuristics.isOnCriticalPath(graph, dependency.id())) {
            warnings.add(new RemovalWarning(
                    RemovalWarning.Code.CRITICAL_PATH,
                    "Removal may affect the critical path",
                    true
            ));
        }

        return new RemovalImpact(
                warnings,
                orphanedTasks(graph, task.id(), dependency.id()),
                cascadeCandidates(graph, task.id(), dependency.id()),
                keywordHeuristics.sharedSkills(task, dependency)
        );
    }

    /**
     * Dependents of {@code taskId} whose only route to {@code dependsOnId}
     * runs through {@code taskId}
     */
    List<String> orphanedTasks(TaskGraph graph, String taskId, String dependsOnId) {
        return graph.dependents(taskId).stream()
                .filter(dependent -> !reachabilityAnalyzer.hasAlternatePath(graph, dependent, dependsOnId, Set.of(taskId)))
                .toList();
    }

    /**
     * Tasks with direct edges to both endpoints, whose edge to
     * {@code dependsOnId} a cascading removal drops
     */
    List<String> cascadeCandidates(TaskGraph graph, String taskId, String dependsOnId) {
        return graph.dependents(taskId).stream()
                .filter(dependent -> !dependent.equals(dependsOnId))
                .filter(dependent -> graph.hasEdge(dependent, dependsOnId))
                .toList();
    }
}
