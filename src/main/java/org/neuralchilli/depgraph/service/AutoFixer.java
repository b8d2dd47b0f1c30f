package org.neuralchilli.depgraph.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.depgraph.core.ReachabilityAnalyzer;
import org.neuralchilli.depgraph.core.TaskGraph;
import org.neuralchilli.depgraph.domain.AuditIssue;
import org.neuralchilli.depgraph.domain.ChangeLogEntry;
import org.neuralchilli.depgraph.domain.FixResult;
import org.neuralchilli.depgraph.domain.Task;
import org.neuralchilli.depgraph.domain.TaskCollection;
import org.neuralchilli.depgraph.domain.TaskPriority;
import org.neuralchilli.depgraph.monitoring.EngineMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Applies the mechanical fix attached to audit issues.
 *
 * Each fix re-checks its precondition against the collection as it is now,
 * since an earlier fix in the same run may already have changed things. A fix
 * either applies completely or writes nothing.
 */
@ApplicationScoped
public class AutoFixer {

    private static final Logger log = LoggerFactory.getLogger(AutoFixer.class);

    static final String NOT_FIXABLE = "Issue is not auto-fixable";

    @Inject
    ReachabilityAnalyzer reachabilityAnalyzer;

    @Inject
    ChangeLogSink changeLog;

    @Inject
    EngineMonitor monitor;

    @Inject
    Clock clock;

    /**
     * One result per issue, in issue order
     */
    public List<FixResult> applyFixes(TaskCollection collection, List<AuditIssue> issues) {
        TaskGraph graph = TaskGraph.of(collection);
        List<FixResult> results = new ArrayList<>();

        for (AuditIssue issue : issues) {
            if (!issue.autoFixable()) {
                results.add(FixResult.skipped(issue, NOT_FIXABLE));
                continue;
            }

            FixResult result = switch (issue.fixAction()) {
                case REMOVE_DEPENDENCY -> removeMissingDependency(graph, issue);
                case REMOVE_REDUNDANT_DEPENDENCY -> removeRedundantDependency(graph, issue);
                case RAISE_PRIORITY -> raisePriority(graph, issue);
            };

            if (result.applied()) {
                monitor.recordFixApplied();
                log.info("Auto-fix applied for {}: {}", issue.type().wireValue(), result.reason());
            } else {
                monitor.recordFixFailed();
                log.warn("Auto-fix for {} on {} -> {} not applied: {}",
                        issue.type().wireValue(), issue.taskId(), issue.dependsOn(), result.reason());
            }
            results.add(result);
        }

        return results;
    }

    private FixResult removeMissingDependency(TaskGraph graph, AuditIssue issue) {
        Optional<Task> task = graph.task(issue.taskId());
        if (task.isEmpty()) {
            return FixResult.skipped(issue, "Task no longer exists: " + issue.taskId());
        }
        if (!task.get().dependsOn(issue.dependsOn())) {
            return FixResult.skipped(issue, "Dependency is no longer present");
        }
        if (graph.taskExists(issue.dependsOn())) {
            return FixResult.skipped(issue, "Dependency target exists now: " + issue.dependsOn());
        }

        removeEdge(graph.collection(), task.get(), issue.dependsOn(), "auto-fix: removed dependency on missing task");
        return FixResult.applied(issue, "Removed dependency on missing task " + issue.dependsOn());
    }

    private FixResult removeRedundantDependency(TaskGraph graph, AuditIssue issue) {
        Optional<Task> task = graph.task(issue.taskId());
        if (task.isEmpty()) {
            return FixResult.skipped(issue, "Task no longer exists: " + issue.taskId());
        }
        if (!task.get().dependsOn(issue.dependsOn())) {
            return FixResult.skipped(issue, "Dependency is no longer present");
        }

        List<String> path = reachabilityAnalyzer.findIndirectPath(graph, issue.taskId(), issue.dependsOn());
        if (path.isEmpty()) {
            return FixResult.skipped(issue, "Dependency is no longer redundant");
        }

        removeEdge(graph.collection(), task.get(), issue.dependsOn(),
                "auto-fix: removed redundant dependency, implied by " + String.join(" → ", path));
        return FixResult.applied(issue, "Removed redundant dependency " + issue.taskId() + " -> " + issue.dependsOn());
    }

    private FixResult raisePriority(TaskGraph graph, AuditIssue issue) {
        Optional<Task> dependency = graph.task(issue.dependsOn());
        if (dependency.isEmpty()) {
            return FixResult.skipped(issue, "Task no longer exists: " + issue.dependsOn());
        }
        if (!dependency.get().hasPriority(TaskPriority.LOW)) {
            return FixResult.skipped(issue, "Priority is no longer low");
        }

        TaskPriority raised = TaskPriority.LOW.raise();
        dependency.get().setPriority(raised.wireValue());
        dependency.get().touch(clock.instant());
        return FixResult.applied(issue, "Raised priority of " + issue.dependsOn() + " from low to " + raised.wireValue());
    }

    private void removeEdge(TaskCollection collection, Task task, String dependsOnId, String reason) {
        Instant now = clock.instant();
        task.removeDependency(dependsOnId);
        task.touch(now);
        collection.dependencyCounter().decrement(now);
        changeLog.record(ChangeLogEntry.removed(task.id(), dependsOnId, reason, List.of(), now.toString()));
    }
}
