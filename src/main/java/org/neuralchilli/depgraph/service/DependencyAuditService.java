package org.neuralchilli.depgraph.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.depgraph.config.DependencyGraphConfig;
import org.neuralchilli.depgraph.core.CriticalPathHeuristics;
import org.neuralchilli.depgraph.core.CycleDetector;
import org.neuralchilli.depgraph.core.DependencyTopology;
import org.neuralchilli.depgraph.core.KeywordHeuristics;
import org.neuralchilli.depgraph.core.ReachabilityAnalyzer;
import org.neuralchilli.depgraph.core.TaskGraph;
import org.neuralchilli.depgraph.domain.AuditCheck;
import org.neuralchilli.depgraph.domain.AuditIssue;
import org.neuralchilli.depgraph.domain.AuditReport;
import org.neuralchilli.depgraph.domain.AuditSummary;
import org.neuralchilli.depgraph.domain.DagStatistics;
import org.neuralchilli.depgraph.domain.DependencyMetrics;
import org.neuralchilli.depgraph.domain.FixAction;
import org.neuralchilli.depgraph.domain.FixResult;
import org.neuralchilli.depgraph.domain.IssueType;
import org.neuralchilli.depgraph.domain.Severity;
import org.neuralchilli.depgraph.domain.Task;
import org.neuralchilli.depgraph.domain.TaskCollection;
import org.neuralchilli.depgraph.domain.TaskPriority;
import org.neuralchilli.depgraph.domain.TaskStatus;
import org.neuralchilli.depgraph.monitoring.EngineMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Whole-collection dependency audit.
 *
 * Runs the requested checks in a fixed order (cycles, logical, orphans,
 * redundant, critical-path), drops issues below the minimum severity and
 * optionally applies the auto-fixes before re-running the same checks.
 */
@ApplicationScoped
public class DependencyAuditService {

    private static final Logger log = LoggerFactory.getLogger(DependencyAuditService.class);

    @Inject
    CycleDetector cycleDetector;

    @Inject
    ReachabilityAnalyzer reachabilityAnalyzer;

    @Inject
    KeywordHeuristics keywordHeuristics;

    @Inject
    CriticalPathHeuristics criticalPathHeuristics;

    @Inject
    DependencyTopology topology;

    @Inject
    AutoFixer autoFixer;

    @Inject
    DependencyGraphConfig config;

    @Inject
    EngineMonitor monitor;

    @Inject
    Clock clock;

    public AuditReport audit(TaskCollection collection) {
        return audit(collection, AuditOptions.defaults());
    }

    /**
     * Audit the collection. With auto-fix enabled the collection is changed
     * in place and the report describes the state after the fixes.
     *
     * @throws IllegalArgumentException if the severity filter is not recognized
     */
    public AuditReport audit(TaskCollection collection, AuditOptions options) {
        Objects.requireNonNull(collection, "collection");
        AuditOptions effective = options != null ? options : AuditOptions.defaults();

        Set<AuditCheck> checks = AuditCheck.expand(effective.checks());
        String severityFilter = effective.minimumSeverity() != null
                ? effective.minimumSeverity()
                : config.audit().minimumSeverity();
        int minimumRank = Severity.minimumRank(severityFilter);

        try (EngineMonitor.Timing ignored = monitor.time("audit")) {
            monitor.recordAudit();
            TaskGraph graph = TaskGraph.of(collection);

            List<AuditIssue> issues = filter(runChecks(graph, checks), minimumRank);
            List<FixResult> fixes = List.of();

            if (effective.autoFix()) {
                fixes = autoFixer.applyFixes(collection, issues);
                long applied = fixes.stream().filter(FixResult::applied).count();
                if (applied > 0) {
                    log.info("Applied {} of {} fixes, re-running audit", applied, fixes.size());
                    issues = filter(runChecks(graph, checks), minimumRank);
                }
            }

            AuditSummary summary = summarize(graph, issues);
            DependencyMetrics metrics = effective.includeMetrics() ? metrics(graph) : null;

            log.info("Audit of {} tasks found {} issues ({} critical, {} warning, {} info)",
                    summary.totalTasks(), summary.totalIssues(),
                    summary.critical(), summary.warning(), summary.info());

            return new AuditReport(issues, summary, metrics, fixes, clock.instant().toString());
        }
    }

    List<AuditIssue> runChecks(TaskGraph graph, Set<AuditCheck> checks) {
        List<AuditIssue> issues = new ArrayList<>();

        if (checks.contains(AuditCheck.CYCLES)) {
            checkCycles(graph, issues);
        }
        if (checks.contains(AuditCheck.LOGICAL)) {
            checkLogicalConsistency(graph, issues);
        }
        if (checks.contains(AuditCheck.ORPHANS)) {
            checkOrphans(graph, issues);
        }
        if (checks.contains(AuditCheck.REDUNDANT)) {
            checkRedundancy(graph, issues);
        }
        if (checks.contains(AuditCheck.CRITICAL_PATH)) {
            checkCriticalPath(graph, issues);
        }

        log.debug("Checks {} produced {} issues", checks, issues.size());
        return issues;
    }

    private void checkCycles(TaskGraph graph, List<AuditIssue> issues) {
        for (List<String> cycle : cycleDetector.findAllCycles(graph)) {
            issues.add(new AuditIssue(
                    IssueType.CYCLE,
                    Severity.CRITICAL,
                    "Circular Dependency Detected",
                    "Circular dependency found in task chain: " + String.join(" → ", cycle),
                    cycle,
                    "Remove one or more dependencies to break the cycle",
                    null,
                    null,
                    null,
                    cycle
            ));
        }
    }

    private void checkLogicalConsistency(TaskGraph graph, List<AuditIssue> issues) {
        for (String taskId : graph.allTaskIds()) {
            Task task = graph.requireTask(taskId);

            for (String dependencyId : task.dependencies().stream().distinct().toList()) {
                if (!graph.taskExists(dependencyId)) {
                    issues.add(new AuditIssue(
                            IssueType.MISSING_DEPENDENCY,
                            Severity.CRITICAL,
                            "Missing Dependency Task",
                            "Task \"" + task.displayName() + "\" depends on non-existent task: " + dependencyId,
                            List.of(taskId),
                            "Remove the dependency or create the missing task",
                            FixAction.REMOVE_DEPENDENCY,
                            taskId,
                            dependencyId,
                            null
                    ));
                    continue;
                }

                Task dependency = graph.requireTask(dependencyId);
                checkKeywordOrder(task, dependency, issues);
                checkStatus(task, dependency, issues);
                checkPriority(task, dependency, issues);
            }
        }
    }

    private void checkKeywordOrder(Task task, Task dependency, List<AuditIssue> issues) {
        if (keywordHeuristics.isQuestionableOrder(task, dependency)) {
            issues.add(edgeIssue(
                    IssueType.LOGICAL_INCONSISTENCY,
                    Severity.WARNING,
                    "Questionable Dependency Order",
                    "Testing task \"" + task.displayName() + "\" depends on implementation task \""
                            + dependency.displayName() + "\" - this may be backwards",
                    task, dependency,
                    "Consider if the implementation should depend on the test specification instead",
                    null
            ));
        }

        if (keywordHeuristics.isImplementationAheadOfSetup(task, dependency)) {
            issues.add(edgeIssue(
                    IssueType.LOGICAL_INCONSISTENCY,
                    Severity.WARNING,
                    "Implementation Completed Before Setup",
                    "Implementation task \"" + task.displayName() + "\" is completed but setup dependency \""
                            + dependency.displayName() + "\" is still pending",
                    task, dependency,
                    "Verify if the setup was actually completed and update task status",
                    null
            ));
        }
    }

    private void checkStatus(Task task, Task dependency, List<AuditIssue> issues) {
        if (task.hasStatus(TaskStatus.COMPLETED)
                && !dependency.hasStatus(TaskStatus.COMPLETED)
                && !dependency.hasStatus(TaskStatus.CANCELLED)) {
            issues.add(edgeIssue(
                    IssueType.STATUS_INCONSISTENCY,
                    Severity.WARNING,
                    "Completed Task with Incomplete Dependency",
                    "Task \"" + task.displayName() + "\" is completed but dependency \""
                            + dependency.displayName() + "\" is " + dependency.status(),
                    task, dependency,
                    "Verify task completion or update dependency status",
                    null
            ));
        }

        if (task.hasStatus(TaskStatus.IN_PROGRESS) && dependency.hasStatus(TaskStatus.PENDING)) {
            issues.add(edgeIssue(
                    IssueType.STATUS_INCONSISTENCY,
                    Severity.INFO,
                    "Task Started Before Dependency",
                    "Task \"" + task.displayName() + "\" is in progress but dependency \""
                            + dependency.displayName() + "\" is still pending",
                    task, dependency,
                    "Consider starting the dependency task if this is a blocking relationship",
                    null
            ));
        }
    }

    private void checkPriority(Task task, Task dependency, List<AuditIssue> issues) {
        if (task.hasPriority(TaskPriority.HIGH) && dependency.hasPriority(TaskPriority.LOW)) {
            issues.add(edgeIssue(
                    IssueType.PRIORITY_INCONSISTENCY,
                    Severity.INFO,
                    "Priority Mismatch",
                    "High priority task \"" + task.displayName() + "\" depends on low priority task \""
                            + dependency.displayName() + "\"",
                    task, dependency,
                    "Consider increasing dependency priority or reviewing task priorities",
                    FixAction.RAISE_PRIORITY
            ));
        }
    }

    private void checkOrphans(TaskGraph graph, List<AuditIssue> issues) {
        for (String taskId : graph.allTaskIds()) {
            if (!graph.neighbors(taskId).isEmpty() || graph.hasDependents(taskId)) {
                continue;
            }
            Task task = graph.requireTask(taskId);
            issues.add(new AuditIssue(
                    IssueType.ORPHANED_TASK,
                    Severity.INFO,
                    "Orphaned Task",
                    "Task \"" + task.displayName() + "\" has no dependencies and no other tasks depend on it",
                    List.of(taskId),
                    "Review if this task needs dependencies or if other tasks should depend on it",
                    null,
                    null,
                    null,
                    null
            ));
        }
    }

    private void checkRedundancy(TaskGraph graph, List<AuditIssue> issues) {
        for (String taskId : graph.allTaskIds()) {
            Task task = graph.requireTask(taskId);

            for (String dependencyId : task.dependencies().stream().distinct().toList()) {
                List<String> path = reachabilityAnalyzer.findIndirectPath(graph, taskId, dependencyId);
                if (path.isEmpty()) {
                    continue;
                }

                String dependencyTitle = graph.task(dependencyId)
                        .map(Task::displayName)
                        .orElse(dependencyId);
                issues.add(new AuditIssue(
                        IssueType.REDUNDANT_DEPENDENCY,
                        Severity.INFO,
                        "Redundant Dependency",
                        "Task \"" + task.displayName() + "\" has redundant dependency on \"" + dependencyTitle
                                + "\" via path: " + String.join(" → ", path),
                        List.of(taskId, dependencyId),
                        "Consider removing the direct dependency as an indirect path exists",
                        FixAction.REMOVE_REDUNDANT_DEPENDENCY,
                        taskId,
                        dependencyId,
                        path
                ));
            }
        }
    }

    private void checkCriticalPath(TaskGraph graph, List<AuditIssue> issues) {
        int bottleneckThreshold = config.audit().bottleneckThreshold();
        int longChainThreshold = config.audit().longChainThreshold();

        for (String taskId : graph.allTaskIds()) {
            if (!criticalPathHeuristics.isBottleneck(graph, taskId, bottleneckThreshold)) {
                continue;
            }
            Task task = graph.requireTask(taskId);
            int dependentCount = graph.dependents(taskId).size();
            issues.add(new AuditIssue(
                    IssueType.CRITICAL_PATH,
                    Severity.WARNING,
                    "Potential Bottleneck",
                    "Task \"" + task.displayName() + "\" has " + dependentCount
                            + " dependent tasks, creating a potential bottleneck",
                    List.of(taskId),
                    "Consider parallelizing some dependent tasks or breaking down this task",
                    null,
                    null,
                    null,
                    null
            ));
        }

        for (Map.Entry<String, Integer> entry : reachabilityAnalyzer.chainLengths(graph).entrySet()) {
            if (entry.getValue() < longChainThreshold) {
                continue;
            }
            Task task = graph.requireTask(entry.getKey());
            issues.add(new AuditIssue(
                    IssueType.CRITICAL_PATH,
                    Severity.INFO,
                    "Long Dependency Chain",
                    "Task \"" + task.displayName() + "\" has a dependency chain of " + entry.getValue() + " tasks",
                    List.of(entry.getKey()),
                    "Review if some dependencies can be parallelized",
                    null,
                    null,
                    null,
                    null
            ));
        }
    }

    private static AuditIssue edgeIssue(
            IssueType type,
            Severity severity,
            String title,
            String description,
            Task task,
            Task dependency,
            String suggestion,
            FixAction fixAction
    ) {
        return new AuditIssue(type, severity, title, description,
                List.of(task.id(), dependency.id()), suggestion, fixAction,
                task.id(), dependency.id(), null);
    }

    private static List<AuditIssue> filter(List<AuditIssue> issues, int minimumRank) {
        return issues.stream()
                .filter(issue -> issue.severity().isAtLeast(minimumRank))
                .toList();
    }

    private AuditSummary summarize(TaskGraph graph, List<AuditIssue> issues) {
        int tasksWithDependencies = 0;
        for (String taskId : graph.allTaskIds()) {
            if (!graph.neighbors(taskId).isEmpty()) {
                tasksWithDependencies++;
            }
        }

        return new AuditSummary(
                graph.size(),
                tasksWithDependencies,
                graph.edgeCount(),
                count(issues, IssueType.CYCLE),
                count(issues, IssueType.ORPHANED_TASK),
                count(issues, IssueType.REDUNDANT_DEPENDENCY),
                count(issues, IssueType.MISSING_DEPENDENCY),
                count(issues, Severity.CRITICAL),
                count(issues, Severity.WARNING),
                count(issues, Severity.INFO)
        );
    }

    private static int count(List<AuditIssue> issues, IssueType type) {
        return (int) issues.stream().filter(issue -> issue.type() == type).count();
    }

    private static int count(List<AuditIssue> issues, Severity severity) {
        return (int) issues.stream().filter(issue -> issue.severity() == severity).count();
    }

    /**
     * Whole-collection dependency metrics.
     */
    DependencyMetrics metrics(TaskGraph graph) {
        int tasksWithDependencies = 0;
        int totalDependencies = 0;
        int maxDependencies = 0;
        int tasksWithNoDependencies = 0;
        int tasksWithNoDependents = 0;
        boolean dangling = false;
        SortedMap<Integer, Integer> distribution = new TreeMap<>();

        for (String taskId : graph.allTaskIds()) {
            List<String> dependencies = graph.neighbors(taskId);
            int count = dependencies.size();

            if (count > 0) {
                tasksWithDependencies++;
                totalDependencies += count;
                maxDependencies = Math.max(maxDependencies, count);
            } else {
                tasksWithNoDependencies++;
            }
            if (!graph.hasDependents(taskId)) {
                tasksWithNoDependents++;
            }
            distribution.merge(count, 1, Integer::sum);
            dangling |= dependencies.stream().anyMatch(id -> !graph.taskExists(id));
        }

        int longestChain = reachabilityAnalyzer.chainLengths(graph).values().stream()
                .mapToInt(Integer::intValue)
                .max()
                .orElse(0);

        double average = graph.size() > 0
                ? Math.round(totalDependencies * 100.0 / graph.size()) / 100.0
                : 0.0;

        DagStatistics dagStatistics = !dangling && topology.isAcyclic(graph)
                ? topology.statistics(graph)
                : null;

        return new DependencyMetrics(
                graph.size(),
                tasksWithDependencies,
                totalDependencies,
                average,
                maxDependencies,
                tasksWithNoDependencies,
                tasksWithNoDependents,
                longestChain,
                distribution,
                dagStatistics
        );
    }
}
