package org.neuralchilli.depgraph.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.depgraph.core.CriticalPathHeuristics;
import org.neuralchilli.depgraph.core.CycleCheck;
import org.neuralchilli.depgraph.core.CycleDetector;
import org.neuralchilli.depgraph.core.EdgeTypeValidator;
import org.neuralchilli.depgraph.core.ReachabilityAnalyzer;
import org.neuralchilli.depgraph.core.TaskGraph;
import org.neuralchilli.depgraph.core.TypeValidation;
import org.neuralchilli.depgraph.domain.AddOutcome;
import org.neuralchilli.depgraph.domain.CascadeRemoval;
import org.neuralchilli.depgraph.domain.ChangeLogEntry;
import org.neuralchilli.depgraph.domain.CircularDependencyException;
import org.neuralchilli.depgraph.domain.DependencyCounter;
import org.neuralchilli.depgraph.domain.DependencyException;
import org.neuralchilli.depgraph.domain.DependencyType;
import org.neuralchilli.depgraph.domain.DependencyTypeException;
import org.neuralchilli.depgraph.domain.DetailedDependency;
import org.neuralchilli.depgraph.domain.ImpactSummary;
import org.neuralchilli.depgraph.domain.MutationResult;
import org.neuralchilli.depgraph.domain.RemovalImpact;
import org.neuralchilli.depgraph.domain.RemovalWarningException;
import org.neuralchilli.depgraph.domain.RemoveOutcome;
import org.neuralchilli.depgraph.domain.SelfDependencyException;
import org.neuralchilli.depgraph.domain.Task;
import org.neuralchilli.depgraph.domain.TaskCollection;
import org.neuralchilli.depgraph.domain.TaskNotFoundException;
import org.neuralchilli.depgraph.monitoring.EngineMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Adds and removes single dependency edges on an in-memory task collection.
 *
 * Every check runs before the first write, so a failed mutation leaves the
 * collection untouched. Domain failures come back as a
 * {@link MutationResult.Failure}; only programming errors such as null
 * arguments are thrown.
 *
 * Checks here are local to the edge being changed. Cycles elsewhere in the
 * collection are left for the audit to find.
 */
@ApplicationScoped
public class DependencyMutationService {

    private static final Logger log = LoggerFactory.getLogger(DependencyMutationService.class);

    @Inject
    CycleDetector cycleDetector;

    @Inject
    EdgeTypeValidator edgeTypeValidator;

    @Inject
    ReachabilityAnalyzer reachabilityAnalyzer;

    @Inject
    CriticalPathHeuristics criticalPathHeuristics;

    @Inject
    RemovalImpactAnalyzer removalImpactAnalyzer;

    @Inject
    ChangeLogSink changeLog;

    @Inject
    EngineMonitor monitor;

    @Inject
    Clock clock;

    /**
     * Add a blocking edge with default options
     */
    public MutationResult<AddOutcome> addDependency(TaskCollection collection, String taskId, String dependsOnId) {
        return addDependency(collection, taskId, dependsOnId, DependencyType.BLOCKING.wireValue(), AddOptions.defaults());
    }

    /**
     * Make {@code taskId} depend on {@code dependsOnId}.
     *
     * @param type dependency type as stored; null means blocking. Unknown
     *             types fail the type check.
     */
    public MutationResult<AddOutcome> addDependency(
            TaskCollection collection,
            String taskId,
            String dependsOnId,
            String type,
            AddOptions options
    ) {
        Objects.requireNonNull(collection, "collection");
        Objects.requireNonNull(taskId, "taskId");
        Objects.requireNonNull(dependsOnId, "dependsOnId");

        String edgeType = type != null ? type : DependencyType.BLOCKING.wireValue();
        AddOptions effective = options != null ? options : AddOptions.defaults();

        try (EngineMonitor.Timing ignored = monitor.time("add-dependency")) {
            return MutationResult.success(add(collection, taskId, dependsOnId, edgeType, effective));
        } catch (DependencyException e) {
            monitor.recordMutationRejected();
            log.info("Rejected dependency {} -> {}: {}", taskId, dependsOnId, e.getMessage());
            return MutationResult.failure(e.toError());
        }
    }

    /**
     * Remove an edge with default options
     */
    public MutationResult<RemoveOutcome> removeDependency(TaskCollection collection, String taskId, String dependsOnId) {
        return removeDependency(collection, taskId, dependsOnId, RemoveOptions.defaults());
    }

    /**
     * Stop {@code taskId} depending on {@code dependsOnId}.
     */
    public MutationResult<RemoveOutcome> removeDependency(
            TaskCollection collection,
            String taskId,
            String dependsOnId,
            RemoveOptions options
    ) {
        Objects.requireNonNull(collection, "collection");
        Objects.requireNonNull(taskId, "taskId");
        Objects.requireNonNull(dependsOnId, "dependsOnId");

        RemoveOptions effective = options != null ? options : RemoveOptions.defaults();

        try (EngineMonitor.Timing ignored = monitor.time("remove-dependency")) {
            return MutationResult.success(remove(collection, taskId, dependsOnId, effective));
        } catch (DependencyException e) {
            monitor.recordMutationRejected();
            log.info("Rejected removal of {} -> {}: {}", taskId, dependsOnId, e.getMessage());
            return MutationResult.failure(e.toError());
        }
    }

    private AddOutcome add(TaskCollection collection, String taskId, String dependsOnId, String type, AddOptions options) {
        if (taskId.equals(dependsOnId)) {
            throw new SelfDependencyException(taskId);
        }

        TaskGraph graph = TaskGraph.of(collection);
        Task task = graph.task(taskId)
                .orElseThrow(() -> new TaskNotFoundException(taskId, taskId, dependsOnId));
        Task dependency = graph.task(dependsOnId)
                .orElseThrow(() -> new TaskNotFoundException(dependsOnId, taskId, dependsOnId));

        if (task.dependsOn(dependsOnId)) {
            monitor.recordMutationNoOp();
            log.debug("Dependency {} -> {} already exists", taskId, dependsOnId);
            return AddOutcome.alreadyPresent(taskId, dependsOnId, type, collection.totalDependencies());
        }

        List<String> warnings = new ArrayList<>();
        List<String> cyclePath = List.of();
        boolean forcedCycle = false;

        if (options.validateCycles()) {
            CycleCheck check = cycleDetector.wouldCreateCycle(graph, taskId, dependsOnId);
            if (check.hasCycle()) {
                CircularDependencyException cycle = new CircularDependencyException(taskId, dependsOnId, check.cyclePath());
                if (!options.force()) {
                    throw cycle;
                }
                forcedCycle = true;
                cyclePath = check.cyclePath();
                warnings.add(cycle.getMessage());
                log.warn("Forcing dependency {} -> {} despite circular dependency: {}",
                        taskId, dependsOnId, String.join(" → ", cyclePath));
            }
        }

        TypeValidation validation = edgeTypeValidator.validate(task, dependency, type);
        if (!validation.valid()) {
            DependencyTypeException violation = new DependencyTypeException(taskId, dependsOnId, type, validation.reason());
            if (!options.force()) {
                throw violation;
            }
            warnings.add(violation.getMessage());
            log.warn("Forcing {} dependency {} -> {} despite type rule: {}",
                    type, taskId, dependsOnId, validation.reason());
        }

        Instant now = clock.instant();
        String reason = options.reason() != null ? options.reason() : type + " dependency";
        DetailedDependency detail = collection.useDetailedDependencies()
                ? new DetailedDependency(dependsOnId, type, now.toString(), reason, DetailedDependency.ENGINE_WRITER)
                : null;

        task.appendDependency(dependsOnId, detail);
        task.touch(now);
        DependencyCounter counter = collection.dependencyCounter();
        counter.increment(now);

        changeLog.record(ChangeLogEntry.added(taskId, dependsOnId, type, reason, now.toString()));

        ImpactSummary impact = new ImpactSummary(
                graph.dependents(taskId).size(),
                reachabilityAnalyzer.transitiveDependencies(graph, dependsOnId).size(),
                criticalPathHeuristics.isOnCriticalPath(graph, taskId)
                        || criticalPathHeuristics.isOnCriticalPath(graph, dependsOnId)
        );

        monitor.recordMutationApplied();
        if (!warnings.isEmpty()) {
            monitor.recordMutationForced();
        }
        log.info("Added {} dependency {} -> {} ({} total)", type, taskId, dependsOnId, counter.totalDependencies());

        return new AddOutcome(taskId, dependsOnId, type, reason, false, forcedCycle,
                cyclePath, warnings, counter.totalDependencies(), impact);
    }

    private RemoveOutcome remove(TaskCollection collection, String taskId, String dependsOnId, RemoveOptions options) {
        TaskGraph graph = TaskGraph.of(collection);
        Task task = graph.task(taskId)
                .orElseThrow(() -> new TaskNotFoundException(taskId, taskId, dependsOnId));
        Task dependency = graph.task(dependsOnId)
                .orElseThrow(() -> new TaskNotFoundException(dependsOnId, taskId, dependsOnId));

        if (!task.dependsOn(dependsOnId)) {
            monitor.recordMutationNoOp();
            log.debug("Dependency {} -> {} does not exist", taskId, dependsOnId);
            return RemoveOutcome.absent(taskId, dependsOnId, task.dependencies().size(), collection.totalDependencies());
        }

        RemovalImpact impact = RemovalImpact.none();
        boolean forced = false;

        if (options.analyzeImpact()) {
            impact = removalImpactAnalyzer.analyze(graph, task, dependency);
            if (impact.hasBlockingWarnings()) {
                if (!options.force()) {
                    throw new RemovalWarningException(taskId, dependsOnId, impact.warningMessages());
                }
                forced = true;
                log.warn("Forcing removal of dependency {} -> {} despite warnings: {}",
                        taskId, dependsOnId, impact.warningMessages());
            }
        }

        Instant now = clock.instant();
        task.removeDependency(dependsOnId);
        task.touch(now);
        DependencyCounter counter = collection.dependencyCounter();
        counter.decrement(now);

        List<CascadeRemoval> cascadeRemovals = new ArrayList<>();
        if (options.cascadeRemoval()) {
            for (String otherId : graph.dependents(taskId)) {
                Task other = graph.requireTask(otherId);
                if (otherId.equals(taskId) || !other.dependsOn(dependsOnId)) {
                    continue;
                }

                other.removeDependency(dependsOnId);
                other.touch(now);
                counter.decrement(now);
                cascadeRemovals.add(new CascadeRemoval(otherId, other.displayName(), dependsOnId, CascadeRemoval.REDUNDANT));
                log.info("Cascade removed redundant dependency {} -> {}", otherId, dependsOnId);
            }
            monitor.recordCascadeRemovals(cascadeRemovals.size());
        }

        changeLog.record(ChangeLogEntry.removed(taskId, dependsOnId, options.reason(), cascadeRemovals, now.toString()));

        monitor.recordMutationApplied();
        if (forced) {
            monitor.recordMutationForced();
        }
        log.info("Removed dependency {} -> {} ({} total)", taskId, dependsOnId, counter.totalDependencies());

        return new RemoveOutcome(taskId, dependsOnId, true, forced, task.dependencies().size(),
                impact, cascadeRemovals, counter.totalDependencies());
    }
}
