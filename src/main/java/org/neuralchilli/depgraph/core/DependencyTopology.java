package org.neuralchilli.depgraph.core;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jgrapht.Graph;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.traverse.TopologicalOrderIterator;
import org.neuralchilli.depgraph.domain.CircularDependencyException;
import org.neuralchilli.depgraph.domain.DagStatistics;
import org.neuralchilli.depgraph.domain.MissingReferenceException;
import org.neuralchilli.depgraph.domain.Task;
import org.neuralchilli.depgraph.domain.TaskNotFoundException;
import org.neuralchilli.depgraph.domain.TaskPriority;
import org.neuralchilli.depgraph.domain.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Ordering and shape queries over a dependency graph, built on JGraphT.
 *
 * In the JGraphT graph an edge runs from a dependency to its dependent, so
 * topological order lists dependencies first. Ties are broken by collection
 * order to keep results stable between runs.
 */
@ApplicationScoped
public class DependencyTopology {

    private static final Logger log = LoggerFactory.getLogger(DependencyTopology.class);

    @Inject
    CycleDetector cycleDetector;

    /**
     * Build a JGraphT graph with one vertex per task.
     *
     * @throws MissingReferenceException if an edge names a task that does not exist
     */
    public Graph<String, DefaultEdge> buildDirectedGraph(TaskGraph graph) {
        DefaultDirectedGraph<String, DefaultEdge> directed = new DefaultDirectedGraph<>(DefaultEdge.class);

        for (String taskId : graph.allTaskIds()) {
            directed.addVertex(taskId);
        }

        for (String taskId : graph.allTaskIds()) {
            for (String dependency : graph.neighbors(taskId)) {
                if (!graph.taskExists(dependency)) {
                    throw new MissingReferenceException(taskId, dependency);
                }
                // duplicate entries collapse into one edge
                if (!directed.containsEdge(dependency, taskId)) {
                    directed.addEdge(dependency, taskId);
                }
            }
        }

        log.debug("Built dependency graph: {} vertices, {} edges",
                directed.vertexSet().size(),
                directed.edgeSet().size()
        );

        return directed;
    }

    /**
     * Whether the graph can be ordered at all
     */
    public boolean isAcyclic(TaskGraph graph) {
        return !new org.jgrapht.alg.cycle.CycleDetector<>(buildDirectedGraph(graph)).detectCycles();
    }

    /**
     * Task ids with every dependency ahead of its dependents.
     *
     * @throws CircularDependencyException if the graph contains a cycle
     */
    public List<String> topologicalOrder(TaskGraph graph) {
        Graph<String, DefaultEdge> directed = requireAcyclic(graph);

        List<String> order = new ArrayList<>();
        TopologicalOrderIterator<String, DefaultEdge> iterator =
                new TopologicalOrderIterator<>(directed, collectionOrder(graph));

        while (iterator.hasNext()) {
            order.add(iterator.next());
        }

        return order;
    }

    /**
     * Groups of tasks with no dependencies on each other; every task's
     * dependencies sit in earlier levels.
     */
    public List<Set<String>> executionLevels(TaskGraph graph) {
        Graph<String, DefaultEdge> directed = requireAcyclic(graph);

        List<Set<String>> levels = new ArrayList<>();
        Set<String> processed = new HashSet<>();
        Set<String> remaining = new LinkedHashSet<>(graph.allTaskIds());

        while (!remaining.isEmpty()) {
            Set<String> currentLevel = new LinkedHashSet<>();

            for (String taskId : remaining) {
                Set<String> dependencies = directed.incomingEdgesOf(taskId).stream()
                        .map(directed::getEdgeSource)
                        .collect(Collectors.toSet());
                if (processed.containsAll(dependencies)) {
                    currentLevel.add(taskId);
                }
            }

            if (currentLevel.isEmpty()) {
                // unreachable once requireAcyclic passed
                throw new IllegalStateException("Could not determine execution levels");
            }

            levels.add(currentLevel);
            processed.addAll(currentLevel);
            remaining.removeAll(currentLevel);
        }

        log.debug("Graph has {} execution levels", levels.size());
        return levels;
    }

    /**
     * Tasks with no dependencies
     */
    public Set<String> rootTasks(TaskGraph graph) {
        return graph.allTaskIds().stream()
                .filter(taskId -> graph.neighbors(taskId).isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * Tasks nothing depends on
     */
    public Set<String> leafTasks(TaskGraph graph) {
        return graph.allTaskIds().stream()
                .filter(taskId -> !graph.hasDependents(taskId))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * Pending or in-progress tasks whose dependencies are all completed or
     * cancelled. Tasks holding up the most others come first, then higher
     * priority, then id.
     */
    public List<Task> readyTasks(TaskGraph graph) {
        Map<String, Integer> dependentCounts = new HashMap<>();
        List<Task> ready = new ArrayList<>();

        for (String taskId : graph.allTaskIds()) {
            Task task = graph.requireTask(taskId);
            if (!task.hasStatus(TaskStatus.PENDING) && !task.hasStatus(TaskStatus.IN_PROGRESS)) {
                continue;
            }

            boolean unblocked = task.dependencies().stream()
                    .allMatch(dependency -> graph.task(dependency)
                            .map(dep -> dep.hasStatus(TaskStatus.COMPLETED) || dep.hasStatus(TaskStatus.CANCELLED))
                            .orElse(false));

            if (unblocked) {
                ready.add(task);
                dependentCounts.put(taskId, graph.dependents(taskId).size());
            }
        }

        ready.sort(Comparator
                .comparing((Task task) -> dependentCounts.get(task.id()), Comparator.reverseOrder())
                .thenComparing(task -> TaskPriority.weightOf(task.priority()), Comparator.reverseOrder())
                .thenComparing(Task::id));

        log.debug("Found {} ready tasks", ready.size());
        return ready;
    }

    /**
     * Tasks within {@code maxDepth} hops of the focus task in either
     * direction, in collection order. A depth of 0 means unlimited.
     *
     * @throws TaskNotFoundException if the focus task does not exist
     */
    public List<String> focusSubgraph(TaskGraph graph, String focusId, int maxDepth) {
        if (!graph.taskExists(focusId)) {
            throw new TaskNotFoundException(focusId);
        }

        Set<String> included = new HashSet<>();
        Map<String, Integer> depth = new HashMap<>();
        Queue<String> queue = new LinkedList<>();

        included.add(focusId);
        depth.put(focusId, 0);
        queue.add(focusId);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            int currentDepth = depth.get(current);
            if (maxDepth > 0 && currentDepth >= maxDepth) {
                continue;
            }

            List<String> adjacent = new ArrayList<>(graph.neighbors(current));
            adjacent.addAll(graph.dependents(current));

            for (String next : adjacent) {
                if (included.add(next)) {
                    depth.put(next, currentDepth + 1);
                    queue.add(next);
                }
            }
        }

        return graph.allTaskIds().stream()
                .filter(included::contains)
                .toList();
    }

    /**
     * Depth and width of an acyclic graph.
     *
     * @throws CircularDependencyException if the graph contains a cycle
     */
    public DagStatistics statistics(TaskGraph graph) {
        List<Set<String>> levels = executionLevels(graph);
        int maxParallelism = levels.stream()
                .mapToInt(Set::size)
                .max()
                .orElse(0);

        return new DagStatistics(
                graph.size(),
                rootTasks(graph).size(),
                leafTasks(graph).size(),
                levels.size(),
                maxParallelism
        );
    }

    private Graph<String, DefaultEdge> requireAcyclic(TaskGraph graph) {
        Graph<String, DefaultEdge> directed = buildDirectedGraph(graph);
        if (new org.jgrapht.alg.cycle.CycleDetector<>(directed).detectCycles()) {
            List<List<String>> cycles = cycleDetector.findAllCycles(graph);
            List<String> first = cycles.isEmpty() ? List.of() : cycles.get(0);
            throw new CircularDependencyException(
                    "Cannot order tasks: graph contains a circular dependency " + String.join(" → ", first),
                    first
            );
        }
        return directed;
    }

    private static Comparator<String> collectionOrder(TaskGraph graph) {
        Map<String, Integer> position = new HashMap<>();
        for (String taskId : graph.allTaskIds()) {
            position.put(taskId, position.size());
        }
        return Comparator.comparing(position::get);
    }
}
