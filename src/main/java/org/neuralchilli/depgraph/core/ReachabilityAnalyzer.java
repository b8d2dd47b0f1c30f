package org.neuralchilli.depgraph.core;

import jakarta.enterprise.context.ApplicationScoped;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;

/**
 * Path existence and chain depth queries over a {@link TaskGraph}.
 * All traversals follow edges from a task to its dependencies.
 */
@ApplicationScoped
public class ReachabilityAnalyzer {

    /**
     * Check whether {@code to} is reachable from {@code from}.
     *
     * @param excludeDirectEdge skip the direct edge {@code from -> to} (and any
     *                          duplicate of it), so only paths of two or more
     *                          hops count
     */
    public boolean hasPath(TaskGraph graph, String from, String to, boolean excludeDirectEdge) {
        return !search(graph, from, to, excludeDirectEdge).isEmpty();
    }

    /**
     * Shortest path {@code [from, ..., to]} that does not use the direct edge,
     * or an empty list if there is none.
     */
    public List<String> findIndirectPath(TaskGraph graph, String from, String to) {
        return search(graph, from, to, true);
    }

    /**
     * Breadth-first search from {@code from} that never enters {@code excluded}.
     * Used to decide whether a dependent keeps a route to a dependency once an
     * intermediate task is taken out of the picture.
     */
    public boolean hasAlternatePath(TaskGraph graph, String from, String to, Collection<String> excluded) {
        Set<String> visited = new HashSet<>(excluded);
        Queue<String> queue = new LinkedList<>();
        queue.add(from);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (!visited.add(current)) {
                continue;
            }

            for (String dependency : graph.neighbors(current)) {
                if (dependency.equals(to)) {
                    return true;
                }
                if (!visited.contains(dependency)) {
                    queue.add(dependency);
                }
            }
        }

        return false;
    }

    /**
     * Distinct tasks reachable from {@code taskId}, excluding itself, in
     * depth-first pre-order.
     */
    public Set<String> transitiveDependencies(TaskGraph graph, String taskId) {
        Set<String> chain = new LinkedHashSet<>();
        Set<String> visited = new HashSet<>();
        Deque<Iterator<String>> stack = new ArrayDeque<>();

        visited.add(taskId);
        stack.push(graph.neighbors(taskId).iterator());

        while (!stack.isEmpty()) {
            Iterator<String> edges = stack.peek();
            if (!edges.hasNext()) {
                stack.pop();
                continue;
            }

            String next = edges.next();
            if (!next.equals(taskId)) {
                chain.add(next);
            }
            if (visited.add(next)) {
                stack.push(graph.neighbors(next).iterator());
            }
        }

        return chain;
    }

    /**
     * Longest dependency chain starting at {@code taskId}, counted in tasks.
     * A task without dependencies, or one not in the collection, has length 1.
     * Edges back onto the current path count 0, so existing cycles terminate.
     */
    public int chainLength(TaskGraph graph, String taskId) {
        return chainLength(graph, taskId, new HashMap<>());
    }

    /**
     * Chain length for every task, sharing intermediate results
     */
    public Map<String, Integer> chainLengths(TaskGraph graph) {
        Map<String, Integer> memo = new HashMap<>();
        Map<String, Integer> result = new LinkedHashMap<>();
        for (String taskId : graph.allTaskIds()) {
            result.put(taskId, chainLength(graph, taskId, memo));
        }
        return result;
    }

    private int chainLength(TaskGraph graph, String taskId, Map<String, Integer> memo) {
        Integer known = memo.get(taskId);
        if (known != null) {
            return known;
        }

        Set<String> onPath = new HashSet<>();
        Deque<ChainFrame> stack = new ArrayDeque<>();
        onPath.add(taskId);
        stack.push(new ChainFrame(taskId, graph.neighbors(taskId)));

        while (true) {
            ChainFrame frame = stack.peek();

            if (frame.edges.hasNext()) {
                String next = frame.edges.next();
                if (onPath.contains(next)) {
                    // revisiting the current path contributes nothing, and
                    // makes this frame's result depend on the path taken
                    frame.pathDependent = true;
                } else if (memo.containsKey(next)) {
                    frame.best = Math.max(frame.best, memo.get(next));
                } else {
                    onPath.add(next);
                    stack.push(new ChainFrame(next, graph.neighbors(next)));
                }
                continue;
            }

            stack.pop();
            onPath.remove(frame.node);
            int length = frame.best + 1;
            if (!frame.pathDependent) {
                memo.put(frame.node, length);
            }

            ChainFrame parent = stack.peek();
            if (parent == null) {
                return length;
            }
            parent.best = Math.max(parent.best, length);
            parent.pathDependent |= frame.pathDependent;
        }
    }

    private List<String> search(TaskGraph graph, String from, String to, boolean excludeDirectEdge) {
        Map<String, String> parents = new HashMap<>();
        Set<String> visited = new HashSet<>();
        Queue<String> queue = new LinkedList<>();

        visited.add(from);
        queue.add(from);

        while (!queue.isEmpty()) {
            String current = queue.poll();

            for (String dependency : graph.neighbors(current)) {
                if (excludeDirectEdge && current.equals(from) && dependency.equals(to)) {
                    continue;
                }
                if (dependency.equals(to)) {
                    List<String> path = new ArrayList<>();
                    path.add(to);
                    for (String step = current; step != null; step = parents.get(step)) {
                        path.add(0, step);
                    }
                    return path;
                }
                if (visited.add(dependency)) {
                    parents.put(dependency, current);
                    queue.add(dependency);
                }
            }
        }

        return List.of();
    }

    private static final class ChainFrame {
        private final String node;
        private final Iterator<String> edges;
        private int best;
        private boolean pathDependent;

        private ChainFrame(String node, List<String> neighbors) {
            this.node = node;
            this.edges = List.copyOf(neighbors).iterator();
        }
    }
}
