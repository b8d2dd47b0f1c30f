package org.neuralchilli.depgraph.core;

import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * Depth-first cycle detection over a {@link TaskGraph}.
 *
 * Both searches keep an explicit stack instead of recursing, so long
 * dependency chains cannot overflow the thread stack. Traversal order is the
 * collection order of tasks and the insertion order of each task's edges.
 */
@ApplicationScoped
public class CycleDetector {

    private static final Logger log = LoggerFactory.getLogger(CycleDetector.class);

    /**
     * Check whether adding {@code from -> to} would close a cycle.
     *
     * The search starts at {@code to} with the candidate edge provisionally
     * present. Reaching {@code from} means the candidate edge is a back-edge
     * onto the root, and the reported path runs {@code [to, ..., from, to]}.
     * Cycles that do not pass through the candidate edge are not reported;
     * finding those is the audit's job.
     */
    public CycleCheck wouldCreateCycle(TaskGraph graph, String from, String to) {
        if (from.equals(to)) {
            return CycleCheck.found(List.of(from, to));
        }

        Set<String> visited = new HashSet<>();
        List<String> path = new ArrayList<>();
        Deque<Frame> stack = new ArrayDeque<>();

        visited.add(to);
        path.add(to);
        stack.push(new Frame(to, graph.neighbors(to)));

        while (!stack.isEmpty()) {
            Frame frame = stack.peek();

            if (frame.node.equals(from)) {
                List<String> cycle = new ArrayList<>(path);
                cycle.add(to);
                log.debug("Edge {} -> {} would close cycle {}", from, to, cycle);
                return CycleCheck.found(cycle);
            }

            if (frame.edges.hasNext()) {
                String next = frame.edges.next();
                if (visited.add(next)) {
                    path.add(next);
                    stack.push(new Frame(next, graph.neighbors(next)));
                }
            } else {
                stack.pop();
                path.remove(path.size() - 1);
            }
        }

        return CycleCheck.none();
    }

    /**
     * Find cycles across the whole graph in a single DFS pass.
     *
     * Every back-edge to a node on the current stack yields one cycle, reported
     * as the stack slice from that node to the current node plus the node
     * again. The same cycle may be reported more than once when several
     * back-edges close it.
     */
    public List<List<String>> findAllCycles(TaskGraph graph) {
        List<List<String>> cycles = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        Set<String> onStack = new HashSet<>();
        List<String> path = new ArrayList<>();
        Deque<Frame> stack = new ArrayDeque<>();

        for (String start : graph.allTaskIds()) {
            if (visited.contains(start)) {
                continue;
            }

            visited.add(start);
            onStack.add(start);
            path.add(start);
            stack.push(new Frame(start, graph.neighbors(start)));

            while (!stack.isEmpty()) {
                Frame frame = stack.peek();

                if (frame.edges.hasNext()) {
                    String next = frame.edges.next();
                    if (onStack.contains(next)) {
                        List<String> cycle = new ArrayList<>(path.subList(path.indexOf(next), path.size()));
                        cycle.add(next);
                        cycles.add(cycle);
                    } else if (visited.add(next)) {
                        onStack.add(next);
                        path.add(next);
                        stack.push(new Frame(next, graph.neighbors(next)));
                    }
                } else {
                    stack.pop();
                    onStack.remove(frame.node);
                    path.remove(path.size() - 1);
                }
            }
        }

        log.debug("Found {} cycles across {} tasks", cycles.size(), graph.size());
        return cycles;
    }

    public boolean hasCycles(TaskGraph graph) {
        return !findAllCycles(graph).isEmpty();
    }

    private static final class Frame {
        private final String node;
        private final Iterator<String> edges;

        private Frame(String node, List<String> neighbors) {
            this.node = node;
            // snapshot so the walk is stable even if the task list changes later
            this.edges = List.copyOf(neighbors).iterator();
        }
    }
}
