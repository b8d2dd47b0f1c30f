package org.neuralchilli.depgraph.core;

import org.neuralchilli.depgraph.domain.Task;
import org.neuralchilli.depgraph.domain.TaskCollection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Adjacency view over a task collection.
 *
 * Edges point from a task to the tasks it depends on. The view reads each
 * task's dependency list on every call, so edge mutations made through the
 * collection are visible immediately. Edges may reference ids that are not in
 * the collection; such ids have no neighbors and {@link #taskExists} is false.
 */
public final class TaskGraph {

    private final TaskCollection collection;
    private final Map<String, Task> index;

    private TaskGraph(TaskCollection collection) {
        this.collection = collection;
        this.index = new LinkedHashMap<>();
        for (Task task : collection.tasks()) {
            // first occurrence wins on duplicate ids
            index.putIfAbsent(task.id(), task);
        }
    }

    public static TaskGraph of(TaskCollection collection) {
        Objects.requireNonNull(collection, "collection");
        return new TaskGraph(collection);
    }

    public TaskCollection collection() {
        return collection;
    }

    /**
     * Tasks {@code taskId} depends on, in insertion order
     */
    public List<String> neighbors(String taskId) {
        Task task = index.get(taskId);
        return task == null ? List.of() : task.dependencies();
    }

    public boolean taskExists(String taskId) {
        return index.containsKey(taskId);
    }

    /**
     * All task ids in collection order
     */
    public Set<String> allTaskIds() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(index.keySet()));
    }

    public Optional<Task> task(String taskId) {
        return Optional.ofNullable(index.get(taskId));
    }

    public Task requireTask(String taskId) {
        Task task = index.get(taskId);
        if (task == null) {
            throw new IllegalArgumentException("Task not in graph: " + taskId);
        }
        return task;
    }

    /**
     * Tasks that list {@code taskId} among their dependencies, in collection order
     */
    public List<String> dependents(String taskId) {
        List<String> result = new ArrayList<>();
        for (Task task : index.values()) {
            if (task.dependsOn(taskId)) {
                result.add(task.id());
            }
        }
        return result;
    }

    public boolean hasDependents(String taskId) {
        return index.values().stream().anyMatch(task -> task.dependsOn(taskId));
    }

    public boolean hasEdge(String from, String to) {
        return neighbors(from).contains(to);
    }

    public int size() {
        return index.size();
    }

    public int edgeCount() {
        return index.values().stream()
                .mapToInt(task -> task.dependencies().size())
                .sum();
    }
}
