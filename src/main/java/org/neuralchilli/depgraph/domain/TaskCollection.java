package org.neuralchilli.depgraph.domain;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A deserialized task collection: {@code { metadata: {...}, tasks: [...] }}.
 *
 * The collection is owned by whichever caller loaded it, for the duration of
 * one operation. The engine mutates it in place; the caller writes it back.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"metadata", "tasks"})
public class TaskCollection {

    @JsonProperty("metadata")
    private CollectionMetadata metadata;

    @JsonProperty("tasks")
    private List<Task> tasks = new ArrayList<>();

    private final Map<String, Object> attributes = new LinkedHashMap<>();

    public TaskCollection() {
    }

    public TaskCollection(List<Task> tasks) {
        this.tasks = new ArrayList<>(tasks);
    }

    public static TaskCollection of(Task... tasks) {
        return new TaskCollection(Arrays.asList(tasks));
    }

    public CollectionMetadata metadata() {
        return metadata;
    }

    public List<Task> tasks() {
        return tasks == null ? List.of() : Collections.unmodifiableList(tasks);
    }

    public Optional<Task> findTask(String id) {
        return tasks().stream()
                .filter(task -> task.id().equals(id))
                .findFirst();
    }

    /**
     * Whether adds should write a detailed entry next to the simple id
     */
    public boolean useDetailedDependencies() {
        return metadata == null || metadata.useDetailedDependencies();
    }

    /**
     * The dependency aggregate, created on first use
     */
    public DependencyCounter dependencyCounter() {
        if (metadata == null) {
            metadata = new CollectionMetadata();
        }
        return metadata.dependenciesOrCreate();
    }

    /**
     * Current aggregate total, 0 when the collection has none yet
     */
    public int totalDependencies() {
        return metadata == null || metadata.dependencies() == null
                ? 0
                : metadata.dependencies().totalDependencies();
    }

    /**
     * Recompute the aggregate from the tasks' current edges
     *
     * @return the new total
     */
    public int recountDependencies(Instant now) {
        int total = tasks().stream()
                .mapToInt(task -> task.dependencies().size())
                .sum();
        dependencyCounter().reset(total, now);
        return total;
    }

    @JsonAnyGetter
    public Map<String, Object> attributes() {
        return attributes;
    }

    @JsonAnySetter
    public void setAttribute(String name, Object value) {
        attributes.put(name, value);
    }
}
