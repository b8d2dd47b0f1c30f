package org.neuralchilli.depgraph.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.depgraph.domain.ChangeLogEntry;
import org.neuralchilli.depgraph.domain.DetailedDependency;
import org.neuralchilli.depgraph.domain.Task;
import org.neuralchilli.depgraph.domain.TaskCollection;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Reads and writes task collections as JSON.
 *
 * Fields the engine does not model are carried through untouched, at the
 * collection, metadata and task level, so a read followed by a write keeps
 * every other collaborator's data.
 */
@ApplicationScoped
public class TaskCollectionCodec {

    private final ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);

    /**
     * Parse a task collection from a JSON string
     */
    public TaskCollection parse(String json) {
        try {
            return validate(mapper.readValue(json, TaskCollection.class));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed task collection: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Parse a task collection from an InputStream
     */
    public TaskCollection parse(InputStream inputStream) throws IOException {
        try {
            return validate(mapper.readValue(inputStream, TaskCollection.class));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed task collection: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Pretty-printed JSON for the collection file
     */
    public String write(TaskCollection collection) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(collection);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize task collection", e);
        }
    }

    /**
     * One change log entry as a single line of JSON
     */
    public String writeEntry(ChangeLogEntry entry) {
        try {
            return mapper.writeValueAsString(entry);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize change log entry", e);
        }
    }

    public ChangeLogEntry parseEntry(String line) {
        try {
            return mapper.readValue(line, ChangeLogEntry.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed change log entry: " + e.getOriginalMessage(), e);
        }
    }

    private TaskCollection validate(TaskCollection collection) {
        if (collection == null) {
            throw new IllegalArgumentException("Task collection is empty");
        }

        List<Task> tasks = collection.tasks();
        for (int i = 0; i < tasks.size(); i++) {
            Task task = tasks.get(i);
            if (task == null || task.id() == null || task.id().isBlank()) {
                throw new IllegalArgumentException("Task at index " + i + " has no id");
            }
            for (String dependency : task.dependencies()) {
                if (dependency == null || dependency.isBlank()) {
                    throw new IllegalArgumentException(
                            "Task at index " + i + " (" + task.id() + ") has a dependency with no id");
                }
            }
            List<DetailedDependency> detailed = task.detailedDependencies();
            if (detailed != null && detailed.stream().anyMatch(d -> d == null || d.taskId() == null)) {
                throw new IllegalArgumentException(
                        "Task at index " + i + " (" + task.id() + ") has a detailed dependency with no task id");
            }
        }
        return collection;
    }
}
