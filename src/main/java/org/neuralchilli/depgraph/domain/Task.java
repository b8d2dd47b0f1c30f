package org.neuralchilli.depgraph.domain;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A node in the dependency graph.
 *
 * Only the fields the engine reads are typed. Everything else a task record
 * carries is kept in {@link #attributes()} and written back unchanged, so
 * collaborators keep whatever metadata they stored.
 *
 * Tasks are mutated in place by the mutation and audit services; the
 * {@code dependencies} and {@code detailed_dependencies} lists are only ever
 * changed together through {@link #appendDependency} and
 * {@link #removeDependency}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"id", "title", "description", "status", "priority", "effort", "skills",
        "dependencies", "detailed_dependencies", "updated_at"})
public class Task {

    @JsonProperty("id")
    private String id;

    @JsonProperty("title")
    private String title;

    @JsonProperty("description")
    private String description;

    @JsonProperty("status")
    private String status;

    @JsonProperty("priority")
    private String priority;

    @JsonProperty("effort")
    private Number effort;

    @JsonProperty("skills")
    private List<String> skills;

    @JsonProperty("dependencies")
    private List<String> dependencies;

    @JsonProperty("detailed_dependencies")
    private List<DetailedDependency> detailedDependencies;

    @JsonProperty("updated_at")
    private String updatedAt;

    private final Map<String, Object> attributes = new LinkedHashMap<>();

    // lists created by appendDependency, dropped again once emptied
    @JsonIgnore
    private boolean dependenciesAppended;

    @JsonIgnore
    private boolean detailsAppended;

    protected Task() {
        // for Jackson
    }

    public Task(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Task id cannot be null or empty");
        }
        this.id = id;
    }

    public String id() {
        return id;
    }

    public String title() {
        return title;
    }

    /**
     * Title for messages, falling back to the id
     */
    public String displayName() {
        return title != null && !title.isBlank() ? title : id;
    }

    public String description() {
        return description;
    }

    public String status() {
        return status;
    }

    public String priority() {
        return priority;
    }

    public Number effort() {
        return effort;
    }

    public List<String> skills() {
        return skills == null ? List.of() : Collections.unmodifiableList(skills);
    }

    /**
     * Outgoing edges in insertion order. A task stored without the field has none.
     */
    public List<String> dependencies() {
        return dependencies == null ? List.of() : Collections.unmodifiableList(dependencies);
    }

    /**
     * Edge metadata, or null when the task has never tracked it
     */
    public List<DetailedDependency> detailedDependencies() {
        return detailedDependencies == null ? null : Collections.unmodifiableList(detailedDependencies);
    }

    public String updatedAt() {
        return updatedAt;
    }

    @JsonAnyGetter
    public Map<String, Object> attributes() {
        return attributes;
    }

    @JsonAnySetter
    public void setAttribute(String name, Object value) {
        attributes.put(name, value);
    }

    public boolean hasStatus(TaskStatus expected) {
        return expected.matches(status);
    }

    public boolean hasPriority(TaskPriority expected) {
        return expected.matches(priority);
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public void setPriority(String priority) {
        this.priority = priority;
    }

    public boolean dependsOn(String taskId) {
        return dependencies != null && dependencies.contains(taskId);
    }

    /**
     * Append an outgoing edge. When {@code detail} is non-null a matching
     * entry is appended to the detailed list as well.
     */
    public void appendDependency(String taskId, DetailedDependency detail) {
        Objects.requireNonNull(taskId, "taskId");
        if (dependencies == null) {
            dependencies = new ArrayList<>();
            dependenciesAppended = true;
        }
        dependencies.add(taskId);

        if (detail != null) {
            if (detailedDependencies == null) {
                detailedDependencies = new ArrayList<>();
                detailsAppended = true;
            }
            detailedDependencies.add(detail);
        }
    }

    /**
     * Remove every edge to {@code taskId}, simple and detailed.
     *
     * @return true if anything was removed
     */
    public boolean removeDependency(String taskId) {
        boolean removed = false;
        if (dependencies != null && dependencies.removeIf(taskId::equals)) {
            removed = true;
            if (dependencies.isEmpty() && dependenciesAppended) {
                dependencies = null;
                dependenciesAppended = false;
            }
        }
        if (detailedDependencies != null && detailedDependencies.removeIf(detail -> taskId.equals(detail.taskId()))) {
            removed = true;
            if (detailedDependencies.isEmpty() && detailsAppended) {
                // back to untracked, as before the first append
                detailedDependencies = null;
                detailsAppended = false;
            }
        }
        return removed;
    }

    public void touch(Instant now) {
        this.updatedAt = now.toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (obj == null || obj.getClass() != this.getClass()) return false;
        Task that = (Task) obj;
        return Objects.equals(this.id, that.id) &&
                Objects.equals(this.title, that.title) &&
                Objects.equals(this.description, that.description) &&
                Objects.equals(this.status, that.status) &&
                Objects.equals(this.priority, that.priority) &&
                Objects.equals(this.effort, that.effort) &&
                Objects.equals(this.skills, that.skills) &&
                Objects.equals(this.dependencies, that.dependencies) &&
                Objects.equals(this.detailedDependencies, that.detailedDependencies) &&
                Objects.equals(this.updatedAt, that.updatedAt) &&
                Objects.equals(this.attributes, that.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, title, status, priority, dependencies);
    }

    @Override
    public String toString() {
        return "Task[" +
                "id=" + id + ", " +
                "title=" + title + ", " +
                "status=" + status + ", " +
                "priority=" + priority + ", " +
                "dependencies=" + dependencies + ']';
    }

    /**
     * Builder for creating tasks fluently
     */
    public static Builder builder(String id) {
        return new Builder(id);
    }

    public static class Builder {
        private final String id;
        private String title;
        private String description;
        private String status = TaskStatus.PENDING.wireValue();
        private String priority = TaskPriority.MEDIUM.wireValue();
        private Number effort;
        private List<String> skills;
        private List<String> dependencies = List.of();

        public Builder(String id) {
            this.id = id;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status.wireValue();
            return this;
        }

        public Builder status(String status) {
            this.status = status;
            return this;
        }

        public Builder priority(TaskPriority priority) {
            this.priority = priority.wireValue();
            return this;
        }

        public Builder priority(String priority) {
            this.priority = priority;
            return this;
        }

        public Builder effort(Number effort) {
            this.effort = effort;
            return this;
        }

        public Builder skills(List<String> skills) {
            this.skills = skills;
            return this;
        }

        public Builder dependsOn(String... dependencies) {
            this.dependencies = List.of(dependencies);
            return this;
        }

        public Task build() {
            Task task = new Task(id);
            task.title = title != null ? title : id;
            task.description = description;
            task.status = status;
            task.priority = priority;
            task.effort = effort;
            task.skills = skills != null ? new ArrayList<>(skills) : null;
            task.dependencies = new ArrayList<>(dependencies);
            return task;
        }
    }
}
