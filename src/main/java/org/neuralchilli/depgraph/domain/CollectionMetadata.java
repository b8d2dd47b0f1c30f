package org.neuralchilli.depgraph.domain;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The {@code metadata} block of a task collection. Fields other than the
 * dependency aggregate belong to other collaborators and are passed through.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CollectionMetadata {

    @JsonProperty("dependencies")
    private DependencyCounter dependencies;

    @JsonProperty("useDetailedDependencies")
    private Boolean useDetailedDependencies;

    private final Map<String, Object> attributes = new LinkedHashMap<>();

    public DependencyCounter dependencies() {
        return dependencies;
    }

    /**
     * Detailed edge metadata is written unless explicitly switched off
     */
    public boolean useDetailedDependencies() {
        return !Boolean.FALSE.equals(useDetailedDependencies);
    }

    public void setUseDetailedDependencies(Boolean useDetailedDependencies) {
        this.useDetailedDependencies = useDetailedDependencies;
    }

    DependencyCounter dependenciesOrCreate() {
        if (dependencies == null) {
            dependencies = new DependencyCounter();
        }
        return dependencies;
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
