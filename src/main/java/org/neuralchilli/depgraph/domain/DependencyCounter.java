package org.neuralchilli.depgraph.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Collection-level dependency aggregate ({@code metadata.dependencies}).
 * Maintained incrementally by every mutation.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DependencyCounter {

    @JsonProperty("totalDependencies")
    private int totalDependencies;

    @JsonProperty("lastUpdated")
    private String lastUpdated;

    public DependencyCounter() {
    }

    public DependencyCounter(int totalDependencies, String lastUpdated) {
        this.totalDependencies = totalDependencies;
        this.lastUpdated = lastUpdated;
    }

    public int totalDependencies() {
        return totalDependencies;
    }

    public String lastUpdated() {
        return lastUpdated;
    }

    public void increment(Instant now) {
        totalDependencies++;
        lastUpdated = now.toString();
    }

    /**
     * Never goes below zero, even if the stored count was already stale.
     */
    public void decrement(Instant now) {
        totalDependencies = Math.max(0, totalDependencies - 1);
        lastUpdated = now.toString();
    }

    public void reset(int total, Instant now) {
        totalDependencies = total;
        lastUpdated = now.toString();
    }

    @Override
    public String toString() {
        return "DependencyCounter[totalDependencies=" + totalDependencies + ", lastUpdated=" + lastUpdated + ']';
    }
}
