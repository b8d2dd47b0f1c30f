package org.neuralchilli.depgraph.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Lifecycle status of a task as stored in the task collection.
 * Tasks keep the raw string, so values outside this set survive a round trip
 * and simply never match a status rule.
 */
public enum TaskStatus {
    /**
     * Not started yet
     */
    PENDING("pending"),

    /**
     * Work has started
     */
    IN_PROGRESS("in-progress"),

    /**
     * Finished
     */
    COMPLETED("completed"),

    /**
     * Waiting on something outside the task itself
     */
    BLOCKED("blocked"),

    /**
     * Dropped, no longer expected to finish
     */
    CANCELLED("cancelled");

    private final String wireValue;

    TaskStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    /**
     * Check whether a raw status string denotes this status
     */
    public boolean matches(String value) {
        return wireValue.equalsIgnoreCase(value);
    }

    /**
     * Check if this is a terminal state (task will not progress further)
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }

    /**
     * Parse status from its stored form (case-insensitive)
     */
    public static Optional<TaskStatus> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(status -> status.matches(value))
                .findFirst();
    }
}
