package org.neuralchilli.depgraph.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Task priority levels, lowest weight first.
 */
public enum TaskPriority {
    LOW("low", 1),
    MEDIUM("medium", 2),
    HIGH("high", 3);

    private final String wireValue;
    private final int weight;

    TaskPriority(String wireValue, int weight) {
        this.wireValue = wireValue;
        this.weight = weight;
    }

    public String wireValue() {
        return wireValue;
    }

    public int weight() {
        return weight;
    }

    public boolean matches(String value) {
        return wireValue.equalsIgnoreCase(value);
    }

    /**
     * Next level up; HIGH stays HIGH.
     */
    public TaskPriority raise() {
        return switch (this) {
            case LOW -> MEDIUM;
            case MEDIUM, HIGH -> HIGH;
        };
    }

    /**
     * Parse priority from its stored form (case-insensitive)
     */
    public static Optional<TaskPriority> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(priority -> priority.matches(value))
                .findFirst();
    }

    /**
     * Weight of a raw priority string, MEDIUM when unrecognized
     */
    public static int weightOf(String value) {
        return fromString(value).orElse(MEDIUM).weight();
    }
}
