package org.neuralchilli.depgraph.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Semantics of a dependency edge.
 * BLOCKING is the default for edges added without an explicit type.
 */
public enum DependencyType {
    BLOCKING("blocking"),
    RELATED("related"),
    OPTIONAL("optional"),
    FINISH_TO_START("finish-to-start"),
    START_TO_START("start-to-start"),
    FINISH_TO_FINISH("finish-to-finish"),
    START_TO_FINISH("start-to-finish");

    private final String wireValue;

    DependencyType(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    /**
     * Informational types never constrain task ordering
     */
    public boolean isInformational() {
        return this == RELATED || this == OPTIONAL;
    }

    /**
     * Parse type from its stored form (case-insensitive)
     */
    public static Optional<DependencyType> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(type -> type.wireValue.equalsIgnoreCase(value))
                .findFirst();
    }
}
