package org.neuralchilli.depgraph.core;

import java.util.List;

/**
 * Result of a pre-flight cycle check.
 *
 * @param hasCycle  whether the candidate edge closes a cycle
 * @param cyclePath the closed path, starting and ending at the re-visited node
 */
public record CycleCheck(boolean hasCycle, List<String> cyclePath) {

    public CycleCheck {
        cyclePath = cyclePath != null ? List.copyOf(cyclePath) : List.of();
    }

    public static CycleCheck none() {
        return new CycleCheck(false, List.of());
    }

    public static CycleCheck found(List<String> cyclePath) {
        return new CycleCheck(true, cyclePath);
    }
}
