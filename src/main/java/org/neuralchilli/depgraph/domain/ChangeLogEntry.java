package org.neuralchilli.depgraph.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

/**
 * One mutation record for the append-only change log.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ChangeLogEntry(
        Action action,
        String taskId,
        String dependsOn,
        String type,
        String reason,
        List<CascadeRemoval> cascadeResults,
        String timestamp
) {
    public enum Action {
        ADD,
        REMOVE;

        @JsonValue
        public String wireValue() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public ChangeLogEntry {
        cascadeResults = cascadeResults != null ? List.copyOf(cascadeResults) : List.of();
    }

    public static ChangeLogEntry added(String taskId, String dependsOn, String type, String reason, String timestamp) {
        return new ChangeLogEntry(Action.ADD, taskId, dependsOn, type, reason, List.of(), timestamp);
    }

    public static ChangeLogEntry removed(String taskId, String dependsOn, String reason,
                                         List<CascadeRemoval> cascadeResults, String timestamp) {
        return new ChangeLogEntry(Action.REMOVE, taskId, dependsOn, null, reason, cascadeResults, timestamp);
    }
}
