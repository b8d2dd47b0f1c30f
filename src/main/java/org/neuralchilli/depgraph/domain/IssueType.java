package org.neuralchilli.depgraph.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Categories of audit findings.
 */
public enum IssueType {
    CYCLE("cycle"),
    MISSING_DEPENDENCY("missing-dependency"),
    LOGICAL_INCONSISTENCY("logical-inconsistency"),
    STATUS_INCONSISTENCY("status-inconsistency"),
    PRIORITY_INCONSISTENCY("priority-inconsistency"),
    ORPHANED_TASK("orphaned-task"),
    REDUNDANT_DEPENDENCY("redundant-dependency"),
    CRITICAL_PATH("critical-path");

    private final String wireValue;

    IssueType(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }
}
