package org.neuralchilli.depgraph.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Mechanical remediation attached to an auto-fixable issue.
 */
public enum FixAction {
    /**
     * Drop an edge whose target does not exist
     */
    REMOVE_DEPENDENCY("remove-dependency"),

    /**
     * Raise the dependency's priority one level
     */
    RAISE_PRIORITY("adjust-priority"),

    /**
     * Drop a direct edge already implied by an indirect path
     */
    REMOVE_REDUNDANT_DEPENDENCY("remove-redundant-dependency");

    private final String wireValue;

    FixAction(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }
}
