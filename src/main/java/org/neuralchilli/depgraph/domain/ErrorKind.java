package org.neuralchilli.depgraph.domain;

/**
 * Failure categories reported by the engine. Callers branch on these rather
 * than on message text.
 */
public enum ErrorKind {
    /**
     * A task was asked to depend on itself (never overridable)
     */
    SELF_DEPENDENCY,

    /**
     * One of the referenced tasks is not in the collection (never overridable)
     */
    TASK_NOT_FOUND,

    /**
     * The new edge would close a cycle
     */
    CIRCULAR_DEPENDENCY,

    /**
     * The edge violates its dependency type's status/priority rule
     */
    DEPENDENCY_TYPE,

    /**
     * Removal impact analysis raised blocking warnings
     */
    REMOVAL_WARNING,

    /**
     * An edge points at a task that does not exist
     */
    MISSING_REFERENCE;

    /**
     * Whether {@code force} may push a mutation past this failure
     */
    public boolean isOverridable() {
        return this == CIRCULAR_DEPENDENCY || this == DEPENDENCY_TYPE || this == REMOVAL_WARNING;
    }
}
