package org.neuralchilli.depgraph.domain;

/**
 * An edge removed as redundant while cascading another removal.
 *
 * @param taskId            task whose edge was removed
 * @param taskTitle         its title, for display
 * @param removedDependency the id it no longer depends on
 * @param reason            why the edge went
 */
public record CascadeRemoval(
        String taskId,
        String taskTitle,
        String removedDependency,
        String reason
) {
    public static final String REDUNDANT = "Redundant dependency removed";
}
