package org.neuralchilli.depgraph.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Metadata for one outgoing edge, kept alongside the simple dependency list.
 *
 * @param taskId  id of the task depended on
 * @param type    dependency type as stored (see {@link DependencyType})
 * @param addedAt ISO-8601 timestamp of the edge's creation
 * @param reason  free-text justification
 * @param addedBy writer that created the edge
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DetailedDependency(
        String taskId,
        String type,
        String addedAt,
        String reason,
        String addedBy
) {
    public static final String ENGINE_WRITER = "depgraph";
}
