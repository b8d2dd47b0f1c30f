package org.neuralchilli.depgraph.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One audit finding.
 *
 * @param type          category
 * @param severity      severity
 * @param title         short headline
 * @param description   full sentence describing the finding
 * @param affectedTasks ids involved, dependent first where an edge is concerned
 * @param suggestion    remediation hint for a human
 * @param fixAction     mechanical fix, null when not auto-fixable
 * @param taskId        dependent end of the edge a fix targets, if any
 * @param dependsOn     depended-on end of that edge, if any
 * @param path          cycle or indirect path, where relevant
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record AuditIssue(
        IssueType type,
        Severity severity,
        String title,
        String description,
        List<String> affectedTasks,
        String suggestion,
        FixAction fixAction,
        String taskId,
        String dependsOn,
        List<String> path
) {
    public AuditIssue {
        if (type == null || severity == null) {
            throw new IllegalArgumentException("Issue type and severity are required");
        }
        affectedTasks = affectedTasks != null ? List.copyOf(affectedTasks) : List.of();
        path = path != null ? List.copyOf(path) : List.of();
    }

    @JsonProperty("autoFixable")
    @JsonInclude(JsonInclude.Include.ALWAYS)
    public boolean autoFixable() {
        return fixAction != null;
    }
}
