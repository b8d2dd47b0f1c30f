package org.neuralchilli.depgraph.domain;

/**
 * Outcome of one auto-fix attempt. A fix either fully applies or writes nothing.
 */
public record FixResult(
        IssueType issueType,
        String taskId,
        String dependsOn,
        boolean applied,
        String reason
) {
    public static FixResult applied(AuditIssue issue, String reason) {
        return new FixResult(issue.type(), issue.taskId(), issue.dependsOn(), true, reason);
    }

    public static FixResult skipped(AuditIssue issue, String reason) {
        return new FixResult(issue.type(), issue.taskId(), issue.dependsOn(), false, reason);
    }
}
