package org.neuralchilli.depgraph.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Full audit output: {@code { issues, summary, metrics?, fixes? }}.
 * When fixes were applied, issues and summary describe the post-fix state.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record AuditReport(
        List<AuditIssue> issues,
        AuditSummary summary,
        DependencyMetrics metrics,
        List<FixResult> fixes,
        String validatedAt
) {
    public AuditReport {
        issues = issues != null ? List.copyOf(issues) : List.of();
        fixes = fixes != null ? List.copyOf(fixes) : List.of();
    }

    public List<AuditIssue> issuesOfType(IssueType type) {
        return issues.stream()
                .filter(issue -> issue.type() == type)
                .toList();
    }

    public long fixesApplied() {
        return fixes.stream().filter(FixResult::applied).count();
    }
}
