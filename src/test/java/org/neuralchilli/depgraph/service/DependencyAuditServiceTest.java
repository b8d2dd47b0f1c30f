package org.neuralchilli.depgraph.service;

import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.depgraph.TestTasks;
import org.neuralchilli.depgraph.domain.AuditCheck;
import org.neuralchilli.depgraph.domain.AuditIssue;
import org.neuralchilli.depgraph.domain.AuditReport;
import org.neuralchilli.depgraph.domain.ChangeLogEntry;
import org.neuralchilli.depgraph.domain.DependencyMetrics;
import org.neuralchilli.depgraph.domain.FixAction;
import org.neuralchilli.depgraph.domain.FixResult;
import org.neuralchilli.depgraph.domain.IssueType;
import org.neuralchilli.depgraph.domain.Severity;
import org.neuralchilli.depgraph.domain.Task;
import org.neuralchilli.depgraph.domain.TaskCollection;
import org.neuralchilli.depgraph.domain.TaskPriority;
import org.neuralchilli.depgraph.domain.TaskStatus;
import org.neuralchilli.depgraph.monitoring.EngineMonitor;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;
import static org.assertj.core.api.Assertions.tuple;
import static org.neuralchilli.depgraph.TestTasks.task;

@QuarkusTest
class DependencyAuditServiceTest {

    @Inject
    DependencyAuditService auditor;

    @Inject
    DependencyMutationService mutations;

    @Inject
    AutoFixer autoFixer;

    @Inject
    InMemoryChangeLogSink changeLog;

    @Inject
    EngineMonitor monitor;

    @BeforeEach
    void setUp() {
        changeLog.clear();
        monitor.reset();
    }

    @Test
    void shouldFindRedundantDependency() {
        // Given: A -> B -> C and A -> C
        TaskCollection collection = TestTasks.triangle();

        // When
        AuditReport report = auditor.audit(collection, checks(AuditCheck.REDUNDANT));

        // Then: Only the direct edge A -> C is redundant
        assertThat(report.issues()).singleElement().satisfies(issue -> {
            assertThat(issue.type()).isEqualTo(IssueType.REDUNDANT_DEPENDENCY);
            assertThat(issue.title()).isEqualTo("Redundant Dependency");
            assertThat(issue.taskId()).isEqualTo("A");
            assertThat(issue.dependsOn()).isEqualTo("C");
            assertThat(issue.path()).containsExactly("A", "B", "C");
            assertThat(issue.affectedTasks()).containsExactly("A", "C");
            assertThat(issue.autoFixable()).isTrue();
        });
        assertThat(report.summary().redundantDependencies()).isEqualTo(1);
        assertThat(collection.findTask("A").orElseThrow().dependencies()).containsExactly("B", "C");
    }

    @Test
    void shouldRemoveRedundantDependencyAndReaudit() {
        // Given: The triangle with an up-to-date counter
        TaskCollection collection = TestTasks.triangle();
        collection.recountDependencies(Instant.parse("2024-01-01T00:00:00Z"));

        // When: Auditing with auto-fix
        AuditReport report = auditor.audit(collection, AuditOptions.builder()
                .checks(AuditCheck.REDUNDANT)
                .autoFix(true)
                .build());

        // Then: The fix was applied and the re-audit is clean
        assertThat(report.fixesApplied()).isEqualTo(1);
        assertThat(report.issues()).isEmpty();
        assertThat(collection.findTask("A").orElseThrow().dependencies()).containsExactly("B");
        assertThat(collection.totalDependencies()).isEqualTo(2);
        assertThat(changeLog.entries()).singleElement().satisfies(entry -> {
            assertThat(entry.action()).isEqualTo(ChangeLogEntry.Action.REMOVE);
            assertThat(entry.reason()).contains("A → B → C");
        });
        assertThat(monitor.snapshot().fixesApplied()).isEqualTo(1);
    }

    @Test
    void shouldFindOrphanUntilSomethingDependsOnIt() {
        // Given: A -> B, and X on its own
        TaskCollection collection = TaskCollection.of(task("A", "B"), task("B"), task("X"));

        // Then: Only X is orphaned
        assertThat(auditor.audit(collection, checks(AuditCheck.ORPHANS)).issues())
                .extracting(AuditIssue::affectedTasks)
                .containsExactly(List.of("X"));

        // When: X joins the graph
        mutations.addDependency(collection, "X", "A");

        // Then: No orphans remain
        AuditReport report = auditor.audit(collection, checks(AuditCheck.ORPHANS));
        assertThat(report.issues()).isEmpty();
        assertThat(report.summary().orphanedTasks()).isZero();
    }

    @Test
    void shouldReportAndFixMissingReference() {
        // Given: A depends on a task that does not exist
        TaskCollection collection = TaskCollection.of(task("A", "ghost"), task("B", "A"));

        // When
        AuditReport report = auditor.audit(collection, checks(AuditCheck.LOGICAL));

        // Then
        AuditIssue issue = report.issues().get(0);
        assertThat(report.issues()).hasSize(1);
        assertThat(issue.type()).isEqualTo(IssueType.MISSING_DEPENDENCY);
        assertThat(issue.severity()).isEqualTo(Severity.CRITICAL);
        assertThat(issue.affectedTasks()).containsExactly("A");
        assertThat(issue.fixAction()).isEqualTo(FixAction.REMOVE_DEPENDENCY);
        assertThat(report.summary().missingReferences()).isEqualTo(1);
        assertThat(report.metrics().dagStatistics()).isNull();

        // When: Fixing
        AuditReport fixed = auditor.audit(collection, AuditOptions.builder()
                .checks(AuditCheck.LOGICAL)
                .autoFix(true)
                .build());

        // Then
        assertThat(fixed.fixes()).singleElement().satisfies(fix -> {
            assertThat(fix.applied()).isTrue();
            assertThat(fix.reason()).isEqualTo("Removed dependency on missing task ghost");
        });
        assertThat(fixed.issues()).isEmpty();
        assertThat(collection.findTask("A").orElseThrow().dependencies()).isEmpty();
        assertThat(fixed.metrics().dagStatistics()).isNotNull();
    }

    @Test
    void shouldRaiseLowPriorityDependency() {
        TaskCollection collection = TaskCollection.of(
                task("A", TaskStatus.PENDING, TaskPriority.HIGH, "B"),
                task("B", TaskStatus.PENDING, TaskPriority.LOW)
        );

        AuditReport report = auditor.audit(collection, AuditOptions.builder()
                .checks(AuditCheck.LOGICAL)
                .autoFix(true)
                .build());

        assertThat(report.fixes()).extracting(FixResult::issueType)
                .containsExactly(IssueType.PRIORITY_INCONSISTENCY);
        assertThat(report.issues()).isEmpty();
        Task b = collection.findTask("B").orElseThrow();
        assertThat(b.priority()).isEqualTo("medium");
        assertThat(b.updatedAt()).isNotNull();
    }

    @Test
    void shouldReportPriorityMismatchAsInfo() {
        TaskCollection collection = TaskCollection.of(
                task("A", TaskStatus.PENDING, TaskPriority.HIGH, "B"),
                task("B", TaskStatus.PENDING, TaskPriority.LOW)
        );

        AuditIssue issue = auditor.audit(collection, checks(AuditCheck.LOGICAL)).issues().get(0);

        assertThat(issue.title()).isEqualTo("Priority Mismatch");
        assertThat(issue.severity()).isEqualTo(Severity.INFO);
        assertThat(issue.fixAction()).isEqualTo(FixAction.RAISE_PRIORITY);
        assertThat(issue.affectedTasks()).containsExactly("A", "B");
    }

    @Test
    void shouldFlagStatusInconsistencies() {
        TaskCollection collection = TaskCollection.of(
                task("A", TaskStatus.COMPLETED, TaskPriority.MEDIUM, "B"),
                task("B", TaskStatus.PENDING, TaskPriority.MEDIUM),
                task("C", TaskStatus.IN_PROGRESS, TaskPriority.MEDIUM, "D"),
                task("D", TaskStatus.PENDING, TaskPriority.MEDIUM),
                task("E", TaskStatus.COMPLETED, TaskPriority.MEDIUM, "F"),
                task("F", TaskStatus.CANCELLED, TaskPriority.MEDIUM)
        );

        AuditReport report = auditor.audit(collection, checks(AuditCheck.LOGICAL));

        assertThat(report.issues())
                .extracting(AuditIssue::title, AuditIssue::severity)
                .containsExactly(
                        tuple("Completed Task with Incomplete Dependency", Severity.WARNING),
                        tuple("Task Started Before Dependency", Severity.INFO)
                );
        assertThat(report.issues().get(0).description()).isEqualTo("Task \"A\" is completed but dependency \"B\" is pending");
    }

    @Test
    void shouldFlagQuestionableOrdering() {
        TaskCollection collection = TaskCollection.of(
                Task.builder("test").title("Test login").dependsOn("impl").build(),
                Task.builder("impl").title("Implement login").build()
        );

        AuditReport report = auditor.audit(collection, checks(AuditCheck.LOGICAL));

        assertThat(report.issues()).singleElement().satisfies(issue -> {
            assertThat(issue.type()).isEqualTo(IssueType.LOGICAL_INCONSISTENCY);
            assertThat(issue.title()).isEqualTo("Questionable Dependency Order");
            assertThat(issue.autoFixable()).isFalse();
        });
    }

    @Test
    void shouldReportEachCycle() {
        TaskCollection collection = TaskCollection.of(task("A", "B"), task("B", "A"), task("X"));

        AuditReport report = auditor.audit(collection, AuditOptions.defaults());

        // cycles come first, then the orphan
        assertThat(report.issues()).extracting(AuditIssue::type)
                .containsExactly(IssueType.CYCLE, IssueType.ORPHANED_TASK);
        assertThat(report.issues().get(0).path()).containsExactly("A", "B", "A");
        assertThat(report.issues().get(0).description())
                .isEqualTo("Circular dependency found in task chain: A → B → A");
        assertThat(report.summary().cyclesFound()).isEqualTo(1);
        assertThat(report.summary().critical()).isEqualTo(1);
        assertThat(report.metrics().dagStatistics()).isNull();
    }

    @Test
    void shouldSkipIssuesThatCannotBeFixed() {
        // Given: A cycle and a missing reference
        TaskCollection collection = TaskCollection.of(task("A", "B"), task("B", "A"), task("C", "ghost"));

        // When
        AuditReport report = auditor.audit(collection, AuditOptions.builder()
                .checks(AuditCheck.CYCLES, AuditCheck.LOGICAL)
                .autoFix(true)
                .build());

        // Then: The cycle is left, the missing reference is gone
        assertThat(report.fixes()).extracting(FixResult::applied).containsExactly(false, true);
        assertThat(report.fixes().get(0).reason()).isEqualTo(AutoFixer.NOT_FIXABLE);
        assertThat(report.issues()).extracting(AuditIssue::type).containsExactly(IssueType.CYCLE);
    }

    @Test
    void shouldRecheckFixPreconditions() {
        // Given: A redundant edge whose indirect path has since gone
        TaskCollection collection = TestTasks.triangle();
        AuditIssue stale = auditor.audit(collection, checks(AuditCheck.REDUNDANT)).issues().get(0);
        collection.findTask("A").orElseThrow().removeDependency("B");

        // When
        List<FixResult> results = autoFixer.applyFixes(collection, List.of(stale));

        // Then: Nothing is removed
        assertThat(results).singleElement().satisfies(result -> {
            assertThat(result.applied()).isFalse();
            assertThat(result.reason()).isEqualTo("Dependency is no longer redundant");
        });
        assertThat(collection.findTask("A").orElseThrow().dependencies()).containsExactly("C");
        assertThat(monitor.snapshot().fixesFailed()).isEqualTo(1);
    }

    @Test
    void shouldFilterBySeverity() {
        // Given: A status warning plus an orphan (info)
        TaskCollection collection = TaskCollection.of(
                task("A", TaskStatus.COMPLETED, TaskPriority.MEDIUM, "B"),
                task("B", TaskStatus.PENDING, TaskPriority.MEDIUM),
                task("X")
        );

        AuditReport warnings = auditor.audit(collection, AuditOptions.builder().minimumSeverity("warning").build());
        AuditReport everything = auditor.audit(collection, AuditOptions.builder().minimumSeverity("all").build());
        AuditReport critical = auditor.audit(collection, AuditOptions.builder().minimumSeverity("critical").build());

        assertThat(warnings.issues()).extracting(AuditIssue::type)
                .containsExactly(IssueType.STATUS_INCONSISTENCY);
        assertThat(everything.issues()).extracting(AuditIssue::type)
                .containsExactly(IssueType.STATUS_INCONSISTENCY, IssueType.ORPHANED_TASK);
        assertThat(critical.issues()).isEmpty();
        assertThat(critical.summary().isClean()).isTrue();
    }

    @Test
    void shouldRejectUnknownSeverity() {
        TaskCollection collection = TestTasks.chain();

        assertThatThrownBy(() -> auditor.audit(collection, AuditOptions.builder().minimumSeverity("loud").build()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid severity filter");
    }

    @Test
    void shouldFlagBottleneck() {
        TaskCollection collection = TaskCollection.of(
                task("core"),
                task("a", "core"),
                task("b", "core"),
                task("c", "core")
        );

        AuditReport report = auditor.audit(collection, checks(AuditCheck.CRITICAL_PATH));

        assertThat(report.issues()).singleElement().satisfies(issue -> {
            assertThat(issue.title()).isEqualTo("Potential Bottleneck");
            assertThat(issue.severity()).isEqualTo(Severity.WARNING);
            assertThat(issue.description())
                    .isEqualTo("Task \"core\" has 3 dependent tasks, creating a potential bottleneck");
        });
    }

    @Test
    void shouldFlagLongChain() {
        TaskCollection collection = TaskCollection.of(
                task("n1", "n2"),
                task("n2", "n3"),
                task("n3", "n4"),
                task("n4", "n5"),
                task("n5")
        );

        AuditReport report = auditor.audit(collection, checks(AuditCheck.CRITICAL_PATH));

        assertThat(report.issues()).singleElement().satisfies(issue -> {
            assertThat(issue.title()).isEqualTo("Long Dependency Chain");
            assertThat(issue.affectedTasks()).containsExactly("n1");
            assertThat(issue.description()).isEqualTo("Task \"n1\" has a dependency chain of 5 tasks");
        });
    }

    @Test
    void shouldComputeMetrics() {
        // Given: A diamond, A -> {B, C} -> D
        TaskCollection collection = TaskCollection.of(
                task("A", "B", "C"),
                task("B", "D"),
                task("C", "D"),
                task("D")
        );

        // When
        DependencyMetrics metrics = auditor.audit(collection).metrics();

        // Then
        assertThat(metrics.totalTasks()).isEqualTo(4);
        assertThat(metrics.tasksWithDependencies()).isEqualTo(3);
        assertThat(metrics.totalDependencies()).isEqualTo(4);
        assertThat(metrics.averageDependenciesPerTask()).isEqualTo(1.0);
        assertThat(metrics.maxDependencies()).isEqualTo(2);
        assertThat(metrics.tasksWithNoDependencies()).isEqualTo(1);
        assertThat(metrics.tasksWithNoDependents()).isEqualTo(1);
        assertThat(metrics.longestDependencyChain()).isEqualTo(3);
        assertThat(metrics.dependencyDistribution())
                .containsExactly(entry(0, 1), entry(1, 2), entry(2, 1));
        assertThat(metrics.dagStatistics().executionLevels()).isEqualTo(3);
        assertThat(metrics.dagStatistics().maxParallelism()).isEqualTo(2);
    }

    @Test
    void shouldRoundAverageToTwoDecimals() {
        DependencyMetrics metrics = auditor.audit(TestTasks.chain()).metrics();

        assertThat(metrics.averageDependenciesPerTask()).isEqualTo(0.67);
    }

    @Test
    void shouldLeaveOutMetricsWhenNotRequested() {
        AuditReport report = auditor.audit(TestTasks.chain(), AuditOptions.builder().includeMetrics(false).build());

        assertThat(report.metrics()).isNull();
        assertThat(report.summary().totalTasks()).isEqualTo(3);
        assertThat(report.summary().totalDependencies()).isEqualTo(2);
        assertThat(report.validatedAt()).isNotBlank();
    }

    @Test
    void shouldAcceptCheckNames() {
        AuditOptions options = AuditOptions.builder().checks("redundant", "critical-path").build();

        assertThat(options.checks()).containsExactlyInAnyOrder(AuditCheck.REDUNDANT, AuditCheck.CRITICAL_PATH);
        assertThat(auditor.audit(TestTasks.triangle(), options).issues())
                .extracting(AuditIssue::type)
                .containsExactly(IssueType.REDUNDANT_DEPENDENCY);
    }

    @Test
    void shouldCountAudits() {
        auditor.audit(TestTasks.chain());
        auditor.audit(TestTasks.chain());

        assertThat(monitor.snapshot().auditsRun()).isEqualTo(2);
        assertThat(monitor.timings("audit").runs()).isEqualTo(2);
    }

    private static AuditOptions checks(AuditCheck... checks) {
        return AuditOptions.builder().checks(checks).build();
    }
}
