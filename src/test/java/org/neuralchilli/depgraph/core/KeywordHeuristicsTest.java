package org.neuralchilli.depgraph.core;

import org.junit.jupiter.api.Test;
import org.neuralchilli.depgraph.domain.Task;
import org.neuralchilli.depgraph.domain.TaskStatus;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class KeywordHeuristicsTest {

    private final KeywordHeuristics heuristics = new KeywordHeuristics();

    @Test
    void shouldExpectSetupBeforeImplementation() {
        Task task = titled("Implement login API");
        Task dependency = titled("Setup database");

        assertThat(heuristics.inferLogicalDependency(task, dependency))
                .contains("Setup/configuration tasks typically should complete before implementation");
    }

    @Test
    void shouldExpectDesignBeforeBuild() {
        Task task = titled("Build dashboard");
        Task dependency = titled("Design dashboard layout");

        assertThat(heuristics.inferLogicalDependency(task, dependency))
                .contains("Design tasks should typically complete before implementation");
    }

    @Test
    void shouldReportSharedComponents() {
        Task task = titled("Write API docs");
        Task dependency = titled("Deploy API service");

        assertThat(heuristics.sharedComponents(task, dependency)).containsExactly("api");
        assertThat(heuristics.inferLogicalDependency(task, dependency))
                .contains("Tasks share common components: api");
    }

    @Test
    void shouldLookAtDescriptionsForComponents() {
        Task task = Task.builder("a").title("Tune queries").description("Indexes on the database").build();
        Task dependency = Task.builder("b").title("Provision").description("Database cluster").build();

        assertThat(heuristics.sharedComponents(task, dependency)).containsExactly("database");
    }

    @Test
    void shouldInferNothingForUnrelatedTasks() {
        assertThat(heuristics.inferLogicalDependency(titled("Write docs"), titled("Order pizza"))).isEmpty();
    }

    @Test
    void shouldFlagTestingWaitingOnImplementation() {
        Task testing = titled("Test login flow");
        Task implementation = titled("Implement login flow");

        assertThat(heuristics.isQuestionableOrder(testing, implementation)).isTrue();
        assertThat(heuristics.isQuestionableOrder(implementation, testing)).isFalse();
    }

    @Test
    void shouldFlagImplementationCompletedBeforeSetup() {
        Task implementation = Task.builder("impl")
                .title("Implement importer")
                .status(TaskStatus.COMPLETED)
                .build();
        Task setup = Task.builder("setup")
                .title("Configure storage")
                .status(TaskStatus.PENDING)
                .build();

        assertThat(heuristics.isImplementationAheadOfSetup(implementation, setup)).isTrue();

        setup.setStatus("completed");
        assertThat(heuristics.isImplementationAheadOfSetup(implementation, setup)).isFalse();
    }

    @Test
    void shouldListSharedSkillsOnce() {
        Task task = Task.builder("a").skills(List.of("java", "sql", "sql")).build();
        Task dependency = Task.builder("b").skills(List.of("sql", "go")).build();

        assertThat(heuristics.sharedSkills(task, dependency)).containsExactly("sql");
        assertThat(heuristics.sharedSkills(task, Task.builder("c").build())).isEmpty();
    }

    private static Task titled(String title) {
        return Task.builder(title.toLowerCase().replace(' ', '-')).title(title).build();
    }
}
