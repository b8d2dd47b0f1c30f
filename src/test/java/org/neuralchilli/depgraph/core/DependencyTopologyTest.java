package org.neuralchilli.depgraph.core;

import org.jgrapht.Graph;
import org.jgrapht.graph.DefaultEdge;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.depgraph.TestTasks;
import org.neuralchilli.depgraph.domain.CircularDependencyException;
import org.neuralchilli.depgraph.domain.DagStatistics;
import org.neuralchilli.depgraph.domain.MissingReferenceException;
import org.neuralchilli.depgraph.domain.Task;
import org.neuralchilli.depgraph.domain.TaskCollection;
import org.neuralchilli.depgraph.domain.TaskNotFoundException;
import org.neuralchilli.depgraph.domain.TaskPriority;
import org.neuralchilli.depgraph.domain.TaskStatus;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.neuralchilli.depgraph.TestTasks.task;

class DependencyTopologyTest {

    private DependencyTopology topology;

    @BeforeEach
    void setUp() {
        topology = new DependencyTopology();
        topology.cycleDetector = new CycleDetector();
    }

    @Test
    void shouldBuildGraphFromDependencyToDependent() {
        // Given: A depends on B twice
        TaskGraph graph = TaskGraph.of(TaskCollection.of(task("A", "B", "B"), task("B")));

        // When
        Graph<String, DefaultEdge> directed = topology.buildDirectedGraph(graph);

        // Then: One edge, pointing at the dependent
        assertThat(directed.vertexSet()).containsExactlyInAnyOrder("A", "B");
        assertThat(directed.edgeSet()).hasSize(1);
        assertThat(directed.containsEdge("B", "A")).isTrue();
    }

    @Test
    void shouldRejectEdgeToMissingTask() {
        TaskGraph graph = TaskGraph.of(TaskCollection.of(task("A", "ghost")));

        assertThatThrownBy(() -> topology.topologicalOrder(graph))
                .isInstanceOf(MissingReferenceException.class)
                .hasMessageContaining("ghost");
    }

    @Test
    void shouldOrderDependenciesFirst() {
        TaskGraph graph = TaskGraph.of(TestTasks.chain());

        assertThat(topology.topologicalOrder(graph)).containsExactly("C", "B", "A");
    }

    @Test
    void shouldBreakTiesByCollectionOrder() {
        TaskGraph graph = TaskGraph.of(diamond());

        assertThat(topology.topologicalOrder(graph)).containsExactly("D", "B", "C", "A");
    }

    @Test
    void shouldGroupTasksIntoExecutionLevels() {
        TaskGraph graph = TaskGraph.of(diamond());

        List<Set<String>> levels = topology.executionLevels(graph);

        assertThat(levels).hasSize(3);
        assertThat(levels.get(0)).containsExactly("D");
        assertThat(levels.get(1)).containsExactly("B", "C");
        assertThat(levels.get(2)).containsExactly("A");
    }

    @Test
    void shouldRefuseToOrderCyclicGraph() {
        TaskGraph graph = TaskGraph.of(TaskCollection.of(task("A", "B"), task("B", "A")));

        assertThat(topology.isAcyclic(graph)).isFalse();
        assertThatThrownBy(() -> topology.topologicalOrder(graph))
                .isInstanceOf(CircularDependencyException.class)
                .satisfies(e -> assertThat(((CircularDependencyException) e).cyclePath())
                        .containsExactly("A", "B", "A"));
    }

    @Test
    void shouldFindRootsAndLeaves() {
        TaskGraph graph = TaskGraph.of(TestTasks.chain());

        assertThat(topology.rootTasks(graph)).containsExactly("C");
        assertThat(topology.leafTasks(graph)).containsExactly("A");
    }

    @Test
    void shouldListReadyTasksMostBlockingFirst() {
        // Given: C is done, so B can start; E and F have no dependencies
        TaskGraph graph = TaskGraph.of(TaskCollection.of(
                task("A", TaskStatus.PENDING, TaskPriority.MEDIUM, "B"),
                task("B", TaskStatus.PENDING, TaskPriority.LOW, "C"),
                task("C", TaskStatus.COMPLETED, TaskPriority.MEDIUM),
                task("F", TaskStatus.IN_PROGRESS, TaskPriority.LOW),
                task("E", TaskStatus.PENDING, TaskPriority.HIGH),
                task("G", TaskStatus.CANCELLED, TaskPriority.HIGH),
                task("H", TaskStatus.BLOCKED, TaskPriority.HIGH),
                task("I", TaskStatus.PENDING, TaskPriority.HIGH, "ghost")
        ));

        // When
        List<Task> ready = topology.readyTasks(graph);

        // Then: B unblocks A, then priority decides
        assertThat(ready).extracting(Task::id).containsExactly("B", "E", "F");
    }

    @Test
    void shouldCollectFocusNeighbourhood() {
        TaskGraph graph = TaskGraph.of(TaskCollection.of(
                task("A", "B"),
                task("B", "C"),
                task("C"),
                task("X")
        ));

        assertThat(topology.focusSubgraph(graph, "B", 1)).containsExactly("A", "B", "C");
        assertThat(topology.focusSubgraph(graph, "A", 1)).containsExactly("A", "B");
        assertThat(topology.focusSubgraph(graph, "A", 0)).containsExactly("A", "B", "C");
        assertThat(topology.focusSubgraph(graph, "X", 0)).containsExactly("X");
    }

    @Test
    void shouldRejectUnknownFocusTask() {
        TaskGraph graph = TaskGraph.of(TestTasks.chain());

        assertThatThrownBy(() -> topology.focusSubgraph(graph, "nope", 2))
                .isInstanceOf(TaskNotFoundException.class);
    }

    @Test
    void shouldSummariseGraphShape() {
        DagStatistics stats = topology.statistics(TaskGraph.of(diamond()));

        assertThat(stats.totalTasks()).isEqualTo(4);
        assertThat(stats.rootTasks()).isEqualTo(1);
        assertThat(stats.leafTasks()).isEqualTo(1);
        assertThat(stats.executionLevels()).isEqualTo(3);
        assertThat(stats.maxParallelism()).isEqualTo(2);
        assertThat(stats.hasParallelism()).isTrue();
    }

    private static TaskCollection diamond() {
        return TaskCollection.of(
                task("A", "B", "C"),
                task("B", "D"),
                task("C", "D"),
                task("D")
        );
    }
}
