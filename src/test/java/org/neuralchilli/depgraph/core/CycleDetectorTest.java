package org.neuralchilli.depgraph.core;

import org.junit.jupiter.api.Test;
import org.neuralchilli.depgraph.TestTasks;
import org.neuralchilli.depgraph.domain.Task;
import org.neuralchilli.depgraph.domain.TaskCollection;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.neuralchilli.depgraph.TestTasks.task;

class CycleDetectorTest {

    private final CycleDetector detector = new CycleDetector();

    @Test
    void shouldReportCycleClosedByNewEdge() {
        // Given: A -> B -> C
        TaskGraph graph = TaskGraph.of(TestTasks.chain());

        // When: C would depend on A
        CycleCheck check = detector.wouldCreateCycle(graph, "C", "A");

        // Then: Path follows edge direction and closes on A
        assertThat(check.hasCycle()).isTrue();
        assertThat(check.cyclePath()).containsExactly("A", "B", "C", "A");
    }

    @Test
    void shouldRootPathAtTargetOfNewEdge() {
        TaskGraph graph = TaskGraph.of(TestTasks.threeStep());

        CycleCheck check = detector.wouldCreateCycle(graph, "T1", "T3");

        assertThat(check.hasCycle()).isTrue();
        assertThat(check.cyclePath()).containsExactly("T3", "T2", "T1", "T3");
    }

    @Test
    void shouldAllowEdgeThatClosesNoCycle() {
        TaskGraph graph = TaskGraph.of(TestTasks.chain());

        CycleCheck check = detector.wouldCreateCycle(graph, "A", "C");

        assertThat(check.hasCycle()).isFalse();
        assertThat(check.cyclePath()).isEmpty();
    }

    @Test
    void shouldIgnoreExistingCyclesElsewhere() {
        // Given: X and Y already depend on each other
        TaskGraph graph = TaskGraph.of(TaskCollection.of(
                task("X", "Y"),
                task("Y", "X"),
                task("P"),
                task("Q")
        ));

        // Then: An unrelated edge is not reported
        assertThat(detector.wouldCreateCycle(graph, "P", "Q").hasCycle()).isFalse();
    }

    @Test
    void shouldTreatSelfEdgeAsCycle() {
        TaskGraph graph = TaskGraph.of(TestTasks.chain());

        assertThat(detector.wouldCreateCycle(graph, "B", "B").cyclePath()).containsExactly("B", "B");
    }

    @Test
    void shouldFindEachCycleInGraph() {
        // Given: A <-> B, plus C -> D -> E -> C
        TaskGraph graph = TaskGraph.of(TaskCollection.of(
                task("A", "B"),
                task("B", "A"),
                task("C", "D"),
                task("D", "E"),
                task("E", "C"),
                task("F")
        ));

        List<List<String>> cycles = detector.findAllCycles(graph);

        assertThat(cycles).containsExactly(
                List.of("A", "B", "A"),
                List.of("C", "D", "E", "C")
        );
        assertThat(detector.hasCycles(graph)).isTrue();
    }

    @Test
    void shouldFindNoCyclesInDag() {
        TaskGraph graph = TaskGraph.of(TestTasks.triangle());

        assertThat(detector.findAllCycles(graph)).isEmpty();
        assertThat(detector.hasCycles(graph)).isFalse();
    }

    @Test
    void shouldIgnoreEdgesToUnknownTasks() {
        TaskGraph graph = TaskGraph.of(TaskCollection.of(task("A", "ghost")));

        assertThat(detector.findAllCycles(graph)).isEmpty();
        assertThat(detector.wouldCreateCycle(graph, "A", "ghost").hasCycle()).isFalse();
    }

    @Test
    void shouldHandleVeryLongChainsWithoutRecursion() {
        // Given: n0 -> n1 -> ... -> n9999
        List<Task> tasks = new ArrayList<>();
        int size = 10_000;
        for (int i = 0; i < size; i++) {
            tasks.add(i < size - 1 ? task("n" + i, "n" + (i + 1)) : task("n" + i));
        }
        TaskGraph graph = TaskGraph.of(new TaskCollection(tasks));

        // Then: Both searches complete
        assertThat(detector.findAllCycles(graph)).isEmpty();

        CycleCheck check = detector.wouldCreateCycle(graph, "n9999", "n0");
        assertThat(check.hasCycle()).isTrue();
        assertThat(check.cyclePath()).hasSize(size + 1);
        assertThat(check.cyclePath().get(0)).isEqualTo("n0");
        assertThat(check.cyclePath().get(size)).isEqualTo("n0");
    }
}
