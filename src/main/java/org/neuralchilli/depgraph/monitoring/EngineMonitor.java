package org.neuralchilli.depgraph.monitoring;

import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAccumulator;
import java.util.concurrent.atomic.LongAdder;

/**
 * In-process counters for engine operations.
 *
 * Tracks:
 * - mutations applied, rejected, forced and no-op
 * - cascade removals
 * - audits and auto-fixes
 * - per-operation timings
 */
@ApplicationScoped
public class EngineMonitor {

    private static final Logger log = LoggerFactory.getLogger(EngineMonitor.class);

    // Mutation metrics
    private final LongAdder mutationsApplied = new LongAdder();
    private final LongAdder mutationsRejected = new LongAdder();
    private final LongAdder mutationsForced = new LongAdder();
    private final LongAdder mutationsNoOp = new LongAdder();
    private final LongAdder cascadeRemovals = new LongAdder();

    // Audit metrics
    private final LongAdder auditsRun = new LongAdder();
    private final LongAdder fixesApplied = new LongAdder();
    private final LongAdder fixesFailed = new LongAdder();

    private final Map<String, Accumulator> timings = new ConcurrentHashMap<>();

    public void recordMutationApplied() {
        mutationsApplied.increment();
    }

    public void recordMutationRejected() {
        mutationsRejected.increment();
    }

    /**
     * Record a mutation pushed through past an overridable check
     */
    public void recordMutationForced() {
        mutationsForced.increment();
    }

    /**
     * Record a mutation that found nothing to do
     */
    public void recordMutationNoOp() {
        mutationsNoOp.increment();
    }

    public void recordCascadeRemovals(int count) {
        cascadeRemovals.add(count);
    }

    public void recordAudit() {
        auditsRun.increment();
    }

    public void recordFixApplied() {
        fixesApplied.increment();
    }

    public void recordFixFailed() {
        fixesFailed.increment();
    }

    /**
     * Time one run of {@code operation}; closing the handle records it.
     * Meant for try-with-resources around the operation body.
     */
    public Timing time(String operation) {
        return new Timing(operation, System.nanoTime());
    }

    public final class Timing implements AutoCloseable {
        private final String operation;
        private final long startNanos;

        private Timing(String operation, long startNanos) {
            this.operation = operation;
            this.startNanos = startNanos;
        }

        @Override
        public void close() {
            long elapsed = System.nanoTime() - startNanos;
            timings.computeIfAbsent(operation, key -> new Accumulator()).add(elapsed);
        }
    }

    /**
     * Runs recorded so far for {@code operation}, all zero if it never ran
     */
    public OperationTimings timings(String operation) {
        Accumulator accumulator = timings.get(operation);
        return accumulator == null ? OperationTimings.NONE : accumulator.read();
    }

    public record OperationTimings(long runs, Duration total, Duration slowest) {

        static final OperationTimings NONE = new OperationTimings(0, Duration.ZERO, Duration.ZERO);

        public Duration mean() {
            return runs == 0 ? Duration.ZERO : total.dividedBy(runs);
        }
    }

    private static final class Accumulator {
        private final LongAdder runs = new LongAdder();
        private final LongAdder totalNanos = new LongAdder();
        private final LongAccumulator slowestNanos = new LongAccumulator(Long::max, 0);

        void add(long nanos) {
            runs.increment();
            totalNanos.add(nanos);
            slowestNanos.accumulate(nanos);
        }

        OperationTimings read() {
            return new OperationTimings(runs.sum(), Duration.ofNanos(totalNanos.sum()),
                    Duration.ofNanos(slowestNanos.get()));
        }
    }

    public Snapshot snapshot() {
        return new Snapshot(
                mutationsApplied.sum(),
                mutationsRejected.sum(),
                mutationsForced.sum(),
                mutationsNoOp.sum(),
                cascadeRemovals.sum(),
                auditsRun.sum(),
                fixesApplied.sum(),
                fixesFailed.sum()
        );
    }

    /**
     * Point-in-time copy of the counters.
     */
    public record Snapshot(
            long mutationsApplied,
            long mutationsRejected,
            long mutationsForced,
            long mutationsNoOp,
            long cascadeRemovals,
            long auditsRun,
            long fixesApplied,
            long fixesFailed
    ) {
        @Override
        public String toString() {
            return String.format("""
                Engine Statistics:
                ==================
                Mutations:
                  Applied: %d, Rejected: %d, Forced: %d, No-op: %d
                  Cascade removals: %d

                Audits:
                  Runs: %d
                  Fixes applied: %d, failed: %d
                """,
                    mutationsApplied, mutationsRejected, mutationsForced, mutationsNoOp,
                    cascadeRemovals,
                    auditsRun, fixesApplied, fixesFailed
            );
        }
    }

    /**
     * Reset all counters (useful for testing).
     */
    public void reset() {
        mutationsApplied.reset();
        mutationsRejected.reset();
        mutationsForced.reset();
        mutationsNoOp.reset();
        cascadeRemovals.reset();
        auditsRun.reset();
        fixesApplied.reset();
        fixesFailed.reset();
        timings.clear();
        log.info("Engine statistics reset");
    }
}
