package org.neuralchilli.depgraph.service;

import org.neuralchilli.depgraph.domain.ChangeLogEntry;

/**
 * Append-only destination for mutation records. The engine never reads the
 * log back.
 *
 * Implementations must not throw: a mutation that was written stands even
 * when its record cannot be stored.
 */
public interface ChangeLogSink {

    void record(ChangeLogEntry entry);
}
