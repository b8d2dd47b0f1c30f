package org.neuralchilli.depgraph.domain;

/**
 * One finding of removal impact analysis. Blocking warnings stop an
 * unforced removal; the rest are informational.
 */
public record RemovalWarning(Code code, String message, boolean blocking) {

    public enum Code {
        PREMATURE_UNBLOCK,
        LOGICAL_DEPENDENCY,
        CRITICAL_PATH
    }
}
