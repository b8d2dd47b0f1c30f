package org.neuralchilli.depgraph.domain;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * Selectable audit passes. FULL expands to every other check.
 */
public enum AuditCheck {
    CYCLES("cycles"),
    LOGICAL("logical"),
    ORPHANS("orphans"),
    REDUNDANT("redundant"),
    CRITICAL_PATH("critical-path"),
    FULL("full");

    private final String wireValue;

    AuditCheck(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    /**
     * Parse a check name as used on the wire (case-insensitive)
     */
    public static AuditCheck fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Audit check cannot be null");
        }
        return Arrays.stream(values())
                .filter(check -> check.wireValue.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Invalid audit check: " + value +
                                ". Valid checks: cycles, logical, orphans, redundant, critical-path, full"
                ));
    }

    /**
     * The concrete passes a requested set stands for
     */
    public static Set<AuditCheck> expand(Set<AuditCheck> requested) {
        if (requested == null || requested.isEmpty() || requested.contains(FULL)) {
            return EnumSet.complementOf(EnumSet.of(FULL));
        }
        return EnumSet.copyOf(requested);
    }
}
