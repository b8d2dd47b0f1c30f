package org.neuralchilli.depgraph.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Audit issue severity, most severe first.
 */
public enum Severity {
    CRITICAL(3),
    WARNING(2),
    INFO(1);

    private final int rank;

    Severity(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    public boolean isAtLeast(int minimumRank) {
        return rank >= minimumRank;
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Minimum rank for a severity filter string; "all" keeps everything.
     */
    public static int minimumRank(String filter) {
        if (filter == null || filter.isBlank()) {
            return WARNING.rank;
        }
        if ("all".equalsIgnoreCase(filter)) {
            return 0;
        }
        try {
            return valueOf(filter.toUpperCase(Locale.ROOT)).rank;
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Invalid severity filter: " + filter +
                            ". Valid values: all, critical, warning, info"
            );
        }
    }
}
