package org.neuralchilli.depgraph.service;

import org.neuralchilli.depgraph.domain.AuditCheck;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * Options for an audit run.
 *
 * @param checks          passes to run; empty or containing FULL means all
 * @param autoFix         apply mechanical fixes and re-audit
 * @param minimumSeverity critical, warning, info or all; null uses the configured default
 * @param includeMetrics  attach whole-collection metrics to the report
 */
public record AuditOptions(
        Set<AuditCheck> checks,
        boolean autoFix,
        String minimumSeverity,
        boolean includeMetrics
) {
    public AuditOptions {
        checks = checks == null || checks.isEmpty()
                ? EnumSet.of(AuditCheck.FULL)
                : EnumSet.copyOf(checks);
    }

    public static AuditOptions defaults() {
        return new AuditOptions(EnumSet.of(AuditCheck.FULL), false, null, true);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Set<AuditCheck> checks = EnumSet.of(AuditCheck.FULL);
        private boolean autoFix;
        private String minimumSeverity;
        private boolean includeMetrics = true;

        public Builder checks(AuditCheck... checks) {
            this.checks = checks.length == 0 ? EnumSet.of(AuditCheck.FULL) : EnumSet.copyOf(Arrays.asList(checks));
            return this;
        }

        /**
         * Checks by wire name, e.g. "redundant" or "critical-path"
         */
        public Builder checks(String... names) {
            Set<AuditCheck> parsed = EnumSet.noneOf(AuditCheck.class);
            for (String name : names) {
                parsed.add(AuditCheck.fromString(name));
            }
            this.checks = parsed;
            return this;
        }

        public Builder autoFix(boolean autoFix) {
            this.autoFix = autoFix;
            return this;
        }

        public Builder minimumSeverity(String minimumSeverity) {
            this.minimumSeverity = minimumSeverity;
            return this;
        }

        public Builder includeMetrics(boolean includeMetrics) {
            this.includeMetrics = includeMetrics;
            return this;
        }

        public AuditOptions build() {
            return new AuditOptions(checks, autoFix, minimumSeverity, includeMetrics);
        }
    }
}
