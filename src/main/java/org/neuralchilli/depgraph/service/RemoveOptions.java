package org.neuralchilli.depgraph.service;

/**
 * Options for removing an edge.
 *
 * @param force          remove even when impact analysis finds blocking warnings
 * @param cascadeRemoval also drop edges that the removal leaves redundant
 * @param analyzeImpact  run removal impact analysis first
 * @param reason         recorded in the change log
 */
public record RemoveOptions(boolean force, boolean cascadeRemoval, boolean analyzeImpact, String reason) {

    public static RemoveOptions defaults() {
        return new RemoveOptions(false, false, true, null);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean force;
        private boolean cascadeRemoval;
        private boolean analyzeImpact = true;
        private String reason;

        public Builder force(boolean force) {
            this.force = force;
            return this;
        }

        public Builder cascadeRemoval(boolean cascadeRemoval) {
            this.cascadeRemoval = cascadeRemoval;
            return this;
        }

        public Builder analyzeImpact(boolean analyzeImpact) {
            this.analyzeImpact = analyzeImpact;
            return this;
        }

        public Builder reason(String reason) {
            this.reason = reason;
            return this;
        }

        public RemoveOptions build() {
            return new RemoveOptions(force, cascadeRemoval, analyzeImpact, reason);
        }
    }
}
