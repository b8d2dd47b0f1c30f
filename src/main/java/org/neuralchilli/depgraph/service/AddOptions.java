package org.neuralchilli.depgraph.service;

/**
 * Options for adding an edge.
 *
 * @param force          push through cycle and type-rule rejections, keeping them as warnings
 * @param validateCycles run the cycle check before writing
 * @param reason         justification stored with the edge, defaults to "&lt;type&gt; dependency"
 */
public record AddOptions(boolean force, boolean validateCycles, String reason) {

    public static AddOptions defaults() {
        return new AddOptions(false, true, null);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean force;
        private boolean validateCycles = true;
        private String reason;

        public Builder force(boolean force) {
            this.force = force;
            return this;
        }

        public Builder validateCycles(boolean validateCycles) {
            this.validateCycles = validateCycles;
            return this;
        }

        public Builder reason(String reason) {
            this.reason = reason;
            return this;
        }

        public AddOptions build() {
            return new AddOptions(force, validateCycles, reason);
        }
    }
}
