package org.neuralchilli.depgraph.core;

/**
 * Verdict of a dependency type rule. {@code reason} is empty when valid.
 */
public record TypeValidation(boolean valid, String reason) {

    private static final TypeValidation VALID = new TypeValidation(true, "");

    public static TypeValidation ok() {
        return VALID;
    }

    public static TypeValidation rejected(String reason) {
        return new TypeValidation(false, reason);
    }
}
