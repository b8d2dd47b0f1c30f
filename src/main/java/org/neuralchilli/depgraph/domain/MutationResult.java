package org.neuralchilli.depgraph.domain;

import java.util.Optional;

/**
 * Result of a graph mutation.
 * Provides type-safe success/failure handling without exceptions crossing
 * the engine boundary.
 */
public sealed interface MutationResult<T> {

    /**
     * Check if the mutation went through (possibly forced, possibly a no-op)
     */
    boolean isSuccess();

    /**
     * Outcome of a successful mutation
     */
    Optional<T> outcome();

    /**
     * Error of a failed mutation
     */
    Optional<DependencyError> error();

    /**
     * Successful mutation
     */
    record Success<T>(T value) implements MutationResult<T> {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public Optional<T> outcome() {
            return Optional.of(value);
        }

        @Override
        public Optional<DependencyError> error() {
            return Optional.empty();
        }
    }

    /**
     * Failed mutation; nothing was written
     */
    record Failure<T>(DependencyError cause) implements MutationResult<T> {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public Optional<T> outcome() {
            return Optional.empty();
        }

        @Override
        public Optional<DependencyError> error() {
            return Optional.of(cause);
        }
    }

    static <T> MutationResult<T> success(T outcome) {
        return new Success<>(outcome);
    }

    static <T> MutationResult<T> failure(DependencyError error) {
        return new Failure<>(error);
    }
}
