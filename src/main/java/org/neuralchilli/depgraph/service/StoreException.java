package org.neuralchilli.depgraph.service;

import java.nio.file.Path;

/**
 * Thrown when a task collection cannot be read, written or locked.
 */
public class StoreException extends RuntimeException {

    private final Path path;

    public StoreException(String message, Path path) {
        super(message + ": " + path);
        this.path = path;
    }

    public StoreException(String message, Path path, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
