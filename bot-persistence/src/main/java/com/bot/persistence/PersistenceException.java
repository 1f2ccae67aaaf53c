package com.bot.persistence;

import java.nio.file.Path;

/**
 * Base of the errors raised by a {@link PersistenceEngine}. Carries the path of the data file
 * involved, when known.
 */
public class PersistenceException extends RuntimeException {

    private final Path path;

    public PersistenceException(Path path, String message) {
        super(message);
        this.path = path;
    }

    public PersistenceException(Path path, String message, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    /** Data file involved; null when the failure is not tied to a file. */
    public Path getPath() {
        return path;
    }
}
