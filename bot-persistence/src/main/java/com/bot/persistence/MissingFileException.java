package com.bot.persistence;

import java.nio.file.Path;

/**
 * The data file does not exist.
 */
public final class MissingFileException extends PersistenceException {

    public MissingFileException(Path path, String message) {
        super(path, message);
    }

    public MissingFileException(Path path, String message, Throwable cause) {
        super(path, message, cause);
    }
}
