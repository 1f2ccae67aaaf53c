package com.bot.persistence;

import java.nio.file.Path;

/**
 * The data file format is not recognised by the engine.
 */
public final class UnknownFormatException extends PersistenceException {

    public UnknownFormatException(Path path, String message) {
        super(path, message);
    }

    public UnknownFormatException(Path path, String message, Throwable cause) {
        super(path, message, cause);
    }
}
