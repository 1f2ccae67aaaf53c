package com.bot.persistence;

import java.nio.file.Path;

/**
 * The data file exists but could not be read or is malformed (empty, not a mapping, bad syntax).
 */
public final class LoadException extends PersistenceException {

    public LoadException(Path path, String message) {
        super(path, message);
    }

    public LoadException(Path path, String message, Throwable cause) {
        super(path, message, cause);
    }
}
