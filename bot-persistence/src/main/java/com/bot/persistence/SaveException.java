package com.bot.persistence;

import java.nio.file.Path;

/**
 * The in-memory data could not be written to the data file.
 */
public final class SaveException extends PersistenceException {

    public SaveException(Path path, String message) {
        super(path, message);
    }

    public SaveException(Path path, String message, Throwable cause) {
        super(path, message, cause);
    }
}
