package com.bot.persistence;

import java.util.Locale;

/**
 * Formats a plugin's persisted data file can be written in. The format name doubles as the
 * data file extension.
 */
public enum SaveFormat {

    JSON("json"),

    YAML("yaml");

    private final String extension;

    SaveFormat(String extension) {
        this.extension = extension;
    }

    /** File extension without the dot (e.g. {@code json}). */
    public String getExtension() {
        return extension;
    }

    /**
     * Resolves a format by name, case-insensitively; {@code yml} is accepted for YAML.
     *
     * @throws UnknownFormatException if the name does not denote a supported format
     */
    public static SaveFormat of(String name) {
        if (name == null || name.isBlank()) {
            throw new UnknownFormatException(null, "Save format must be non-blank");
        }
        String n = name.trim().toLowerCase(Locale.ROOT);
        if ("yml".equals(n)) {
            return YAML;
        }
        for (SaveFormat format : values()) {
            if (format.extension.equals(n)) {
                return format;
            }
        }
        throw new UnknownFormatException(null, "Unknown save format: " + name);
    }
}
