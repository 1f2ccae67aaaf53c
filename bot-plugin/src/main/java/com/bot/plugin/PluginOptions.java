package com.bot.plugin;

import com.bot.config.BotConfig;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Per-plugin construction options: persistent root, explicit source directory, debug mode and
 * free-form metadata. {@link #fromMap(Map)} accepts only the known keys.
 */
public final class PluginOptions {

    public static final String PERSISTENT_ROOT = "persistentRoot";
    public static final String SOURCE_DIRECTORY = "sourceDirectory";
    public static final String DEBUG = "debug";
    public static final String META_DATA = "metaData";

    private static final Set<String> KNOWN_KEYS = Set.of(PERSISTENT_ROOT, SOURCE_DIRECTORY, DEBUG, META_DATA);

    private final Path persistentRoot;
    private final Path sourceDirectory;
    private final boolean debug;
    private final Map<String, Object> metaData;

    private PluginOptions(Builder b) {
        this.persistentRoot = b.persistentRoot;
        this.sourceDirectory = b.sourceDirectory;
        this.debug = b.debug;
        this.metaData = Collections.unmodifiableMap(new LinkedHashMap<>(b.metaData));
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Options carrying the host's persistent directory and debug flag. */
    public static PluginOptions defaults(BotConfig config) {
        Objects.requireNonNull(config, "config");
        return builder()
                .persistentRoot(Path.of(config.getPersistentDir()))
                .debug(config.isDebug())
                .build();
    }

    /**
     * Builds options from loosely typed key/values (e.g. read from a plugin listing).
     * Paths may be {@link Path} or String; debug may be Boolean or String.
     *
     * @throws IllegalArgumentException on unknown keys or values of the wrong type
     */
    public static PluginOptions fromMap(Map<String, ?> values) {
        Objects.requireNonNull(values, "values");
        Set<String> unknown = new TreeSet<>(values.keySet());
        unknown.removeAll(KNOWN_KEYS);
        if (!unknown.isEmpty()) {
            throw new IllegalArgumentException("Unknown plugin options: " + unknown + "; allowed: " + new TreeSet<>(KNOWN_KEYS));
        }
        Builder b = builder();
        if (values.get(PERSISTENT_ROOT) != null) {
            b.persistentRoot(toPath(PERSISTENT_ROOT, values.get(PERSISTENT_ROOT)));
        }
        if (values.get(SOURCE_DIRECTORY) != null) {
            b.sourceDirectory(toPath(SOURCE_DIRECTORY, values.get(SOURCE_DIRECTORY)));
        }
        Object debug = values.get(DEBUG);
        if (debug instanceof Boolean flag) {
            b.debug(flag);
        } else if (debug instanceof String s) {
            b.debug(Boolean.parseBoolean(s.trim()));
        } else if (debug != null) {
            throw new IllegalArgumentException("Option " + DEBUG + " must be a boolean, got " + debug.getClass().getName());
        }
        Object meta = values.get(META_DATA);
        if (meta instanceof Map<?, ?> m) {
            m.forEach((k, v) -> b.metaData(String.valueOf(k), v));
        } else if (meta != null) {
            throw new IllegalArgumentException("Option " + META_DATA + " must be a map, got " + meta.getClass().getName());
        }
        return b.build();
    }

    private static Path toPath(String key, Object value) {
        if (value instanceof Path p) {
            return p;
        }
        if (value instanceof String s && !s.isBlank()) {
            return Path.of(s.trim());
        }
        throw new IllegalArgumentException("Option " + key + " must be a path, got " + value);
    }

    public Path getPersistentRoot() {
        return persistentRoot;
    }

    /** Explicit source directory; null means derive it from the plugin class. */
    public Path getSourceDirectory() {
        return sourceDirectory;
    }

    public boolean isDebug() {
        return debug;
    }

    public Map<String, Object> getMetaData() {
        return metaData;
    }

    @Override
    public String toString() {
        return "PluginOptions{persistentRoot=" + persistentRoot + ", sourceDirectory=" + sourceDirectory
                + ", debug=" + debug + ", metaData=" + metaData.keySet() + "}";
    }

    public static final class Builder {
        private Path persistentRoot = Path.of("data");
        private Path sourceDirectory;
        private boolean debug;
        private final Map<String, Object> metaData = new LinkedHashMap<>();

        public Builder persistentRoot(Path persistentRoot) {
            this.persistentRoot = Objects.requireNonNull(persistentRoot, "persistentRoot");
            return this;
        }

        public Builder sourceDirectory(Path sourceDirectory) {
            this.sourceDirectory = sourceDirectory;
            return this;
        }

        public Builder debug(boolean debug) {
            this.debug = debug;
            return this;
        }

        public Builder metaData(String key, Object value) {
            metaData.put(Objects.requireNonNull(key, "key"), value);
            return this;
        }

        public Builder metaData(Map<String, ?> values) {
            if (values != null) {
                metaData.putAll(values);
            }
            return this;
        }

        public PluginOptions build() {
            return new PluginOptions(this);
        }
    }
}
