package com.bot.plugin;

import com.bot.persistence.LoadException;
import com.bot.persistence.MissingFileException;
import com.bot.persistence.PersistenceEngine;
import com.bot.persistence.SaveException;
import com.bot.persistence.SaveFormat;
import com.bot.persistence.TreeView;
import com.bot.persistence.UnknownFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A plugin's persisted data tree bound to its data file. The tree is one insertion-ordered map
 * whose identity never changes; {@link #load()} replaces its contents. All access goes through
 * the plugin lock.
 */
public final class PersistentData {

    private static final Logger log = LoggerFactory.getLogger(PersistentData.class);

    private final String pluginName;
    private final Path file;
    private final SaveFormat format;
    private final PersistenceEngine engine;
    private final boolean debug;
    private final ReentrantLock lock;
    private final Map<String, Object> data = new LinkedHashMap<>();

    public PersistentData(String pluginName, Path file, SaveFormat format, PersistenceEngine engine,
                          boolean debug, ReentrantLock lock) {
        this.pluginName = Objects.requireNonNull(pluginName, "pluginName");
        this.file = Objects.requireNonNull(file, "file");
        this.format = Objects.requireNonNull(format, "format");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.debug = debug;
        this.lock = Objects.requireNonNull(lock, "lock");
    }

    /**
     * Loads the data file into the tree. A missing, unreadable or unrecognised file is reset
     * outside debug mode: the file is truncated, the current tree is saved into it and loaded
     * back. In debug mode the file is left untouched and the tree is kept as is.
     *
     * @throws com.bot.persistence.PersistenceException if the reset itself fails
     */
    public void load() {
        lock.lock();
        try {
            try {
                replace(engine.load(file, format));
                log.debug("Loaded {} top-level entries for plugin {} from {}", data.size(), pluginName, file);
            } catch (UnknownFormatException | LoadException | MissingFileException e) {
                if (debug) {
                    log.warn("Could not load data of plugin {} ({}); debug mode, keeping in-memory data and leaving {} as is",
                            pluginName, e.getMessage(), file);
                    return;
                }
                log.warn("Could not load data of plugin {} ({}); resetting {}", pluginName, e.getMessage(), file);
                reset();
            }
        } finally {
            lock.unlock();
        }
    }

    private void reset() {
        try {
            Files.writeString(file, "");
        } catch (IOException e) {
            throw new SaveException(file, "Cannot truncate data file of plugin " + pluginName, e);
        }
        engine.save(data, file, format);
        replace(engine.load(file, format));
    }

    private void replace(Map<String, Object> loaded) {
        data.clear();
        if (loaded != null) {
            data.putAll(loaded);
        }
    }

    /**
     * Writes the tree to the data file. The file holds the normalized form described by
     * {@link com.bot.persistence.DataTree}, so a later {@link #load()} yields
     * {@code DataTree.copyOf(data())}. The live tree itself is not rewritten.
     *
     * @throws SaveException if the engine cannot write or the tree holds an unsupported value
     */
    public void save() {
        lock.lock();
        try {
            engine.save(data, file, format);
            log.debug("Saved data of plugin {} to {}", pluginName, file);
        } finally {
            lock.unlock();
        }
    }

    /**
     * The live tree. Callers mutating it from threads other than the plugin's hooks should hold
     * {@link #lock()}.
     */
    public Map<String, Object> data() {
        return data;
    }

    /**
     * Nested map stored under {@code name}, created when absent.
     *
     * @throws IllegalStateException if {@code name} holds something other than a map
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> section(String name) {
        Objects.requireNonNull(name, "name");
        lock.lock();
        try {
            Object existing = data.get(name);
            if (existing == null) {
                Map<String, Object> created = new LinkedHashMap<>();
                data.put(name, created);
                return created;
            }
            if (existing instanceof Map<?, ?>) {
                return (Map<String, Object>) existing;
            }
            throw new IllegalStateException("Entry '" + name + "' of plugin " + pluginName + " is not a map");
        } finally {
            lock.unlock();
        }
    }

    /** Tree view of the data, one line per node. */
    public List<String> render() {
        lock.lock();
        try {
            return TreeView.render(data);
        } finally {
            lock.unlock();
        }
    }

    public ReentrantLock lock() {
        return lock;
    }

    public Path getFile() {
        return file;
    }

    public SaveFormat getFormat() {
        return format;
    }
}
