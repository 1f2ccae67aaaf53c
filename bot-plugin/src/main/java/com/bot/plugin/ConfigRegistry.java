package com.bot.plugin;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Configuration keys declared by one plugin, in declaration order. Keys are not required to be
 * unique; a repeated key is kept and logged. The default of a new key is written into the
 * {@code config} section unless a value is already persisted there.
 */
public final class ConfigRegistry {

    private static final Logger log = LoggerFactory.getLogger(ConfigRegistry.class);

    /** Section of the persisted data holding configuration values. */
    public static final String CONFIG_SECTION = "config";

    private final String pluginName;
    private final PersistentData data;
    private final List<Conf> confs = new ArrayList<>();

    public ConfigRegistry(String pluginName, PersistentData data) {
        this.pluginName = Objects.requireNonNull(pluginName, "pluginName");
        this.data = Objects.requireNonNull(data, "data");
    }

    public Conf registerConfig(String key, Object defaultValue) {
        return registerConfig(key, defaultValue, null);
    }

    /**
     * Declares a configuration key.
     *
     * @param converter turns raw text into the stored value; null keeps the text
     * @throws IllegalArgumentException if the key is blank
     */
    public Conf registerConfig(String key, Object defaultValue, Function<String, ?> converter) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Config key must not be blank (plugin " + pluginName + ")");
        }
        Conf conf = new Conf(pluginName, key, defaultValue, converter, data);
        data.lock().lock();
        try {
            if (confs.stream().anyMatch(c -> c.getKey().equals(key))) {
                log.warn("Plugin {} registers config key '{}' more than once", pluginName, key);
            }
            confs.add(conf);
            data.section(CONFIG_SECTION).putIfAbsent(key, defaultValue);
        } finally {
            data.lock().unlock();
        }
        log.debug("Registered config {}", conf.getFullKey());
        return conf;
    }

    /** First declaration of the key. */
    public Optional<Conf> get(String key) {
        data.lock().lock();
        try {
            return confs.stream().filter(c -> c.getKey().equals(key)).findFirst();
        } finally {
            data.lock().unlock();
        }
    }

    /** Snapshot in declaration order, duplicates included. */
    public List<Conf> configs() {
        data.lock().lock();
        try {
            return List.copyOf(confs);
        } finally {
            data.lock().unlock();
        }
    }
}
