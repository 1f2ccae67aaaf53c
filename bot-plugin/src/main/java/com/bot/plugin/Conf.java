package com.bot.plugin;

import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * A configuration key declared by a plugin. Values live in the {@code config} section of the
 * plugin's persisted data; raw (textual) updates go through the converter.
 */
public final class Conf {

    private final String pluginName;
    private final String key;
    private final Object defaultValue;
    private final Function<String, ?> converter;
    private final PersistentData data;

    Conf(String pluginName, String key, Object defaultValue, Function<String, ?> converter, PersistentData data) {
        this.pluginName = Objects.requireNonNull(pluginName, "pluginName");
        this.key = Objects.requireNonNull(key, "key");
        this.defaultValue = defaultValue;
        this.converter = converter;
        this.data = Objects.requireNonNull(data, "data");
    }

    public String getPluginName() {
        return pluginName;
    }

    public String getKey() {
        return key;
    }

    /** {@code plugin.key}. */
    public String getFullKey() {
        return pluginName + "." + key;
    }

    public Object getDefaultValue() {
        return defaultValue;
    }

    /** Converter for raw values; null means raw strings are stored as is. */
    public Function<String, ?> getConverter() {
        return converter;
    }

    /** Applies the converter to a raw value. Converter exceptions propagate. */
    public Object convert(String raw) {
        return converter == null ? raw : converter.apply(raw);
    }

    /**
     * Converts {@code raw} and stores it as the current value.
     *
     * @return the stored value
     */
    public Object modify(String raw) {
        Object value = convert(raw);
        data.lock().lock();
        try {
            data.section(ConfigRegistry.CONFIG_SECTION).put(key, value);
        } finally {
            data.lock().unlock();
        }
        return value;
    }

    /** Persisted value, or the default when none is stored. */
    public Object getValue() {
        data.lock().lock();
        try {
            Map<String, Object> section = data.section(ConfigRegistry.CONFIG_SECTION);
            return section.containsKey(key) ? section.get(key) : defaultValue;
        } finally {
            data.lock().unlock();
        }
    }

    @Override
    public String toString() {
        return "Conf{" + getFullKey() + ", default=" + defaultValue + "}";
    }
}
