package com.bot.plugin;

/**
 * A name is already taken: a function or scheduled task within one plugin, or a plugin
 * within one host. The existing registration is left untouched.
 */
public final class DuplicateNameException extends PluginException {

    private final String kind;
    private final String name;

    public DuplicateNameException(String pluginName, String kind, String name) {
        super(pluginName, "Plugin " + pluginName + " already has " + kind + " '" + name + "'");
        this.kind = kind;
        this.name = name;
    }

    /** What the name identifies: {@code function}, {@code scheduled task} or {@code plugin}. */
    public String getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }
}
