package com.bot.plugin;

/**
 * A declared plugin dependency is missing, has an unacceptable version, or is part of a cycle.
 */
public final class DependencyException extends PluginException {

    public DependencyException(String pluginName, String message) {
        super(pluginName, message);
    }
}
