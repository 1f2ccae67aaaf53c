package com.bot.plugin;

/**
 * Unload could not persist the plugin's data. The cause is the persistence error.
 */
public final class TeardownException extends PluginException {

    public TeardownException(String pluginName, String message, Throwable cause) {
        super(pluginName, message, cause);
    }
}
