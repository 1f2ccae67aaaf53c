package com.bot.plugin;

/**
 * Base of the plugin core's errors. Carries the name of the plugin involved (may be the class
 * name when the plugin has no valid identity yet).
 */
public class PluginException extends RuntimeException {

    private final String pluginName;

    public PluginException(String pluginName, String message) {
        super(message);
        this.pluginName = pluginName;
    }

    public PluginException(String pluginName, String message, Throwable cause) {
        super(message, cause);
        this.pluginName = pluginName;
    }

    public String getPluginName() {
        return pluginName;
    }
}
