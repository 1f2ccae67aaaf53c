package com.bot.plugin;

/**
 * The plugin's working directory cannot be used: the path exists but is not a directory, it
 * cannot be created, or the source directory cannot be determined. Fatal at construction.
 */
public final class WorkspaceException extends PluginException {

    public WorkspaceException(String pluginName, String message) {
        super(pluginName, message);
    }

    public WorkspaceException(String pluginName, String message, Throwable cause) {
        super(pluginName, message, cause);
    }
}
