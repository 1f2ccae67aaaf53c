package com.bot.plugin;

/**
 * A plugin's declared identity is missing or invalid (no {@code @BotPlugin}, blank name or
 * version, unknown save format). Fatal at construction.
 */
public final class IdentityException extends PluginException {

    public IdentityException(String pluginName, String message) {
        super(pluginName, message);
    }

    public IdentityException(String pluginName, String message, Throwable cause) {
        super(pluginName, message, cause);
    }
}
