package com.bot.plugin;

/**
 * A registration call was rejected because its arguments break a registry rule (e.g. a
 * non-default function without any filter).
 */
public final class ValidationException extends PluginException {

    public ValidationException(String pluginName, String message) {
        super(pluginName, message);
    }

    public ValidationException(String pluginName, String message, Throwable cause) {
        super(pluginName, message, cause);
    }
}
