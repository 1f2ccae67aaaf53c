package com.bot.plugin;

/**
 * A lifecycle transition was requested from a state that does not allow it, e.g. a second
 * {@code load()} or an {@code unload()} before {@code load()} completed.
 */
public final class LifecycleException extends PluginException {

    private final LifecycleState state;

    public LifecycleException(String pluginName, String transition, LifecycleState state) {
        super(pluginName, "Cannot " + transition + " plugin " + pluginName + " in state " + state);
        this.state = state;
    }

    /** State the plugin was in when the transition was refused. */
    public LifecycleState getState() {
        return state;
    }
}
