package com.bot.plugin;

/**
 * Lifecycle of one plugin instance. Each transition happens at most once:
 * {@code UNINITIALIZED → LOADING → LOADED → UNLOADING → UNLOADED}. A failed transition ends in
 * {@link #FAILED}, after which the host treats the plugin as absent.
 */
public enum LifecycleState {

    /** Constructed, not loaded. */
    UNINITIALIZED,

    /** load() in progress. */
    LOADING,

    /** Loaded; functions may be dispatched. */
    LOADED,

    /** unload() in progress. */
    UNLOADING,

    /** Unloaded; terminal. */
    UNLOADED,

    /** A transition failed; terminal. */
    FAILED
}
