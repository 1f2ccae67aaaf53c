package com.bot.event;

/**
 * Registration surface of the event bus that delivers incoming messages to plugin functions.
 * Plugins reach the bus only through these two calls; dispatch is the bus's own business.
 */
public interface EventBus {

    /**
     * Adds a function to the dispatch index.
     *
     * @throws IllegalArgumentException if a function with the same plugin and name is already registered
     */
    void register(Func func);

    /**
     * Removes a function from the dispatch index. Unknown functions are ignored.
     *
     * @return true if the function was registered
     */
    boolean unregister(Func func);
}
