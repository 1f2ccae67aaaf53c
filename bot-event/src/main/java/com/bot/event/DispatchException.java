package com.bot.event;

/**
 * Wraps a checked exception thrown by a function handler during dispatch.
 */
public final class DispatchException extends RuntimeException {

    private final String function;

    public DispatchException(String function, Throwable cause) {
        super("Handler " + function + " failed: " + cause.getMessage(), cause);
        this.function = function;
    }

    public String getFunction() {
        return function;
    }
}
