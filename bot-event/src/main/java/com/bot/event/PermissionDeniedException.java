package com.bot.event;

/**
 * Thrown by the dispatcher when a caller lacks the permission a function requires and the
 * function was registered with {@code permissionRaise = true}.
 */
public final class PermissionDeniedException extends RuntimeException {

    private final String function;
    private final PermissionGroup required;
    private final PermissionGroup actual;

    public PermissionDeniedException(String function, PermissionGroup required, PermissionGroup actual) {
        super(String.format("Permission denied for %s: requires %s, caller has %s", function, required, actual));
        this.function = function;
        this.required = required;
        this.actual = actual;
    }

    /** Qualified name ({@code plugin.func}) of the function that was refused. */
    public String getFunction() {
        return function;
    }

    public PermissionGroup getRequired() {
        return required;
    }

    public PermissionGroup getActual() {
        return actual;
    }
}
