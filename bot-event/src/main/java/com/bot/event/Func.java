package com.bot.event;

import java.util.Objects;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * A named, permission-scoped, filter-gated handler registered by a plugin. The dispatcher
 * invokes {@link #getHandler()} when {@link #matches(IncomingMessage)} holds and the caller's
 * permission satisfies {@link #getPermission()}.
 * <p>
 * The function named {@value #DEFAULT_NAME} is the plugin's fallback: it carries no filters and
 * runs only when no other function matched a message.
 */
public final class Func {

    public static final String DEFAULT_NAME = "default";

    private final String name;
    private final String pluginName;
    private final MessageHandler handler;
    private final Predicate<IncomingMessage> filter;
    private final Pattern rawMessageFilter;
    private final PermissionGroup permission;
    private final boolean permissionRaise;

    /**
     * @param name             function name, unique within the owning plugin
     * @param pluginName       owning plugin name
     * @param handler          callable invoked on dispatch
     * @param filter           optional predicate over the message; null = no predicate
     * @param rawMessageFilter optional pattern matched at the start of the raw text; null = no pattern
     * @param permission       group required to trigger the function; null = USER
     * @param permissionRaise  when true a caller lacking permission gets a {@link PermissionDeniedException}
     *                         instead of being skipped silently
     */
    public Func(String name, String pluginName, MessageHandler handler, Predicate<IncomingMessage> filter,
                Pattern rawMessageFilter, PermissionGroup permission, boolean permissionRaise) {
        this.name = Objects.requireNonNull(name, "name");
        this.pluginName = Objects.requireNonNull(pluginName, "pluginName");
        this.handler = Objects.requireNonNull(handler, "handler");
        this.filter = filter;
        this.rawMessageFilter = rawMessageFilter;
        this.permission = permission != null ? permission : PermissionGroup.USER;
        this.permissionRaise = permissionRaise;
    }

    public String getName() {
        return name;
    }

    public String getPluginName() {
        return pluginName;
    }

    /** {@code pluginName.name}, used in logs and dispatch results. */
    public String getQualifiedName() {
        return pluginName + "." + name;
    }

    public MessageHandler getHandler() {
        return handler;
    }

    public Predicate<IncomingMessage> getFilter() {
        return filter;
    }

    public Pattern getRawMessageFilter() {
        return rawMessageFilter;
    }

    public PermissionGroup getPermission() {
        return permission;
    }

    public boolean isPermissionRaise() {
        return permissionRaise;
    }

    public boolean isDefault() {
        return DEFAULT_NAME.equals(name);
    }

    public boolean hasFilter() {
        return filter != null || rawMessageFilter != null;
    }

    /**
     * True when every configured filter accepts the message. The raw-message pattern is
     * anchored at the start of the text but need not consume all of it.
     */
    public boolean matches(IncomingMessage message) {
        if (message == null) return false;
        if (rawMessageFilter != null && !rawMessageFilter.matcher(message.getRawMessage()).lookingAt()) {
            return false;
        }
        return filter == null || filter.test(message);
    }

    @Override
    public String toString() {
        return "Func{" + getQualifiedName() + ", permission=" + permission + ", raise=" + permissionRaise + "}";
    }
}
