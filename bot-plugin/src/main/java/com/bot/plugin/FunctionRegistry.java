package com.bot.plugin;

import com.bot.event.EventBus;
import com.bot.event.Func;
import com.bot.event.IncomingMessage;
import com.bot.event.MessageHandler;
import com.bot.event.PermissionGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Functions one plugin exposes to the event bus. Names are unique within the plugin; every
 * function except {@code "default"} needs a predicate or a raw-message pattern. Registration
 * and removal are mirrored on the bus.
 */
public final class FunctionRegistry {

    private static final Logger log = LoggerFactory.getLogger(FunctionRegistry.class);

    static final String MISSING_FILTER = "a non-default function needs at least one filter";

    private final String pluginName;
    private final EventBus eventBus;
    private final ReentrantLock lock;
    private final List<Func> funcs = new ArrayList<>();

    public FunctionRegistry(String pluginName, EventBus eventBus, ReentrantLock lock) {
        this.pluginName = Objects.requireNonNull(pluginName, "pluginName");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus");
        this.lock = Objects.requireNonNull(lock, "lock");
    }

    /**
     * Registers a function any user may trigger.
     *
     * @param filter           predicate over the message; null for none
     * @param rawMessageFilter pattern matched at the start of the raw text; null for none
     * @param permissionRaise  report refused callers instead of skipping them
     * @throws ValidationException     if both filters are null or the name is {@code "default"}
     * @throws DuplicateNameException if the name is taken
     */
    public Func registerUserFunc(String name, MessageHandler handler, Predicate<IncomingMessage> filter,
                                 Pattern rawMessageFilter, boolean permissionRaise) {
        return registerFiltered(name, handler, filter, rawMessageFilter, PermissionGroup.USER, permissionRaise);
    }

    public Func registerUserFunc(String name, MessageHandler handler, String rawMessageFilter) {
        return registerUserFunc(name, handler, rawMessageFilter, false);
    }

    public Func registerUserFunc(String name, MessageHandler handler, String rawMessageFilter, boolean permissionRaise) {
        return registerUserFunc(name, handler, null, compile(name, rawMessageFilter), permissionRaise);
    }

    public Func registerUserFunc(String name, MessageHandler handler, Predicate<IncomingMessage> filter) {
        return registerUserFunc(name, handler, filter, null, false);
    }

    /** Same as {@link #registerUserFunc(String, MessageHandler, Predicate, Pattern, boolean)}, ADMIN only. */
    public Func registerAdminFunc(String name, MessageHandler handler, Predicate<IncomingMessage> filter,
                                  Pattern rawMessageFilter, boolean permissionRaise) {
        return registerFiltered(name, handler, filter, rawMessageFilter, PermissionGroup.ADMIN, permissionRaise);
    }

    public Func registerAdminFunc(String name, MessageHandler handler, String rawMessageFilter) {
        return registerAdminFunc(name, handler, rawMessageFilter, false);
    }

    public Func registerAdminFunc(String name, MessageHandler handler, String rawMessageFilter, boolean permissionRaise) {
        return registerAdminFunc(name, handler, null, compile(name, rawMessageFilter), permissionRaise);
    }

    public Func registerAdminFunc(String name, MessageHandler handler, Predicate<IncomingMessage> filter) {
        return registerAdminFunc(name, handler, filter, null, false);
    }

    /** Registers the catch-all {@code "default"} function for USER callers. */
    public Func registerDefaultFunc(MessageHandler handler) {
        return registerDefaultFunc(handler, PermissionGroup.USER);
    }

    /** Registers the catch-all {@code "default"} function; it runs when no other function matched. */
    public Func registerDefaultFunc(MessageHandler handler, PermissionGroup permission) {
        return registerFunc(Func.DEFAULT_NAME, handler, null, null, permission, false);
    }

    private Func registerFiltered(String name, MessageHandler handler, Predicate<IncomingMessage> filter,
                                  Pattern rawMessageFilter, PermissionGroup permission, boolean permissionRaise) {
        if (Func.DEFAULT_NAME.equals(name)) {
            throw new ValidationException(pluginName, "Function name '" + Func.DEFAULT_NAME
                    + "' is reserved for registerDefaultFunc (plugin " + pluginName + ")");
        }
        if (filter == null && rawMessageFilter == null) {
            throw new ValidationException(pluginName, "Function " + name + " of plugin " + pluginName + ": " + MISSING_FILTER);
        }
        return registerFunc(name, handler, filter, rawMessageFilter, permission, permissionRaise);
    }

    /**
     * Adds a function to the table and the event bus.
     *
     * @throws DuplicateNameException if the plugin already has a function with this name
     */
    Func registerFunc(String name, MessageHandler handler, Predicate<IncomingMessage> filter,
                      Pattern rawMessageFilter, PermissionGroup permission, boolean permissionRaise) {
        if (name == null || name.isBlank()) {
            throw new ValidationException(pluginName, "Function name must not be blank");
        }
        Objects.requireNonNull(handler, "handler");
        lock.lock();
        try {
            for (Func existing : funcs) {
                if (existing.getName().equals(name)) {
                    throw new DuplicateNameException(pluginName, "function", name);
                }
            }
            Func func = new Func(name, pluginName, handler, filter, rawMessageFilter, permission, permissionRaise);
            eventBus.register(func);
            funcs.add(func);
            log.debug("Registered function {} ({})", func.getQualifiedName(), func.getPermission());
            return func;
        } finally {
            lock.unlock();
        }
    }

    private Pattern compile(String name, String rawMessageFilter) {
        if (rawMessageFilter == null) {
            return null;
        }
        try {
            return Pattern.compile(rawMessageFilter);
        } catch (PatternSyntaxException e) {
            throw new ValidationException(pluginName,
                    "Function " + name + " of plugin " + pluginName + " has an invalid raw message filter", e);
        }
    }

    /**
     * Removes every function from the table and from the event bus. Safe to call repeatedly.
     *
     * @return number of functions removed
     */
    public int unregisterAll() {
        lock.lock();
        try {
            int removed = funcs.size();
            for (Func func : funcs) {
                eventBus.unregister(func);
            }
            funcs.clear();
            if (removed > 0) {
                log.debug("Unregistered {} functions of plugin {}", removed, pluginName);
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    /** Snapshot of the registered functions in registration order. */
    public List<Func> funcs() {
        lock.lock();
        try {
            return List.copyOf(funcs);
        } finally {
            lock.unlock();
        }
    }

    public Optional<Func> get(String name) {
        lock.lock();
        try {
            return funcs.stream().filter(f -> f.getName().equals(name)).findFirst();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return funcs.size();
        } finally {
            lock.unlock();
        }
    }
}
