package com.bot.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Event bus that keeps registered functions in registration order and dispatches messages
 * synchronously on the caller's thread.
 * <p>
 * Dispatch: every non-default function whose filters match is considered in order. A caller
 * lacking the required permission is skipped, or gets a {@link PermissionDeniedException} when
 * the function asks for it. If no non-default function matched at all, the default functions
 * are considered instead (with the same permission rule, and any filters they carry still apply).
 */
public final class InMemoryEventBus implements EventBus {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEventBus.class);

    private final List<Func> funcs = new CopyOnWriteArrayList<>();

    @Override
    public synchronized void register(Func func) {
        Objects.requireNonNull(func, "func");
        for (Func existing : funcs) {
            if (existing.getPluginName().equals(func.getPluginName()) && existing.getName().equals(func.getName())) {
                throw new IllegalArgumentException("Function already registered: " + func.getQualifiedName());
            }
        }
        funcs.add(func);
        log.debug("Registered function {}", func.getQualifiedName());
    }

    @Override
    public synchronized boolean unregister(Func func) {
        if (func == null) return false;
        boolean removed = funcs.remove(func);
        if (removed) {
            log.debug("Unregistered function {}", func.getQualifiedName());
        }
        return removed;
    }

    /**
     * Delivers a message to the matching functions.
     *
     * @return qualified names of the functions whose handlers ran, in order
     * @throws PermissionDeniedException if a matching function refuses the caller and raises
     * @throws DispatchException         if a handler throws a checked exception
     */
    public List<String> dispatch(IncomingMessage message) {
        Objects.requireNonNull(message, "message");
        List<String> fired = new ArrayList<>();
        boolean matched = false;
        for (Func func : funcs) {
            if (func.isDefault() || !func.matches(message)) continue;
            matched = true;
            if (permitted(func, message)) {
                invoke(func, message);
                fired.add(func.getQualifiedName());
            }
        }
        if (!matched) {
            for (Func func : funcs) {
                if (func.isDefault() && (!func.hasFilter() || func.matches(message)) && permitted(func, message)) {
                    invoke(func, message);
                    fired.add(func.getQualifiedName());
                }
            }
        }
        return fired;
    }

    private static boolean permitted(Func func, IncomingMessage message) {
        if (message.getSenderPermission().satisfies(func.getPermission())) {
            return true;
        }
        if (func.isPermissionRaise()) {
            throw new PermissionDeniedException(func.getQualifiedName(), func.getPermission(), message.getSenderPermission());
        }
        log.debug("Skipping {}: caller {} lacks {}", func.getQualifiedName(), message.getSenderId(), func.getPermission());
        return false;
    }

    private static void invoke(Func func, IncomingMessage message) {
        try {
            func.getHandler().handle(message);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new DispatchException(func.getQualifiedName(), e);
        }
    }

    /** Snapshot of all registered functions in registration order. */
    public List<Func> getFuncs() {
        return Collections.unmodifiableList(new ArrayList<>(funcs));
    }

    /** Functions registered by the given plugin. */
    public List<Func> getFuncs(String pluginName) {
        return funcs.stream()
                .filter(f -> f.getPluginName().equals(pluginName))
                .collect(Collectors.toList());
    }

    public int size() {
        return funcs.size();
    }
}
