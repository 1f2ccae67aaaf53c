package com.bot.plugin;

import com.bot.config.BotConfig;
import com.bot.event.EventBus;
import com.bot.persistence.JacksonPersistenceEngine;
import com.bot.scheduler.TaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The set of plugins of one bot process. Plugins are registered (constructed) one by one,
 * then loaded together in dependency order and unloaded in reverse.
 * <p>
 * A plugin whose load fails is logged and dropped; plugins depending on it are dropped as well.
 * Dependency problems found before loading (missing plugin, version mismatch, cycle) are fatal.
 */
public final class PluginHost implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PluginHost.class);

    private final BotConfig config;
    private final PluginCollaborators collaborators;
    private final ExecutorService ownedExecutor;
    private final Map<String, PluginLifecycle<?>> plugins = new LinkedHashMap<>();
    private final List<String> loadOrder = new ArrayList<>();

    /**
     * Host with its own hook executor: a cached pool, or a fixed pool when
     * {@link BotConfig#getHookThreads()} is positive.
     */
    public PluginHost(BotConfig config, EventBus eventBus, TaskScheduler scheduler) {
        this.config = Objects.requireNonNull(config, "config");
        this.ownedExecutor = newHookExecutor(config.getHookThreads());
        this.collaborators = new PluginCollaborators(eventBus, scheduler, new JacksonPersistenceEngine(), ownedExecutor);
    }

    /** Host using the given collaborators; their hook executor is not shut down by {@link #close()}. */
    public PluginHost(BotConfig config, PluginCollaborators collaborators) {
        this.config = Objects.requireNonNull(config, "config");
        this.collaborators = Objects.requireNonNull(collaborators, "collaborators");
        this.ownedExecutor = null;
    }

    private static ExecutorService newHookExecutor(int threads) {
        ThreadFactory factory = new ThreadFactory() {
            private final AtomicInteger n = new AtomicInteger();

            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, "bot-plugin-hook-" + n.incrementAndGet());
                t.setDaemon(true);
                return t;
            }
        };
        return threads > 0 ? Executors.newFixedThreadPool(threads, factory) : Executors.newCachedThreadPool(factory);
    }

    /** Registers a plugin with options taken from the host configuration. */
    public <T extends BasePlugin> PluginLifecycle<T> register(Class<T> pluginClass) {
        return register(pluginClass, PluginOptions.defaults(config));
    }

    /**
     * Constructs a plugin and adds it to the host.
     *
     * @throws DuplicateNameException if a plugin with the same name is registered
     */
    public synchronized <T extends BasePlugin> PluginLifecycle<T> register(Class<T> pluginClass, PluginOptions options) {
        String name = PluginIdentity.of(pluginClass).getName();
        if (plugins.containsKey(name)) {
            throw new DuplicateNameException(name, "plugin", name);
        }
        PluginLifecycle<T> lifecycle = PluginLifecycle.construct(pluginClass, collaborators, options);
        plugins.put(name, lifecycle);
        log.info("Registered plugin {}", lifecycle.getIdentity());
        return lifecycle;
    }

    /**
     * Loads every registered, not yet loaded plugin, dependencies first. Blocks until done.
     *
     * @return names of the plugins loaded by this call, in load order
     * @throws DependencyException if a dependency is missing, has an unacceptable version, or forms a cycle
     */
    public synchronized List<String> loadAll() {
        List<String> order = resolveOrder();
        List<String> loaded = new ArrayList<>();
        Set<String> dropped = new HashSet<>();
        for (String name : order) {
            PluginLifecycle<?> lifecycle = plugins.get(name);
            if (lifecycle.getState() != LifecycleState.UNINITIALIZED) {
                continue;
            }
            Optional<String> failedDependency = lifecycle.getIdentity().getDependencies().keySet().stream()
                    .filter(dropped::contains)
                    .findFirst();
            if (failedDependency.isPresent()) {
                log.error("Skipping plugin {}: dependency {} failed to load", name, failedDependency.get());
                plugins.remove(name);
                dropped.add(name);
                continue;
            }
            try {
                await(lifecycle.load());
                loadOrder.add(name);
                loaded.add(name);
            } catch (RuntimeException e) {
                log.error("Plugin {} failed to load (dropping it): {}", name, e.getMessage(), e);
                plugins.remove(name);
                dropped.add(name);
            }
        }
        log.info("Loaded {} plugin(s): {}", loaded.size(), loaded);
        return loaded;
    }

    /**
     * Unloads loaded plugins in reverse load order, passing {@code args} to their unload hooks.
     * Every plugin is attempted; the first failure is rethrown at the end with later ones suppressed.
     */
    public synchronized void unloadAll(Object... args) {
        RuntimeException first = null;
        for (int i = loadOrder.size() - 1; i >= 0; i--) {
            String name = loadOrder.get(i);
            PluginLifecycle<?> lifecycle = plugins.get(name);
            if (lifecycle == null || !lifecycle.isLoaded()) {
                continue;
            }
            try {
                await(lifecycle.unload(args));
            } catch (RuntimeException e) {
                log.error("Plugin {} failed to unload: {}", name, e.getMessage(), e);
                if (first == null) {
                    first = e;
                } else {
                    first.addSuppressed(e);
                }
            }
        }
        loadOrder.clear();
        if (first != null) {
            throw first;
        }
    }

    /** Plugin names in an order where every plugin follows its dependencies. */
    List<String> resolveOrder() {
        for (PluginLifecycle<?> lifecycle : plugins.values()) {
            checkDependencies(lifecycle.getIdentity());
        }
        Set<String> done = new LinkedHashSet<>();
        for (String name : plugins.keySet()) {
            visit(name, done, new LinkedHashSet<>());
        }
        return new ArrayList<>(done);
    }

    private void checkDependencies(PluginIdentity identity) {
        for (Map.Entry<String, String> dependency : identity.getDependencies().entrySet()) {
            PluginLifecycle<?> target = plugins.get(dependency.getKey());
            if (target == null) {
                throw new DependencyException(identity.getName(),
                        "Plugin " + identity.getName() + " requires " + dependency.getKey() + ", which is not registered");
            }
            VersionConstraint constraint = VersionConstraint.parse(dependency.getValue());
            String version = target.getIdentity().getVersion();
            if (!constraint.isSatisfiedBy(version)) {
                throw new DependencyException(identity.getName(), "Plugin " + identity.getName() + " requires "
                        + dependency.getKey() + " " + constraint + " but " + version + " is registered");
            }
        }
    }

    private void visit(String name, Set<String> done, Set<String> path) {
        if (done.contains(name)) {
            return;
        }
        if (!path.add(name)) {
            List<String> cycle = new ArrayList<>(path);
            cycle = cycle.subList(cycle.indexOf(name), cycle.size());
            throw new DependencyException(name, "Dependency cycle: " + String.join(" -> ", cycle) + " -> " + name);
        }
        for (String dependency : plugins.get(name).getIdentity().getDependencies().keySet()) {
            visit(dependency, done, path);
        }
        path.remove(name);
        done.add(name);
    }

    private static void await(CompletableFuture<Void> future) {
        try {
            future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new PluginException(null, "Plugin hook failed: " + cause, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PluginException(null, "Interrupted while waiting for a plugin", e);
        }
    }

    public synchronized Optional<PluginLifecycle<?>> get(String name) {
        return Optional.ofNullable(plugins.get(name));
    }

    /** Registered plugin names in registration order. */
    public synchronized List<String> names() {
        return Collections.unmodifiableList(new ArrayList<>(plugins.keySet()));
    }

    /** Unloads all plugins and stops the hook executor the host created. */
    @Override
    public void close() {
        try {
            unloadAll();
        } finally {
            if (ownedExecutor != null) {
                ownedExecutor.shutdown();
                try {
                    if (!ownedExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                        ownedExecutor.shutdownNow();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    ownedExecutor.shutdownNow();
                }
            }
        }
    }
}
