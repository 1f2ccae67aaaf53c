package com.bot.plugin;

import com.bot.persistence.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.InvocationTargetException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Drives one plugin instance through construct, load and unload. Load and unload each run at
 * most once; any other call completes exceptionally with {@link LifecycleException}.
 *
 * <p>Load: persisted data, then {@link BasePlugin#initialize()} on the hook executor, then
 * {@link BasePlugin#onLoad()}. Unload: functions and scheduled tasks are removed first, then
 * {@link BasePlugin#shutdown(Object...)} on the hook executor, {@link BasePlugin#onClose(Object...)},
 * and finally the data is saved (in debug mode it is logged instead).
 *
 * @param <T> plugin type
 */
public final class PluginLifecycle<T extends BasePlugin> {

    private static final Logger log = LoggerFactory.getLogger(PluginLifecycle.class);

    private final T plugin;
    private final PluginContext context;
    private final Executor hookExecutor;
    private final AtomicReference<LifecycleState> state = new AtomicReference<>(LifecycleState.UNINITIALIZED);

    private PluginLifecycle(T plugin, PluginContext context, Executor hookExecutor) {
        this.plugin = plugin;
        this.context = context;
        this.hookExecutor = hookExecutor;
    }

    /**
     * Creates a plugin instance with its identity, paths and registries in place. Nothing is
     * loaded yet.
     *
     * @throws IdentityException  if the class declares no valid identity
     * @throws WorkspaceException if the working directory cannot be used
     * @throws PluginException    if the class cannot be instantiated
     */
    public static <T extends BasePlugin> PluginLifecycle<T> construct(Class<T> pluginClass,
                                                                      PluginCollaborators collaborators,
                                                                      PluginOptions options) {
        Objects.requireNonNull(pluginClass, "pluginClass");
        Objects.requireNonNull(collaborators, "collaborators");
        Objects.requireNonNull(options, "options");

        PluginIdentity identity = PluginIdentity.of(pluginClass);
        String name = identity.getName();
        PluginPaths paths = new PathResolver(options.getPersistentRoot())
                .resolve(name, pluginClass, options.getSourceDirectory(), identity.getSaveFormat());
        T plugin = instantiate(name, pluginClass);

        ReentrantLock lock = new ReentrantLock();
        PersistentData data = new PersistentData(name, paths.getDataFile(), identity.getSaveFormat(),
                collaborators.getPersistenceEngine(), options.isDebug(), lock);
        PluginContext context = new PluginContext(identity, paths, options, data,
                new FunctionRegistry(name, collaborators.getEventBus(), lock),
                new ConfigRegistry(name, data),
                new SchedulerBinding(name, collaborators.getScheduler()),
                lock);
        plugin.bind(context);
        log.info("Constructed plugin {} (work dir {}, first load {}, debug {})",
                identity, paths.getWorkDirectory(), paths.isFirstLoad(), options.isDebug());
        return new PluginLifecycle<>(plugin, context, collaborators.getHookExecutor());
    }

    private static <T extends BasePlugin> T instantiate(String name, Class<T> pluginClass) {
        try {
            return pluginClass.getDeclaredConstructor().newInstance();
        } catch (InvocationTargetException e) {
            throw new PluginException(name, "Constructor of plugin " + name + " failed", e.getCause());
        } catch (ReflectiveOperationException e) {
            throw new PluginException(name,
                    "Plugin class " + pluginClass.getName() + " needs an accessible no-arg constructor", e);
        }
    }

    /**
     * Loads persisted data and runs the load hooks. Completes exceptionally with the hook's or
     * the persistence layer's exception; the plugin is then {@link LifecycleState#FAILED} and any
     * functions or tasks it registered are removed.
     */
    public CompletableFuture<Void> load() {
        if (!state.compareAndSet(LifecycleState.UNINITIALIZED, LifecycleState.LOADING)) {
            return CompletableFuture.failedFuture(new LifecycleException(getName(), "load", state.get()));
        }
        log.info("Loading plugin {}", getName());
        return CompletableFuture.runAsync(context.getData()::load, hookExecutor)
                .thenRunAsync(() -> runHook("initialize", plugin::initialize), hookExecutor)
                .thenCompose(v -> asyncHook("onLoad", plugin::onLoad))
                .whenComplete((v, error) -> {
                    if (error == null) {
                        state.set(LifecycleState.LOADED);
                        log.info("Plugin {} loaded", getName());
                    } else {
                        state.set(LifecycleState.FAILED);
                        removeRegistrations();
                        log.error("Plugin {} failed to load: {}", getName(), unwrap(error).toString(), unwrap(error));
                    }
                });
    }

    /**
     * Removes the plugin's functions and tasks, runs the unload hooks with {@code args}, then
     * saves the data.
     *
     * <p>Completes exceptionally with {@link TeardownException} if the data cannot be saved, or
     * with a hook's exception; in both cases the plugin ends {@link LifecycleState#FAILED}.
     */
    public CompletableFuture<Void> unload(Object... args) {
        if (!state.compareAndSet(LifecycleState.LOADED, LifecycleState.UNLOADING)) {
            return CompletableFuture.failedFuture(new LifecycleException(getName(), "unload", state.get()));
        }
        log.info("Unloading plugin {}", getName());
        Object[] hookArgs = args == null ? new Object[0] : args.clone();
        try {
            removeRegistrations();
        } catch (RuntimeException e) {
            state.set(LifecycleState.FAILED);
            return CompletableFuture.failedFuture(e);
        }
        return CompletableFuture.runAsync(() -> runHook("shutdown", () -> plugin.shutdown(hookArgs)), hookExecutor)
                .thenCompose(v -> asyncHook("onClose", () -> plugin.onClose(hookArgs)))
                .thenRunAsync(this::persistOnUnload, hookExecutor)
                .whenComplete((v, error) -> {
                    if (error == null) {
                        state.set(LifecycleState.UNLOADED);
                        log.info("Plugin {} unloaded", getName());
                    } else {
                        state.set(LifecycleState.FAILED);
                        log.error("Plugin {} failed to unload: {}", getName(), unwrap(error).toString(), unwrap(error));
                    }
                });
    }

    private void removeRegistrations() {
        int funcs = context.getFunctions().unregisterAll();
        int tasks = context.getTasks().cancelAll();
        log.debug("Plugin {}: removed {} functions and {} scheduled tasks", getName(), funcs, tasks);
    }

    private void persistOnUnload() {
        PersistentData data = context.getData();
        if (context.getOptions().isDebug()) {
            List<String> lines = data.render();
            log.warn("Debug mode: data of plugin {} is not saved", getName());
            log.info("Data of plugin {}:\n{}", getName(), String.join("\n", lines));
            return;
        }
        try {
            data.save();
        } catch (PersistenceException e) {
            throw new TeardownException(getName(), "Failed to save data of plugin " + getName() + ": " + e.getMessage(), e);
        }
    }

    private void runHook(String hook, Hook body) {
        log.debug("Plugin {}: running {}", getName(), hook);
        try {
            body.run();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new CompletionException(e);
        }
    }

    private CompletableFuture<Void> asyncHook(String hook, Supplier<CompletionStage<Void>> body) {
        log.debug("Plugin {}: running {}", getName(), hook);
        CompletionStage<Void> stage = body.get();
        return stage == null ? CompletableFuture.completedFuture(null) : stage.toCompletableFuture();
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    public T plugin() {
        return plugin;
    }

    public PluginContext context() {
        return context;
    }

    public String getName() {
        return context.getIdentity().getName();
    }

    public PluginIdentity getIdentity() {
        return context.getIdentity();
    }

    public LifecycleState getState() {
        return state.get();
    }

    public boolean isLoaded() {
        return state.get() == LifecycleState.LOADED;
    }

    @Override
    public String toString() {
        return "PluginLifecycle{" + getName() + ", " + state.get() + "}";
    }

    @FunctionalInterface
    private interface Hook {
        void run() throws Exception;
    }
}
