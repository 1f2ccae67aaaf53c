package com.bot.plugin;

import com.bot.event.Func;
import com.bot.event.IncomingMessage;
import com.bot.event.MessageHandler;
import com.bot.event.PermissionGroup;
import com.bot.scheduler.ScheduleSpec;
import com.bot.scheduler.TaskHandle;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Base class of every bot plugin. Subclasses carry {@link com.bot.annotations.BotPlugin},
 * have a public no-arg constructor, and override the hooks they need:
 * <ul>
 *   <li>{@link #initialize()} then {@link #onLoad()} after the persisted data is loaded</li>
 *   <li>{@link #shutdown(Object...)} then {@link #onClose(Object...)} after functions and tasks are removed</li>
 * </ul>
 * Instances are created by {@link PluginLifecycle#construct}; the registration helpers may be
 * called from the hooks, never from the constructor.
 */
public abstract class BasePlugin {

    private volatile PluginContext context;

    final void bind(PluginContext context) {
        if (this.context != null) {
            throw new IllegalStateException("Plugin " + getClass().getName() + " is already bound");
        }
        this.context = context;
    }

    /**
     * @throws IllegalStateException if the plugin was not created through {@link PluginLifecycle#construct}
     */
    protected final PluginContext context() {
        PluginContext c = context;
        if (c == null) {
            throw new IllegalStateException("Plugin " + getClass().getName() + " has not been constructed by a host");
        }
        return c;
    }

    // --- hooks ---

    /** Synchronous setup, run off the caller's thread after data is loaded. */
    protected void initialize() throws Exception {
    }

    /** Asynchronous setup, run after {@link #initialize()}. */
    protected CompletionStage<Void> onLoad() {
        return CompletableFuture.completedFuture(null);
    }

    /** Synchronous teardown, run off the caller's thread; receives the arguments given to unload. */
    protected void shutdown(Object... args) throws Exception {
    }

    /** Asynchronous teardown, run after {@link #shutdown(Object...)}. Data is saved afterwards. */
    protected CompletionStage<Void> onClose(Object... args) {
        return CompletableFuture.completedFuture(null);
    }

    // --- identity ---

    public final PluginIdentity getIdentity() {
        return context().getIdentity();
    }

    public final String getName() {
        return getIdentity().getName();
    }

    public final String getVersion() {
        return getIdentity().getVersion();
    }

    public final String getAuthor() {
        return getIdentity().getAuthor();
    }

    public final String getDescription() {
        return getIdentity().getDescription();
    }

    public final Map<String, String> getDependencies() {
        return getIdentity().getDependencies();
    }

    public final PluginPaths getPaths() {
        return context().getPaths();
    }

    public final Path getWorkDirectory() {
        return getPaths().getWorkDirectory();
    }

    public final boolean isFirstLoad() {
        return getPaths().isFirstLoad();
    }

    public final boolean isDebug() {
        return context().getOptions().isDebug();
    }

    public final Map<String, Object> getMetaData() {
        return context().getOptions().getMetaData();
    }

    // --- data ---

    /** The live persisted tree; saved on unload. */
    protected final Map<String, Object> data() {
        return context().getData().data();
    }

    protected final Map<String, Object> dataSection(String name) {
        return context().getData().section(name);
    }

    /** Lock guarding the data tree and the registries; hold it when mutating data from other threads. */
    protected final ReentrantLock lock() {
        return context().getLock();
    }

    // --- functions ---

    protected final Func registerUserFunc(String name, MessageHandler handler, Predicate<IncomingMessage> filter,
                                          Pattern rawMessageFilter, boolean permissionRaise) {
        return context().getFunctions().registerUserFunc(name, handler, filter, rawMessageFilter, permissionRaise);
    }

    protected final Func registerUserFunc(String name, MessageHandler handler, String rawMessageFilter) {
        return context().getFunctions().registerUserFunc(name, handler, rawMessageFilter);
    }

    protected final Func registerUserFunc(String name, MessageHandler handler, String rawMessageFilter,
                                          boolean permissionRaise) {
        return context().getFunctions().registerUserFunc(name, handler, rawMessageFilter, permissionRaise);
    }

    protected final Func registerUserFunc(String name, MessageHandler handler, Predicate<IncomingMessage> filter) {
        return context().getFunctions().registerUserFunc(name, handler, filter);
    }

    protected final Func registerAdminFunc(String name, MessageHandler handler, Predicate<IncomingMessage> filter,
                                           Pattern rawMessageFilter, boolean permissionRaise) {
        return context().getFunctions().registerAdminFunc(name, handler, filter, rawMessageFilter, permissionRaise);
    }

    protected final Func registerAdminFunc(String name, MessageHandler handler, String rawMessageFilter) {
        return context().getFunctions().registerAdminFunc(name, handler, rawMessageFilter);
    }

    protected final Func registerAdminFunc(String name, MessageHandler handler, String rawMessageFilter,
                                           boolean permissionRaise) {
        return context().getFunctions().registerAdminFunc(name, handler, rawMessageFilter, permissionRaise);
    }

    protected final Func registerAdminFunc(String name, MessageHandler handler, Predicate<IncomingMessage> filter) {
        return context().getFunctions().registerAdminFunc(name, handler, filter);
    }

    protected final Func registerDefaultFunc(MessageHandler handler) {
        return context().getFunctions().registerDefaultFunc(handler);
    }

    protected final Func registerDefaultFunc(MessageHandler handler, PermissionGroup permission) {
        return context().getFunctions().registerDefaultFunc(handler, permission);
    }

    /** Registered functions in registration order. */
    public final List<Func> getFuncs() {
        return context().getFunctions().funcs();
    }

    // --- configuration ---

    protected final Conf registerConfig(String key, Object defaultValue) {
        return context().getConfigs().registerConfig(key, defaultValue);
    }

    protected final Conf registerConfig(String key, Object defaultValue, Function<String, ?> converter) {
        return context().getConfigs().registerConfig(key, defaultValue, converter);
    }

    public final List<Conf> getConfigs() {
        return context().getConfigs().configs();
    }

    // --- scheduled tasks ---

    protected final TaskHandle addScheduledTask(String name, String spec, Runnable task) {
        return context().getTasks().addScheduledTask(name, spec, task);
    }

    protected final TaskHandle addScheduledTask(String name, String spec, Runnable task, int maxRuns) {
        return context().getTasks().addScheduledTask(name, spec, task, maxRuns);
    }

    protected final TaskHandle addScheduledTask(String name, ScheduleSpec spec, Runnable task, int maxRuns,
                                                List<BooleanSupplier> conditions) {
        return context().getTasks().addScheduledTask(name, spec, task, maxRuns, conditions);
    }

    protected final boolean removeScheduledTask(String name) {
        return context().getTasks().removeScheduledTask(name);
    }

    @Override
    public String toString() {
        PluginContext c = context;
        return c == null ? getClass().getSimpleName() + "(unbound)" : c.getIdentity().toString();
    }
}
