package com.bot.plugin;

import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Everything a constructed plugin owns: identity, paths, options, data binding, and its
 * function, config and task registries, all sharing one lock.
 */
public final class PluginContext {

    private final PluginIdentity identity;
    private final PluginPaths paths;
    private final PluginOptions options;
    private final PersistentData data;
    private final FunctionRegistry functions;
    private final ConfigRegistry configs;
    private final SchedulerBinding tasks;
    private final ReentrantLock lock;

    PluginContext(PluginIdentity identity, PluginPaths paths, PluginOptions options, PersistentData data,
                  FunctionRegistry functions, ConfigRegistry configs, SchedulerBinding tasks, ReentrantLock lock) {
        this.identity = Objects.requireNonNull(identity, "identity");
        this.paths = Objects.requireNonNull(paths, "paths");
        this.options = Objects.requireNonNull(options, "options");
        this.data = Objects.requireNonNull(data, "data");
        this.functions = Objects.requireNonNull(functions, "functions");
        this.configs = Objects.requireNonNull(configs, "configs");
        this.tasks = Objects.requireNonNull(tasks, "tasks");
        this.lock = Objects.requireNonNull(lock, "lock");
    }

    public PluginIdentity getIdentity() {
        return identity;
    }

    public PluginPaths getPaths() {
        return paths;
    }

    public PluginOptions getOptions() {
        return options;
    }

    public PersistentData getData() {
        return data;
    }

    public FunctionRegistry getFunctions() {
        return functions;
    }

    public ConfigRegistry getConfigs() {
        return configs;
    }

    public SchedulerBinding getTasks() {
        return tasks;
    }

    public ReentrantLock getLock() {
        return lock;
    }
}
