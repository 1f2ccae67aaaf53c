package com.bot.plugin;

import com.bot.event.EventBus;
import com.bot.persistence.JacksonPersistenceEngine;
import com.bot.persistence.PersistenceEngine;
import com.bot.scheduler.TaskScheduler;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Shared services a plugin is wired to: the event bus its functions are registered on, the
 * scheduler its tasks run on, the engine that reads and writes its data file, and the executor
 * that runs its synchronous hooks.
 */
public final class PluginCollaborators {

    private final EventBus eventBus;
    private final TaskScheduler scheduler;
    private final PersistenceEngine persistenceEngine;
    private final Executor hookExecutor;

    public PluginCollaborators(EventBus eventBus, TaskScheduler scheduler, PersistenceEngine persistenceEngine,
                               Executor hookExecutor) {
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.persistenceEngine = Objects.requireNonNull(persistenceEngine, "persistenceEngine");
        this.hookExecutor = Objects.requireNonNull(hookExecutor, "hookExecutor");
    }

    /** Jackson persistence and the common fork-join pool for hooks. */
    public static PluginCollaborators of(EventBus eventBus, TaskScheduler scheduler) {
        return new PluginCollaborators(eventBus, scheduler, new JacksonPersistenceEngine(), ForkJoinPool.commonPool());
    }

    public EventBus getEventBus() {
        return eventBus;
    }

    public TaskScheduler getScheduler() {
        return scheduler;
    }

    public PersistenceEngine getPersistenceEngine() {
        return persistenceEngine;
    }

    public Executor getHookExecutor() {
        return hookExecutor;
    }
}
