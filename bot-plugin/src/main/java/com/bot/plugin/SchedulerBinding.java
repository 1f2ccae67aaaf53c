package com.bot.plugin;

import com.bot.scheduler.ScheduleSpec;
import com.bot.scheduler.ScheduledTask;
import com.bot.scheduler.TaskHandle;
import com.bot.scheduler.TaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.BooleanSupplier;

/**
 * Scheduled tasks of one plugin on the shared scheduler. Tasks are submitted as
 * {@code {pluginName}_{name}} so that plugins cannot collide; names are unique per plugin
 * among tasks still active.
 */
public final class SchedulerBinding {

    private static final Logger log = LoggerFactory.getLogger(SchedulerBinding.class);

    private final String pluginName;
    private final TaskScheduler scheduler;
    private final Map<String, TaskHandle> handles = new LinkedHashMap<>();

    public SchedulerBinding(String pluginName, TaskScheduler scheduler) {
        this.pluginName = Objects.requireNonNull(pluginName, "pluginName");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    }

    /** Unlimited runs, no conditions; {@code spec} as accepted by {@link ScheduleSpec#parse(String)}. */
    public TaskHandle addScheduledTask(String name, String spec, Runnable task) {
        return addScheduledTask(name, ScheduleSpec.parse(spec), task, 0, List.of());
    }

    public TaskHandle addScheduledTask(String name, String spec, Runnable task, int maxRuns) {
        return addScheduledTask(name, ScheduleSpec.parse(spec), task, maxRuns, List.of());
    }

    /**
     * Schedules a task.
     *
     * @param maxRuns    0 for unlimited
     * @param conditions all must hold for a run to happen
     * @throws DuplicateNameException if an active task of this plugin has the name
     */
    public synchronized TaskHandle addScheduledTask(String name, ScheduleSpec spec, Runnable task, int maxRuns,
                                                    List<BooleanSupplier> conditions) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Task name must not be blank (plugin " + pluginName + ")");
        }
        Objects.requireNonNull(spec, "spec");
        TaskHandle existing = handles.get(name);
        if (existing != null && !existing.isCancelled()) {
            throw new DuplicateNameException(pluginName, "scheduled task", name);
        }
        ScheduledTask scheduled = new ScheduledTask(qualify(name), task, maxRuns, conditions);
        TaskHandle handle = scheduler.schedule(scheduled, spec);
        handles.put(name, handle);
        log.debug("Plugin {} scheduled task {} ({})", pluginName, name, spec);
        return handle;
    }

    /**
     * Cancels a task by its plugin-local name.
     *
     * @return false if no such task was active
     */
    public synchronized boolean removeScheduledTask(String name) {
        TaskHandle handle = handles.remove(name);
        if (handle == null) {
            return false;
        }
        return scheduler.cancel(handle);
    }

    /**
     * Cancels every task of the plugin. Safe to call repeatedly.
     *
     * @return number of tasks that were active
     */
    public synchronized int cancelAll() {
        int cancelled = 0;
        for (TaskHandle handle : handles.values()) {
            if (scheduler.cancel(handle)) {
                cancelled++;
            }
        }
        handles.clear();
        if (cancelled > 0) {
            log.debug("Cancelled {} scheduled tasks of plugin {}", cancelled, pluginName);
        }
        return cancelled;
    }

    /** Plugin-local names of tasks added and not removed. */
    public synchronized Set<String> taskNames() {
        return Set.copyOf(handles.keySet());
    }

    String qualify(String name) {
        return pluginName + "_" + name;
    }
}
