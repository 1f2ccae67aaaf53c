package com.bot.scheduler;

/**
 * Shared scheduler for timed plugin callbacks.
 */
public interface TaskScheduler {

    /**
     * Schedules a task.
     *
     * @return handle for cancellation
     * @throws IllegalArgumentException if a task with the same name is scheduled, or the spec is a one-shot in the past
     */
    TaskHandle schedule(ScheduledTask task, ScheduleSpec spec);

    /**
     * Cancels a scheduled task. Unknown or already cancelled handles are ignored.
     *
     * @return true if the task was active and is now cancelled
     */
    boolean cancel(TaskHandle handle);
}
