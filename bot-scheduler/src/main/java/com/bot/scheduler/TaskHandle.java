package com.bot.scheduler;

/**
 * Handle returned by {@link TaskScheduler#schedule}; pass it back to {@link TaskScheduler#cancel}.
 * Each scheduler supplies its own implementation.
 */
public interface TaskHandle {

    /** Name the task was scheduled under. */
    String getName();

    /** Number of completed executions (skipped runs excluded). */
    int getRunCount();

    /** True once the task was cancelled or has finished its last run. */
    boolean isCancelled();
}
