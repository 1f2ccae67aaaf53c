/**
 * Timed callbacks shared by all plugins.
 * <ul>
 *   <li>{@link com.bot.scheduler.TaskScheduler} – schedule/cancel contract consumed by the plugin core</li>
 *   <li>{@link com.bot.scheduler.ExecutorTaskScheduler} – implementation on a scheduled thread pool</li>
 *   <li>{@link com.bot.scheduler.ScheduleSpec} – interval, daily and one-shot schedules</li>
 * </ul>
 */
package com.bot.scheduler;
