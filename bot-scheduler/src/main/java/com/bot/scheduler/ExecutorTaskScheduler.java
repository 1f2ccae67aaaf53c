package com.bot.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link TaskScheduler} on a {@link ScheduledExecutorService}. Task names are unique; a task
 * that reaches its run limit or a one-shot task that has run is removed automatically.
 * A task action that throws is logged and the schedule continues.
 */
public final class ExecutorTaskScheduler implements TaskScheduler, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ExecutorTaskScheduler.class);

    private final ScheduledExecutorService executor;
    private final Clock clock;
    private final Map<String, ExecutorTaskHandle> tasks = new ConcurrentHashMap<>();

    public ExecutorTaskScheduler() {
        this(1, Clock.systemDefaultZone());
    }

    public ExecutorTaskScheduler(int threads, Clock clock) {
        this.executor = Executors.newScheduledThreadPool(Math.max(1, threads), new SchedulerThreadFactory());
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public TaskHandle schedule(ScheduledTask task, ScheduleSpec spec) {
        Objects.requireNonNull(task, "task");
        Objects.requireNonNull(spec, "spec");
        Duration delay = spec.initialDelay(LocalDateTime.now(clock));
        ExecutorTaskHandle handle = new ExecutorTaskHandle(task.getName());
        if (tasks.putIfAbsent(task.getName(), handle) != null) {
            throw new IllegalArgumentException("Task already scheduled: " + task.getName());
        }
        Runnable run = () -> runOnce(task, spec, handle);
        ScheduledFuture<?> future;
        if (spec.isRepeating()) {
            future = executor.scheduleAtFixedRate(run, delay.toMillis(), spec.period().toMillis(), TimeUnit.MILLISECONDS);
        } else {
            future = executor.schedule(run, delay.toMillis(), TimeUnit.MILLISECONDS);
        }
        handle.attach(future);
        log.info("Scheduled task {} ({}), first run in {}", task.getName(), spec, delay);
        return handle;
    }

    @Override
    public boolean cancel(TaskHandle handle) {
        if (!(handle instanceof ExecutorTaskHandle h)) return false;
        tasks.remove(h.getName(), h);
        boolean cancelled = h.cancel();
        if (cancelled) {
            log.info("Cancelled task {}", handle.getName());
        }
        return cancelled;
    }

    private void runOnce(ScheduledTask task, ScheduleSpec spec, ExecutorTaskHandle handle) {
        if (handle.isCancelled()) return;
        if (!task.conditionsHold()) {
            log.debug("Skipping run of {}: conditions not met", task.getName());
            return;
        }
        try {
            task.getAction().run();
        } catch (RuntimeException e) {
            log.error("Scheduled task {} failed: {}", task.getName(), e.getMessage(), e);
        }
        int runs = handle.recordRun();
        boolean limitReached = task.getMaxRuns() > 0 && runs >= task.getMaxRuns();
        if (limitReached || !spec.isRepeating()) {
            tasks.remove(task.getName(), handle);
            handle.cancel();
            log.debug("Task {} finished after {} run(s)", task.getName(), runs);
        }
    }

    /** Names of the tasks currently scheduled. */
    public Set<String> getTaskNames() {
        return Set.copyOf(tasks.keySet());
    }

    public boolean isScheduled(String name) {
        return name != null && tasks.containsKey(name);
    }

    /** Cancels every task and stops the executor. */
    @Override
    public void close() {
        tasks.values().forEach(ExecutorTaskHandle::cancel);
        tasks.clear();
        executor.shutdownNow();
    }

    private static final class SchedulerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "bot-scheduler-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }

    private static final class ExecutorTaskHandle implements TaskHandle {

        private final String name;
        private final AtomicInteger runs = new AtomicInteger();
        private volatile ScheduledFuture<?> future;
        private volatile boolean cancelled;

        ExecutorTaskHandle(String name) {
            this.name = name;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public int getRunCount() {
            return runs.get();
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }

        int recordRun() {
            return runs.incrementAndGet();
        }

        void attach(ScheduledFuture<?> f) {
            this.future = f;
            if (cancelled) {
                f.cancel(false);
            }
        }

        boolean cancel() {
            if (cancelled) return false;
            cancelled = true;
            ScheduledFuture<?> f = future;
            if (f != null) {
                f.cancel(false);
            }
            return true;
        }

        @Override
        public String toString() {
            return "TaskHandle{" + name + ", runs=" + runs.get() + (cancelled ? ", cancelled" : "") + "}";
        }
    }
}
