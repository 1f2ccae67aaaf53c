package com.bot.scheduler;

import java.util.List;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * A unit of scheduled work: a unique name, the action, an optional run limit and optional
 * conditions that must all hold for a due run to execute (a skipped run does not count).
 */
public final class ScheduledTask {

    private final String name;
    private final Runnable action;
    private final int maxRuns;
    private final List<BooleanSupplier> conditions;

    /**
     * @param name       task name, unique within one scheduler
     * @param action     work to run
     * @param maxRuns    number of executions after which the task cancels itself; 0 = unlimited
     * @param conditions run only when all return true; null = none
     */
    public ScheduledTask(String name, Runnable action, int maxRuns, List<BooleanSupplier> conditions) {
        this.name = Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Task name must be non-blank");
        }
        this.action = Objects.requireNonNull(action, "action");
        if (maxRuns < 0) {
            throw new IllegalArgumentException("maxRuns must be >= 0: " + maxRuns);
        }
        this.maxRuns = maxRuns;
        this.conditions = conditions != null ? List.copyOf(conditions) : List.of();
    }

    public static ScheduledTask of(String name, Runnable action) {
        return new ScheduledTask(name, action, 0, null);
    }

    public String getName() {
        return name;
    }

    public Runnable getAction() {
        return action;
    }

    public int getMaxRuns() {
        return maxRuns;
    }

    public List<BooleanSupplier> getConditions() {
        return conditions;
    }

    /** True when every condition currently holds. */
    public boolean conditionsHold() {
        for (BooleanSupplier c : conditions) {
            if (!c.getAsBoolean()) return false;
        }
        return true;
    }
}
