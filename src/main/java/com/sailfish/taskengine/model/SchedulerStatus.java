package com.sailfish.taskengine.model;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Point-in-time view of the daily scheduler.
 */
public final class SchedulerStatus {

    private static final SchedulerStatus STOPPED = new SchedulerStatus(false, null);

    private final boolean running;
    private final LocalDateTime nextRunTime;

    private SchedulerStatus(boolean running, LocalDateTime nextRunTime) {
        this.running = running;
        this.nextRunTime = nextRunTime;
    }

    public static SchedulerStatus stopped() {
        return STOPPED;
    }

    public static SchedulerStatus running(LocalDateTime nextRunTime) {
        return new SchedulerStatus(true, Objects.requireNonNull(nextRunTime, "nextRunTime cannot be null"));
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * @return the next boundary run, or null when stopped.
     */
    public LocalDateTime getNextRunTime() {
        return nextRunTime;
    }

    @Override
    public String toString() {
        return "SchedulerStatus{running=" + running + ", nextRunTime=" + nextRunTime + '}';
    }
}
