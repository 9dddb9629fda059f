package com.sailfish.taskengine.service.impl;

import com.sailfish.taskengine.error.ErrorReporter;
import com.sailfish.taskengine.model.RuleEvaluationResult;
import com.sailfish.taskengine.model.SchedulerStatus;
import com.sailfish.taskengine.repository.RunMarkerStore;
import com.sailfish.taskengine.repository.TaskRepository;
import com.sailfish.taskengine.retry.RetryExecutor;
import com.sailfish.taskengine.service.HostLifecycle;
import com.sailfish.taskengine.service.TaskRulesEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs the {@link TaskRulesEngine} once per calendar day.
 * <p>
 * A one-shot timer fires at each local midnight and a coarser catch-up poll
 * covers boundaries missed while the process was suspended. Every trigger
 * compares the persisted last-run date with today and only evaluates when they
 * differ, so any number of triggers on one day lead to a single run.
 * <p>
 * Nothing prevents a timer-driven run from overlapping {@link #forceRun()}; the
 * marker store is assumed to have a single writer.
 */
public class DailyRuleScheduler {

    private static final Logger log = LoggerFactory.getLogger(DailyRuleScheduler.class);

    public static final String LAST_RUN_MARKER_KEY = "last_task_check";
    public static final Duration DEFAULT_CATCH_UP_INTERVAL = Duration.ofHours(1);

    /** Same shape as {@code "Mon Jan 15 2024"}. */
    static final DateTimeFormatter RUN_DATE_FORMAT = DateTimeFormatter.ofPattern("EEE MMM dd yyyy", Locale.US);

    private final TaskRulesEngine rulesEngine;
    private final TaskRepository taskRepository;
    private final RunMarkerStore runMarkerStore;
    private final RetryExecutor retryExecutor;
    private final ErrorReporter errorReporter;
    private final ScheduledExecutorService schedulerExecutor;
    private final HostLifecycle hostLifecycle;
    private final Clock clock;
    private final Duration catchUpInterval;

    private boolean running;
    private boolean lifecycleBound;
    private ScheduledFuture<?> boundaryTask;
    private ScheduledFuture<?> catchUpTask;
    private LocalDateTime nextRunTime;
    private volatile RuleEvaluationResult lastResult;

    public DailyRuleScheduler(TaskRulesEngine rulesEngine,
                              TaskRepository taskRepository,
                              RunMarkerStore runMarkerStore,
                              RetryExecutor retryExecutor,
                              ErrorReporter errorReporter,
                              ScheduledExecutorService schedulerExecutor,
                              HostLifecycle hostLifecycle,
                              Clock clock) {
        this(rulesEngine, taskRepository, runMarkerStore, retryExecutor, errorReporter, schedulerExecutor,
                hostLifecycle, clock, DEFAULT_CATCH_UP_INTERVAL);
    }

    public DailyRuleScheduler(TaskRulesEngine rulesEngine,
                              TaskRepository taskRepository,
                              RunMarkerStore runMarkerStore,
                              RetryExecutor retryExecutor,
                              ErrorReporter errorReporter,
                              ScheduledExecutorService schedulerExecutor,
                              HostLifecycle hostLifecycle,
                              Clock clock,
                              Duration catchUpInterval) {
        this.rulesEngine = Objects.requireNonNull(rulesEngine, "rulesEngine cannot be null");
        this.taskRepository = Objects.requireNonNull(taskRepository, "taskRepository cannot be null");
        this.runMarkerStore = Objects.requireNonNull(runMarkerStore, "runMarkerStore cannot be null");
        this.retryExecutor = Objects.requireNonNull(retryExecutor, "retryExecutor cannot be null");
        this.errorReporter = Objects.requireNonNull(errorReporter, "errorReporter cannot be null");
        this.schedulerExecutor = Objects.requireNonNull(schedulerExecutor, "schedulerExecutor cannot be null");
        this.hostLifecycle = Objects.requireNonNull(hostLifecycle, "hostLifecycle cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.catchUpInterval = Objects.requireNonNull(catchUpInterval, "catchUpInterval cannot be null");
        if (catchUpInterval.isNegative() || catchUpInterval.isZero()) {
            throw new IllegalArgumentException("catchUpInterval must be positive");
        }
        log.info("DailyRuleScheduler initialized with catchUpInterval={}", catchUpInterval);
    }

    /**
     * Starts the scheduler and hooks it to the host lifecycle: regaining the
     * foreground triggers an immediate catch-up check, teardown stops it.
     */
    @PostConstruct
    public void initialize() {
        start();
        synchronized (this) {
            if (lifecycleBound) {
                return;
            }
            lifecycleBound = true;
        }
        hostLifecycle.addForegroundListener(this::onForeground);
        hostLifecycle.addTeardownListener(this::stop);
    }

    public synchronized void start() {
        if (running) {
            log.warn("DailyRuleScheduler is already running");
            return;
        }
        if (schedulerExecutor.isShutdown() || schedulerExecutor.isTerminated()) {
            log.error("Cannot start DailyRuleScheduler: schedulerExecutor is shut down or terminated.");
            return;
        }

        armBoundary();
        // Fixed rate, not fixed delay: a long run should not push the next check out.
        catchUpTask = schedulerExecutor.scheduleAtFixedRate(
                this::runIfDue,
                catchUpInterval.toMillis(),
                catchUpInterval.toMillis(),
                TimeUnit.MILLISECONDS
        );
        running = true;
        log.info("DailyRuleScheduler started. Next daily run at {}, catch-up check every {}", nextRunTime, catchUpInterval);
    }

    /**
     * Cancels all armed timers. A run already in progress is left to finish.
     */
    @PreDestroy
    public synchronized void stop() {
        if (boundaryTask != null) {
            boundaryTask.cancel(false);
            boundaryTask = null;
        }
        if (catchUpTask != null) {
            catchUpTask.cancel(false);
            catchUpTask = null;
        }
        if (running) {
            log.info("DailyRuleScheduler stopped.");
        }
        running = false;
        nextRunTime = null;
    }

    /**
     * Runs the daily evaluation unless it already ran today.
     * Failures are reported and leave the marker untouched, so a later trigger tries again.
     *
     * @return true if an evaluation ran and completed.
     */
    public boolean runIfDue() {
        try {
            String today = today();
            Optional<String> lastRun = runMarkerStore.read(LAST_RUN_MARKER_KEY);
            if (lastRun.isPresent() && lastRun.get().equals(today)) {
                log.debug("Daily tasks already ran today ({})", today);
                return false;
            }
            log.info("Running daily tasks (last run: {})", lastRun.orElse("never"));
            runDaily(today);
            return true;
        } catch (Exception e) {
            errorReporter.report(e, "Daily task run failed");
            return false;
        }
    }

    /**
     * Evaluates the rules now and records today as the last run date, whatever the
     * marker says. The scheduler state is unchanged. Failures propagate to the caller.
     */
    public RuleEvaluationResult forceRun() {
        log.info("Force running daily tasks...");
        return runDaily(today());
    }

    public synchronized SchedulerStatus getStatus() {
        return running ? SchedulerStatus.running(nextRunTime) : SchedulerStatus.stopped();
    }

    public Optional<String> getLastRunDate() {
        return runMarkerStore.read(LAST_RUN_MARKER_KEY);
    }

    /**
     * @return the result of the most recent completed run, or null if none ran in this process.
     */
    public RuleEvaluationResult getLastResult() {
        return lastResult;
    }

    public Duration getCatchUpInterval() {
        return catchUpInterval;
    }

    private RuleEvaluationResult runDaily(String today) {
        long startMillis = clock.millis();
        RuleEvaluationResult result = rulesEngine.evaluateRules();

        LocalDateTime now = LocalDateTime.now(clock);
        retryExecutor.execute("sweep-expired-tasks", () -> taskRepository.deleteExpired(now))
                .getError()
                .ifPresent(e -> log.warn("Expired task sweep failed; will retry on the next daily run"));

        retryExecutor.execute("write-run-marker", () -> {
            runMarkerStore.write(LAST_RUN_MARKER_KEY, today);
            return today;
        }).getOrThrow();

        lastResult = result;
        log.info("Daily tasks completed in {}ms: {}", clock.millis() - startMillis, result);
        return result;
    }

    private void onBoundary() {
        // Runs outside the monitor; the evaluation can take a while.
        runIfDue();
        synchronized (this) {
            if (running) {
                armBoundary();
                log.debug("Next daily run armed for {}", nextRunTime);
            }
        }
    }

    private void onForeground() {
        log.debug("Host back in foreground; checking for missed daily run");
        try {
            schedulerExecutor.execute(this::runIfDue);
        } catch (RejectedExecutionException e) {
            log.warn("Scheduler executor rejected catch-up check: {}", e.getMessage());
        }
    }

    // Caller holds the monitor. A stop()/start() cycle during a boundary run
    // leaves a newer timer armed, which must not be orphaned by the re-arm.
    private void armBoundary() {
        if (boundaryTask != null) {
            boundaryTask.cancel(false);
        }
        ZonedDateTime nextMidnight = LocalDate.now(clock).plusDays(1).atStartOfDay(clock.getZone());
        long delayMillis = Math.max(0, Duration.between(clock.instant(), nextMidnight.toInstant()).toMillis());
        boundaryTask = schedulerExecutor.schedule(this::onBoundary, delayMillis, TimeUnit.MILLISECONDS);
        nextRunTime = nextMidnight.toLocalDateTime();
    }

    private String today() {
        return LocalDate.now(clock).format(RUN_DATE_FORMAT);
    }
}
