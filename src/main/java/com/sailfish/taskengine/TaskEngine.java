package com.sailfish.taskengine;

import com.sailfish.taskengine.config.TaskEngineSettings;
import com.sailfish.taskengine.error.ErrorReporter;
import com.sailfish.taskengine.error.LoggingErrorReporter;
import com.sailfish.taskengine.offline.ConnectivitySignal;
import com.sailfish.taskengine.offline.OfflineQueue;
import com.sailfish.taskengine.offline.ResilientOperations;
import com.sailfish.taskengine.repository.ContentRepository;
import com.sailfish.taskengine.repository.RunMarkerStore;
import com.sailfish.taskengine.repository.TaskRepository;
import com.sailfish.taskengine.retry.RetryExecutor;
import com.sailfish.taskengine.retry.RetryStrategy;
import com.sailfish.taskengine.retry.Sleeper;
import com.sailfish.taskengine.rules.FeedbackRules;
import com.sailfish.taskengine.rules.TaskRuleRegistry;
import com.sailfish.taskengine.service.HostLifecycle;
import com.sailfish.taskengine.service.TaskRulesEngine;
import com.sailfish.taskengine.service.impl.DailyRuleScheduler;
import com.sailfish.taskengine.service.impl.TaskRulesEngineImpl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Composition root of the task engine. Builds one instance of each component,
 * hands out the handles callers need, and owns their shutdown.
 * <p>
 * Each component gets its own {@link RetryExecutor}, since an executor tracks a
 * single invocation at a time.
 */
public class TaskEngine {

    private static final Logger log = LoggerFactory.getLogger(TaskEngine.class);

    private final TaskRulesEngine rulesEngine;
    private final DailyRuleScheduler scheduler;
    private final OfflineQueue offlineQueue;
    private final ResilientOperations resilientOperations;
    private final ScheduledExecutorService schedulerExecutor;
    private final boolean ownsSchedulerExecutor;
    private final Duration syncInterval;

    private ScheduledFuture<?> syncTask;

    private TaskEngine(Builder builder) {
        TaskEngineSettings settings = builder.settings;
        ErrorReporter errorReporter = builder.errorReporter;
        RetryStrategy retryStrategy = settings.retryStrategy();
        TaskRuleRegistry ruleRegistry = builder.ruleRegistry != null
                ? builder.ruleRegistry
                : FeedbackRules.registry(settings.getFansFeedbackThreshold(), settings.getOverallFeedbackThreshold());

        this.ownsSchedulerExecutor = builder.schedulerExecutor == null;
        this.schedulerExecutor = ownsSchedulerExecutor
                ? Executors.newSingleThreadScheduledExecutor(r -> {
                    Thread t = new Thread(r, "task-engine-scheduler");
                    t.setDaemon(true);
                    return t;
                })
                : builder.schedulerExecutor;

        this.rulesEngine = new TaskRulesEngineImpl(
                builder.contentRepository,
                builder.taskRepository,
                ruleRegistry,
                new RetryExecutor(retryStrategy, errorReporter, builder.sleeper),
                errorReporter,
                builder.clock,
                settings.getTaskLifetime());

        this.scheduler = new DailyRuleScheduler(
                rulesEngine,
                builder.taskRepository,
                builder.runMarkerStore,
                new RetryExecutor(retryStrategy, errorReporter, builder.sleeper),
                errorReporter,
                schedulerExecutor,
                builder.hostLifecycle,
                builder.clock,
                settings.getCatchUpInterval());

        this.syncInterval = settings.getCatchUpInterval();
        this.offlineQueue = new OfflineQueue(
                builder.connectivity,
                new RetryExecutor(retryStrategy, errorReporter, builder.sleeper),
                builder.clock);

        this.resilientOperations = new ResilientOperations(
                new RetryExecutor(retryStrategy, errorReporter, builder.sleeper),
                offlineQueue);

        log.info("TaskEngine assembled with {}", settings);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts the daily scheduler and binds it to the host lifecycle. Parked
     * operations are also replayed on the catch-up cadence, since a host that
     * never goes offline never sees a reconnect.
     */
    public synchronized void start() {
        scheduler.initialize();
        if (syncTask == null && !schedulerExecutor.isShutdown()) {
            syncTask = schedulerExecutor.scheduleAtFixedRate(
                    this::syncParkedOperations,
                    syncInterval.toMillis(),
                    syncInterval.toMillis(),
                    TimeUnit.MILLISECONDS
            );
        }
        log.info("TaskEngine started and ready.");
    }

    /**
     * Stops the scheduler and, if the engine created its executor, shuts that down too.
     */
    public void shutdown(long timeoutSeconds) {
        scheduler.stop();
        synchronized (this) {
            if (syncTask != null) {
                syncTask.cancel(false);
                syncTask = null;
            }
        }
        if (ownsSchedulerExecutor) {
            shutdownExecutor("Scheduler Executor", schedulerExecutor, timeoutSeconds);
        }
        if (offlineQueue.getPendingOperationCount() > 0) {
            log.warn("Shutting down with {} unsynced pending operation(s); they will be lost.",
                    offlineQueue.getPendingOperationCount());
        }
    }

    public TaskRulesEngine getRulesEngine() {
        return rulesEngine;
    }

    public DailyRuleScheduler getScheduler() {
        return scheduler;
    }

    public OfflineQueue getOfflineQueue() {
        return offlineQueue;
    }

    public ResilientOperations getResilientOperations() {
        return resilientOperations;
    }

    private void syncParkedOperations() {
        if (offlineQueue.getPendingOperationCount() == 0 || !offlineQueue.isOnline()) {
            return;
        }
        // An exception escaping here would silently cancel the periodic task.
        try {
            int synced = offlineQueue.syncPendingOperations();
            log.debug("Periodic sync replayed {} parked operation(s)", synced);
        } catch (RuntimeException e) {
            log.error("Periodic sync of parked operations failed", e);
        }
    }

    /** Helper method to shutdown an executor service */
    private void shutdownExecutor(String name, ScheduledExecutorService executor, long timeoutSeconds) {
        log.info("Shutting down {}...", name);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(timeoutSeconds, TimeUnit.SECONDS)) {
                log.warn("{} did not terminate in {} seconds.", name, timeoutSeconds);
                List<Runnable> droppedTasks = executor.shutdownNow();
                log.warn("Forcefully shutting down {}. {} tasks were dropped.", name, droppedTasks.size());
                if (!executor.awaitTermination(timeoutSeconds, TimeUnit.SECONDS)) {
                    log.error("{} did not terminate even after forceful shutdown.", name);
                }
            } else {
                log.info("{} terminated gracefully.", name);
            }
        } catch (InterruptedException ie) {
            log.warn("{} shutdown interrupted. Forcing shutdown now.", name);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public static final class Builder {
        private ContentRepository contentRepository;
        private TaskRepository taskRepository;
        private RunMarkerStore runMarkerStore;
        private ConnectivitySignal connectivity;
        private HostLifecycle hostLifecycle = HostLifecycle.NONE;
        private ErrorReporter errorReporter = new LoggingErrorReporter();
        private TaskRuleRegistry ruleRegistry;
        private TaskEngineSettings settings;
        private ScheduledExecutorService schedulerExecutor;
        private Clock clock = Clock.systemDefaultZone();
        private Sleeper sleeper = Sleeper.THREAD;

        private Builder() {
        }

        public Builder contentRepository(ContentRepository contentRepository) {
            this.contentRepository = contentRepository;
            return this;
        }

        public Builder taskRepository(TaskRepository taskRepository) {
            this.taskRepository = taskRepository;
            return this;
        }

        public Builder runMarkerStore(RunMarkerStore runMarkerStore) {
            this.runMarkerStore = runMarkerStore;
            return this;
        }

        public Builder connectivity(ConnectivitySignal connectivity) {
            this.connectivity = connectivity;
            return this;
        }

        public Builder hostLifecycle(HostLifecycle hostLifecycle) {
            this.hostLifecycle = hostLifecycle;
            return this;
        }

        public Builder errorReporter(ErrorReporter errorReporter) {
            this.errorReporter = errorReporter;
            return this;
        }

        /**
         * Replaces the built-in feedback rules. Threshold settings are ignored when set.
         */
        public Builder ruleRegistry(TaskRuleRegistry ruleRegistry) {
            this.ruleRegistry = ruleRegistry;
            return this;
        }

        public Builder settings(TaskEngineSettings settings) {
            this.settings = settings;
            return this;
        }

        /**
         * Uses a caller-managed executor for scheduler timers. The engine will not shut it down.
         */
        public Builder schedulerExecutor(ScheduledExecutorService schedulerExecutor) {
            this.schedulerExecutor = schedulerExecutor;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public TaskEngine build() {
            Objects.requireNonNull(contentRepository, "contentRepository cannot be null");
            Objects.requireNonNull(taskRepository, "taskRepository cannot be null");
            Objects.requireNonNull(runMarkerStore, "runMarkerStore cannot be null");
            Objects.requireNonNull(connectivity, "connectivity cannot be null");
            Objects.requireNonNull(hostLifecycle, "hostLifecycle cannot be null");
            Objects.requireNonNull(errorReporter, "errorReporter cannot be null");
            Objects.requireNonNull(clock, "clock cannot be null");
            Objects.requireNonNull(sleeper, "sleeper cannot be null");
            if (settings == null) {
                settings = TaskEngineSettings.load();
            }
            return new TaskEngine(this);
        }
    }
}
