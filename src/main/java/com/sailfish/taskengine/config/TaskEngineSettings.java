package com.sailfish.taskengine.config;

import com.sailfish.taskengine.retry.ExponentialBackoffRetryStrategy;
import com.sailfish.taskengine.rules.FeedbackRules;
import com.sailfish.taskengine.service.impl.DailyRuleScheduler;
import com.sailfish.taskengine.service.impl.TaskRulesEngineImpl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Properties;

/**
 * Tunable settings of the task engine. Every value has a code default and can be
 * overridden through {@code task-engine.*} properties.
 */
public final class TaskEngineSettings {

    private static final Logger log = LoggerFactory.getLogger(TaskEngineSettings.class);

    public static final String DEFAULT_RESOURCE = "task-engine.properties";

    static final String FANS_FEEDBACK_DAYS = "task-engine.rules.fans-feedback.threshold-days";
    static final String OVERALL_FEEDBACK_DAYS = "task-engine.rules.overall-feedback.threshold-days";
    static final String CATCH_UP_MINUTES = "task-engine.scheduler.catch-up-interval-minutes";
    static final String TASK_LIFETIME_DAYS = "task-engine.tasks.lifetime-days";
    static final String RETRY_MAX_ATTEMPTS = "task-engine.retry.max-attempts";
    static final String RETRY_BASE_DELAY_MS = "task-engine.retry.base-delay-ms";
    static final String RETRY_BACKOFF_FACTOR = "task-engine.retry.backoff-factor";
    static final String RETRY_MAX_DELAY_MS = "task-engine.retry.max-delay-ms";
    static final String RETRY_JITTER = "task-engine.retry.jitter";

    private final Duration fansFeedbackThreshold;
    private final Duration overallFeedbackThreshold;
    private final Duration catchUpInterval;
    private final Duration taskLifetime;
    private final int retryMaxAttempts;
    private final Duration retryBaseDelay;
    private final double retryBackoffFactor;
    private final Duration retryMaxDelay;
    private final boolean retryJitter;

    private TaskEngineSettings(Properties properties) {
        this.fansFeedbackThreshold = Duration.ofDays(readLong(properties, FANS_FEEDBACK_DAYS,
                FeedbackRules.DEFAULT_FANS_FEEDBACK_THRESHOLD.toDays(), 0));
        this.overallFeedbackThreshold = Duration.ofDays(readLong(properties, OVERALL_FEEDBACK_DAYS,
                FeedbackRules.DEFAULT_OVERALL_FEEDBACK_THRESHOLD.toDays(), 0));
        this.catchUpInterval = Duration.ofMinutes(readLong(properties, CATCH_UP_MINUTES,
                DailyRuleScheduler.DEFAULT_CATCH_UP_INTERVAL.toMinutes(), 1));
        this.taskLifetime = Duration.ofDays(readLong(properties, TASK_LIFETIME_DAYS,
                TaskRulesEngineImpl.DEFAULT_TASK_LIFETIME.toDays(), 1));
        this.retryMaxAttempts = (int) readLong(properties, RETRY_MAX_ATTEMPTS,
                ExponentialBackoffRetryStrategy.DEFAULT_MAX_ATTEMPTS, 1);
        this.retryBaseDelay = Duration.ofMillis(readLong(properties, RETRY_BASE_DELAY_MS,
                ExponentialBackoffRetryStrategy.DEFAULT_BASE_DELAY.toMillis(), 0));
        this.retryBackoffFactor = readDouble(properties, RETRY_BACKOFF_FACTOR,
                ExponentialBackoffRetryStrategy.DEFAULT_BACKOFF_FACTOR);
        this.retryMaxDelay = Duration.ofMillis(readLong(properties, RETRY_MAX_DELAY_MS,
                ExponentialBackoffRetryStrategy.DEFAULT_MAX_DELAY.toMillis(), 0));
        this.retryJitter = Boolean.parseBoolean(properties.getProperty(RETRY_JITTER, "false").trim());
    }

    public static TaskEngineSettings defaults() {
        return new TaskEngineSettings(new Properties());
    }

    public static TaskEngineSettings fromProperties(Properties properties) {
        return new TaskEngineSettings(properties);
    }

    /**
     * Loads {@value #DEFAULT_RESOURCE} from the classpath, falling back to defaults
     * when the resource is absent.
     */
    public static TaskEngineSettings load() {
        return load(DEFAULT_RESOURCE);
    }

    public static TaskEngineSettings load(String resource) {
        Properties properties = new Properties();
        try (InputStream in = TaskEngineSettings.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                log.info("No {} on classpath; using default task engine settings", resource);
                return defaults();
            }
            properties.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + resource, e);
        }
        TaskEngineSettings settings = new TaskEngineSettings(properties);
        log.info("Loaded task engine settings from {}: {}", resource, settings);
        return settings;
    }

    public ExponentialBackoffRetryStrategy retryStrategy() {
        return ExponentialBackoffRetryStrategy.builder()
                .maxAttempts(retryMaxAttempts)
                .baseDelay(retryBaseDelay)
                .backoffFactor(retryBackoffFactor)
                .maxDelay(retryMaxDelay)
                .addJitter(retryJitter)
                .build();
    }

    public Duration getFansFeedbackThreshold() { return fansFeedbackThreshold; }
    public Duration getOverallFeedbackThreshold() { return overallFeedbackThreshold; }
    public Duration getCatchUpInterval() { return catchUpInterval; }
    public Duration getTaskLifetime() { return taskLifetime; }
    public int getRetryMaxAttempts() { return retryMaxAttempts; }
    public Duration getRetryBaseDelay() { return retryBaseDelay; }
    public double getRetryBackoffFactor() { return retryBackoffFactor; }
    public Duration getRetryMaxDelay() { return retryMaxDelay; }
    public boolean isRetryJitter() { return retryJitter; }

    private static long readLong(Properties properties, String key, long defaultValue, long min) {
        String raw = properties.getProperty(key);
        if (raw == null || raw.trim().isEmpty()) {
            return defaultValue;
        }
        long value;
        try {
            value = Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a whole number but was '" + raw + "'", e);
        }
        if (value < min) {
            throw new IllegalArgumentException(key + " must be at least " + min + " but was " + value);
        }
        return value;
    }

    private static double readDouble(Properties properties, String key, double defaultValue) {
        String raw = properties.getProperty(key);
        if (raw == null || raw.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a number but was '" + raw + "'", e);
        }
    }

    @Override
    public String toString() {
        return "TaskEngineSettings{" +
                "fansFeedbackThreshold=" + fansFeedbackThreshold +
                ", overallFeedbackThreshold=" + overallFeedbackThreshold +
                ", catchUpInterval=" + catchUpInterval +
                ", taskLifetime=" + taskLifetime +
                ", retryMaxAttempts=" + retryMaxAttempts +
                ", retryBaseDelay=" + retryBaseDelay +
                ", retryBackoffFactor=" + retryBackoffFactor +
                ", retryMaxDelay=" + retryMaxDelay +
                ", retryJitter=" + retryJitter +
                '}';
    }
}
