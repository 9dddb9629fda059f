package com.sailfish.taskengine.retry;

import com.sailfish.taskengine.error.ErrorClassifier;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Predicate;

/**
 * A retry strategy implementing capped exponential backoff with optional jitter.
 * <p>
 * The delay after attempt {@code n} is {@code min(baseDelay * backoffFactor^(n-1), maxDelay)}.
 */
public class ExponentialBackoffRetryStrategy implements RetryStrategy {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofMillis(1000);
    public static final double DEFAULT_BACKOFF_FACTOR = 2.0;
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofMillis(10000);

    private final int maxAttempts;
    private final Duration baseDelay;
    private final double backoffFactor;
    private final Duration maxDelay;
    private final Predicate<Throwable> retryCondition;
    private final boolean addJitter;

    /**
     * Creates the default strategy.
     * Max Attempts: 3
     * Base Delay: 1 second
     * Backoff Factor: 2.0
     * Max Delay: 10 seconds
     * Retry Condition: transient failures only
     * Jitter: false
     */
    public ExponentialBackoffRetryStrategy() {
        this(DEFAULT_MAX_ATTEMPTS, DEFAULT_BASE_DELAY, DEFAULT_BACKOFF_FACTOR, DEFAULT_MAX_DELAY,
                ErrorClassifier::isRetryable, false);
    }

    /**
     * Creates a configurable strategy.
     *
     * @param maxAttempts    Total number of attempts, including the first.
     * @param baseDelay      Delay after the first failed attempt.
     * @param backoffFactor  Factor by which the delay grows for each subsequent failure.
     * @param maxDelay       Cap on any single delay.
     * @param retryCondition Decides which failures are worth another attempt.
     * @param addJitter      If true, varies each delay by up to +/-10%.
     */
    public ExponentialBackoffRetryStrategy(int maxAttempts, Duration baseDelay, double backoffFactor,
                                           Duration maxDelay, Predicate<Throwable> retryCondition, boolean addJitter) {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be at least 1");
        if (baseDelay == null || baseDelay.isNegative()) throw new IllegalArgumentException("baseDelay must be non-negative");
        if (backoffFactor < 1.0) throw new IllegalArgumentException("backoffFactor must be at least 1.0");
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be at least baseDelay");
        }

        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
        this.backoffFactor = backoffFactor;
        this.maxDelay = maxDelay;
        this.retryCondition = Objects.requireNonNull(retryCondition, "retryCondition cannot be null");
        this.addJitter = addJitter;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder pre-filled with this strategy's settings, for one-off overrides.
     */
    public Builder toBuilder() {
        return new Builder()
                .maxAttempts(maxAttempts)
                .baseDelay(baseDelay)
                .backoffFactor(backoffFactor)
                .maxDelay(maxDelay)
                .retryCondition(retryCondition)
                .addJitter(addJitter);
    }

    @Override
    public boolean shouldRetry(Throwable error, int attempt) {
        return attempt < maxAttempts && isRetryable(error);
    }

    @Override
    public boolean isRetryable(Throwable error) {
        return retryCondition.test(error);
    }

    @Override
    public Duration calculateDelay(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be at least 1");
        }
        double raw = baseDelay.toMillis() * Math.pow(backoffFactor, attempt - 1);
        long delayMillis = (long) Math.min(raw, (double) maxDelay.toMillis());

        // +/- 10% of the calculated delay
        if (addJitter && delayMillis > 0) {
            long jitter = (long) (delayMillis * 0.1 * (ThreadLocalRandom.current().nextDouble() * 2 - 1));
            delayMillis = Math.max(1, delayMillis + jitter);
        }
        return Duration.ofMillis(delayMillis);
    }

    // --- Getters for configuration ---
    @Override
    public int getMaxAttempts() { return maxAttempts; }
    public Duration getBaseDelay() { return baseDelay; }
    public double getBackoffFactor() { return backoffFactor; }
    public Duration getMaxDelay() { return maxDelay; }
    public Predicate<Throwable> getRetryCondition() { return retryCondition; }
    public boolean isAddJitter() { return addJitter; }

    @Override
    public String toString() {
        return "ExponentialBackoffRetryStrategy{" +
                "maxAttempts=" + maxAttempts +
                ", baseDelay=" + baseDelay +
                ", backoffFactor=" + backoffFactor +
                ", maxDelay=" + maxDelay +
                ", addJitter=" + addJitter +
                '}';
    }

    public static final class Builder {
        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
        private Duration baseDelay = DEFAULT_BASE_DELAY;
        private double backoffFactor = DEFAULT_BACKOFF_FACTOR;
        private Duration maxDelay = DEFAULT_MAX_DELAY;
        private Predicate<Throwable> retryCondition = ErrorClassifier::isRetryable;
        private boolean addJitter;

        private Builder() {
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder baseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
            return this;
        }

        public Builder backoffFactor(double backoffFactor) {
            this.backoffFactor = backoffFactor;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder retryCondition(Predicate<Throwable> retryCondition) {
            this.retryCondition = retryCondition;
            return this;
        }

        public Builder addJitter(boolean addJitter) {
            this.addJitter = addJitter;
            return this;
        }

        public ExponentialBackoffRetryStrategy build() {
            return new ExponentialBackoffRetryStrategy(maxAttempts, baseDelay, backoffFactor, maxDelay,
                    retryCondition, addJitter);
        }
    }
}
