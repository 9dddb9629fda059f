package com.sailfish.taskengine.retry;

import com.sailfish.taskengine.error.ErrorReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * Runs one fallible operation at a time with bounded, backed-off retries.
 * <p>
 * A terminal failure (a non-retryable error, or the last attempt failing) is
 * reported to the {@link ErrorReporter} exactly once and handed back as a failed
 * {@link RetryResult}. An {@link Error} is reported and rethrown instead.
 * The executor keeps no queue; an instance is meant to be driven by one caller
 * at a time.
 */
public class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private static final String DEFAULT_OPERATION_NAME = "Operation";

    private final RetryStrategy defaultStrategy;
    private final ErrorReporter errorReporter;
    private final Sleeper sleeper;

    private volatile RetryState state = RetryState.IDLE;

    public RetryExecutor(RetryStrategy defaultStrategy, ErrorReporter errorReporter) {
        this(defaultStrategy, errorReporter, Sleeper.THREAD);
    }

    public RetryExecutor(RetryStrategy defaultStrategy, ErrorReporter errorReporter, Sleeper sleeper) {
        this.defaultStrategy = Objects.requireNonNull(defaultStrategy, "defaultStrategy cannot be null");
        this.errorReporter = Objects.requireNonNull(errorReporter, "errorReporter cannot be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper cannot be null");
    }

    public <T> RetryResult<T> execute(String operationName, Callable<T> operation) {
        return execute(operationName, operation, defaultStrategy);
    }

    /**
     * Runs the operation with a one-off strategy. The executor's default strategy is untouched.
     */
    public <T> RetryResult<T> execute(String operationName, Callable<T> operation, RetryStrategy strategy) {
        Objects.requireNonNull(operation, "operation cannot be null");
        Objects.requireNonNull(strategy, "strategy cannot be null");
        String name = (operationName == null || operationName.trim().isEmpty()) ? DEFAULT_OPERATION_NAME : operationName;

        state = new RetryState(true, 0, null);

        for (int attempt = 1; attempt <= strategy.getMaxAttempts(); attempt++) {
            state = state.withAttempt(attempt);
            try {
                T value = operation.call();
                state = new RetryState(false, attempt, null);
                if (attempt > 1) {
                    log.info("{} succeeded on attempt {}", name, attempt);
                }
                return RetryResult.success(name, value, attempt);
            } catch (Exception e) {
                state = state.withError(e);

                if (e instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                    return fail(name, e, attempt, name + " interrupted: " + e.getMessage());
                }
                if (!strategy.isRetryable(e)) {
                    return fail(name, e, attempt, name + " failed: " + e.getMessage());
                }
                if (!strategy.shouldRetry(e, attempt)) {
                    return fail(name, e, attempt, name + " failed after " + attempt + " attempts: " + e.getMessage());
                }

                Duration delay = strategy.calculateDelay(attempt);
                log.warn("{} failed on attempt {}/{}: {}. Retrying in {} ms",
                        name, attempt, strategy.getMaxAttempts(), e.getMessage(), delay.toMillis());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return fail(name, e, attempt, name + " interrupted during backoff after " + attempt + " attempts: " + e.getMessage());
                }
            } catch (Error err) {
                // Never retried and never folded into a result; the caller gets it as thrown.
                state = state.finished();
                errorReporter.report(err, name + " failed: " + err.getMessage(), attempt);
                throw err;
            }
        }

        // Unreachable for a strategy with maxAttempts >= 1
        throw new IllegalStateException("RetryStrategy allowed no attempts: " + strategy);
    }

    /**
     * Wraps an operation so that every call runs through this executor. The returned
     * callable yields the value on success and throws the failure otherwise.
     */
    public <T> Callable<T> decorate(String operationName, Callable<T> operation) {
        Objects.requireNonNull(operation, "operation cannot be null");
        return () -> execute(operationName, operation).getOrThrow();
    }

    /**
     * @return the live state of the current (or last) invocation.
     */
    public RetryState getState() {
        return state;
    }

    public RetryStrategy getDefaultStrategy() {
        return defaultStrategy;
    }

    private <T> RetryResult<T> fail(String name, Exception error, int attempt, String context) {
        state = state.finished();
        errorReporter.report(error, context, attempt);
        return RetryResult.failure(name, error, attempt);
    }
}
