package com.sailfish.taskengine.retry;

import java.time.Duration;

/**
 * Defines how failed operations are retried.
 */
public interface RetryStrategy {

    /**
     * @return the total number of attempts, including the first one.
     */
    int getMaxAttempts();

    /**
     * Determines if an operation should be attempted again after a failure.
     *
     * @param error   The failure from the attempt that just ran.
     * @param attempt The 1-based number of the attempt that just ran.
     * @return true if another attempt should be made, false otherwise (e.g., attempt limit reached
     * or the error is not retryable).
     */
    boolean shouldRetry(Throwable error, int attempt);

    /**
     * Calculates how long to wait after a failed attempt before the next one.
     *
     * @param attempt The 1-based number of the attempt that just failed.
     * @return the delay before the next attempt.
     */
    Duration calculateDelay(int attempt);

    /**
     * @return true if the error alone (ignoring the attempt count) qualifies for a retry.
     */
    boolean isRetryable(Throwable error);
}
