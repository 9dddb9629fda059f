package com.sailfish.taskengine.retry;

import com.sailfish.taskengine.error.ErrorCategory;
import com.sailfish.taskengine.error.ErrorClassifier;
import com.sailfish.taskengine.error.RetryExhaustedException;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of an operation run through {@link RetryExecutor}. Callers pick how a
 * failure is surfaced: {@link #getOrThrow()}, {@link #orElse(Object)} or
 * {@link #orNull()}.
 *
 * @param <T> the operation's value type.
 */
public final class RetryResult<T> {

    private final String operationName;
    private final T value;
    private final Exception error;
    private final int attempts;

    private RetryResult(String operationName, T value, Exception error, int attempts) {
        this.operationName = operationName;
        this.value = value;
        this.error = error;
        this.attempts = attempts;
    }

    public static <T> RetryResult<T> success(String operationName, T value, int attempts) {
        return new RetryResult<>(operationName, value, null, attempts);
    }

    public static <T> RetryResult<T> failure(String operationName, Exception error, int attempts) {
        return new RetryResult<>(operationName, null, Objects.requireNonNull(error, "error cannot be null"), attempts);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    /**
     * @return the value of a successful run (may itself be null).
     * @throws IllegalStateException if the run failed.
     */
    public T getValue() {
        if (isFailure()) {
            throw new IllegalStateException(operationName + " failed; no value available");
        }
        return value;
    }

    public Optional<Exception> getError() {
        return Optional.ofNullable(error);
    }

    public ErrorCategory getErrorCategory() {
        return error == null ? null : ErrorClassifier.classify(error);
    }

    public int getAttempts() {
        return attempts;
    }

    public String getOperationName() {
        return operationName;
    }

    /**
     * Returns the value, or rethrows the failure. Unchecked failures are rethrown as
     * they are; checked ones are wrapped in {@link RetryExhaustedException}.
     */
    public T getOrThrow() {
        if (isSuccess()) {
            return value;
        }
        if (error instanceof RuntimeException) {
            throw (RuntimeException) error;
        }
        throw new RetryExhaustedException(operationName, attempts, getErrorCategory(), error);
    }

    public T orElse(T fallback) {
        return isSuccess() ? value : fallback;
    }

    public T orNull() {
        return orElse(null);
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "RetryResult{" + operationName + " succeeded after " + attempts + " attempt(s)}"
                : "RetryResult{" + operationName + " failed after " + attempts + " attempt(s): " + error.getMessage() + '}';
    }
}
