package com.sailfish.taskengine.retry;

/**
 * Snapshot of a {@link RetryExecutor}'s current or most recent invocation.
 */
public final class RetryState {

    static final RetryState IDLE = new RetryState(false, 0, null);

    private final boolean retrying;
    private final int attemptCount;
    private final Exception lastError;

    RetryState(boolean retrying, int attemptCount, Exception lastError) {
        this.retrying = retrying;
        this.attemptCount = attemptCount;
        this.lastError = lastError;
    }

    RetryState withAttempt(int attempt) {
        return new RetryState(true, attempt, lastError);
    }

    RetryState withError(Exception error) {
        return new RetryState(retrying, attemptCount, error);
    }

    RetryState finished() {
        return new RetryState(false, attemptCount, lastError);
    }

    /**
     * @return true while an invocation is in progress.
     */
    public boolean isRetrying() {
        return retrying;
    }

    public int getAttemptCount() {
        return attemptCount;
    }

    /**
     * @return the last failure of the current invocation, or null after a success.
     */
    public Exception getLastError() {
        return lastError;
    }

    @Override
    public String toString() {
        return "RetryState{retrying=" + retrying + ", attemptCount=" + attemptCount
                + ", lastError=" + (lastError == null ? null : lastError.getMessage()) + '}';
    }
}
