package com.sailfish.taskengine.offline;

import com.sailfish.taskengine.error.ErrorCategory;
import com.sailfish.taskengine.retry.RetryExecutor;
import com.sailfish.taskengine.retry.RetryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Entry point for mutating calls: runs them now through the {@link RetryExecutor}
 * when online, or parks them in the {@link OfflineQueue} when not.
 * <p>
 * A call that still fails with a transient error after its retries is parked as
 * well, and replayed after the next call that succeeds. Any other terminal
 * failure is thrown back to the caller.
 */
public class ResilientOperations {

    private static final Logger log = LoggerFactory.getLogger(ResilientOperations.class);

    private final RetryExecutor retryExecutor;
    private final OfflineQueue offlineQueue;

    public ResilientOperations(RetryExecutor retryExecutor, OfflineQueue offlineQueue) {
        this.retryExecutor = Objects.requireNonNull(retryExecutor, "retryExecutor cannot be null");
        this.offlineQueue = Objects.requireNonNull(offlineQueue, "offlineQueue cannot be null");
    }

    /**
     * @return the operation's value, or empty if it was deferred.
     */
    public <T> Optional<T> callOrDefer(String operationName, Callable<T> operation) {
        Objects.requireNonNull(operation, "operation cannot be null");
        if (!offlineQueue.isOnline()) {
            log.info("Offline; deferring '{}'", operationName);
            offlineQueue.addPendingOperation(operationName, operation::call);
            return Optional.empty();
        }

        RetryResult<T> result = retryExecutor.execute(operationName, operation);
        if (result.isSuccess()) {
            // Parked calls get no reconnect event while the host stays online.
            if (offlineQueue.getPendingOperationCount() > 0) {
                log.info("'{}' succeeded; replaying {} parked operation(s)",
                        operationName, offlineQueue.getPendingOperationCount());
                offlineQueue.syncPendingOperations();
            }
            return Optional.ofNullable(result.getValue());
        }
        if (result.getErrorCategory() == ErrorCategory.TRANSIENT) {
            log.warn("'{}' still failing after {} attempt(s); deferring until next sync",
                    operationName, result.getAttempts());
            offlineQueue.addPendingOperation(operationName, operation::call);
            return Optional.empty();
        }
        return Optional.ofNullable(result.getOrThrow());
    }

    /**
     * @return true if the operation ran now, false if it was deferred.
     */
    public boolean runOrDefer(String operationName, DeferredOperation operation) {
        Objects.requireNonNull(operation, "operation cannot be null");
        Callable<Boolean> call = () -> {
            operation.run();
            return Boolean.TRUE;
        };
        return callOrDefer(operationName, call).isPresent();
    }

    public RetryExecutor getRetryExecutor() {
        return retryExecutor;
    }

    public OfflineQueue getOfflineQueue() {
        return offlineQueue;
    }
}
