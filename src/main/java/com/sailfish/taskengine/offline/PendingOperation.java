package com.sailfish.taskengine.offline;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * A deferred operation waiting in the {@link OfflineQueue}, with the time it was queued.
 */
public final class PendingOperation {

    private final String name;
    private final DeferredOperation operation;
    private final LocalDateTime enqueuedAt;

    PendingOperation(String name, DeferredOperation operation, LocalDateTime enqueuedAt) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.operation = Objects.requireNonNull(operation, "operation cannot be null");
        this.enqueuedAt = Objects.requireNonNull(enqueuedAt, "enqueuedAt cannot be null");
    }

    public String getName() {
        return name;
    }

    public DeferredOperation getOperation() {
        return operation;
    }

    public LocalDateTime getEnqueuedAt() {
        return enqueuedAt;
    }

    @Override
    public String toString() {
        return "PendingOperation{name='" + name + "', enqueuedAt=" + enqueuedAt + '}';
    }
}
