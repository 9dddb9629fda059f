package com.sailfish.taskengine.offline;

import com.sailfish.taskengine.retry.RetryExecutor;
import com.sailfish.taskengine.retry.RetryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Holds operations deferred while the host is offline and replays them once it
 * is back online.
 * <p>
 * The queue lives in memory only; anything still queued when the process exits
 * is lost. A failed replay is put back at the end of the queue, never dropped.
 * Operations are never run while the internal lock is held.
 */
public class OfflineQueue implements ConnectivityListener {

    private static final Logger log = LoggerFactory.getLogger(OfflineQueue.class);

    private final RetryExecutor retryExecutor;
    private final Clock clock;
    private final Object lock = new Object();
    private final List<PendingOperation> pending = new ArrayList<>();

    private boolean online;
    private boolean wasOffline;
    private LocalDateTime lastOnlineTime;
    private LocalDateTime lastOfflineTime;

    public OfflineQueue(ConnectivitySignal connectivity, RetryExecutor retryExecutor, Clock clock) {
        Objects.requireNonNull(connectivity, "connectivity cannot be null");
        this.retryExecutor = Objects.requireNonNull(retryExecutor, "retryExecutor cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.online = connectivity.isOnline();
        if (online) {
            lastOnlineTime = LocalDateTime.now(clock);
        } else {
            lastOfflineTime = LocalDateTime.now(clock);
        }
        connectivity.addListener(this);
        log.info("OfflineQueue initialized (online={})", online);
    }

    /**
     * Queues an operation for the next sync. The operation is not run here.
     */
    public void addPendingOperation(String name, DeferredOperation operation) {
        PendingOperation entry = new PendingOperation(name, operation, LocalDateTime.now(clock));
        int size;
        synchronized (lock) {
            pending.add(entry);
            size = pending.size();
        }
        log.debug("Queued operation '{}' ({} pending)", name, size);
    }

    /**
     * Replays every operation queued before this call, in order.
     * Operations queued while the replay runs wait for the next sync.
     *
     * @return the number of operations that completed successfully.
     */
    public int syncPendingOperations() {
        List<PendingOperation> batch;
        synchronized (lock) {
            if (!online) {
                log.debug("Skipping sync: offline");
                return 0;
            }
            if (pending.isEmpty()) {
                return 0;
            }
            // Snapshot, then release the lock before running anything
            batch = new ArrayList<>(pending);
            pending.clear();
        }

        log.info("Syncing {} pending operation(s)", batch.size());
        int synced = 0;
        for (PendingOperation entry : batch) {
            RetryResult<Void> result = retryExecutor.execute(entry.getName(), () -> {
                entry.getOperation().run();
                return null;
            });
            if (result.isSuccess()) {
                synced++;
            } else {
                log.warn("Failed to sync pending operation '{}'; re-queued", entry.getName());
                synchronized (lock) {
                    pending.add(entry); // back of the queue, behind anything added meanwhile
                }
            }
        }
        log.info("Sync finished: {} succeeded, {} re-queued", synced, batch.size() - synced);
        return synced;
    }

    @Override
    public void onOnline() {
        boolean syncNow;
        synchronized (lock) {
            boolean transition = !online;
            wasOffline = wasOffline || transition;
            online = true;
            lastOnlineTime = LocalDateTime.now(clock);
            syncNow = transition && wasOffline;
        }
        if (syncNow) {
            log.info("Back online; replaying queued operations");
            syncPendingOperations();
        }
    }

    @Override
    public void onOffline() {
        synchronized (lock) {
            online = false;
            lastOfflineTime = LocalDateTime.now(clock);
        }
        log.info("Connectivity lost; operations will be queued");
    }

    /**
     * Acknowledges the "back online" transition. The queue is untouched.
     */
    public void clearWasOfflineFlag() {
        synchronized (lock) {
            wasOffline = false;
        }
    }

    public boolean isOnline() {
        synchronized (lock) {
            return online;
        }
    }

    public boolean wasOffline() {
        synchronized (lock) {
            return wasOffline;
        }
    }

    public int getPendingOperationCount() {
        synchronized (lock) {
            return pending.size();
        }
    }

    public List<PendingOperation> getPendingOperations() {
        synchronized (lock) {
            return List.copyOf(pending);
        }
    }

    public LocalDateTime getLastOnlineTime() {
        synchronized (lock) {
            return lastOnlineTime;
        }
    }

    public LocalDateTime getLastOfflineTime() {
        synchronized (lock) {
            return lastOfflineTime;
        }
    }
}
