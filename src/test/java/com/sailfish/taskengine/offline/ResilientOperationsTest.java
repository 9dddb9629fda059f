package com.sailfish.taskengine.offline;

import com.sailfish.taskengine.error.PermanentException;
import com.sailfish.taskengine.error.TransientException;
import com.sailfish.taskengine.retry.ExponentialBackoffRetryStrategy;
import com.sailfish.taskengine.retry.RetryExecutor;
import com.sailfish.taskengine.support.FakeConnectivity;
import com.sailfish.taskengine.support.MutableClock;
import com.sailfish.taskengine.support.RecordingErrorReporter;
import com.sailfish.taskengine.support.RecordingSleeper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ResilientOperationsTest {

    private FakeConnectivity connectivity;
    private OfflineQueue queue;
    private ResilientOperations operations;

    @BeforeEach
    void setUp() {
        connectivity = new FakeConnectivity(true);
        RecordingErrorReporter reporter = new RecordingErrorReporter();
        RecordingSleeper sleeper = new RecordingSleeper();
        ExponentialBackoffRetryStrategy strategy = ExponentialBackoffRetryStrategy.builder().maxAttempts(2).build();
        MutableClock clock = MutableClock.at(LocalDateTime.of(2024, 1, 15, 9, 0));
        queue = new OfflineQueue(connectivity, new RetryExecutor(strategy, reporter, sleeper), clock);
        operations = new ResilientOperations(new RetryExecutor(strategy, reporter, sleeper), queue);
    }

    @Test
    void runsImmediatelyWhenOnline() {
        Optional<String> value = operations.callOrDefer("load", () -> "value");

        assertEquals(Optional.of("value"), value);
        assertEquals(0, queue.getPendingOperationCount());
    }

    @Test
    void defersWithoutRunningWhenOffline() {
        connectivity.goOffline();
        AtomicInteger runs = new AtomicInteger();

        boolean ranNow = operations.runOrDefer("update", runs::incrementAndGet);

        assertFalse(ranNow);
        assertEquals(0, runs.get());
        assertEquals(1, queue.getPendingOperationCount());

        connectivity.goOnline();

        assertEquals(1, runs.get());
        assertEquals(0, queue.getPendingOperationCount());
    }

    @Test
    void defersAfterTransientFailuresAreExhausted() {
        AtomicInteger runs = new AtomicInteger();

        boolean ranNow = operations.runOrDefer("update", () -> {
            runs.incrementAndGet();
            throw new TransientException("network unreachable");
        });

        assertFalse(ranNow);
        assertEquals(2, runs.get());
        assertEquals(1, queue.getPendingOperationCount());
    }

    @Test
    void parkedCallIsReplayedAfterNextSuccessWithoutReconnect() {
        AtomicInteger flakyRuns = new AtomicInteger();
        operations.runOrDefer("flaky", () -> {
            if (flakyRuns.incrementAndGet() <= 2) {
                throw new TransientException("connection reset");
            }
        });
        assertEquals(2, flakyRuns.get());
        assertEquals(1, queue.getPendingOperationCount());

        assertTrue(operations.runOrDefer("healthy", () -> { }));

        assertEquals(3, flakyRuns.get());
        assertEquals(0, queue.getPendingOperationCount());
    }

    @Test
    void permanentFailureIsThrownToCaller() {
        assertThrows(PermanentException.class, () -> operations.runOrDefer("update", () -> {
            throw new PermanentException("invalid stage");
        }));
        assertEquals(0, queue.getPendingOperationCount());
    }
}
