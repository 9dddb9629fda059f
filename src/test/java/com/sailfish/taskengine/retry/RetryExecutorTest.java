package com.sailfish.taskengine.retry;

import com.sailfish.taskengine.error.PermanentException;
import com.sailfish.taskengine.error.RetryExhaustedException;
import com.sailfish.taskengine.error.TransientException;
import com.sailfish.taskengine.support.RecordingErrorReporter;
import com.sailfish.taskengine.support.RecordingSleeper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RetryExecutorTest {

    private RecordingErrorReporter reporter;
    private RecordingSleeper sleeper;
    private RetryExecutor executor;

    @BeforeEach
    void setUp() {
        reporter = new RecordingErrorReporter();
        sleeper = new RecordingSleeper();
        ExponentialBackoffRetryStrategy strategy = ExponentialBackoffRetryStrategy.builder()
                .maxAttempts(4)
                .baseDelay(Duration.ofMillis(100))
                .backoffFactor(2)
                .maxDelay(Duration.ofMillis(1000))
                .build();
        executor = new RetryExecutor(strategy, reporter, sleeper);
    }

    @Test
    void returnsValueOnFirstSuccess() {
        RetryResult<String> result = executor.execute("load", () -> "ok");

        assertTrue(result.isSuccess());
        assertEquals("ok", result.getValue());
        assertEquals(1, result.getAttempts());
        assertTrue(sleeper.getDelays().isEmpty());
        assertTrue(reporter.getReports().isEmpty());
        assertFalse(executor.getState().isRetrying());
        assertEquals(1, executor.getState().getAttemptCount());
    }

    @Test
    void backsOffBetweenTransientFailures() {
        AtomicInteger calls = new AtomicInteger();

        RetryResult<String> result = executor.execute("load", () -> {
            if (calls.incrementAndGet() <= 3) {
                throw new TransientException("network unreachable");
            }
            return "done";
        });

        assertTrue(result.isSuccess());
        assertEquals(4, result.getAttempts());
        assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(200), Duration.ofMillis(400)),
                sleeper.getDelays());
        assertTrue(reporter.getReports().isEmpty());
        assertNull(executor.getState().getLastError());
        assertEquals(4, executor.getState().getAttemptCount());
    }

    @Test
    void nonRetryableErrorStopsAfterOneAttempt() {
        AtomicInteger calls = new AtomicInteger();
        PermanentException failure = new PermanentException("validation failed: topic required");

        RetryResult<String> result = executor.execute("save-content", () -> {
            calls.incrementAndGet();
            throw failure;
        });

        assertTrue(result.isFailure());
        assertEquals(1, calls.get());
        assertEquals(1, result.getAttempts());
        assertTrue(sleeper.getDelays().isEmpty());
        assertEquals(1, reporter.getReports().size());
        RecordingErrorReporter.Report report = reporter.getReports().get(0);
        assertSame(failure, report.error);
        assertEquals("save-content failed: validation failed: topic required", report.context);
        assertEquals(1, report.attempt);
        assertSame(failure, executor.getState().getLastError());
        assertFalse(executor.getState().isRetrying());
    }

    @Test
    void unclassifiedErrorIsNotRetried() {
        AtomicInteger calls = new AtomicInteger();

        RetryResult<Object> result = executor.execute("odd", () -> {
            calls.incrementAndGet();
            throw new IllegalStateException("something odd");
        });

        assertTrue(result.isFailure());
        assertEquals(1, calls.get());
    }

    @Test
    void exhaustedRetriesAreReportedOnce() {
        AtomicInteger calls = new AtomicInteger();

        RetryResult<String> result = executor.execute("sync", () -> {
            calls.incrementAndGet();
            throw new TransientException("timeout talking to server");
        });

        assertTrue(result.isFailure());
        assertEquals(4, calls.get());
        assertEquals(3, sleeper.getDelays().size());
        assertEquals(1, reporter.getReports().size());
        assertEquals("sync failed after 4 attempts: timeout talking to server", reporter.getReports().get(0).context);
        assertEquals(4, reporter.getReports().get(0).attempt);
    }

    @Test
    void overrideStrategyAppliesToSingleCall() {
        AtomicInteger calls = new AtomicInteger();
        ExponentialBackoffRetryStrategy once = ExponentialBackoffRetryStrategy.builder().maxAttempts(1).build();

        RetryResult<String> overridden = executor.execute("sync", () -> {
            calls.incrementAndGet();
            throw new TransientException("network down");
        }, once);

        assertTrue(overridden.isFailure());
        assertEquals(1, calls.get());
        assertEquals(4, executor.getDefaultStrategy().getMaxAttempts());

        calls.set(0);
        executor.execute("sync", () -> {
            calls.incrementAndGet();
            throw new TransientException("network down");
        });
        assertEquals(4, calls.get());
    }

    @Test
    void getOrThrowRethrowsUncheckedFailureAsIs() {
        PermanentException failure = new PermanentException("forbidden");
        RetryResult<String> result = executor.execute("delete", () -> {
            throw failure;
        });

        PermanentException thrown = assertThrows(PermanentException.class, result::getOrThrow);
        assertSame(failure, thrown);
        assertNull(result.orNull());
        assertEquals("fallback", result.orElse("fallback"));
    }

    @Test
    void getOrThrowWrapsCheckedFailure() {
        ExponentialBackoffRetryStrategy once = ExponentialBackoffRetryStrategy.builder().maxAttempts(1).build();
        RetryResult<String> result = executor.execute("read", () -> {
            throw new IOException("connection reset");
        }, once);

        RetryExhaustedException thrown = assertThrows(RetryExhaustedException.class, result::getOrThrow);
        assertEquals("read", thrown.getOperationName());
        assertEquals(1, thrown.getAttempts());
        assertInstanceOf(IOException.class, thrown.getCause());
    }

    @Test
    void decorateUnwrapsOrThrows() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        Callable<Integer> flaky = executor.decorate("count", () -> {
            if (calls.incrementAndGet() == 1) {
                throw new TransientException("503 service unavailable");
            }
            return calls.get();
        });

        assertEquals(2, flaky.call());

        Callable<Integer> broken = executor.decorate("broken", () -> {
            throw new PermanentException("invalid");
        });
        assertThrows(PermanentException.class, broken::call);
    }

    @Test
    void interruptedBackoffEndsAsReportedFailure() {
        RetryExecutor interrupting = new RetryExecutor(new ExponentialBackoffRetryStrategy(), reporter, delay -> {
            throw new InterruptedException("stop");
        });

        RetryResult<String> result = interrupting.execute("load", () -> {
            throw new TransientException("network");
        });

        assertTrue(result.isFailure());
        assertTrue(Thread.interrupted());
        assertEquals(1, reporter.getReports().size());
    }

    @Test
    void errorIsReportedAndRethrownWithoutRetry() {
        AtomicInteger calls = new AtomicInteger();

        AssertionError thrown = assertThrows(AssertionError.class, () -> executor.execute("load", () -> {
            calls.incrementAndGet();
            throw new AssertionError("corrupt state");
        }));

        assertEquals("corrupt state", thrown.getMessage());
        assertEquals(1, calls.get());
        assertTrue(sleeper.getDelays().isEmpty());
        assertFalse(executor.getState().isRetrying());
        assertEquals(1, reporter.getReports().size());
        assertEquals("load failed: corrupt state", reporter.getReports().get(0).context);
    }

    @Test
    void blankOperationNameFallsBackToDefault() {
        executor.execute(" ", () -> {
            throw new PermanentException("invalid");
        });

        assertTrue(reporter.getReports().get(0).context.startsWith("Operation failed"));
    }
}
