package com.sailfish.taskengine.retry;

import com.sailfish.taskengine.error.PermanentException;
import com.sailfish.taskengine.error.TransientException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ExponentialBackoffRetryStrategyTest {

    @Test
    void defaultsMatchDocumentedValues() {
        ExponentialBackoffRetryStrategy strategy = new ExponentialBackoffRetryStrategy();

        assertEquals(3, strategy.getMaxAttempts());
        assertEquals(Duration.ofMillis(1000), strategy.getBaseDelay());
        assertEquals(2.0, strategy.getBackoffFactor());
        assertEquals(Duration.ofMillis(10000), strategy.getMaxDelay());
        assertFalse(strategy.isAddJitter());
    }

    @Test
    void delayDoublesBelowCap() {
        ExponentialBackoffRetryStrategy strategy = ExponentialBackoffRetryStrategy.builder()
                .baseDelay(Duration.ofMillis(100))
                .backoffFactor(2)
                .maxDelay(Duration.ofMillis(1000))
                .build();

        assertEquals(Duration.ofMillis(100), strategy.calculateDelay(1));
        assertEquals(Duration.ofMillis(200), strategy.calculateDelay(2));
        assertEquals(Duration.ofMillis(400), strategy.calculateDelay(3));
    }

    @Test
    void delayIsCappedAtMaxDelay() {
        ExponentialBackoffRetryStrategy strategy = new ExponentialBackoffRetryStrategy();

        assertEquals(Duration.ofMillis(8000), strategy.calculateDelay(4));
        assertEquals(Duration.ofMillis(10000), strategy.calculateDelay(5));
        assertEquals(Duration.ofMillis(10000), strategy.calculateDelay(30));
    }

    @Test
    void jitterStaysWithinTenPercent() {
        ExponentialBackoffRetryStrategy strategy = ExponentialBackoffRetryStrategy.builder()
                .baseDelay(Duration.ofMillis(1000))
                .addJitter(true)
                .build();

        for (int i = 0; i < 50; i++) {
            long delay = strategy.calculateDelay(1).toMillis();
            assertTrue(delay >= 900 && delay <= 1100, "delay out of range: " + delay);
        }
    }

    @Test
    void shouldRetryOnlyTransientErrorsBeforeLastAttempt() {
        ExponentialBackoffRetryStrategy strategy = new ExponentialBackoffRetryStrategy();

        assertTrue(strategy.shouldRetry(new TransientException("network down"), 1));
        assertTrue(strategy.shouldRetry(new TransientException("network down"), 2));
        assertFalse(strategy.shouldRetry(new TransientException("network down"), 3));
        assertFalse(strategy.shouldRetry(new PermanentException("invalid topic"), 1));
    }

    @Test
    void toBuilderLeavesOriginalUnchanged() {
        ExponentialBackoffRetryStrategy original = new ExponentialBackoffRetryStrategy();

        ExponentialBackoffRetryStrategy override = original.toBuilder().maxAttempts(7).build();

        assertEquals(7, override.getMaxAttempts());
        assertEquals(3, original.getMaxAttempts());
        assertEquals(original.getBaseDelay(), override.getBaseDelay());
    }

    @Test
    void rejectsInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class,
                () -> ExponentialBackoffRetryStrategy.builder().maxAttempts(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> ExponentialBackoffRetryStrategy.builder().backoffFactor(0.5).build());
        assertThrows(IllegalArgumentException.class,
                () -> ExponentialBackoffRetryStrategy.builder().baseDelay(Duration.ofMillis(-1)).build());
        assertThrows(IllegalArgumentException.class,
                () -> ExponentialBackoffRetryStrategy.builder()
                        .baseDelay(Duration.ofSeconds(5))
                        .maxDelay(Duration.ofSeconds(1))
                        .build());
        assertThrows(IllegalArgumentException.class,
                () -> new ExponentialBackoffRetryStrategy().calculateDelay(0));
    }
}
