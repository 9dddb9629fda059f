package com.sailfish.taskengine.config;

import com.sailfish.taskengine.retry.ExponentialBackoffRetryStrategy;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class TaskEngineSettingsTest {

    @Test
    void defaultsWhenNothingConfigured() {
        TaskEngineSettings settings = TaskEngineSettings.defaults();

        assertEquals(Duration.ofDays(2), settings.getFansFeedbackThreshold());
        assertEquals(Duration.ofDays(10), settings.getOverallFeedbackThreshold());
        assertEquals(Duration.ofHours(1), settings.getCatchUpInterval());
        assertEquals(Duration.ofDays(7), settings.getTaskLifetime());
        assertEquals(3, settings.getRetryMaxAttempts());
        assertEquals(Duration.ofSeconds(1), settings.getRetryBaseDelay());
        assertEquals(2.0, settings.getRetryBackoffFactor());
        assertEquals(Duration.ofSeconds(10), settings.getRetryMaxDelay());
        assertFalse(settings.isRetryJitter());
    }

    @Test
    void loadsOverridesFromClasspathResource() {
        TaskEngineSettings settings = TaskEngineSettings.load("task-engine-test.properties");

        assertEquals(Duration.ofDays(3), settings.getFansFeedbackThreshold());
        assertEquals(Duration.ofDays(10), settings.getOverallFeedbackThreshold());
        assertEquals(Duration.ofMinutes(15), settings.getCatchUpInterval());
        assertEquals(5, settings.getRetryMaxAttempts());
        assertTrue(settings.isRetryJitter());

        ExponentialBackoffRetryStrategy strategy = settings.retryStrategy();
        assertEquals(5, strategy.getMaxAttempts());
        assertEquals(Duration.ofMillis(100), strategy.getBaseDelay());
        assertEquals(Duration.ofMillis(1000), strategy.getMaxDelay());
        assertTrue(strategy.isAddJitter());
    }

    @Test
    void missingResourceFallsBackToDefaults() {
        TaskEngineSettings settings = TaskEngineSettings.load("does-not-exist.properties");

        assertEquals(Duration.ofDays(2), settings.getFansFeedbackThreshold());
    }

    @Test
    void blankValuesUseDefaults() {
        Properties properties = new Properties();
        properties.setProperty(TaskEngineSettings.TASK_LIFETIME_DAYS, "  ");

        assertEquals(Duration.ofDays(7), TaskEngineSettings.fromProperties(properties).getTaskLifetime());
    }

    @Test
    void rejectsNonNumericValue() {
        Properties properties = new Properties();
        properties.setProperty(TaskEngineSettings.RETRY_MAX_ATTEMPTS, "three");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> TaskEngineSettings.fromProperties(properties));
        assertTrue(e.getMessage().contains(TaskEngineSettings.RETRY_MAX_ATTEMPTS));
    }

    @Test
    void rejectsValuesBelowMinimum() {
        Properties zeroInterval = new Properties();
        zeroInterval.setProperty(TaskEngineSettings.CATCH_UP_MINUTES, "0");
        Properties negativeThreshold = new Properties();
        negativeThreshold.setProperty(TaskEngineSettings.FANS_FEEDBACK_DAYS, "-1");

        assertThrows(IllegalArgumentException.class, () -> TaskEngineSettings.fromProperties(zeroInterval));
        assertThrows(IllegalArgumentException.class, () -> TaskEngineSettings.fromProperties(negativeThreshold));
    }

    @Test
    void zeroDayThresholdIsAllowed() {
        Properties properties = new Properties();
        properties.setProperty(TaskEngineSettings.OVERALL_FEEDBACK_DAYS, "0");

        assertEquals(Duration.ZERO, TaskEngineSettings.fromProperties(properties).getOverallFeedbackThreshold());
    }
}
