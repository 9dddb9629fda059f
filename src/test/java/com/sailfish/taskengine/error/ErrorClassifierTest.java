package com.sailfish.taskengine.error;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class ErrorClassifierTest {

    @Test
    void engineExceptionsCarryTheirOwnCategory() {
        assertEquals(ErrorCategory.TRANSIENT, ErrorClassifier.classify(new TransientException("x")));
        assertEquals(ErrorCategory.PERMANENT, ErrorClassifier.classify(new PermanentException("x")));
        assertEquals(ErrorCategory.NOT_FOUND, ErrorClassifier.classify(NotFoundException.task(7L)));
    }

    @Test
    void ioAndTimeoutFailuresAreTransient() {
        assertEquals(ErrorCategory.TRANSIENT, ErrorClassifier.classify(new IOException("broken pipe")));
        assertEquals(ErrorCategory.TRANSIENT, ErrorClassifier.classify(new TimeoutException()));
    }

    @Test
    void causeChainIsInspected() {
        RuntimeException wrapped = new RuntimeException("wrapper", new IOException("reset"));

        assertEquals(ErrorCategory.TRANSIENT, ErrorClassifier.classify(wrapped));
    }

    @Test
    void messagesAreMatchedWhenTypeIsUnknown() {
        assertEquals(ErrorCategory.TRANSIENT, ErrorClassifier.classify(new RuntimeException("Failed to fetch")));
        assertEquals(ErrorCategory.TRANSIENT, ErrorClassifier.classify(new RuntimeException("request timeout")));
        assertEquals(ErrorCategory.TRANSIENT, ErrorClassifier.classify(new RuntimeException("HTTP 503")));
        assertEquals(ErrorCategory.NOT_FOUND, ErrorClassifier.classify(new RuntimeException("row not found")));
        assertEquals(ErrorCategory.NOT_FOUND, ErrorClassifier.classify(new RuntimeException("HTTP 404")));
        assertEquals(ErrorCategory.PERMANENT, ErrorClassifier.classify(new RuntimeException("topic is required")));
        assertEquals(ErrorCategory.PERMANENT, ErrorClassifier.classify(new RuntimeException("Unauthorized")));
        assertEquals(ErrorCategory.PERMANENT, ErrorClassifier.classify(new RuntimeException("HTTP 422")));
    }

    @Test
    void unknownFailuresAreUnclassifiedAndNotRetried() {
        IllegalStateException error = new IllegalStateException("bad state");

        assertEquals(ErrorCategory.UNCLASSIFIED, ErrorClassifier.classify(error));
        assertEquals(ErrorCategory.UNCLASSIFIED, ErrorClassifier.classify(null));
        assertFalse(ErrorClassifier.isRetryable(error));
        assertTrue(ErrorClassifier.isRetryable(new RuntimeException("connection refused")));
    }
}
