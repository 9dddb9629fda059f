package com.sailfish.taskengine.error;

/**
 * A failure expected to go away on its own, such as a dropped connection or a
 * server-side 5xx. Retryable by default.
 */
public class TransientException extends TaskEngineException {

    private static final long serialVersionUID = 1L;

    public TransientException(String message) {
        super(message);
    }

    public TransientException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.TRANSIENT;
    }
}
