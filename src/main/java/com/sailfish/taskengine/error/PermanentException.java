package com.sailfish.taskengine.error;

/**
 * A failure that will repeat on every attempt, such as a validation or
 * authorization error.
 */
public class PermanentException extends TaskEngineException {

    private static final long serialVersionUID = 1L;

    public PermanentException(String message) {
        super(message);
    }

    public PermanentException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.PERMANENT;
    }
}
