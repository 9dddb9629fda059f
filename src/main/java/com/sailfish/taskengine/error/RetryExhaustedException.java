package com.sailfish.taskengine.error;

/**
 * Thrown when a caller unwraps a failed retry result. The original failure is
 * the cause.
 */
public class RetryExhaustedException extends TaskEngineException {

    private static final long serialVersionUID = 1L;

    private final String operationName;
    private final int attempts;
    private final ErrorCategory category;

    public RetryExhaustedException(String operationName, int attempts, ErrorCategory category, Throwable cause) {
        super(operationName + " failed after " + attempts + " attempt(s): " + cause.getMessage(), cause);
        this.operationName = operationName;
        this.attempts = attempts;
        this.category = category;
    }

    public String getOperationName() {
        return operationName;
    }

    public int getAttempts() {
        return attempts;
    }

    @Override
    public ErrorCategory getCategory() {
        return category;
    }
}
