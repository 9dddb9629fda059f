package com.sailfish.taskengine.error;

/**
 * Base type for failures raised by the task engine.
 */
public class TaskEngineException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public TaskEngineException(String message) {
        super(message);
    }

    public TaskEngineException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * @return the category this failure belongs to.
     */
    public ErrorCategory getCategory() {
        return ErrorCategory.UNCLASSIFIED;
    }
}
