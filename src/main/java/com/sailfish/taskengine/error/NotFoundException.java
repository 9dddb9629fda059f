package com.sailfish.taskengine.error;

/**
 * Raised when a referenced task or content item does not exist.
 */
public class NotFoundException extends TaskEngineException {

    private static final long serialVersionUID = 1L;

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException task(Long taskId) {
        return new NotFoundException("Task not found: " + taskId);
    }

    public static NotFoundException content(Long contentId) {
        return new NotFoundException("Content not found: " + contentId);
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.NOT_FOUND;
    }
}
