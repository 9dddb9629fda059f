package com.sailfish.taskengine.error;

/**
 * Sink for failures that the engine gives up on. Implementations decide how the
 * user is told.
 */
@FunctionalInterface
public interface ErrorReporter {

    /**
     * @param error   the failure.
     * @param context short description of what was being attempted.
     * @param attempt the attempt number the failure happened on, or null when not retried.
     */
    void report(Throwable error, String context, Integer attempt);

    default void report(Throwable error, String context) {
        report(error, context, null);
    }
}
