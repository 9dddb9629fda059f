package com.sailfish.taskengine.error;

/**
 * Coarse classification of a failure, used to decide whether it is worth retrying.
 */
public enum ErrorCategory {
    /**
     * Network, timeout or connection class failure. Retryable.
     */
    TRANSIENT,
    /**
     * Validation or authorization class failure. Never retried.
     */
    PERMANENT,
    /**
     * A referenced task or content item does not exist.
     */
    NOT_FOUND,
    /**
     * Nothing matched. Treated as non-retryable.
     */
    UNCLASSIFIED
}
