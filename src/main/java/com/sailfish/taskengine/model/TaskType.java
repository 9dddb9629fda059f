package com.sailfish.taskengine.model;

/**
 * Origin of a task.
 */
public enum TaskType {
    /**
     * Created directly by a user.
     */
    USER,
    /**
     * Derived by the rules engine from content state.
     */
    SYSTEM
}
