package com.sailfish.taskengine.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Monotonic review markers on a content item. A flag records that a human has
 * completed the review step of the matching rule.
 */
public enum ContentFlag {
    /**
     * Fans feedback for the content has been reviewed.
     */
    FANS_FEEDBACK_ANALYSED("fans_feedback_analysed"),
    /**
     * Overall feedback for the content has been reviewed.
     */
    OVERALL_FEEDBACK_ANALYSED("overall_feedback_analysed");

    private final String value;

    ContentFlag(String value) {
        this.value = value;
    }

    /**
     * @return the stored representation of the flag.
     */
    public String getValue() {
        return value;
    }

    public static Optional<ContentFlag> fromValue(String value) {
        return Arrays.stream(values())
                .filter(flag -> flag.value.equals(value))
                .findFirst();
    }
}
