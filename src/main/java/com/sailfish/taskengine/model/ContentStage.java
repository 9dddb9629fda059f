package com.sailfish.taskengine.model;

/**
 * The fixed, ordered production stages a content item moves through.
 * The last stage ({@link #PUBLISHED}) is terminal.
 */
public enum ContentStage {
    PENDING("Pending"),
    TITLE("Title"),
    THUMBNAIL("Thumbnail"),
    TOC("ToC"),
    ORDERED("Ordered"),
    SCRIPTED("Scripted"),
    RECORDED("Recorded"),
    VOICE_EDITED("Voice Edited"),
    EDITED("Edited"),
    REVISED("Revised"),
    SEO_OPTIMISED("SEO Optimised"),
    PUBLISHED("Published");

    private final String displayName;

    ContentStage(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public int getIndex() {
        return ordinal();
    }

    public boolean isTerminal() {
        return this == terminal();
    }

    public static ContentStage terminal() {
        ContentStage[] stages = values();
        return stages[stages.length - 1];
    }

    /**
     * Looks up a stage by its position in the pipeline.
     *
     * @throws IllegalArgumentException if the index is outside the pipeline.
     */
    public static ContentStage fromIndex(int index) {
        ContentStage[] stages = values();
        if (index < 0 || index >= stages.length) {
            throw new IllegalArgumentException("Stage index out of range: " + index);
        }
        return stages[index];
    }
}
