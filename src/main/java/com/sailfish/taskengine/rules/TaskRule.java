package com.sailfish.taskengine.rules;

import com.sailfish.taskengine.model.Content;
import com.sailfish.taskengine.model.ContentFlag;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * A time-threshold rule: once published content has waited {@code threshold}
 * without {@code flag}, a follow-up task titled from {@code titleTemplate} is due.
 * <p>
 * Templates take the content topic as their single {@code %s} argument.
 */
public final class TaskRule {

    private final String id;
    private final Duration threshold;
    private final ContentFlag flag;
    private final String titleTemplate;
    private final String descriptionTemplate;
    private final String titlePrefix;

    public TaskRule(String id, Duration threshold, ContentFlag flag, String titleTemplate, String descriptionTemplate) {
        if (id == null || id.trim().isEmpty()) {
            throw new IllegalArgumentException("id cannot be blank");
        }
        if (threshold == null || threshold.isNegative()) {
            throw new IllegalArgumentException("threshold must be non-negative");
        }
        Objects.requireNonNull(titleTemplate, "titleTemplate cannot be null");
        if (!titleTemplate.endsWith("%s") || titleTemplate.indexOf("%s") != titleTemplate.length() - 2) {
            throw new IllegalArgumentException("titleTemplate must end with its only %s placeholder: " + titleTemplate);
        }
        this.id = id;
        this.threshold = threshold;
        this.flag = Objects.requireNonNull(flag, "flag cannot be null");
        this.titleTemplate = titleTemplate;
        this.descriptionTemplate = Objects.requireNonNull(descriptionTemplate, "descriptionTemplate cannot be null");
        this.titlePrefix = titleTemplate.substring(0, titleTemplate.length() - 2);
    }

    /**
     * True when the content is published, at least {@code threshold} old and not yet flagged.
     */
    public boolean isDue(Content content, LocalDateTime now) {
        if (!content.isPublished() || content.hasFlag(flag)) {
            return false;
        }
        return !content.getUpdatedAt().plus(threshold).isAfter(now);
    }

    public String titleFor(String topic) {
        return String.format(titleTemplate, topic);
    }

    public String descriptionFor(String topic) {
        return String.format(descriptionTemplate, topic);
    }

    /**
     * Recovers the topic from a title this rule produced.
     * Titles are matched by prefix, so a topic that itself looks like another
     * rule's title can be attributed to the wrong rule.
     */
    public Optional<String> parseTopic(String title) {
        if (title == null || !title.startsWith(titlePrefix) || title.length() == titlePrefix.length()) {
            return Optional.empty();
        }
        return Optional.of(title.substring(titlePrefix.length()));
    }

    public boolean matchesTitle(String title) {
        return parseTopic(title).isPresent();
    }

    /**
     * @return a copy of this rule with a different threshold.
     */
    public TaskRule withThreshold(Duration newThreshold) {
        return new TaskRule(id, newThreshold, flag, titleTemplate, descriptionTemplate);
    }

    public String getId() { return id; }
    public Duration getThreshold() { return threshold; }
    public ContentFlag getFlag() { return flag; }
    public String getTitleTemplate() { return titleTemplate; }
    public String getDescriptionTemplate() { return descriptionTemplate; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TaskRule that = (TaskRule) o;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "TaskRule{id='" + id + "', threshold=" + threshold + ", flag=" + flag + '}';
    }
}
