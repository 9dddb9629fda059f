package com.sailfish.taskengine.model;

import jakarta.persistence.*;
import java.io.Serializable;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A content item moving through the production pipeline.
 * <p>
 * The stage only ever moves forward and flags are only ever added. The
 * {@code updatedAt} timestamp tracks stage changes; adding a flag leaves it
 * untouched so rule thresholds keep counting from the last stage change.
 */
@Entity
@Table(name = "contents", indexes = {
    @Index(name = "idx_contents_stage", columnList = "stage")
})
public class Content implements Serializable {

    private static final long serialVersionUID = 1L;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 200)
    private String topic;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ContentStage stage = ContentStage.PENDING;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "content_flags", joinColumns = @JoinColumn(name = "content_id"))
    @Enumerated(EnumType.STRING)
    @Column(name = "flag", nullable = false, length = 40)
    private Set<ContentFlag> flags = new HashSet<>();

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    protected Content() {
        // for JPA
    }

    public Content(String topic, ContentStage stage, LocalDateTime updatedAt) {
        if (topic == null || topic.trim().isEmpty()) {
            throw new IllegalArgumentException("topic cannot be blank");
        }
        this.topic = topic;
        this.stage = Objects.requireNonNull(stage, "stage cannot be null");
        this.updatedAt = Objects.requireNonNull(updatedAt, "updatedAt cannot be null");
    }

    @PrePersist
    protected void onCreate() {
        if (updatedAt == null) {
            updatedAt = LocalDateTime.now();
        }
    }

    /**
     * Moves the content to a later stage.
     *
     * @throws IllegalArgumentException if {@code target} is before the current stage.
     */
    public void advanceTo(ContentStage target, LocalDateTime changedAt) {
        Objects.requireNonNull(target, "target cannot be null");
        if (target.compareTo(stage) < 0) {
            throw new IllegalArgumentException("Content '" + topic + "' cannot move back from "
                    + stage.getDisplayName() + " to " + target.getDisplayName());
        }
        if (target != stage) {
            this.stage = target;
            this.updatedAt = Objects.requireNonNull(changedAt, "changedAt cannot be null");
        }
    }

    /**
     * @return true if the flag was not present before.
     */
    public boolean addFlag(ContentFlag flag) {
        return flags.add(Objects.requireNonNull(flag, "flag cannot be null"));
    }

    public boolean hasFlag(ContentFlag flag) {
        return flags.contains(flag);
    }

    public boolean isPublished() {
        return stage.isTerminal();
    }

    // --- Getters ---

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public String getTopic() { return topic; }
    public ContentStage getStage() { return stage; }
    public Set<ContentFlag> getFlags() { return Collections.unmodifiableSet(flags); }
    public LocalDateTime getUpdatedAt() { return updatedAt; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Content that = (Content) o;
        return id != null && Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Content{" +
                "id=" + id +
                ", topic='" + topic + '\'' +
                ", stage=" + stage +
                ", flags=" + flags +
                ", updatedAt=" + updatedAt +
                '}';
    }
}
