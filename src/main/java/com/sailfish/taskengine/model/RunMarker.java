package com.sailfish.taskengine.model;

import jakarta.persistence.*;
import java.io.Serializable;
import java.time.LocalDateTime;

/**
 * A single persisted key/value marker. The scheduler keeps the date of its
 * last successful daily run here.
 */
@Entity
@Table(name = "run_markers")
public class RunMarker implements Serializable {

    private static final long serialVersionUID = 1L;

    @Id
    @Column(name = "marker_key", length = 100)
    private String key;

    @Column(name = "marker_value", nullable = false, length = 100)
    private String value;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    protected RunMarker() {
        // for JPA
    }

    public RunMarker(String key, String value) {
        this.key = key;
        this.value = value;
    }

    @PrePersist
    @PreUpdate
    protected void onWrite() {
        updatedAt = LocalDateTime.now();
    }

    public String getKey() {
        return key;
    }

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = value;
    }

    public LocalDateTime getUpdatedAt() {
        return updatedAt;
    }
}
