package com.sailfish.taskengine.repository;

import java.util.Optional;

/**
 * Persists small string markers across restarts.
 */
public interface RunMarkerStore {

    Optional<String> read(String key);

    void write(String key, String value);
}
