package com.sailfish.taskengine.repository;

import com.sailfish.taskengine.model.RunMarker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.transaction.Transactional;
import java.util.Optional;

/**
 * Stores run markers as {@link RunMarker} rows.
 */
public class JpaRunMarkerStore implements RunMarkerStore {

    private static final Logger log = LoggerFactory.getLogger(JpaRunMarkerStore.class);

    @PersistenceContext
    private EntityManager entityManager;

    public JpaRunMarkerStore() {
    }

    public JpaRunMarkerStore(EntityManager entityManager) {
        this.entityManager = entityManager;
    }

    @Override
    public Optional<String> read(String key) {
        RunMarker marker = entityManager.find(RunMarker.class, key);
        return marker == null ? Optional.empty() : Optional.of(marker.getValue());
    }

    @Override
    @Transactional
    public void write(String key, String value) {
        RunMarker marker = entityManager.find(RunMarker.class, key);
        if (marker == null) { // first run ever
            entityManager.persist(new RunMarker(key, value));
        } else {
            marker.setValue(value);
            entityManager.merge(marker);
        }
        log.debug("Run marker '{}' set to '{}'", key, value);
    }
}
