package com.sailfish.taskengine.repository;

import com.sailfish.taskengine.error.NotFoundException;
import com.sailfish.taskengine.model.Content;
import com.sailfish.taskengine.model.ContentFlag;
import com.sailfish.taskengine.model.ContentStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.transaction.Transactional;
import java.util.List;
import java.util.Optional;

/**
 * JPA implementation of the ContentRepository.
 * Assumes a JPA environment is configured; the EntityManager is either injected
 * by the container or passed in directly.
 */
public class JpaContentRepository implements ContentRepository {

    private static final Logger log = LoggerFactory.getLogger(JpaContentRepository.class);

    @PersistenceContext
    private EntityManager entityManager;

    public JpaContentRepository() {
    }

    public JpaContentRepository(EntityManager entityManager) {
        this.entityManager = entityManager;
    }

    @Override
    public List<Content> findPublished() {
        // Oldest first, so the most overdue content gets its task first
        return entityManager.createQuery("SELECT c FROM Content c WHERE c.stage = :stage ORDER BY c.updatedAt ASC", Content.class)
                .setParameter("stage", ContentStage.terminal())
                .getResultList();
    }

    @Override
    public Optional<Content> findById(Long id) {
        return Optional.ofNullable(entityManager.find(Content.class, id));
    }

    @Override
    public Optional<Content> findByTopic(String topic) {
        List<Content> matches = entityManager.createQuery("SELECT c FROM Content c WHERE c.topic = :topic", Content.class)
                .setParameter("topic", topic)
                .setMaxResults(1) // topic is unique
                .getResultList();
        return matches.stream().findFirst();
    }

    @Override
    @Transactional
    public Content addFlag(Long contentId, ContentFlag flag) {
        Content content = entityManager.find(Content.class, contentId);
        if (content == null) {
            throw NotFoundException.content(contentId);
        }
        // Flags only accumulate; skip the write when nothing changed
        if (content.addFlag(flag)) {
            content = entityManager.merge(content);
            log.debug("Added flag {} to content ID {}", flag, contentId);
        } else {
            log.debug("Content ID {} already has flag {}", contentId, flag);
        }
        return content;
    }

    @Override
    @Transactional
    public Content save(Content content) {
        if (content.getId() == null) {
            entityManager.persist(content); // id assigned by the identity column
            log.debug("Persisted new Content with ID: {}", content.getId());
            return content;
        }
        Content merged = entityManager.merge(content);
        log.debug("Merged existing Content with ID: {}", merged.getId());
        return merged;
    }
}
