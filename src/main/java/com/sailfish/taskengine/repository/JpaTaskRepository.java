package com.sailfish.taskengine.repository;

import com.sailfish.taskengine.model.Task;
import com.sailfish.taskengine.model.TaskType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.transaction.Transactional;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * JPA implementation of the TaskRepository.
 */
public class JpaTaskRepository implements TaskRepository {

    private static final Logger log = LoggerFactory.getLogger(JpaTaskRepository.class);

    @PersistenceContext
    private EntityManager entityManager;

    public JpaTaskRepository() {
    }

    public JpaTaskRepository(EntityManager entityManager) {
        this.entityManager = entityManager;
    }

    @Override
    public List<Task> findByType(TaskType type) {
        // Expired rows are returned too; callers filter, the daily sweep deletes
        return entityManager.createQuery("SELECT t FROM Task t WHERE t.type = :type ORDER BY t.createdAt ASC", Task.class)
                .setParameter("type", type)
                .getResultList();
    }

    @Override
    public Optional<Task> findById(Long id) {
        return Optional.ofNullable(entityManager.find(Task.class, id));
    }

    @Override
    @Transactional
    public Task save(Task task) {
        if (task.getId() == null) {
            entityManager.persist(task);
            log.debug("Persisted new Task with ID: {}", task.getId());
            return task;
        }
        Task merged = entityManager.merge(task);
        log.debug("Merged existing Task with ID: {}", merged.getId());
        return merged;
    }

    @Override
    @Transactional
    public boolean deleteById(Long id) {
        Task task = entityManager.find(Task.class, id);
        if (task == null) {
            log.warn("Attempted to delete non-existent task ID {}", id);
            return false;
        }
        entityManager.remove(task);
        log.debug("Deleted task ID {}", id);
        return true;
    }

    @Override
    @Transactional
    public int deleteExpired(LocalDateTime now) {
        // Bulk delete; bypasses the persistence context
        int deleted = entityManager.createQuery("DELETE FROM Task t WHERE t.expiresAt < :now")
                .setParameter("now", now)
                .executeUpdate();
        if (deleted > 0) {
            log.info("Deleted {} expired task(s)", deleted);
        }
        return deleted;
    }
}
