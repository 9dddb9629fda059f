package com.sailfish.taskengine.repository;

import com.sailfish.taskengine.model.Task;
import com.sailfish.taskengine.model.TaskType;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for tasks.
 */
public interface TaskRepository {

    List<Task> findByType(TaskType type);

    Optional<Task> findById(Long id);

    /**
     * Saves or updates a task.
     *
     * @param task The task to save.
     * @return The saved task, with its generated id.
     */
    Task save(Task task);

    /**
     * @return true if a task was deleted.
     */
    boolean deleteById(Long id);

    /**
     * Deletes every task whose expiry time is before {@code now}.
     *
     * @return the number of tasks deleted.
     */
    int deleteExpired(LocalDateTime now);
}
