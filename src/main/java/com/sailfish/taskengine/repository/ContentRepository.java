package com.sailfish.taskengine.repository;

import com.sailfish.taskengine.model.Content;
import com.sailfish.taskengine.model.ContentFlag;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for content items, as far as the task engine needs them.
 */
public interface ContentRepository {

    /**
     * @return all content in the terminal (published) stage.
     */
    List<Content> findPublished();

    Optional<Content> findById(Long id);

    /**
     * Finds content by its unique topic.
     *
     * @param topic The exact topic.
     * @return An Optional containing the content if found, empty otherwise.
     */
    Optional<Content> findByTopic(String topic);

    /**
     * Adds a flag to the content's flag set. Adding a flag that is already present is a no-op.
     *
     * @param contentId The id of the content.
     * @param flag      The flag to add.
     * @return the updated content.
     * @throws com.sailfish.taskengine.error.NotFoundException if no content has that id.
     */
    Content addFlag(Long contentId, ContentFlag flag);

    Content save(Content content);
}
