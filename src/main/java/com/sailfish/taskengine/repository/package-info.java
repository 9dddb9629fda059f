/**
 * Defines the data access ports the engine depends on
 * ({@link com.sailfish.taskengine.repository.ContentRepository},
 * {@link com.sailfish.taskengine.repository.TaskRepository},
 * {@link com.sailfish.taskengine.repository.RunMarkerStore}) and their JPA implementations.
 */
package com.sailfish.taskengine.repository;
