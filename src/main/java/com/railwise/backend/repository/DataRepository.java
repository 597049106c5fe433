package com.railwise.backend.repository;

import java.util.List;

/**
 * Generic repository interface for document-store operations.
 * Allows plug-and-play database implementations.
 * 
 * @param <T>  The entity type
 * @param <ID> The ID type
 */
public interface DataRepository<T, ID> {

    /**
     * Save an entity.
     */
    void save(T entity);

    /**
     * Get all entities.
     */
    List<T> findAll();

    /**
     * Delete an entity by its ID.
     */
    void deleteById(ID id);
}
