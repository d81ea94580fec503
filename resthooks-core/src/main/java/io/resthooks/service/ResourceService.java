package io.resthooks.service;

import io.resthooks.request.IncludeService;
import io.resthooks.request.TargetedFields;

import java.util.List;
import java.util.Optional;

/**
 * Resource operations of one resource type, each running the resource hooks of its pipeline.
 *
 * @param <T> the resource type
 */
public interface ResourceService<T> {

    List<T> getAll(IncludeService includeService);

    /**
     * @throws ResourceNotFoundException if the resource does not exist or a hook filtered it out
     */
    T get(Object id, IncludeService includeService);

    /**
     * Read the value of one relationship: the related resource, a collection of them, or null.
     *
     * @throws ResourceNotFoundException if the resource does not exist or a hook filtered it out
     */
    Object getRelationship(Object id, String relationshipName);

    /**
     * @return the created resource, or empty when a hook filtered it out
     */
    Optional<T> create(T resource);

    /**
     * Copy the targeted attributes and relationships of {@code changes} onto the stored resource.
     *
     * @return the updated resource, or empty when a hook filtered it out
     * @throws ResourceNotFoundException if the resource does not exist
     */
    Optional<T> update(Object id, T changes, TargetedFields targetedFields);

    /**
     * Replace the value of one relationship.
     *
     * @param value a related resource, a collection of them, or null
     * @throws ResourceNotFoundException if the resource does not exist
     */
    void updateRelationship(Object id, String relationshipName, Object value);

    /**
     * @return false when a hook filtered the resource out and nothing was deleted
     * @throws ResourceNotFoundException if the resource does not exist
     */
    boolean delete(Object id);
}
