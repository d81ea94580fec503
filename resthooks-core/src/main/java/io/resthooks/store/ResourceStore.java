package io.resthooks.store;

import io.resthooks.core.RelationshipAttribute;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence collaborator of the hook engine and the resource service.
 * <p>
 * Every load returns fresh instances, detached from whatever the caller holds.
 * Relationships are loaded only along the given include chains; relationships that are
 * not included are left null.
 */
public interface ResourceStore {

    <T> List<T> findAll(Class<T> resourceType, List<List<RelationshipAttribute>> include);

    <T> Optional<T> findById(Class<T> resourceType, Object id, List<List<RelationshipAttribute>> include);

    /**
     * Load the resources with the given ids. Unknown ids are skipped.
     */
    <T> List<T> findAllById(Class<T> resourceType, Collection<?> ids, List<List<RelationshipAttribute>> include);

    /**
     * Insert or update a resource. A resource without an id is inserted and receives a
     * generated id.
     *
     * @return the resource that was passed in
     */
    <T> T save(T resource);

    /**
     * Delete a resource by the id it carries.
     *
     * @return true if a resource was deleted
     */
    boolean delete(Object resource);

    /**
     * @return true if a resource was deleted
     */
    boolean deleteById(Class<?> resourceType, Object id);

    /**
     * Wrap single relationships into one-element include chains.
     */
    static List<List<RelationshipAttribute>> chainsOf(Collection<RelationshipAttribute> relationships) {
        return relationships.stream().map(List::of).toList();
    }
}
