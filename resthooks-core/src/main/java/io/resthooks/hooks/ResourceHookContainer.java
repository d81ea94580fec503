package io.resthooks.hooks;

import java.util.Collection;
import java.util.Set;

/**
 * Business logic attached to the lifecycle of one resource type.
 * <p>
 * Before hooks and {@link #onReturn} return the resources that may proceed; anything
 * left out is detached from the request's object graph. Exceptions thrown from any
 * hook reach the caller unchanged.
 *
 * @param <T> the resource type
 */
public interface ResourceHookContainer<T> {

    Class<T> resourceType();

    /**
     * Called before resources of this type are read, either directly or as part of
     * an include chain.
     *
     * @param pipeline the request kind
     * @param isIncluded true when this type is read because another resource includes it
     * @param stringId the requested id for single-resource reads, otherwise null
     */
    void beforeRead(ResourcePipeline pipeline, boolean isIncluded, String stringId);

    Collection<T> beforeCreate(ResourceHashSet<T> resources, ResourcePipeline pipeline);

    /**
     * Called before resources are updated. Persisted values are available through
     * {@link DiffableResourceHashSet#getDiffs()} when database values are loaded.
     */
    Collection<T> beforeUpdate(DiffableResourceHashSet<T> resources, ResourcePipeline pipeline);

    Collection<T> beforeDelete(ResourceHashSet<T> resources, ResourcePipeline pipeline);

    /**
     * Called for resources that are about to be assigned to a relationship of another
     * resource. The dictionary is keyed by the relationships of this type that point
     * back at the updated resources.
     *
     * @return the ids of the resources that may be assigned
     */
    Set<String> beforeUpdateRelationship(Set<String> ids, RelationshipsDictionary<T> resourcesByRelationship,
                                         ResourcePipeline pipeline);

    /**
     * Called for resources outside the request whose relationships change as a side
     * effect, such as the previous owner of a reassigned one-to-one relationship.
     */
    void beforeImplicitUpdateRelationship(RelationshipsDictionary<T> resourcesByRelationship, ResourcePipeline pipeline);

    Collection<T> onReturn(Set<T> resources, ResourcePipeline pipeline);

    void afterCreate(Set<T> resources, ResourcePipeline pipeline);

    void afterRead(Set<T> resources, ResourcePipeline pipeline, boolean isIncluded);

    void afterUpdate(Set<T> resources, ResourcePipeline pipeline);

    void afterDelete(Set<T> resources, ResourcePipeline pipeline, boolean succeeded);

    void afterUpdateRelationship(RelationshipsDictionary<T> resourcesByRelationship, ResourcePipeline pipeline);
}
