package io.resthooks.graph;

import io.resthooks.core.RelationshipAttribute;
import io.resthooks.core.ResourceMetadata;

import java.util.List;
import java.util.Set;

/**
 * Registry of the resource types known to the hook engine and their relationships.
 */
public interface ResourceGraph {

    /**
     * @throws io.resthooks.core.ResourceSetupException if the type is not registered
     */
    <T> ResourceMetadata<T> getMetadata(Class<T> resourceType);

    boolean isResource(Class<?> type);

    Set<Class<?>> getResourceTypes();

    List<RelationshipAttribute> getRelationships(Class<?> resourceType);

    /**
     * @return the relationship named {@code name} on the type, or null
     */
    RelationshipAttribute getRelationship(Class<?> resourceType, String name);

    /**
     * Resolve the relationship on the right type that points back to the left type.
     *
     * @return the inverse relationship, or null when the relationship is unidirectional
     */
    RelationshipAttribute getInverse(RelationshipAttribute relationship);

    /**
     * Map an instance to its registered resource type, walking up the class hierarchy.
     */
    Class<?> resourceTypeOf(Object resource);

    boolean isResourceInstance(Object candidate);

    Object getId(Object resource);

    /**
     * @return the id as a string, or null for unsaved resources
     */
    String getStringId(Object resource);

    ResourceKey keyOf(Object resource);
}
