package io.resthooks.graph;

import io.resthooks.core.RelationshipAttribute;
import io.resthooks.core.ResourceMetadata;
import io.resthooks.core.ResourceSetupException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Immutable resource graph built by {@link ResourceGraphBuilder}.
 */
public final class DefaultResourceGraph implements ResourceGraph {

    private final Map<Class<?>, ResourceMetadata<?>> metadataByType;
    private final Map<Class<?>, Class<?>> resolvedTypes = new ConcurrentHashMap<>();

    DefaultResourceGraph(Map<Class<?>, ResourceMetadata<?>> metadataByType) {
        this.metadataByType = Collections.unmodifiableMap(new LinkedHashMap<>(metadataByType));
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> ResourceMetadata<T> getMetadata(Class<T> resourceType) {
        var metadata = metadataByType.get(resourceType);
        if (metadata == null) {
            throw new ResourceSetupException("Resource type is not registered: " + resourceType.getName());
        }
        return (ResourceMetadata<T>) metadata;
    }

    @Override
    public boolean isResource(Class<?> type) {
        return metadataByType.containsKey(type);
    }

    @Override
    public Set<Class<?>> getResourceTypes() {
        return metadataByType.keySet();
    }

    @Override
    public List<RelationshipAttribute> getRelationships(Class<?> resourceType) {
        return getMetadata(resourceType).relationships();
    }

    @Override
    public RelationshipAttribute getRelationship(Class<?> resourceType, String name) {
        return getMetadata(resourceType).relationship(name);
    }

    @Override
    public RelationshipAttribute getInverse(RelationshipAttribute relationship) {
        if (relationship.inverseName() == null || !isResource(relationship.rightType())) {
            return null;
        }
        return getRelationship(relationship.rightType(), relationship.inverseName());
    }

    @Override
    public Class<?> resourceTypeOf(Object resource) {
        var type = registeredTypeOf(resource.getClass());
        if (type == null) {
            throw new ResourceSetupException("Resource type is not registered: " + resource.getClass().getName());
        }
        return type;
    }

    @Override
    public boolean isResourceInstance(Object candidate) {
        return registeredTypeOf(candidate.getClass()) != null;
    }

    private Class<?> registeredTypeOf(Class<?> type) {
        if (metadataByType.containsKey(type)) {
            return type;
        }
        return resolvedTypes.computeIfAbsent(type, this::findRegisteredSuperclass);
    }

    private Class<?> findRegisteredSuperclass(Class<?> type) {
        for (Class<?> current = type.getSuperclass(); current != null; current = current.getSuperclass()) {
            if (metadataByType.containsKey(current)) {
                return current;
            }
        }
        return null;
    }

    @Override
    public Object getId(Object resource) {
        return getMetadata(resourceTypeOf(resource)).getId(resource);
    }

    @Override
    public String getStringId(Object resource) {
        var id = getId(resource);
        return id != null ? id.toString() : null;
    }

    @Override
    public ResourceKey keyOf(Object resource) {
        var type = resourceTypeOf(resource);
        return ResourceKey.of(type, getMetadata(type).getId(resource), resource);
    }
}
