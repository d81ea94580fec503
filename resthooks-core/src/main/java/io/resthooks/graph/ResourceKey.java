package io.resthooks.graph;

import java.util.Objects;

/**
 * Identity of a resource instance: its resource type and id.
 * <p>
 * Resources without an id (not yet persisted) are identified by the instance itself,
 * so two distinct unsaved resources never collapse into one.
 */
public final class ResourceKey {
    private final Class<?> resourceType;
    private final Object id;
    private final Object instance;

    private ResourceKey(Class<?> resourceType, Object id, Object instance) {
        this.resourceType = resourceType;
        this.id = id;
        this.instance = instance;
    }

    public static ResourceKey of(Class<?> resourceType, Object id, Object instance) {
        Objects.requireNonNull(resourceType, "resourceType");
        return new ResourceKey(resourceType, id, id == null ? Objects.requireNonNull(instance, "instance") : null);
    }

    public Class<?> resourceType() {
        return resourceType;
    }

    /**
     * @return the id, or null for unsaved resources
     */
    public Object id() {
        return id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ResourceKey other)) {
            return false;
        }
        if (!resourceType.equals(other.resourceType)) {
            return false;
        }
        if (id == null || other.id == null) {
            return id == null && other.id == null && instance == other.instance;
        }
        return id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return 31 * resourceType.hashCode() + (id != null ? id.hashCode() : System.identityHashCode(instance));
    }

    @Override
    public String toString() {
        return resourceType.getSimpleName() + "#" + (id != null ? id : "new@" + Integer.toHexString(System.identityHashCode(instance)));
    }
}
