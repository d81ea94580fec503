package io.resthooks.core;

import java.lang.reflect.Constructor;
import java.util.List;

/**
 * Reflective description of one resource type: its id, plain attributes and relationships.
 *
 * @param <T> the resource type
 */
public record ResourceMetadata<T>(
        Class<T> resourceType,
        Constructor<T> constructor,
        FieldAccessor idAccessor,
        List<FieldAccessor> attributes,
        List<RelationshipAttribute> relationships
) {

    public ResourceMetadata {
        attributes = List.copyOf(attributes);
        relationships = List.copyOf(relationships);
    }

    public T newInstance() {
        try {
            return constructor.newInstance();
        } catch (ReflectiveOperationException e) {
            throw new ResourceHooksException("Cannot instantiate resource " + resourceType.getName(), e);
        }
    }

    public Object getId(Object resource) {
        return idAccessor.get(resource);
    }

    public void setId(Object resource, Object id) {
        idAccessor.set(resource, id);
    }

    public Class<?> idType() {
        return idAccessor.type();
    }

    /**
     * @return the relationship declared under {@code name}, or null
     */
    public RelationshipAttribute relationship(String name) {
        for (var relationship : relationships) {
            if (relationship.name().equals(name)) {
                return relationship;
            }
        }
        return null;
    }

    /**
     * @return the plain attribute declared under {@code name}, or null
     */
    public FieldAccessor attribute(String name) {
        for (var attribute : attributes) {
            if (attribute.name().equals(name)) {
                return attribute;
            }
        }
        return null;
    }
}
