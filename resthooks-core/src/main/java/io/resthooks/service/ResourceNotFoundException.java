package io.resthooks.service;

import io.resthooks.core.ResourceHooksException;

public class ResourceNotFoundException extends ResourceHooksException {

    private final Class<?> resourceType;
    private final Object id;

    public ResourceNotFoundException(Class<?> resourceType, Object id) {
        super("Resource of type " + resourceType.getSimpleName() + " with id '" + id + "' does not exist");
        this.resourceType = resourceType;
        this.id = id;
    }

    public Class<?> resourceType() {
        return resourceType;
    }

    public Object id() {
        return id;
    }
}
