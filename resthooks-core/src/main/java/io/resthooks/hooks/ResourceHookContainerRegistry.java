package io.resthooks.hooks;

/**
 * Resolves the hook container registered for a resource type.
 */
public interface ResourceHookContainerRegistry {

    /**
     * @return the container for the type, or null when none is registered
     */
    <T> ResourceHookContainer<T> getContainer(Class<T> resourceType);

    /**
     * @return the hooks discovered on the type's container, or null when none is registered
     */
    HooksDiscovery getDiscovery(Class<?> resourceType);
}
