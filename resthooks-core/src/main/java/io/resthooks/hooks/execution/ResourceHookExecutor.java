package io.resthooks.hooks.execution;

import io.resthooks.hooks.ResourcePipeline;

import java.util.Collection;

/**
 * Fires resource hooks over a root set of resources and everything reachable from it.
 * <p>
 * Methods that return a collection filter the caller's collection in place and return
 * it: resources dropped by a hook are removed from it, and references to dropped
 * related resources are removed from the object graph. When the caller's collection
 * is unmodifiable it is left untouched and a filtered copy ({@code List} or
 * {@code Set}) is returned instead, so callers should always use the returned value.
 */
public interface ResourceHookExecutor {

    /**
     * Fire {@code beforeRead} on the resource type and, once each, on every type along
     * the include chains of the request.
     */
    <T> void beforeRead(Class<T> resourceType, ResourcePipeline pipeline, String stringId);

    <T, C extends Collection<T>> C beforeCreate(Class<T> resourceType, C resources, ResourcePipeline pipeline);

    <T, C extends Collection<T>> C beforeUpdate(Class<T> resourceType, C resources, ResourcePipeline pipeline);

    <T, C extends Collection<T>> C beforeDelete(Class<T> resourceType, C resources, ResourcePipeline pipeline);

    /**
     * Filter the resources about to be returned, layer by layer.
     *
     * @throws io.resthooks.core.InvalidHookResponseException if the root hook returns
     *         more than one resource for {@link ResourcePipeline#GET_SINGLE}
     */
    <T, C extends Collection<T>> C onReturn(Class<T> resourceType, C resources, ResourcePipeline pipeline);

    <T> void afterRead(Class<T> resourceType, Collection<T> resources, ResourcePipeline pipeline);

    <T> void afterCreate(Class<T> resourceType, Collection<T> resources, ResourcePipeline pipeline);

    <T> void afterUpdate(Class<T> resourceType, Collection<T> resources, ResourcePipeline pipeline);

    <T> void afterDelete(Class<T> resourceType, Collection<T> resources, ResourcePipeline pipeline, boolean succeeded);
}
