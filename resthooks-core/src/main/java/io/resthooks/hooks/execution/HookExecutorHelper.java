package io.resthooks.hooks.execution;

import io.resthooks.core.RelationshipAttribute;
import io.resthooks.hooks.ResourceHook;
import io.resthooks.hooks.ResourceHookContainer;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Resolves hook containers and loads persisted state for the executor.
 */
public interface HookExecutorHelper {

    /**
     * @return the container for the type if it implements {@code hook}, otherwise null
     * @throws IllegalArgumentException for {@link ResourceHook#NONE}
     */
    <T> ResourceHookContainer<T> getResourceHookContainer(Class<T> resourceType, ResourceHook hook);

    /**
     * Decide whether persisted values are loaded for the hook: an explicit opt-out wins,
     * then an explicit opt-in, then the configured default.
     */
    boolean shouldLoadDbValues(Class<?> resourceType, ResourceHook hook);

    /**
     * Load the persisted copies of {@code resources} with the given relationships included.
     *
     * @return the persisted resources, or null when the hook does not load database values
     */
    <T> List<T> loadDbValues(Class<T> resourceType, Collection<?> resources, ResourceHook hook,
                             Collection<RelationshipAttribute> relationships);

    /**
     * Find the resources outside the request whose relationships change implicitly.
     * For every relationship the persisted right-side values of the left resources are
     * loaded, minus {@code existingRightResources}. Has-many-through relationships are skipped.
     *
     * @param leftResourcesByRelationship left resources keyed by the relationship they hold
     * @param existingRightResources resources already part of the request, may be null
     * @return persisted right-side resources keyed by relationship, without empty groups
     */
    Map<RelationshipAttribute, Set<Object>> loadImplicitlyAffected(
            Map<RelationshipAttribute, ? extends Collection<?>> leftResourcesByRelationship,
            Collection<?> existingRightResources);
}
