package io.resthooks.hooks.execution;

import io.resthooks.core.RelationshipAttribute;
import io.resthooks.core.RelationshipAttribute.RelationshipType;
import io.resthooks.core.ResourceHooksConfiguration;
import io.resthooks.core.TypedCollections;
import io.resthooks.graph.IdentifiableSet;
import io.resthooks.graph.ResourceGraph;
import io.resthooks.hooks.ResourceHook;
import io.resthooks.hooks.ResourceHookContainer;
import io.resthooks.hooks.ResourceHookContainerRegistry;
import io.resthooks.store.ResourceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class DefaultHookExecutorHelper implements HookExecutorHelper {
    private static final Logger LOGGER = LoggerFactory.getLogger(DefaultHookExecutorHelper.class);

    private final ResourceHookContainerRegistry registry;
    private final ResourceStore store;
    private final ResourceGraph resourceGraph;
    private final ResourceHooksConfiguration configuration;

    public DefaultHookExecutorHelper(ResourceHookContainerRegistry registry, ResourceStore store,
                                     ResourceGraph resourceGraph, ResourceHooksConfiguration configuration) {
        this.registry = registry;
        this.store = store;
        this.resourceGraph = resourceGraph;
        this.configuration = configuration;
    }

    @Override
    public <T> ResourceHookContainer<T> getResourceHookContainer(Class<T> resourceType, ResourceHook hook) {
        if (hook == ResourceHook.NONE) {
            throw new IllegalArgumentException("ResourceHook.NONE does not identify a hook");
        }
        var discovery = registry.getDiscovery(resourceType);
        if (discovery == null || !discovery.isImplemented(hook)) {
            return null;
        }
        return registry.getContainer(resourceType);
    }

    @Override
    public boolean shouldLoadDbValues(Class<?> resourceType, ResourceHook hook) {
        var discovery = registry.getDiscovery(resourceType);
        if (discovery == null) {
            return hook == ResourceHook.BEFORE_IMPLICIT_UPDATE_RELATIONSHIP || configuration.loadDatabaseValues();
        }
        if (discovery.databaseValuesDisabledHooks().contains(hook)) {
            return false;
        }
        if (discovery.databaseValuesEnabledHooks().contains(hook)) {
            return true;
        }
        return configuration.loadDatabaseValues();
    }

    @Override
    public <T> List<T> loadDbValues(Class<T> resourceType, Collection<?> resources, ResourceHook hook,
                                    Collection<RelationshipAttribute> relationships) {
        if (!shouldLoadDbValues(resourceType, hook)) {
            return null;
        }
        var ids = new ArrayList<Object>(resources.size());
        for (var resource : resources) {
            var id = resourceGraph.getId(resource);
            if (id != null) {
                ids.add(id);
            }
        }
        if (ids.isEmpty()) {
            return List.of();
        }
        LOGGER.debug("Loading database values of {} {} for {} including {}",
                ids.size(), resourceType.getSimpleName(), hook, relationships);
        return store.findAllById(resourceType, ids, ResourceStore.chainsOf(relationships));
    }

    @Override
    public Map<RelationshipAttribute, Set<Object>> loadImplicitlyAffected(
            Map<RelationshipAttribute, ? extends Collection<?>> leftResourcesByRelationship,
            Collection<?> existingRightResources) {
        var existing = existingRightResources != null
                ? new IdentifiableSet<Object>(resourceGraph, existingRightResources)
                : new IdentifiableSet<Object>(resourceGraph);
        var implicitlyAffected = new LinkedHashMap<RelationshipAttribute, Set<Object>>();
        for (var entry : leftResourcesByRelationship.entrySet()) {
            var relationship = entry.getKey();
            if (relationship.relationshipType() == RelationshipType.HAS_MANY_THROUGH || entry.getValue().isEmpty()) {
                continue;
            }
            var persistedLefts = loadDbValues(relationship.leftType(), entry.getValue(),
                    ResourceHook.BEFORE_IMPLICIT_UPDATE_RELATIONSHIP, List.of(relationship));
            if (persistedLefts == null) {
                continue;
            }
            for (var persistedLeft : persistedLefts) {
                for (var right : TypedCollections.elements(relationship.getValue(persistedLeft))) {
                    if (!existing.contains(right)) {
                        implicitlyAffected.computeIfAbsent(relationship, r -> new IdentifiableSet<>(resourceGraph)).add(right);
                    }
                }
            }
        }
        return implicitlyAffected;
    }
}
