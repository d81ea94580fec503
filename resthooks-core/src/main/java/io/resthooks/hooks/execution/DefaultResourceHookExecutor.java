package io.resthooks.hooks.execution;

import io.resthooks.core.InvalidHookResponseException;
import io.resthooks.core.RelationshipAttribute;
import io.resthooks.graph.IdentifiableSet;
import io.resthooks.graph.ResourceGraph;
import io.resthooks.hooks.DiffableResourceHashSet;
import io.resthooks.hooks.RelationshipsDictionary;
import io.resthooks.hooks.ResourceHashSet;
import io.resthooks.hooks.ResourceHook;
import io.resthooks.hooks.ResourceHookContainer;
import io.resthooks.hooks.ResourcePipeline;
import io.resthooks.hooks.traversal.Node;
import io.resthooks.hooks.traversal.NodeLayer;
import io.resthooks.hooks.traversal.RelationshipProxy;
import io.resthooks.hooks.traversal.RootNode;
import io.resthooks.hooks.traversal.TraversalHelper;
import io.resthooks.request.IncludeService;
import io.resthooks.request.TargetedFields;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiConsumer;

/**
 * Executor for one request. It walks the resource graph breadth-first from the root
 * resources and fires the hooks implemented for each type it meets.
 */
public final class DefaultResourceHookExecutor implements ResourceHookExecutor {
    private static final Logger LOGGER = LoggerFactory.getLogger(DefaultResourceHookExecutor.class);

    private final HookExecutorHelper executorHelper;
    private final TraversalHelper traversalHelper;
    private final TargetedFields targetedFields;
    private final IncludeService includeService;
    private final ResourceGraph resourceGraph;

    public DefaultResourceHookExecutor(HookExecutorHelper executorHelper, TraversalHelper traversalHelper,
                                       TargetedFields targetedFields, IncludeService includeService,
                                       ResourceGraph resourceGraph) {
        this.executorHelper = executorHelper;
        this.traversalHelper = traversalHelper;
        this.targetedFields = targetedFields;
        this.includeService = includeService;
        this.resourceGraph = resourceGraph;
    }

    @Override
    public <T> void beforeRead(Class<T> resourceType, ResourcePipeline pipeline, String stringId) {
        var container = executorHelper.getResourceHookContainer(resourceType, ResourceHook.BEFORE_READ);
        if (container != null) {
            LOGGER.debug("Firing {} on {}", ResourceHook.BEFORE_READ, resourceType.getSimpleName());
            container.beforeRead(pipeline, false, stringId);
        }
        var calledTypes = new HashSet<Class<?>>();
        calledTypes.add(resourceType);
        for (var chain : includeService.get()) {
            for (var relationship : chain) {
                var rightType = relationship.rightType();
                if (!calledTypes.add(rightType)) {
                    continue;
                }
                var includedContainer = executorHelper.getResourceHookContainer(rightType, ResourceHook.BEFORE_READ);
                if (includedContainer != null) {
                    LOGGER.debug("Firing {} on included {}", ResourceHook.BEFORE_READ, rightType.getSimpleName());
                    includedContainer.beforeRead(pipeline, true, null);
                }
            }
        }
    }

    @Override
    public <T, C extends Collection<T>> C beforeCreate(Class<T> resourceType, C resources, ResourcePipeline pipeline) {
        var node = traversalHelper.createRootNode(resourceType, resources);
        var container = executorHelper.getResourceHookContainer(resourceType, ResourceHook.BEFORE_CREATE);
        if (container != null) {
            var affected = new ResourceHashSet<>(resourceGraph, node.uniqueResources(), node.leftsToNextLayer());
            logFiring(ResourceHook.BEFORE_CREATE, node);
            node.updateUnique(container.beforeCreate(affected, pipeline));
            node.reassign();
        }
        fireNestedBeforeUpdateHooks(pipeline, traversalHelper.createNextLayer(node));
        return resultOf(node);
    }

    @Override
    public <T, C extends Collection<T>> C beforeUpdate(Class<T> resourceType, C resources, ResourcePipeline pipeline) {
        var node = traversalHelper.createRootNode(resourceType, resources);
        var container = executorHelper.getResourceHookContainer(resourceType, ResourceHook.BEFORE_UPDATE);
        if (container != null) {
            var dbValues = executorHelper.loadDbValues(resourceType, node.uniqueResources(),
                    ResourceHook.BEFORE_UPDATE, attributesOf(node.relationshipsToNextLayer()));
            var diff = new DiffableResourceHashSet<>(resourceGraph, node.uniqueResources(), dbValues,
                    node.leftsToNextLayer(), targetedFields.attributes());
            logFiring(ResourceHook.BEFORE_UPDATE, node);
            node.updateUnique(container.beforeUpdate(diff, pipeline));
            node.reassign();
        }
        fireNestedBeforeUpdateHooks(pipeline, traversalHelper.createNextLayer(node));
        return resultOf(node);
    }

    @Override
    public <T, C extends Collection<T>> C beforeDelete(Class<T> resourceType, C resources, ResourcePipeline pipeline) {
        var node = traversalHelper.createRootNode(resourceType, resources);
        var container = executorHelper.getResourceHookContainer(resourceType, ResourceHook.BEFORE_DELETE);
        if (container != null) {
            var dbValues = executorHelper.loadDbValues(resourceType, node.uniqueResources(),
                    ResourceHook.BEFORE_DELETE, attributesOf(node.relationshipsToNextLayer()));
            Collection<T> targets = dbValues != null ? dbValues : node.uniqueResources();
            var affected = new ResourceHashSet<>(resourceGraph, targets, node.leftsToNextLayer());
            logFiring(ResourceHook.BEFORE_DELETE, node);
            node.updateUnique(container.beforeDelete(affected, pipeline));
            node.reassign();
        }

        // Deleting the root resources detaches them from everything they reference
        for (var entry : node.leftsToNextLayerByRelationships().entrySet()) {
            fireForAffectedImplicits(entry.getKey(), entry.getValue(), pipeline, null);
        }
        return resultOf(node);
    }

    @Override
    public <T, C extends Collection<T>> C onReturn(Class<T> resourceType, C resources, ResourcePipeline pipeline) {
        var node = traversalHelper.createRootNode(resourceType, resources);
        var container = executorHelper.getResourceHookContainer(resourceType, ResourceHook.ON_RETURN);
        if (container != null && pipeline != ResourcePipeline.GET_RELATIONSHIP) {
            logFiring(ResourceHook.ON_RETURN, node);
            var updated = container.onReturn(node.uniqueResources(), pipeline);
            validateHookResponse(updated, pipeline);
            node.updateUnique(updated);
            node.reassign();
        }

        traverse(traversalHelper.createNextLayer(node), ResourceHook.ON_RETURN,
                (nextContainer, nextNode) -> fireOnReturn(nextContainer, nextNode, pipeline));
        return resultOf(node);
    }

    @Override
    public <T> void afterRead(Class<T> resourceType, Collection<T> resources, ResourcePipeline pipeline) {
        var node = traversalHelper.createRootNode(resourceType, resources);
        var container = executorHelper.getResourceHookContainer(resourceType, ResourceHook.AFTER_READ);
        if (container != null) {
            logFiring(ResourceHook.AFTER_READ, node);
            container.afterRead(node.uniqueResources(), pipeline, false);
        }

        traverse(traversalHelper.createNextLayer(node), ResourceHook.AFTER_READ,
                (nextContainer, nextNode) -> fireAfterRead(nextContainer, nextNode, pipeline));
    }

    @Override
    public <T> void afterCreate(Class<T> resourceType, Collection<T> resources, ResourcePipeline pipeline) {
        var node = traversalHelper.createRootNode(resourceType, resources);
        var container = executorHelper.getResourceHookContainer(resourceType, ResourceHook.AFTER_CREATE);
        if (container != null) {
            logFiring(ResourceHook.AFTER_CREATE, node);
            container.afterCreate(node.uniqueResources(), pipeline);
        }

        traverse(traversalHelper.createNextLayer(node), ResourceHook.AFTER_UPDATE_RELATIONSHIP,
                (nextContainer, nextNode) -> fireAfterUpdateRelationship(nextContainer, nextNode, pipeline));
    }

    @Override
    public <T> void afterUpdate(Class<T> resourceType, Collection<T> resources, ResourcePipeline pipeline) {
        var node = traversalHelper.createRootNode(resourceType, resources);
        var container = executorHelper.getResourceHookContainer(resourceType, ResourceHook.AFTER_UPDATE);
        if (container != null) {
            logFiring(ResourceHook.AFTER_UPDATE, node);
            container.afterUpdate(node.uniqueResources(), pipeline);
        }

        traverse(traversalHelper.createNextLayer(node), ResourceHook.AFTER_UPDATE_RELATIONSHIP,
                (nextContainer, nextNode) -> fireAfterUpdateRelationship(nextContainer, nextNode, pipeline));
    }

    @Override
    public <T> void afterDelete(Class<T> resourceType, Collection<T> resources, ResourcePipeline pipeline, boolean succeeded) {
        var node = traversalHelper.createRootNode(resourceType, resources);
        var container = executorHelper.getResourceHookContainer(resourceType, ResourceHook.AFTER_DELETE);
        if (container != null) {
            logFiring(ResourceHook.AFTER_DELETE, node);
            container.afterDelete(node.uniqueResources(), pipeline, succeeded);
        }
    }

    /**
     * Visit every layer below the root, firing {@code action} on each node whose type
     * implements {@code hook}. Stops at the first layer without resources.
     */
    private void traverse(NodeLayer layer, ResourceHook hook, BiConsumer<ResourceHookContainer<?>, Node> action) {
        var current = layer;
        while (current.anyResources()) {
            for (var node : current) {
                var container = executorHelper.getResourceHookContainer(node.resourceType(), hook);
                if (container != null) {
                    logFiring(hook, node);
                    action.accept(container, node);
                }
            }
            current = traversalHelper.createNextLayer(current.nodes());
        }
    }

    /**
     * Fire the nested hooks of one layer, in this order per node:
     * <ol>
     *   <li>{@code beforeUpdateRelationship} on the newly related resources</li>
     *   <li>{@code beforeImplicitUpdateRelationship} on their previous holders, unless creating</li>
     *   <li>{@code beforeImplicitUpdateRelationship} on the left type, for resources that
     *       currently reference the newly related resources</li>
     * </ol>
     * For example, when article1's owner changes from ownerOld to ownerNew, and ownerNew
     * currently owns article2, the order is ownerNew, then ownerOld, then article2.
     */
    private void fireNestedBeforeUpdateHooks(ResourcePipeline pipeline, NodeLayer layer) {
        for (var node : layer) {
            var resourceType = node.resourceType();
            var uniqueResources = new ArrayList<Object>(node.uniqueResources());

            var nestedContainer = executorHelper.getResourceHookContainer(resourceType, ResourceHook.BEFORE_UPDATE_RELATIONSHIP);
            if (nestedContainer != null && !uniqueResources.isEmpty()) {
                var dbValues = executorHelper.loadDbValues(resourceType, uniqueResources,
                        ResourceHook.BEFORE_UPDATE_RELATIONSHIP, attributesOf(node.relationshipsToNextLayer()));
                // Keyed by the relationships of this node's type that point back at the previous layer
                var grouped = replaceKeysWithInverseRelationships(node.relationshipsFromPreviousLayer().getRightResources());
                logFiring(ResourceHook.BEFORE_UPDATE_RELATIONSHIP, node);
                var allowedIds = fireBeforeUpdateRelationship(nestedContainer, uniqueResources,
                        replaceWithDbValues(grouped, dbValues), pipeline);
                node.updateUnique(getAllowedResources(uniqueResources, allowedIds));
                node.reassign();
            }

            // Nothing can have held a relationship to a resource that is being created
            if (pipeline != ResourcePipeline.POST) {
                var leftResources = node.relationshipsFromPreviousLayer().getLeftResources();
                if (!leftResources.isEmpty()) {
                    fireForAffectedImplicits(resourceType, leftResources, pipeline, uniqueResources);
                }
            }

            var currentGrouped = node.relationshipsFromPreviousLayer().getRightResources();
            if (!currentGrouped.isEmpty()) {
                // The root layer is homogeneous, so every group shares the same left type
                var leftType = currentGrouped.keySet().iterator().next().leftType();
                fireForAffectedImplicits(leftType, replaceKeysWithInverseRelationships(currentGrouped), pipeline, null);
            }
        }
    }

    /**
     * Load the resources implicitly affected through {@code implicitsTarget} and fire
     * {@code beforeImplicitUpdateRelationship} on {@code resourceType}. Relationships
     * without an inverse are skipped.
     */
    private void fireForAffectedImplicits(Class<?> resourceType,
                                          Map<RelationshipAttribute, ? extends Collection<?>> implicitsTarget,
                                          ResourcePipeline pipeline, Collection<?> existingImplicitResources) {
        var container = executorHelper.getResourceHookContainer(resourceType, ResourceHook.BEFORE_IMPLICIT_UPDATE_RELATIONSHIP);
        if (container == null) {
            return;
        }
        var inversable = new LinkedHashMap<RelationshipAttribute, Collection<?>>();
        implicitsTarget.forEach((relationship, resources) -> {
            if (resourceGraph.getInverse(relationship) != null) {
                inversable.put(relationship, resources);
            }
        });
        if (inversable.isEmpty()) {
            return;
        }
        var implicitlyAffected = executorHelper.loadImplicitlyAffected(inversable, existingImplicitResources);
        if (implicitlyAffected.isEmpty()) {
            return;
        }
        LOGGER.debug("Firing {} on {} for {}", ResourceHook.BEFORE_IMPLICIT_UPDATE_RELATIONSHIP,
                resourceType.getSimpleName(), implicitlyAffected.keySet());
        fireBeforeImplicitUpdateRelationship(container, replaceKeysWithInverseRelationships(implicitlyAffected), pipeline);
    }

    /**
     * Re-key groups by the inverse relationship, dropping relationships without one.
     */
    private <V> Map<RelationshipAttribute, V> replaceKeysWithInverseRelationships(Map<RelationshipAttribute, V> resourcesByRelationship) {
        var result = new LinkedHashMap<RelationshipAttribute, V>();
        resourcesByRelationship.forEach((relationship, resources) -> {
            var inverse = resourceGraph.getInverse(relationship);
            if (inverse != null) {
                result.put(inverse, resources);
            }
        });
        return result;
    }

    /**
     * Substitute the persisted instances for the requested ones where both exist.
     */
    private <V extends Collection<?>> Map<RelationshipAttribute, Set<Object>> replaceWithDbValues(
            Map<RelationshipAttribute, V> resourcesByRelationship, Collection<?> dbValues) {
        var persisted = dbValues != null ? new IdentifiableSet<Object>(resourceGraph, dbValues) : null;
        var result = new LinkedHashMap<RelationshipAttribute, Set<Object>>();
        resourcesByRelationship.forEach((relationship, resources) -> {
            var replaced = new IdentifiableSet<Object>(resourceGraph);
            for (var resource : resources) {
                var tracked = persisted != null ? persisted.find(resource) : null;
                replaced.add(tracked != null ? tracked : resource);
            }
            result.put(relationship, replaced);
        });
        return result;
    }

    private List<Object> getAllowedResources(Collection<Object> resources, Set<String> allowedIds) {
        var allowed = new ArrayList<Object>(resources.size());
        for (var resource : resources) {
            if (allowedIds.contains(resourceGraph.getStringId(resource))) {
                allowed.add(resource);
            }
        }
        return allowed;
    }

    private Set<String> getIds(Collection<?> resources) {
        var ids = new LinkedHashSet<String>();
        for (var resource : resources) {
            ids.add(resourceGraph.getStringId(resource));
        }
        return ids;
    }

    private static List<RelationshipAttribute> attributesOf(List<RelationshipProxy> proxies) {
        var attributes = new ArrayList<RelationshipAttribute>(proxies.size());
        for (var proxy : proxies) {
            attributes.add(proxy.attribute());
        }
        return attributes;
    }

    /**
     * Reject more than one resource for a single-resource response.
     */
    // An unmodifiable root collection is replaced by a filtered copy of the same kind
    @SuppressWarnings("unchecked")
    private static <T, C extends Collection<T>> C resultOf(RootNode<T> node) {
        return (C) node.resources();
    }

    private static void validateHookResponse(Collection<?> returned, ResourcePipeline pipeline) {
        if (pipeline == ResourcePipeline.GET_SINGLE && returned != null && returned.size() > 1) {
            throw new InvalidHookResponseException("The collection returned from this hook may contain at most one item in the case of the "
                    + pipeline + " pipeline, but contained " + returned.size(), pipeline);
        }
    }

    private static void logFiring(ResourceHook hook, Node node) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Firing {} on {} for {} resources", hook, node.resourceType().getSimpleName(),
                    node.uniqueResources().size());
        }
    }

    // Typed dispatch for nodes whose type is only known at runtime

    @SuppressWarnings("unchecked")
    private static <T> void fireOnReturn(ResourceHookContainer<T> container, Node node, ResourcePipeline pipeline) {
        var updated = container.onReturn((Set<T>) node.uniqueResources(), pipeline);
        node.updateUnique(updated);
        node.reassign();
    }

    @SuppressWarnings("unchecked")
    private static <T> void fireAfterRead(ResourceHookContainer<T> container, Node node, ResourcePipeline pipeline) {
        container.afterRead((Set<T>) node.uniqueResources(), pipeline, true);
    }

    private void fireAfterUpdateRelationship(ResourceHookContainer<?> container, Node node, ResourcePipeline pipeline) {
        var grouped = replaceKeysWithInverseRelationships(node.relationshipsFromPreviousLayer().getRightResources());
        dispatchAfterUpdateRelationship(container, grouped, pipeline);
    }

    @SuppressWarnings("unchecked")
    private static <T> void dispatchAfterUpdateRelationship(ResourceHookContainer<T> container,
                                                            Map<RelationshipAttribute, ? extends Set<?>> grouped,
                                                            ResourcePipeline pipeline) {
        container.afterUpdateRelationship(new RelationshipsDictionary<>((Map<RelationshipAttribute, Set<T>>) (Map<RelationshipAttribute, ?>) grouped), pipeline);
    }

    @SuppressWarnings("unchecked")
    private <T> Set<String> fireBeforeUpdateRelationship(ResourceHookContainer<T> container, Collection<Object> resources,
                                                         Map<RelationshipAttribute, Set<Object>> grouped,
                                                         ResourcePipeline pipeline) {
        var dictionary = new RelationshipsDictionary<>((Map<RelationshipAttribute, Set<T>>) (Map<RelationshipAttribute, ?>) grouped);
        var allowedIds = container.beforeUpdateRelationship(getIds(resources), dictionary, pipeline);
        return allowedIds != null ? new HashSet<>(allowedIds) : Set.of();
    }

    @SuppressWarnings("unchecked")
    private static <T> void fireBeforeImplicitUpdateRelationship(ResourceHookContainer<T> container,
                                                                 Map<RelationshipAttribute, Set<Object>> grouped,
                                                                 ResourcePipeline pipeline) {
        var dictionary = new RelationshipsDictionary<>((Map<RelationshipAttribute, Set<T>>) (Map<RelationshipAttribute, ?>) grouped);
        container.beforeImplicitUpdateRelationship(dictionary, pipeline);
    }
}
