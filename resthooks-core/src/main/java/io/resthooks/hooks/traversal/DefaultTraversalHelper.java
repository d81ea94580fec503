package io.resthooks.hooks.traversal;

import io.resthooks.core.RelationshipAttribute;
import io.resthooks.graph.IdentifiableSet;
import io.resthooks.graph.ResourceGraph;
import io.resthooks.graph.ResourceKey;
import io.resthooks.request.TargetedFields;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Traversal helper for one request. Relationships targeted by the request are context
 * relations: they are always followed, even when no resource holds a value for them.
 */
public final class DefaultTraversalHelper implements TraversalHelper {
    private static final Logger LOGGER = LoggerFactory.getLogger(DefaultTraversalHelper.class);

    private final ResourceGraph resourceGraph;
    private final TargetedFields targetedFields;
    private final Map<RelationshipAttribute, RelationshipProxy> proxies = new HashMap<>();
    private final Set<ResourceKey> processedResources = new HashSet<>();

    public DefaultTraversalHelper(ResourceGraph resourceGraph, TargetedFields targetedFields) {
        this.resourceGraph = resourceGraph;
        this.targetedFields = targetedFields;
    }

    @Override
    public <T> RootNode<T> createRootNode(Class<T> resourceType, Collection<T> rootResources) {
        processedResources.clear();
        var uniqueResources = new IdentifiableSet<T>(resourceGraph, rootResources);
        registerProcessed(uniqueResources);
        var allRelationships = proxiesOf(resourceType);
        var populatedRelationships = getPopulatedRelationships(allRelationships, uniqueResources);
        LOGGER.debug("Root node {} with {} resources, populated relationships {}",
                resourceType.getSimpleName(), uniqueResources.size(), populatedRelationships);
        return new RootNode<>(resourceType, resourceGraph, rootResources, uniqueResources,
                populatedRelationships, allRelationships);
    }

    @Override
    public NodeLayer createNextLayer(Node node) {
        return createNextLayer(List.of(node));
    }

    @Override
    public NodeLayer createNextLayer(List<? extends Node> nodes) {
        // right type -> proxy -> (lefts, rights)
        var edgesByType = new LinkedHashMap<Class<?>, Map<RelationshipProxy, Edges>>();
        for (var node : nodes) {
            var lefts = node.uniqueResources();
            for (var proxy : node.relationshipsToNextLayer()) {
                for (var left : lefts) {
                    var value = proxy.getValue(left);
                    if (value.isEmpty() && !proxy.isContextRelation()) {
                        continue;
                    }
                    var uniqueRights = uniqueInTree(value.elements());
                    if (proxy.isContextRelation() || !uniqueRights.isEmpty()) {
                        var edges = edgesByType
                                .computeIfAbsent(proxy.rightType(), type -> new LinkedHashMap<>())
                                .computeIfAbsent(proxy, p -> new Edges(resourceGraph));
                        edges.lefts.add(left);
                        edges.rights.addAll(uniqueRights);
                    }
                }
            }
        }

        for (var edges : edgesByType.values()) {
            for (var edge : edges.values()) {
                registerProcessed(edge.rights);
            }
        }

        var childNodes = new ArrayList<Node>(edgesByType.size());
        for (var entry : edgesByType.entrySet()) {
            childNodes.add(createChildNode(entry.getKey(), entry.getValue()));
        }
        var layer = new NodeLayer(childNodes);
        LOGGER.debug("Next layer {}", layer);
        return layer;
    }

    @SuppressWarnings("unchecked")
    private <T> ChildNode<T> createChildNode(Class<T> resourceType, Map<RelationshipProxy, Edges> edgesByProxy) {
        var groups = new ArrayList<RelationshipGroup<T>>(edgesByProxy.size());
        var uniqueRights = new IdentifiableSet<T>(resourceGraph);
        for (var entry : edgesByProxy.entrySet()) {
            var rights = new IdentifiableSet<T>(resourceGraph, (Collection<T>) (Collection<?>) entry.getValue().rights);
            uniqueRights.addAll(rights);
            groups.add(new RelationshipGroup<>(entry.getKey(), entry.getValue().lefts, rights));
        }
        var populated = getPopulatedRelationships(proxiesOf(resourceType), uniqueRights);
        return new ChildNode<>(resourceType, resourceGraph, populated, new RelationshipsFromPreviousLayer<>(groups));
    }

    private List<RelationshipProxy> getPopulatedRelationships(List<RelationshipProxy> candidates, Collection<?> lefts) {
        var populated = new ArrayList<RelationshipProxy>();
        for (var proxy : candidates) {
            if (proxy.isContextRelation() || anyHoldsValue(proxy, lefts)) {
                populated.add(proxy);
            }
        }
        return populated;
    }

    private static boolean anyHoldsValue(RelationshipProxy proxy, Collection<?> lefts) {
        for (var left : lefts) {
            if (!proxy.getValue(left).isEmpty()) {
                return true;
            }
        }
        return false;
    }

    private List<RelationshipProxy> proxiesOf(Class<?> resourceType) {
        if (!resourceGraph.isResource(resourceType)) {
            return List.of();
        }
        var result = new ArrayList<RelationshipProxy>();
        for (var relationship : resourceGraph.getRelationships(resourceType)) {
            if (!relationship.canInclude()) {
                continue;
            }
            var proxy = proxies.computeIfAbsent(relationship, attribute -> new RelationshipProxy(
                    attribute, targetedFields.relationships().contains(attribute), resourceGraph));
            if (resourceGraph.isResource(proxy.rightType())) {
                result.add(proxy);
            }
        }
        return result;
    }

    private List<Object> uniqueInTree(List<Object> resources) {
        var unique = new ArrayList<Object>(resources.size());
        for (var resource : resources) {
            if (!processedResources.contains(resourceGraph.keyOf(resource))) {
                unique.add(resource);
            }
        }
        return unique;
    }

    private void registerProcessed(Collection<?> resources) {
        for (var resource : resources) {
            processedResources.add(resourceGraph.keyOf(resource));
        }
    }

    private static final class Edges {
        private final IdentifiableSet<Object> lefts;
        private final IdentifiableSet<Object> rights;

        private Edges(ResourceGraph resourceGraph) {
            this.lefts = new IdentifiableSet<>(resourceGraph);
            this.rights = new IdentifiableSet<>(resourceGraph);
        }
    }
}
