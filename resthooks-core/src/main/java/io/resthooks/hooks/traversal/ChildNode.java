package io.resthooks.hooks.traversal;

import io.resthooks.graph.IdentifiableSet;
import io.resthooks.graph.ResourceGraph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * A node below the root layer, reached through one or more relationship groups.
 *
 * @param <T> the resource type
 */
public final class ChildNode<T> implements Node {
    private final Class<T> resourceType;
    private final ResourceGraph resourceGraph;
    private final List<RelationshipProxy> relationshipsToNextLayer;
    private final RelationshipsFromPreviousLayer<T> relationshipsFromPreviousLayer;
    private final IdentifiableSet<T> excluded;

    public ChildNode(Class<T> resourceType, ResourceGraph resourceGraph,
                     List<RelationshipProxy> relationshipsToNextLayer,
                     RelationshipsFromPreviousLayer<T> relationshipsFromPreviousLayer) {
        this.resourceType = resourceType;
        this.resourceGraph = resourceGraph;
        this.relationshipsToNextLayer = List.copyOf(relationshipsToNextLayer);
        this.relationshipsFromPreviousLayer = relationshipsFromPreviousLayer;
        this.excluded = new IdentifiableSet<>(resourceGraph);
    }

    @Override
    public Class<T> resourceType() {
        return resourceType;
    }

    /**
     * The union of the right-side resources of all groups.
     */
    @Override
    public IdentifiableSet<T> uniqueResources() {
        var unique = new IdentifiableSet<T>(resourceGraph);
        for (var group : relationshipsFromPreviousLayer) {
            unique.addAll(group.rightResources());
        }
        return unique;
    }

    @Override
    public List<RelationshipProxy> relationshipsToNextLayer() {
        return relationshipsToNextLayer;
    }

    @Override
    public RelationshipsFromPreviousLayer<T> relationshipsFromPreviousLayer() {
        return relationshipsFromPreviousLayer;
    }

    @Override
    public void updateUnique(Collection<?> updated) {
        Objects.requireNonNull(updated, "Hook for " + resourceType.getSimpleName() + " returned null");
        var kept = new IdentifiableSet<Object>(resourceGraph, updated);
        for (var group : relationshipsFromPreviousLayer) {
            var iterator = group.rightResources().iterator();
            while (iterator.hasNext()) {
                var resource = iterator.next();
                if (!kept.contains(resource)) {
                    excluded.add(resource);
                    iterator.remove();
                }
            }
        }
    }

    /**
     * Remove excluded resources from the relationships of the previous layer: collections
     * lose exactly those members, single references become null.
     */
    @Override
    public void reassign() {
        if (excluded.isEmpty()) {
            return;
        }
        for (var group : relationshipsFromPreviousLayer) {
            var proxy = group.proxy();
            for (var left : group.leftResources()) {
                var value = proxy.getValue(left);
                if (value instanceof RelationshipValue.Many many) {
                    var retained = new ArrayList<Object>(many.resources().size());
                    for (var resource : many.resources()) {
                        if (!excluded.contains(resource)) {
                            retained.add(resource);
                        }
                    }
                    if (retained.size() != many.resources().size()) {
                        proxy.setValue(left, retained);
                    }
                } else if (value instanceof RelationshipValue.Single single && excluded.contains(single.resource())) {
                    proxy.setValue(left, null);
                }
            }
        }
    }

    @Override
    public String toString() {
        return "ChildNode[" + resourceType.getSimpleName() + "]";
    }
}
