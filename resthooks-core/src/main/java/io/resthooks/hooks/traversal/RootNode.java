package io.resthooks.hooks.traversal;

import io.resthooks.core.RelationshipAttribute;
import io.resthooks.graph.IdentifiableSet;
import io.resthooks.graph.ResourceGraph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The first layer of a traversal: the resources the caller passed in.
 * <p>
 * Reassignment removes excluded resources from the caller's collection itself. When that
 * collection is unmodifiable, a filtered copy takes its place and is returned by
 * {@link #resources()}.
 *
 * @param <T> the resource type
 */
public final class RootNode<T> implements Node {
    private final Class<T> resourceType;
    private final ResourceGraph resourceGraph;
    private Collection<T> source;
    private final IdentifiableSet<T> uniqueResources;
    private final IdentifiableSet<T> excluded;
    private final List<RelationshipProxy> relationshipsToNextLayer;
    private final List<RelationshipProxy> allRelationshipsToNextLayer;

    public RootNode(Class<T> resourceType, ResourceGraph resourceGraph, Collection<T> source,
                    IdentifiableSet<T> uniqueResources,
                    List<RelationshipProxy> populatedRelationships,
                    List<RelationshipProxy> allRelationships) {
        this.resourceType = resourceType;
        this.resourceGraph = resourceGraph;
        this.source = source;
        this.uniqueResources = uniqueResources;
        this.excluded = new IdentifiableSet<>(resourceGraph);
        this.relationshipsToNextLayer = List.copyOf(populatedRelationships);
        this.allRelationshipsToNextLayer = List.copyOf(allRelationships);
    }

    @Override
    public Class<T> resourceType() {
        return resourceType;
    }

    @Override
    public IdentifiableSet<T> uniqueResources() {
        return uniqueResources;
    }

    @Override
    public List<RelationshipProxy> relationshipsToNextLayer() {
        return relationshipsToNextLayer;
    }

    @Override
    public RelationshipsFromPreviousLayer<T> relationshipsFromPreviousLayer() {
        return RelationshipsFromPreviousLayer.empty();
    }

    /**
     * Populated relationships mapped to the root resources they affect: every resource
     * for relationships targeted by the request, otherwise those holding a value.
     */
    public Map<RelationshipAttribute, Set<T>> leftsToNextLayer() {
        var result = new LinkedHashMap<RelationshipAttribute, Set<T>>();
        for (var proxy : relationshipsToNextLayer) {
            var lefts = new IdentifiableSet<T>(resourceGraph);
            for (var resource : uniqueResources) {
                if (proxy.isContextRelation() || !proxy.getValue(resource).isEmpty()) {
                    lefts.add(resource);
                }
            }
            result.put(proxy.attribute(), lefts);
        }
        return result;
    }

    /**
     * Every relationship of the root type, grouped by the type it points at, each mapped
     * to all root resources. Used to find implicitly affected resources on delete.
     */
    public Map<Class<?>, Map<RelationshipAttribute, Set<Object>>> leftsToNextLayerByRelationships() {
        var result = new LinkedHashMap<Class<?>, Map<RelationshipAttribute, Set<Object>>>();
        for (var proxy : allRelationshipsToNextLayer) {
            result.computeIfAbsent(proxy.rightType(), type -> new LinkedHashMap<>())
                    .put(proxy.attribute(), new IdentifiableSet<Object>(resourceGraph, uniqueResources));
        }
        return result;
    }

    @Override
    public void updateUnique(Collection<?> updated) {
        Objects.requireNonNull(updated, "Hook for " + resourceType.getSimpleName() + " returned null");
        var kept = new IdentifiableSet<Object>(resourceGraph, updated);
        var iterator = uniqueResources.iterator();
        while (iterator.hasNext()) {
            var resource = iterator.next();
            if (!kept.contains(resource)) {
                excluded.add(resource);
                iterator.remove();
            }
        }
    }

    @Override
    public void reassign() {
        if (excluded.isEmpty()) {
            return;
        }
        try {
            source.removeIf(excluded::contains);
        } catch (UnsupportedOperationException e) {
            Collection<T> copy = source instanceof Set<?> ? new LinkedHashSet<>() : new ArrayList<>();
            for (var resource : source) {
                if (!excluded.contains(resource)) {
                    copy.add(resource);
                }
            }
            source = copy;
        }
    }

    /**
     * @return the caller's collection, or its filtered copy if it could not be modified
     */
    public Collection<T> resources() {
        return source;
    }
}
