package io.resthooks.graph;

import java.util.AbstractSet;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Insertion-ordered set of resources deduplicated by {@link ResourceKey} rather than
 * by {@code equals}. The first instance added for a key is the one kept.
 *
 * @param <T> the resource type
 */
public class IdentifiableSet<T> extends AbstractSet<T> {

    private final ResourceGraph resourceGraph;
    private final Map<ResourceKey, T> elements = new LinkedHashMap<>();

    public IdentifiableSet(ResourceGraph resourceGraph) {
        this.resourceGraph = resourceGraph;
    }

    public IdentifiableSet(ResourceGraph resourceGraph, Collection<? extends T> resources) {
        this(resourceGraph);
        addAll(resources);
    }

    protected ResourceGraph resourceGraph() {
        return resourceGraph;
    }

    @Override
    public boolean add(T resource) {
        if (resource == null) {
            return false;
        }
        return elements.putIfAbsent(resourceGraph.keyOf(resource), resource) == null;
    }

    @Override
    public boolean contains(Object o) {
        return o != null && resourceGraph.isResourceInstance(o) && elements.containsKey(resourceGraph.keyOf(o));
    }

    @Override
    public boolean remove(Object o) {
        return o != null && resourceGraph.isResourceInstance(o) && elements.remove(resourceGraph.keyOf(o)) != null;
    }

    /**
     * @return the instance held for the same identity as {@code resource}, or null
     */
    public T find(Object resource) {
        if (resource == null || !resourceGraph.isResourceInstance(resource)) {
            return null;
        }
        return elements.get(resourceGraph.keyOf(resource));
    }

    @Override
    public Iterator<T> iterator() {
        return elements.values().iterator();
    }

    @Override
    public int size() {
        return elements.size();
    }

    @Override
    public void clear() {
        elements.clear();
    }
}
