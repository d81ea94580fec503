package io.resthooks.hooks.traversal;

import io.resthooks.core.RelationshipAttribute;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The relationship groups that connect a node to the previous layer.
 *
 * @param <T> the resource type of the node
 */
public final class RelationshipsFromPreviousLayer<T> implements Iterable<RelationshipGroup<T>> {
    private final List<RelationshipGroup<T>> groups;

    public RelationshipsFromPreviousLayer(List<RelationshipGroup<T>> groups) {
        this.groups = List.copyOf(groups);
    }

    public static <T> RelationshipsFromPreviousLayer<T> empty() {
        return new RelationshipsFromPreviousLayer<>(List.of());
    }

    /**
     * Right-side resources keyed by the relationship that reached them.
     */
    public Map<RelationshipAttribute, Set<T>> getRightResources() {
        var result = new LinkedHashMap<RelationshipAttribute, Set<T>>();
        for (var group : groups) {
            result.put(group.proxy().attribute(), group.rightResources());
        }
        return result;
    }

    /**
     * Left-side resources keyed by the relationship they hold.
     */
    public Map<RelationshipAttribute, Set<Object>> getLeftResources() {
        var result = new LinkedHashMap<RelationshipAttribute, Set<Object>>();
        for (var group : groups) {
            result.put(group.proxy().attribute(), group.leftResources());
        }
        return result;
    }

    public boolean isEmpty() {
        return groups.isEmpty();
    }

    @Override
    public Iterator<RelationshipGroup<T>> iterator() {
        return groups.iterator();
    }
}
