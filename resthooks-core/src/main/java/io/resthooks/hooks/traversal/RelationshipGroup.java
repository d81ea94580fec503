package io.resthooks.hooks.traversal;

import io.resthooks.graph.IdentifiableSet;

/**
 * The edges produced by one relationship between two adjacent layers.
 *
 * @param <T> the right-side resource type
 */
public final class RelationshipGroup<T> {
    private final RelationshipProxy proxy;
    private final IdentifiableSet<Object> leftResources;
    private final IdentifiableSet<T> rightResources;

    public RelationshipGroup(RelationshipProxy proxy, IdentifiableSet<Object> leftResources, IdentifiableSet<T> rightResources) {
        this.proxy = proxy;
        this.leftResources = leftResources;
        this.rightResources = rightResources;
    }

    public RelationshipProxy proxy() {
        return proxy;
    }

    public IdentifiableSet<Object> leftResources() {
        return leftResources;
    }

    public IdentifiableSet<T> rightResources() {
        return rightResources;
    }
}
