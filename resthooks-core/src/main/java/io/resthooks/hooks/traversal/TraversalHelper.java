package io.resthooks.hooks.traversal;

import java.util.Collection;
import java.util.List;

/**
 * Builds the layers of a breadth-first traversal over the resource graph.
 * <p>
 * A helper tracks the resources it has already visited since the last
 * {@link #createRootNode}, and never places a resource in a later layer twice. This
 * keeps traversals over cyclic graphs finite.
 */
public interface TraversalHelper {

    /**
     * Start a new traversal from the caller's resources.
     */
    <T> RootNode<T> createRootNode(Class<T> resourceType, Collection<T> rootResources);

    NodeLayer createNextLayer(Node node);

    NodeLayer createNextLayer(List<? extends Node> nodes);
}
