package io.resthooks.hooks.traversal;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * One resource type at one depth of a breadth-first hook traversal.
 */
public interface Node {

    Class<?> resourceType();

    /**
     * The deduplicated resources of this node.
     */
    Set<?> uniqueResources();

    /**
     * Relationships of this node's resources that lead into the next layer.
     */
    List<RelationshipProxy> relationshipsToNextLayer();

    /**
     * The edges through which the previous layer reached this node; empty for a root node.
     */
    RelationshipsFromPreviousLayer<?> relationshipsFromPreviousLayer();

    /**
     * Keep only the resources present in {@code updated}. Resources that are dropped are
     * remembered for {@link #reassign()}.
     */
    void updateUnique(Collection<?> updated);

    /**
     * Detach every resource dropped by {@link #updateUnique} from the object graph that
     * led to this node.
     */
    void reassign();
}
