package io.resthooks.hooks.traversal;

import java.util.Iterator;
import java.util.List;

/**
 * All nodes at one depth of the traversal, one per resource type.
 */
public final class NodeLayer implements Iterable<Node> {
    private final List<Node> nodes;

    public NodeLayer(List<Node> nodes) {
        this.nodes = List.copyOf(nodes);
    }

    public boolean anyResources() {
        for (var node : nodes) {
            if (!node.uniqueResources().isEmpty()) {
                return true;
            }
        }
        return false;
    }

    public List<Node> nodes() {
        return nodes;
    }

    @Override
    public Iterator<Node> iterator() {
        return nodes.iterator();
    }

    @Override
    public String toString() {
        return "NodeLayer" + nodes;
    }
}
