package io.resthooks.hooks;

import io.resthooks.core.RelationshipAttribute;
import io.resthooks.graph.IdentifiableSet;
import io.resthooks.graph.ResourceGraph;

import java.util.Collection;
import java.util.Map;
import java.util.Set;

/**
 * The resources handed to a before hook, with the relationships through which they
 * reach other resources in the request.
 *
 * @param <T> the resource type
 */
public class ResourceHashSet<T> extends IdentifiableSet<T> {

    private final RelationshipsDictionary<T> relationships;

    public ResourceHashSet(ResourceGraph resourceGraph, Collection<? extends T> resources,
                           Map<RelationshipAttribute, ? extends Set<T>> relationships) {
        super(resourceGraph, resources);
        this.relationships = new RelationshipsDictionary<>(relationships);
    }

    /**
     * Populated relationships of these resources, each mapped to the resources holding a value for it.
     */
    public RelationshipsDictionary<T> affectedRelationships() {
        return relationships;
    }

    public Map<RelationshipAttribute, Set<T>> getByRelationship(Class<?> rightType) {
        return relationships.getByRelationship(rightType);
    }

    public Set<T> getAffected(String relationshipName) {
        return relationships.getAffected(relationshipName);
    }
}
