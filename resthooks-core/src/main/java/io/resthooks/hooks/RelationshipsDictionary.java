package io.resthooks.hooks;

import io.resthooks.core.RelationshipAttribute;

import java.util.AbstractMap;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Resources of one type grouped by the relationship through which they are affected.
 * Keys are relationships declared on the resource type itself.
 *
 * @param <T> the resource type
 */
public class RelationshipsDictionary<T> extends AbstractMap<RelationshipAttribute, Set<T>> {

    private final Map<RelationshipAttribute, Set<T>> resourcesByRelationship;

    public RelationshipsDictionary(Map<RelationshipAttribute, ? extends Set<T>> resourcesByRelationship) {
        var copy = new LinkedHashMap<RelationshipAttribute, Set<T>>();
        resourcesByRelationship.forEach((relationship, resources) ->
                copy.put(relationship, Collections.unmodifiableSet(resources)));
        this.resourcesByRelationship = Collections.unmodifiableMap(copy);
    }

    /**
     * Groups whose relationship points at {@code rightType}.
     */
    public Map<RelationshipAttribute, Set<T>> getByRelationship(Class<?> rightType) {
        var result = new LinkedHashMap<RelationshipAttribute, Set<T>>();
        resourcesByRelationship.forEach((relationship, resources) -> {
            if (relationship.rightType() == rightType) {
                result.put(relationship, resources);
            }
        });
        return result;
    }

    /**
     * @return the resources affected through the relationship called {@code relationshipName}, possibly empty
     */
    public Set<T> getAffected(String relationshipName) {
        for (var entry : resourcesByRelationship.entrySet()) {
            if (entry.getKey().name().equals(relationshipName)) {
                return entry.getValue();
            }
        }
        return Set.of();
    }

    @Override
    public Set<Entry<RelationshipAttribute, Set<T>>> entrySet() {
        return resourcesByRelationship.entrySet();
    }
}
