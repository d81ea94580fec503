package io.resthooks.request;

import io.resthooks.core.RelationshipAttribute;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

public final class DefaultTargetedFields implements TargetedFields {
    private final Set<String> attributes = new LinkedHashSet<>();
    private final Set<RelationshipAttribute> relationships = new LinkedHashSet<>();

    public DefaultTargetedFields addAttribute(String attributeName) {
        attributes.add(attributeName);
        return this;
    }

    public DefaultTargetedFields addRelationship(RelationshipAttribute relationship) {
        relationships.add(relationship);
        return this;
    }

    @Override
    public Set<String> attributes() {
        return Collections.unmodifiableSet(attributes);
    }

    @Override
    public Set<RelationshipAttribute> relationships() {
        return Collections.unmodifiableSet(relationships);
    }
}
