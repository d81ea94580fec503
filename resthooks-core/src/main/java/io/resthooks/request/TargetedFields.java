package io.resthooks.request;

import io.resthooks.core.RelationshipAttribute;

import java.util.Set;

/**
 * The attributes and relationships a write request sets on its primary resources.
 */
public interface TargetedFields {

    Set<String> attributes();

    Set<RelationshipAttribute> relationships();

    static TargetedFields none() {
        return new DefaultTargetedFields();
    }
}
