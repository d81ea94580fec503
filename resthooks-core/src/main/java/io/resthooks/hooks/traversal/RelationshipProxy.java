package io.resthooks.hooks.traversal;

import io.resthooks.core.RelationshipAttribute;
import io.resthooks.core.RelationshipAttribute.RelationshipType;
import io.resthooks.core.TypedCollections;
import io.resthooks.graph.IdentifiableSet;
import io.resthooks.graph.ResourceGraph;

import java.util.ArrayList;
import java.util.Collection;

/**
 * A relationship as traversed by the hook engine.
 * <p>
 * For has-many-through relationships whose join entity has an id, the traversal visits
 * the join entities as a layer of their own and {@link #rightType()} is the join type.
 * Otherwise the join entities are skipped and the proxy reads and writes the related
 * resources directly.
 */
public final class RelationshipProxy {
    private final RelationshipAttribute attribute;
    private final Class<?> rightType;
    private final boolean skipJoinTable;
    private final boolean contextRelation;
    private final ResourceGraph resourceGraph;

    public RelationshipProxy(RelationshipAttribute attribute, boolean contextRelation, ResourceGraph resourceGraph) {
        this.attribute = attribute;
        this.contextRelation = contextRelation;
        this.resourceGraph = resourceGraph;
        if (attribute.relationshipType() == RelationshipType.HAS_MANY_THROUGH && attribute.through().identifiable()) {
            this.rightType = attribute.through().throughType();
            this.skipJoinTable = false;
        } else {
            this.rightType = attribute.rightType();
            this.skipJoinTable = attribute.relationshipType() == RelationshipType.HAS_MANY_THROUGH;
        }
    }

    public RelationshipAttribute attribute() {
        return attribute;
    }

    public Class<?> leftType() {
        return attribute.leftType();
    }

    public Class<?> rightType() {
        return rightType;
    }

    /**
     * True when the current request targets this relationship.
     */
    public boolean isContextRelation() {
        return contextRelation;
    }

    public RelationshipValue getValue(Object left) {
        Object raw = isJoinLayer()
                ? attribute.through().throughField().get(left)
                : attribute.getValue(left);
        if (raw == null) {
            return new RelationshipValue.Empty();
        }
        if (raw instanceof Collection<?>) {
            return new RelationshipValue.Many(TypedCollections.elements(raw));
        }
        return new RelationshipValue.Single(raw);
    }

    /**
     * Write back a relationship value: null, a single resource, or a collection that is
     * copied into the field's declared collection type.
     */
    public void setValue(Object left, Object value) {
        if (isJoinLayer()) {
            setJoinEntities(left, value);
        } else if (skipJoinTable) {
            setRightsKeepingJoinEntities(left, value);
        } else {
            attribute.setValue(left, value);
        }
    }

    private boolean isJoinLayer() {
        return attribute.relationshipType() == RelationshipType.HAS_MANY_THROUGH && !skipJoinTable;
    }

    private void setJoinEntities(Object left, Object value) {
        var through = attribute.through();
        if (value == null) {
            through.throughField().set(left, null);
            attribute.setValue(left, null);
            return;
        }
        var joinEntities = TypedCollections.elements(value);
        through.throughField().set(left, TypedCollections.copyTo(joinEntities, through.throughField().type()));
        var rights = new ArrayList<Object>(joinEntities.size());
        for (var joinEntity : joinEntities) {
            var right = through.rightProperty().get(joinEntity);
            if (right != null) {
                rights.add(right);
            }
        }
        attribute.accessor().set(left, TypedCollections.copyTo(rights, attribute.accessor().type()));
    }

    // Keep exactly the join entities whose right side is still present
    private void setRightsKeepingJoinEntities(Object left, Object value) {
        var through = attribute.through();
        var currentJoins = (Collection<?>) through.throughField().get(left);
        if (value == null) {
            through.throughField().set(left, null);
            attribute.accessor().set(left, null);
            return;
        }
        var rights = TypedCollections.elements(value);
        attribute.accessor().set(left, TypedCollections.copyTo(rights, attribute.accessor().type()));
        if (currentJoins == null) {
            return;
        }
        var retainedRights = new IdentifiableSet<Object>(resourceGraph, rights);
        var retainedJoins = new ArrayList<Object>();
        for (var joinEntity : currentJoins) {
            var right = through.rightProperty().get(joinEntity);
            if (right != null && retainedRights.contains(right)) {
                retainedJoins.add(joinEntity);
            }
        }
        through.throughField().set(left, TypedCollections.copyTo(retainedJoins, through.throughField().type()));
    }

    @Override
    public String toString() {
        return attribute + " -> " + rightType.getSimpleName();
    }
}
