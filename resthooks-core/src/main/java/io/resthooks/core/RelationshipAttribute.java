package io.resthooks.core;

import java.lang.reflect.Constructor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Objects;

/**
 * A navigable relationship declared on a resource type.
 * <p>
 * Identity is the pair (left type, name), so one attribute instance per declared field
 * is shared by everything that refers to it.
 */
public final class RelationshipAttribute {

    public enum RelationshipType {
        HAS_ONE,
        HAS_MANY,
        HAS_MANY_THROUGH
    }

    /**
     * Join entity mapping of a {@link RelationshipType#HAS_MANY_THROUGH} relationship.
     */
    public record ThroughMapping(
            FieldAccessor throughField,
            Class<?> throughType,
            Constructor<?> throughConstructor,
            FieldAccessor leftProperty,
            FieldAccessor rightProperty,
            boolean identifiable
    ) {
        public Object newJoinEntity() {
            try {
                return throughConstructor.newInstance();
            } catch (ReflectiveOperationException e) {
                throw new ResourceHooksException("Cannot instantiate join entity " + throughType.getName(), e);
            }
        }
    }

    private final String name;
    private final Class<?> leftType;
    private final Class<?> rightType;
    private final RelationshipType relationshipType;
    private final FieldAccessor accessor;
    private final String inverseName;
    private final boolean mappedBySide;
    private final boolean canInclude;
    private final ThroughMapping through;

    public RelationshipAttribute(
            String name,
            Class<?> leftType,
            Class<?> rightType,
            RelationshipType relationshipType,
            FieldAccessor accessor,
            String inverseName,
            boolean mappedBySide,
            boolean canInclude,
            ThroughMapping through
    ) {
        if (relationshipType == RelationshipType.HAS_MANY_THROUGH && through == null) {
            throw new IllegalArgumentException("Has-many-through relationship requires a join mapping: " + name);
        }
        this.name = Objects.requireNonNull(name, "name");
        this.leftType = Objects.requireNonNull(leftType, "leftType");
        this.rightType = Objects.requireNonNull(rightType, "rightType");
        this.relationshipType = Objects.requireNonNull(relationshipType, "relationshipType");
        this.accessor = accessor;
        this.inverseName = inverseName == null || inverseName.isBlank() ? null : inverseName;
        this.mappedBySide = mappedBySide;
        this.canInclude = canInclude;
        this.through = through;
    }

    public String name() {
        return name;
    }

    public Class<?> leftType() {
        return leftType;
    }

    public Class<?> rightType() {
        return rightType;
    }

    public RelationshipType relationshipType() {
        return relationshipType;
    }

    /**
     * Name of the relationship on the right type that points back to the left type,
     * or null when the relationship is unidirectional.
     */
    public String inverseName() {
        return inverseName;
    }

    /**
     * True when this side is declared with {@code mappedBy}: its value is derived from
     * the owning side and is not stored on its own.
     */
    public boolean mappedBySide() {
        return mappedBySide;
    }

    public boolean canInclude() {
        return canInclude;
    }

    /**
     * The declared field. For has-many-through relationships this is the field exposing
     * the related resources, not the join collection.
     */
    public FieldAccessor accessor() {
        return accessor;
    }

    public ThroughMapping through() {
        return through;
    }

    public boolean isCollection() {
        return relationshipType != RelationshipType.HAS_ONE;
    }

    /**
     * Read the current value. Has-many-through relationships are read from the join
     * entities, falling back to the declared field while no join collection is set.
     */
    public Object getValue(Object resource) {
        if (relationshipType == RelationshipType.HAS_MANY_THROUGH) {
            var joinEntities = (Collection<?>) through.throughField().get(resource);
            if (joinEntities == null) {
                return accessor.get(resource);
            }
            var rights = new ArrayList<Object>(joinEntities.size());
            for (var joinEntity : joinEntities) {
                var right = through.rightProperty().get(joinEntity);
                if (right != null) {
                    rights.add(right);
                }
            }
            return TypedCollections.copyTo(rights, accessor.type());
        }
        return accessor.get(resource);
    }

    /**
     * Assign a new value. Collections are copied into the declared collection type;
     * has-many-through values also rebuild the join entities.
     */
    public void setValue(Object resource, Object value) {
        switch (relationshipType) {
            case HAS_ONE -> accessor.set(resource, value);
            case HAS_MANY -> accessor.set(resource, value == null
                    ? null
                    : TypedCollections.copyTo(TypedCollections.elements(value), accessor.type()));
            case HAS_MANY_THROUGH -> setThroughValue(resource, value);
        }
    }

    private void setThroughValue(Object resource, Object value) {
        if (value == null) {
            accessor.set(resource, null);
            through.throughField().set(resource, null);
            return;
        }
        var rights = TypedCollections.elements(value);
        accessor.set(resource, TypedCollections.copyTo(rights, accessor.type()));
        var joinEntities = new ArrayList<Object>(rights.size());
        for (var right : rights) {
            var joinEntity = through.newJoinEntity();
            through.leftProperty().set(joinEntity, resource);
            through.rightProperty().set(joinEntity, right);
            joinEntities.add(joinEntity);
        }
        through.throughField().set(resource, TypedCollections.copyTo(joinEntities, through.throughField().type()));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RelationshipAttribute other)) {
            return false;
        }
        return leftType.equals(other.leftType) && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(leftType, name);
    }

    @Override
    public String toString() {
        return leftType.getSimpleName() + "." + name;
    }
}
