package io.resthooks.core;

import io.resthooks.core.RelationshipAttribute.RelationshipType;
import io.resthooks.core.RelationshipAttribute.ThroughMapping;
import jakarta.persistence.Id;
import jakarta.persistence.ManyToMany;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OneToOne;
import jakarta.persistence.Transient;

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Extracts resource metadata from annotated entity classes.
 * All reflection work happens once per resource type.
 *
 * <p>Relationships are read from the Jakarta Persistence annotations:
 * <ul>
 *   <li>{@code @ManyToOne} and {@code @OneToOne} declare has-one relationships</li>
 *   <li>{@code @OneToMany} and {@code @ManyToMany} declare has-many relationships</li>
 *   <li>{@link HasManyThrough} on a collection declares a relationship stored through join entities</li>
 * </ul>
 * Inverses are paired through {@code mappedBy} in both directions. A relationship
 * without a {@code mappedBy} partner has no inverse.
 */
public final class MetadataExtractor {

    private MetadataExtractor() {
    }

    /**
     * Extract metadata from a resource class.
     *
     * @param resourceClass the resource class
     * @return the resource metadata
     * @throws ResourceSetupException if the class is not a valid resource
     */
    public static <T> ResourceMetadata<T> extractResourceMetadata(Class<T> resourceClass) {
        Constructor<T> constructor;
        try {
            constructor = resourceClass.getDeclaredConstructor();
            constructor.setAccessible(true);
        } catch (NoSuchMethodException e) {
            throw new ResourceSetupException("Resource requires a no-arg constructor: " + resourceClass.getName(), e);
        }

        var idField = findIdField(resourceClass);
        if (idField == null) {
            throw new ResourceSetupException("No @Id field found on resource: " + resourceClass.getName());
        }

        var joinFields = throughFieldNames(resourceClass);
        var attributes = new ArrayList<FieldAccessor>();
        var relationships = new ArrayList<RelationshipAttribute>();
        for (var field : instanceFields(resourceClass)) {
            if (field.equals(idField) || joinFields.contains(field.getName())) {
                continue;
            }
            HasManyThrough hasManyThrough = field.getAnnotation(HasManyThrough.class);
            if (hasManyThrough != null) {
                relationships.add(createThroughRelationship(resourceClass, field, hasManyThrough));
            } else if (isRelationship(field)) {
                relationships.add(createRelationship(resourceClass, field));
            } else if (!field.isAnnotationPresent(Transient.class)) {
                attributes.add(FieldAccessor.of(field));
            }
        }

        return new ResourceMetadata<>(resourceClass, constructor, FieldAccessor.of(idField), attributes, relationships);
    }

    /**
     * Check whether a type declares an id, which makes it usable as a resource.
     *
     * @param type the candidate type
     * @return true if an {@code @Id} field or a field named {@code id} exists
     */
    public static boolean isIdentifiable(Class<?> type) {
        return findIdField(type) != null;
    }

    private static Field findIdField(Class<?> type) {
        Field named = null;
        for (var field : instanceFields(type)) {
            if (field.isAnnotationPresent(Id.class)) {
                return field;
            }
            if (named == null && field.getName().equals("id")) {
                named = field;
            }
        }
        return named;
    }

    private static RelationshipAttribute createRelationship(Class<?> resourceClass, Field field) {
        RelationshipType relationshipType = isHasOne(field) ? RelationshipType.HAS_ONE : RelationshipType.HAS_MANY;
        Class<?> rightType = resolveTargetType(field);
        String mappedBy = mappedByOf(field);
        boolean mappedBySide = !mappedBy.isBlank();
        String inverseName;
        if (mappedBySide) {
            Field inverseField = findField(rightType, mappedBy);
            if (inverseField == null || !isRelationship(inverseField)) {
                throw new ResourceSetupException("mappedBy relationship not found: "
                        + rightType.getName() + "#" + mappedBy + " (declared on "
                        + resourceClass.getName() + "#" + field.getName() + ")");
            }
            inverseName = mappedBy;
        } else {
            inverseName = findMappedByPartner(resourceClass, field.getName(), rightType);
        }

        return new RelationshipAttribute(
                field.getName(),
                resourceClass,
                rightType,
                relationshipType,
                FieldAccessor.of(field),
                inverseName,
                mappedBySide,
                !field.isAnnotationPresent(NotIncludable.class),
                null
        );
    }

    private static RelationshipAttribute createThroughRelationship(Class<?> resourceClass, Field field, HasManyThrough annotation) {
        Class<?> rightType = TypedCollections.elementType(field);
        if (rightType == null) {
            throw new ResourceSetupException("@HasManyThrough requires a parameterized collection: "
                    + resourceClass.getName() + "#" + field.getName());
        }
        Field throughField = findField(resourceClass, annotation.through());
        if (throughField == null) {
            throw new ResourceSetupException("Join collection not found: "
                    + resourceClass.getName() + "#" + annotation.through());
        }
        Class<?> throughType = TypedCollections.elementType(throughField);
        if (throughType == null) {
            throw new ResourceSetupException("Join collection requires a parameterized collection: "
                    + resourceClass.getName() + "#" + annotation.through());
        }

        Constructor<?> throughConstructor;
        try {
            throughConstructor = throughType.getDeclaredConstructor();
            throughConstructor.setAccessible(true);
        } catch (NoSuchMethodException e) {
            throw new ResourceSetupException("Join entity requires a no-arg constructor: " + throughType.getName(), e);
        }

        Field leftProperty = findJoinProperty(throughType, annotation.leftProperty(), resourceClass, annotation.rightProperty());
        Field rightProperty = findJoinProperty(throughType, annotation.rightProperty(), rightType, leftProperty.getName());

        var through = new ThroughMapping(
                FieldAccessor.of(throughField),
                throughType,
                throughConstructor,
                FieldAccessor.of(leftProperty),
                FieldAccessor.of(rightProperty),
                isIdentifiable(throughType)
        );

        return new RelationshipAttribute(
                field.getName(),
                resourceClass,
                rightType,
                RelationshipType.HAS_MANY_THROUGH,
                FieldAccessor.of(field),
                null,
                false,
                !field.isAnnotationPresent(NotIncludable.class),
                through
        );
    }

    private static Field findJoinProperty(Class<?> throughType, String explicitName, Class<?> targetType, String excludedName) {
        if (!explicitName.isBlank()) {
            Field field = findField(throughType, explicitName);
            if (field == null) {
                throw new ResourceSetupException("Join property not found: " + throughType.getName() + "#" + explicitName);
            }
            return field;
        }
        var candidates = new ArrayList<Field>();
        for (var field : instanceFields(throughType)) {
            if (field.getType().isAssignableFrom(targetType)
                    && field.getType() != Object.class
                    && !field.getName().equals(excludedName)) {
                candidates.add(field);
            }
        }
        if (candidates.size() != 1) {
            throw new ResourceSetupException("Cannot infer join property for " + targetType.getSimpleName()
                    + " on " + throughType.getName() + ": found " + candidates.size() + " candidates");
        }
        return candidates.get(0);
    }

    /**
     * Find the field on {@code rightType} that names {@code fieldName} as its mappedBy partner.
     */
    private static String findMappedByPartner(Class<?> resourceClass, String fieldName, Class<?> rightType) {
        var joinFields = throughFieldNames(rightType);
        for (var candidate : instanceFields(rightType)) {
            if (joinFields.contains(candidate.getName()) || !isRelationship(candidate)) {
                continue;
            }
            if (fieldName.equals(mappedByOf(candidate))
                    && resolveTargetType(candidate).isAssignableFrom(resourceClass)) {
                return candidate.getName();
            }
        }
        return null;
    }

    private static Set<String> throughFieldNames(Class<?> type) {
        var names = new HashSet<String>();
        for (var field : instanceFields(type)) {
            HasManyThrough hasManyThrough = field.getAnnotation(HasManyThrough.class);
            if (hasManyThrough != null) {
                names.add(hasManyThrough.through());
            }
        }
        return names;
    }

    private static boolean isRelationship(Field field) {
        return field.isAnnotationPresent(ManyToOne.class)
                || field.isAnnotationPresent(OneToOne.class)
                || field.isAnnotationPresent(OneToMany.class)
                || field.isAnnotationPresent(ManyToMany.class);
    }

    private static boolean isHasOne(Field field) {
        return field.isAnnotationPresent(ManyToOne.class) || field.isAnnotationPresent(OneToOne.class);
    }

    private static String mappedByOf(Field field) {
        OneToOne oneToOne = field.getAnnotation(OneToOne.class);
        if (oneToOne != null) {
            return oneToOne.mappedBy();
        }
        OneToMany oneToMany = field.getAnnotation(OneToMany.class);
        if (oneToMany != null) {
            return oneToMany.mappedBy();
        }
        ManyToMany manyToMany = field.getAnnotation(ManyToMany.class);
        if (manyToMany != null) {
            return manyToMany.mappedBy();
        }
        return "";
    }

    private static Class<?> resolveTargetType(Field field) {
        Class<?> explicit = void.class;
        ManyToOne manyToOne = field.getAnnotation(ManyToOne.class);
        OneToOne oneToOne = field.getAnnotation(OneToOne.class);
        OneToMany oneToMany = field.getAnnotation(OneToMany.class);
        ManyToMany manyToMany = field.getAnnotation(ManyToMany.class);
        if (manyToOne != null) {
            explicit = manyToOne.targetEntity();
        } else if (oneToOne != null) {
            explicit = oneToOne.targetEntity();
        } else if (oneToMany != null) {
            explicit = oneToMany.targetEntity();
        } else if (manyToMany != null) {
            explicit = manyToMany.targetEntity();
        }
        if (explicit != null && explicit != void.class) {
            return explicit;
        }
        if (!TypedCollections.isCollection(field.getType())) {
            return field.getType();
        }
        Class<?> elementType = TypedCollections.elementType(field);
        if (elementType == null) {
            throw new ResourceSetupException("Cannot resolve related type of "
                    + field.getDeclaringClass().getName() + "#" + field.getName());
        }
        return elementType;
    }

    private static Field findField(Class<?> type, String name) {
        for (var field : instanceFields(type)) {
            if (field.getName().equals(name)) {
                return field;
            }
        }
        return null;
    }

    // Superclass fields first, declaration order within each class
    private static List<Field> instanceFields(Class<?> type) {
        var hierarchy = new ArrayList<Class<?>>();
        for (Class<?> current = type; current != null && current != Object.class; current = current.getSuperclass()) {
            hierarchy.add(0, current);
        }
        var fields = new ArrayList<Field>();
        for (var current : hierarchy) {
            for (var field : current.getDeclaredFields()) {
                if (!Modifier.isStatic(field.getModifiers()) && !field.isSynthetic()) {
                    fields.add(field);
                }
            }
        }
        return fields;
    }
}
