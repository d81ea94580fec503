package io.resthooks.hooks.traversal;

import java.util.List;

/**
 * The value of a relationship on one resource, as seen by the traversal.
 */
public sealed interface RelationshipValue {

    /**
     * @return the related resources, empty when the value is null
     */
    List<Object> elements();

    default boolean isEmpty() {
        return this instanceof Empty;
    }

    /** The relationship holds null. */
    record Empty() implements RelationshipValue {
        @Override
        public List<Object> elements() {
            return List.of();
        }
    }

    /** A has-one relationship holding a resource. */
    record Single(Object resource) implements RelationshipValue {
        @Override
        public List<Object> elements() {
            return List.of(resource);
        }
    }

    /** A collection relationship, possibly empty. */
    record Many(List<Object> resources) implements RelationshipValue {
        public Many {
            resources = List.copyOf(resources);
        }

        @Override
        public List<Object> elements() {
            return resources;
        }
    }
}
