package io.resthooks.hooks;

/**
 * The kind of request that triggered a hook execution. Hooks can branch on it to
 * behave differently per endpoint shape.
 */
public enum ResourcePipeline {
    NONE,
    /** Fetch a collection of resources. */
    GET,
    /** Fetch one resource by id. */
    GET_SINGLE,
    /** Fetch the related resources of one relationship. */
    GET_RELATIONSHIP,
    /** Create a resource. */
    POST,
    /** Update the attributes and relationships of a resource. */
    PATCH,
    /** Replace the value of one relationship. */
    PATCH_RELATIONSHIP,
    /** Delete a resource. */
    DELETE
}
