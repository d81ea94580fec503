package io.resthooks.hooks;

/**
 * The lifecycle callbacks a {@link ResourceHookContainer} can implement.
 */
public enum ResourceHook {
    NONE,
    BEFORE_CREATE,
    BEFORE_READ,
    BEFORE_UPDATE,
    BEFORE_DELETE,
    BEFORE_UPDATE_RELATIONSHIP,
    BEFORE_IMPLICIT_UPDATE_RELATIONSHIP,
    ON_RETURN,
    AFTER_CREATE,
    AFTER_READ,
    AFTER_UPDATE,
    AFTER_DELETE,
    AFTER_UPDATE_RELATIONSHIP
}
