package io.resthooks.request;

import io.resthooks.core.ResourceHooksException;

/**
 * Thrown when an include path names an unknown relationship or one that cannot be included.
 */
public class InvalidIncludeException extends ResourceHooksException {

    private final String path;

    public InvalidIncludeException(String message, String path) {
        super(message);
        this.path = path;
    }

    public String path() {
        return path;
    }
}
