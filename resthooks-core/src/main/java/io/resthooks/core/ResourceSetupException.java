package io.resthooks.core;

/**
 * Thrown when resource metadata or hook definitions are declared inconsistently,
 * for example a {@code mappedBy} that names a missing field.
 */
public class ResourceSetupException extends ResourceHooksException {

    public ResourceSetupException(String message) {
        super(message);
    }

    public ResourceSetupException(String message, Throwable cause) {
        super(message, cause);
    }
}
