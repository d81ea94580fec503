package io.resthooks.core;

public class ResourceHooksException extends RuntimeException {

    public ResourceHooksException(Throwable cause) {
        super(cause);
    }

    public ResourceHooksException(String message, Throwable cause) {
        super(message, cause);
    }

    public ResourceHooksException(String message) {
        super(message);
    }

}
