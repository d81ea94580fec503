package io.resthooks.core;

import io.resthooks.hooks.ResourcePipeline;

/**
 * Thrown when a hook implementation returns a result that the current pipeline cannot
 * serve, such as several resources for a single-resource response.
 */
public class InvalidHookResponseException extends ResourceHooksException {

    private final ResourcePipeline pipeline;

    public InvalidHookResponseException(String message, ResourcePipeline pipeline) {
        super(message);
        this.pipeline = pipeline;
    }

    public ResourcePipeline pipeline() {
        return pipeline;
    }
}
