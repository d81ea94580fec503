package io.resthooks.hooks.execution;

import io.resthooks.hooks.ResourcePipeline;

import java.util.Collection;

/**
 * Executor used when resource hooks are disabled.
 */
public final class NoopResourceHookExecutor implements ResourceHookExecutor {

    public static final NoopResourceHookExecutor INSTANCE = new NoopResourceHookExecutor();

    private NoopResourceHookExecutor() {
    }

    @Override
    public <T> void beforeRead(Class<T> resourceType, ResourcePipeline pipeline, String stringId) {
    }

    @Override
    public <T, C extends Collection<T>> C beforeCreate(Class<T> resourceType, C resources, ResourcePipeline pipeline) {
        return resources;
    }

    @Override
    public <T, C extends Collection<T>> C beforeUpdate(Class<T> resourceType, C resources, ResourcePipeline pipeline) {
        return resources;
    }

    @Override
    public <T, C extends Collection<T>> C beforeDelete(Class<T> resourceType, C resources, ResourcePipeline pipeline) {
        return resources;
    }

    @Override
    public <T, C extends Collection<T>> C onReturn(Class<T> resourceType, C resources, ResourcePipeline pipeline) {
        return resources;
    }

    @Override
    public <T> void afterRead(Class<T> resourceType, Collection<T> resources, ResourcePipeline pipeline) {
    }

    @Override
    public <T> void afterCreate(Class<T> resourceType, Collection<T> resources, ResourcePipeline pipeline) {
    }

    @Override
    public <T> void afterUpdate(Class<T> resourceType, Collection<T> resources, ResourcePipeline pipeline) {
    }

    @Override
    public <T> void afterDelete(Class<T> resourceType, Collection<T> resources, ResourcePipeline pipeline, boolean succeeded) {
    }
}
