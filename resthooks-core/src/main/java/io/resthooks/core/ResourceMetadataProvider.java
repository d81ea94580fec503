package io.resthooks.core;

public interface ResourceMetadataProvider {
    <T> ResourceMetadata<T> getMetadata(Class<T> resourceClass);
}
