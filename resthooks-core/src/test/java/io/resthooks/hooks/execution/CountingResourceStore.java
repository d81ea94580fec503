package io.resthooks.hooks.execution;

import io.resthooks.core.RelationshipAttribute;
import io.resthooks.store.ResourceStore;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Counts the loads made through a delegate store.
 */
class CountingResourceStore implements ResourceStore {
    private final ResourceStore delegate;
    private int loads;

    CountingResourceStore(ResourceStore delegate) {
        this.delegate = delegate;
    }

    int loads() {
        return loads;
    }

    @Override
    public <T> List<T> findAll(Class<T> resourceType, List<List<RelationshipAttribute>> include) {
        loads++;
        return delegate.findAll(resourceType, include);
    }

    @Override
    public <T> Optional<T> findById(Class<T> resourceType, Object id, List<List<RelationshipAttribute>> include) {
        loads++;
        return delegate.findById(resourceType, id, include);
    }

    @Override
    public <T> List<T> findAllById(Class<T> resourceType, Collection<?> ids, List<List<RelationshipAttribute>> include) {
        loads++;
        return delegate.findAllById(resourceType, ids, include);
    }

    @Override
    public <T> T save(T resource) {
        return delegate.save(resource);
    }

    @Override
    public boolean delete(Object resource) {
        return delegate.delete(resource);
    }

    @Override
    public boolean deleteById(Class<?> resourceType, Object id) {
        return delegate.deleteById(resourceType, id);
    }
}
