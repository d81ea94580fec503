package io.resthooks.service;

import io.resthooks.core.RelationshipAttribute;
import io.resthooks.core.ResourceHooksException;
import io.resthooks.core.ResourceMetadata;
import io.resthooks.core.TypedCollections;
import io.resthooks.graph.IdentifiableSet;
import io.resthooks.graph.ResourceGraph;
import io.resthooks.hooks.ResourcePipeline;
import io.resthooks.hooks.execution.ResourceHookExecutorFactory;
import io.resthooks.request.DefaultIncludeService;
import io.resthooks.request.DefaultTargetedFields;
import io.resthooks.request.IncludeService;
import io.resthooks.request.TargetedFields;
import io.resthooks.store.ResourceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs every resource operation through the hook pipeline around the store call.
 * <p>
 * Writes load the stored resource with all of its relationships, apply the request on
 * top of it and save it back. Hooks see the request resources before the write and the
 * stored resources after it.
 *
 * @param <T> the resource type
 */
public class DefaultResourceService<T> implements ResourceService<T> {
    private static final Logger LOGGER = LoggerFactory.getLogger(DefaultResourceService.class);

    private final Class<T> resourceType;
    private final ResourceGraph resourceGraph;
    private final ResourceStore store;
    private final ResourceHookExecutorFactory executorFactory;
    private final ResourceMetadata<T> metadata;

    public DefaultResourceService(Class<T> resourceType, ResourceGraph resourceGraph, ResourceStore store,
                                  ResourceHookExecutorFactory executorFactory) {
        this.resourceType = resourceType;
        this.resourceGraph = resourceGraph;
        this.store = store;
        this.executorFactory = executorFactory;
        this.metadata = resourceGraph.getMetadata(resourceType);
    }

    @Override
    public List<T> getAll(IncludeService includeService) {
        var executor = executorFactory.create(TargetedFields.none(), includeService);
        executor.beforeRead(resourceType, ResourcePipeline.GET, null);
        var resources = store.findAll(resourceType, includeService.get());
        executor.afterRead(resourceType, resources, ResourcePipeline.GET);
        return executor.onReturn(resourceType, resources, ResourcePipeline.GET);
    }

    @Override
    public T get(Object id, IncludeService includeService) {
        var executor = executorFactory.create(TargetedFields.none(), includeService);
        executor.beforeRead(resourceType, ResourcePipeline.GET_SINGLE, String.valueOf(id));
        var resources = new ArrayList<T>();
        store.findById(resourceType, id, includeService.get()).ifPresent(resources::add);
        if (resources.isEmpty()) {
            throw new ResourceNotFoundException(resourceType, id);
        }
        executor.afterRead(resourceType, resources, ResourcePipeline.GET_SINGLE);
        var returned = executor.onReturn(resourceType, resources, ResourcePipeline.GET_SINGLE);
        if (returned.isEmpty()) {
            throw new ResourceNotFoundException(resourceType, id);
        }
        return returned.get(0);
    }

    @Override
    public Object getRelationship(Object id, String relationshipName) {
        var relationship = requireRelationship(relationshipName);
        var includeService = new DefaultIncludeService(List.of(List.of(relationship)));
        var executor = executorFactory.create(TargetedFields.none(), includeService);
        executor.beforeRead(resourceType, ResourcePipeline.GET_RELATIONSHIP, String.valueOf(id));
        var resources = new ArrayList<T>();
        store.findById(resourceType, id, includeService.get()).ifPresent(resources::add);
        if (resources.isEmpty()) {
            throw new ResourceNotFoundException(resourceType, id);
        }
        executor.afterRead(resourceType, resources, ResourcePipeline.GET_RELATIONSHIP);
        var returned = executor.onReturn(resourceType, resources, ResourcePipeline.GET_RELATIONSHIP);
        if (returned.isEmpty()) {
            throw new ResourceNotFoundException(resourceType, id);
        }
        return relationship.getValue(returned.get(0));
    }

    @Override
    public Optional<T> create(T resource) {
        var targetedFields = targetAllFields();
        var executor = executorFactory.create(targetedFields, IncludeService.none());
        var resources = executor.beforeCreate(resourceType, listOf(resource), ResourcePipeline.POST);
        if (resources.isEmpty()) {
            LOGGER.debug("Creation of {} was filtered out by a hook", resourceType.getSimpleName());
            return Optional.empty();
        }
        store.save(resources.get(0));
        executor.afterCreate(resourceType, resources, ResourcePipeline.POST);
        return first(executor.onReturn(resourceType, resources, ResourcePipeline.POST));
    }

    @Override
    public Optional<T> update(Object id, T changes, TargetedFields targetedFields) {
        var stored = loadForWrite(id);
        metadata.setId(changes, id);
        var executor = executorFactory.create(targetedFields, IncludeService.none());
        var requested = executor.beforeUpdate(resourceType, listOf(changes), ResourcePipeline.PATCH);
        if (requested.isEmpty()) {
            LOGGER.debug("Update of {}#{} was filtered out by a hook", resourceType.getSimpleName(), id);
            return Optional.empty();
        }
        var request = requested.get(0);
        for (var attributeName : targetedFields.attributes()) {
            var attribute = metadata.attribute(attributeName);
            if (attribute == null) {
                throw new ResourceHooksException("Attribute '" + attributeName + "' does not exist on "
                        + resourceType.getSimpleName());
            }
            attribute.set(stored, attribute.get(request));
        }
        var tracked = trackedResources(stored);
        for (var relationship : targetedFields.relationships()) {
            relationship.setValue(stored, trackedValue(relationship, relationship.getValue(request), tracked));
        }
        store.save(stored);
        var resources = listOf(stored);
        executor.afterUpdate(resourceType, resources, ResourcePipeline.PATCH);
        return first(executor.onReturn(resourceType, resources, ResourcePipeline.PATCH));
    }

    /**
     * The new value is assigned before {@code beforeUpdate} fires, so hooks see the
     * requested relationship value and the stored value through the diff.
     */
    @Override
    public void updateRelationship(Object id, String relationshipName, Object value) {
        var relationship = requireRelationship(relationshipName);
        var stored = loadForWrite(id);
        relationship.setValue(stored, trackedValue(relationship, value, trackedResources(stored)));
        var targetedFields = new DefaultTargetedFields().addRelationship(relationship);
        var executor = executorFactory.create(targetedFields, IncludeService.none());
        var resources = executor.beforeUpdate(resourceType, listOf(stored), ResourcePipeline.PATCH_RELATIONSHIP);
        if (resources.isEmpty()) {
            LOGGER.debug("Relationship update of {}#{} was filtered out by a hook", resourceType.getSimpleName(), id);
            return;
        }
        store.save(stored);
        executor.afterUpdate(resourceType, resources, ResourcePipeline.PATCH_RELATIONSHIP);
    }

    @Override
    public boolean delete(Object id) {
        var resource = metadata.newInstance();
        metadata.setId(resource, id);
        var executor = executorFactory.create();
        var resources = executor.beforeDelete(resourceType, listOf(resource), ResourcePipeline.DELETE);
        if (resources.isEmpty()) {
            LOGGER.debug("Deletion of {}#{} was filtered out by a hook", resourceType.getSimpleName(), id);
            return false;
        }
        var succeeded = store.deleteById(resourceType, id);
        executor.afterDelete(resourceType, resources, ResourcePipeline.DELETE, succeeded);
        if (!succeeded) {
            throw new ResourceNotFoundException(resourceType, id);
        }
        return true;
    }

    private T loadForWrite(Object id) {
        return store.findById(resourceType, id, ResourceStore.chainsOf(metadata.relationships()))
                .orElseThrow(() -> new ResourceNotFoundException(resourceType, id));
    }

    private IdentifiableSet<Object> trackedResources(T stored) {
        var tracked = new IdentifiableSet<Object>(resourceGraph);
        tracked.add(stored);
        for (var relationship : metadata.relationships()) {
            tracked.addAll(TypedCollections.elements(relationship.getValue(stored)));
        }
        return tracked;
    }

    /**
     * Replace requested related resources by the instances tracked for the stored
     * resource, loading the ones not reachable from it. The stored graph never holds a
     * request instance next to a tracked instance of the same resource.
     */
    private Object trackedValue(RelationshipAttribute relationship, Object requested, IdentifiableSet<Object> tracked) {
        if (requested == null) {
            return null;
        }
        var elements = TypedCollections.elements(requested);
        var missingIds = new ArrayList<Object>();
        for (var element : elements) {
            var elementId = resourceGraph.getId(element);
            if (elementId != null && !tracked.contains(element)) {
                missingIds.add(elementId);
            }
        }
        if (!missingIds.isEmpty()) {
            tracked.addAll(store.findAllById(relationship.rightType(), missingIds, List.of()));
        }
        var resolved = new ArrayList<Object>(elements.size());
        for (var element : elements) {
            var trackedElement = tracked.find(element);
            if (trackedElement != null) {
                resolved.add(trackedElement);
            } else if (resourceGraph.getId(element) == null) {
                resolved.add(element);
            } else {
                throw new ResourceNotFoundException(relationship.rightType(), resourceGraph.getId(element));
            }
        }
        if (!relationship.isCollection()) {
            return resolved.isEmpty() ? null : resolved.get(0);
        }
        return resolved;
    }

    // A create request sets every field of the new resource
    private TargetedFields targetAllFields() {
        var targetedFields = new DefaultTargetedFields();
        for (var attribute : metadata.attributes()) {
            targetedFields.addAttribute(attribute.name());
        }
        for (var relationship : metadata.relationships()) {
            targetedFields.addRelationship(relationship);
        }
        return targetedFields;
    }

    private RelationshipAttribute requireRelationship(String relationshipName) {
        var relationship = resourceGraph.getRelationship(resourceType, relationshipName);
        if (relationship == null) {
            throw new ResourceHooksException("Relationship '" + relationshipName + "' does not exist on "
                    + resourceType.getSimpleName());
        }
        return relationship;
    }

    private List<T> listOf(T resource) {
        var resources = new ArrayList<T>();
        resources.add(resource);
        return resources;
    }

    private static <T> Optional<T> first(List<T> resources) {
        return resources.isEmpty() ? Optional.empty() : Optional.of(resources.get(0));
    }
}
