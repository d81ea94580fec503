package io.resthooks.hooks;

import io.resthooks.core.ResourceSetupException;

import java.lang.reflect.ParameterizedType;
import java.util.Collection;
import java.util.Set;

/**
 * Base class for hook implementations. Every hook passes its input through unchanged;
 * a hook counts as implemented once a subclass overrides it.
 *
 * <pre>
 * public class TagDefinition extends ResourceDefinition&lt;Tag&gt; {
 *     &#64;Override
 *     public Collection&lt;Tag&gt; onReturn(Set&lt;Tag&gt; tags, ResourcePipeline pipeline) {
 *         return tags.stream().filter(tag -&gt; !tag.isHidden()).toList();
 *     }
 * }
 * </pre>
 *
 * @param <T> the resource type
 */
public abstract class ResourceDefinition<T> implements ResourceHookContainer<T> {

    private final Class<T> resourceType;

    protected ResourceDefinition(Class<T> resourceType) {
        this.resourceType = resourceType;
    }

    /**
     * Resolve the resource type from the type argument of a direct subclass.
     */
    protected ResourceDefinition() {
        this.resourceType = resolveResourceType(getClass());
    }

    @SuppressWarnings("unchecked")
    private static <T> Class<T> resolveResourceType(Class<?> definitionClass) {
        Class<?> current = definitionClass;
        while (current.getSuperclass() != ResourceDefinition.class) {
            current = current.getSuperclass();
            if (current == null) {
                throw new ResourceSetupException("Cannot resolve resource type of " + definitionClass.getName());
            }
        }
        if (current.getGenericSuperclass() instanceof ParameterizedType parameterized
                && parameterized.getActualTypeArguments()[0] instanceof Class<?> type) {
            return (Class<T>) type;
        }
        throw new ResourceSetupException("Cannot resolve resource type of " + definitionClass.getName()
                + ": pass it to the constructor");
    }

    @Override
    public Class<T> resourceType() {
        return resourceType;
    }

    @Override
    public void beforeRead(ResourcePipeline pipeline, boolean isIncluded, String stringId) {
    }

    @Override
    public Collection<T> beforeCreate(ResourceHashSet<T> resources, ResourcePipeline pipeline) {
        return resources;
    }

    @Override
    public Collection<T> beforeUpdate(DiffableResourceHashSet<T> resources, ResourcePipeline pipeline) {
        return resources;
    }

    @Override
    public Collection<T> beforeDelete(ResourceHashSet<T> resources, ResourcePipeline pipeline) {
        return resources;
    }

    @Override
    public Set<String> beforeUpdateRelationship(Set<String> ids, RelationshipsDictionary<T> resourcesByRelationship,
                                                ResourcePipeline pipeline) {
        return ids;
    }

    @Override
    public void beforeImplicitUpdateRelationship(RelationshipsDictionary<T> resourcesByRelationship, ResourcePipeline pipeline) {
    }

    @Override
    public Collection<T> onReturn(Set<T> resources, ResourcePipeline pipeline) {
        return resources;
    }

    @Override
    public void afterCreate(Set<T> resources, ResourcePipeline pipeline) {
    }

    @Override
    public void afterRead(Set<T> resources, ResourcePipeline pipeline, boolean isIncluded) {
    }

    @Override
    public void afterUpdate(Set<T> resources, ResourcePipeline pipeline) {
    }

    @Override
    public void afterDelete(Set<T> resources, ResourcePipeline pipeline, boolean succeeded) {
    }

    @Override
    public void afterUpdateRelationship(RelationshipsDictionary<T> resourcesByRelationship, ResourcePipeline pipeline) {
    }
}
