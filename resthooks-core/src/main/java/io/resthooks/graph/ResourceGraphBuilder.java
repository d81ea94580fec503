package io.resthooks.graph;

import io.resthooks.core.MetadataExtractor;
import io.resthooks.core.RelationshipAttribute.RelationshipType;
import io.resthooks.core.ResourceHooksConfiguration;
import io.resthooks.core.ResourceMetadata;
import io.resthooks.core.ResourceMetadataProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Collects resource types and extracts their metadata.
 * <p>
 * Types reachable through relationships are registered as well, including join
 * entities of has-many-through relationships that declare an id of their own.
 */
public final class ResourceGraphBuilder {
    private static final Logger LOGGER = LoggerFactory.getLogger(ResourceGraphBuilder.class);

    private final ResourceMetadataProvider metadataProvider;
    private final Set<Class<?>> resourceTypes = new LinkedHashSet<>();

    public ResourceGraphBuilder() {
        this(ResourceHooksConfiguration.builder().build());
    }

    public ResourceGraphBuilder(ResourceHooksConfiguration configuration) {
        this.metadataProvider = configuration.resourceMetadataProvider();
    }

    public ResourceGraphBuilder add(Class<?> resourceType) {
        if (!MetadataExtractor.isIdentifiable(resourceType)) {
            LOGGER.warn("Type '{}' declares no id and is not registered as a resource", resourceType.getName());
            return this;
        }
        resourceTypes.add(resourceType);
        return this;
    }

    public ResourceGraphBuilder addAll(Iterable<Class<?>> types) {
        for (var type : types) {
            add(type);
        }
        return this;
    }

    public ResourceGraph build() {
        Map<Class<?>, ResourceMetadata<?>> metadataByType = new LinkedHashMap<>();
        var pending = new ArrayDeque<>(resourceTypes);
        while (!pending.isEmpty()) {
            var type = pending.poll();
            if (metadataByType.containsKey(type)) {
                continue;
            }
            var metadata = metadataProvider.getMetadata(type);
            metadataByType.put(type, metadata);
            for (var relationship : metadata.relationships()) {
                if (relationship.relationshipType() == RelationshipType.HAS_MANY_THROUGH
                        && relationship.through().identifiable()) {
                    pending.add(relationship.through().throughType());
                }
                if (MetadataExtractor.isIdentifiable(relationship.rightType())) {
                    pending.add(relationship.rightType());
                } else {
                    LOGGER.warn("Related type '{}' of {} declares no id and is not registered as a resource",
                            relationship.rightType().getName(), relationship);
                }
            }
        }
        LOGGER.debug("Built resource graph with {} resource types", metadataByType.size());
        return new DefaultResourceGraph(metadataByType);
    }
}
