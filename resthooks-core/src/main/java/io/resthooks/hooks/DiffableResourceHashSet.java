package io.resthooks.hooks;

import io.resthooks.core.RelationshipAttribute;
import io.resthooks.graph.IdentifiableSet;
import io.resthooks.graph.ResourceGraph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The resources handed to {@code beforeUpdate}, with access to their persisted values
 * and to the attributes targeted by the request.
 *
 * @param <T> the resource type
 */
public class DiffableResourceHashSet<T> extends ResourceHashSet<T> {

    private final IdentifiableSet<T> databaseValues;
    private final Set<String> targetedAttributes;

    /**
     * @param databaseValues persisted copies of the resources, or null when they were not loaded
     * @param targetedAttributes names of the attributes the request updates
     */
    public DiffableResourceHashSet(ResourceGraph resourceGraph, Collection<? extends T> resources,
                                   Collection<? extends T> databaseValues,
                                   Map<RelationshipAttribute, ? extends Set<T>> relationships,
                                   Set<String> targetedAttributes) {
        super(resourceGraph, resources, relationships);
        this.databaseValues = databaseValues != null ? new IdentifiableSet<>(resourceGraph, databaseValues) : null;
        this.targetedAttributes = Set.copyOf(targetedAttributes);
    }

    /**
     * Pair every requested resource with its persisted value.
     *
     * @throws IllegalStateException when database values were not loaded for this hook
     */
    public List<ResourceDiffPair<T>> getDiffs() {
        if (databaseValues == null) {
            throw new IllegalStateException("Database values were not loaded. Enable loadDatabaseValues in the "
                    + "configuration or annotate the hook with @LoadDatabaseValues to compare against persisted state.");
        }
        var diffs = new ArrayList<ResourceDiffPair<T>>(size());
        for (var resource : this) {
            diffs.add(new ResourceDiffPair<>(resource, databaseValues.find(resource)));
        }
        return diffs;
    }

    /**
     * Resources affected through the named relationship, or all resources when the
     * name is an attribute targeted by the request.
     */
    @Override
    public Set<T> getAffected(String name) {
        var byRelationship = super.getAffected(name);
        if (!byRelationship.isEmpty()) {
            return byRelationship;
        }
        if (targetedAttributes.contains(name)) {
            return Collections.unmodifiableSet(new LinkedHashSet<>(this));
        }
        return Set.of();
    }
}
