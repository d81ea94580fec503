package io.resthooks.store;

import io.resthooks.core.RelationshipAttribute;
import io.resthooks.core.RelationshipAttribute.RelationshipType;
import io.resthooks.core.ResourceHooksException;
import io.resthooks.core.TypedCollections;
import io.resthooks.graph.ResourceGraph;
import io.resthooks.graph.ResourceKey;
import jakarta.persistence.OneToOne;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Resource store that keeps detached snapshots in memory.
 * <p>
 * Snapshots hold plain attributes by value and relationships by id:
 * <ul>
 *   <li>owning relationships (no {@code mappedBy}) are stored on the declaring resource</li>
 *   <li>{@code mappedBy} sides are derived from the owning side when loading</li>
 *   <li>has-many-through relationships store the related ids and rebuild the join
 *       entities on load, unless the join entity has an id of its own, in which case
 *       join entities are stored as resources</li>
 * </ul>
 * Every load materializes fresh instances. Within one load call, one instance is used per
 * resource identity.
 * <p>
 * Collection relationships that are null when saving are left unchanged, as are
 * {@code mappedBy} sides holding null. Owning has-one relationships are always written,
 * so a resource that is saved again must be loaded with them included. Saving a non-null
 * {@code mappedBy} side updates the owning side of the related resources.
 */
public final class InMemoryResourceStore implements ResourceStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryResourceStore.class);

    private final ResourceGraph resourceGraph;
    private final Map<Class<?>, Map<Object, Row>> tables = new HashMap<>();
    private final Map<Class<?>, Long> sequences = new HashMap<>();

    public InMemoryResourceStore(ResourceGraph resourceGraph) {
        this.resourceGraph = resourceGraph;
    }

    @Override
    public synchronized <T> List<T> findAll(Class<T> resourceType, List<List<RelationshipAttribute>> include) {
        var context = new HashMap<ResourceKey, Object>();
        var result = new ArrayList<T>();
        for (var id : new ArrayList<>(table(resourceType).keySet())) {
            result.add(materialize(resourceType, id, include, context));
        }
        return result;
    }

    @Override
    public synchronized <T> Optional<T> findById(Class<T> resourceType, Object id, List<List<RelationshipAttribute>> include) {
        return Optional.ofNullable(materialize(resourceType, id, include, new HashMap<>()));
    }

    @Override
    public synchronized <T> List<T> findAllById(Class<T> resourceType, Collection<?> ids, List<List<RelationshipAttribute>> include) {
        var context = new HashMap<ResourceKey, Object>();
        var result = new ArrayList<T>(ids.size());
        for (var id : ids) {
            var resource = materialize(resourceType, id, include, context);
            if (resource != null) {
                result.add(resource);
            }
        }
        return result;
    }

    @Override
    public synchronized <T> T save(T resource) {
        Objects.requireNonNull(resource, "resource");
        var resourceType = resourceGraph.resourceTypeOf(resource);
        var metadata = resourceGraph.getMetadata(resourceType);
        var id = metadata.getId(resource);
        if (id == null) {
            id = nextId(resourceType, metadata.idType());
            metadata.setId(resource, id);
        } else {
            advanceSequence(resourceType, id);
        }

        var table = table(resourceType);
        var existing = table.get(id);
        var row = new Row();
        for (var attribute : metadata.attributes()) {
            row.attributes.put(attribute.name(), attribute.get(resource));
        }
        for (var relationship : metadata.relationships()) {
            writeRelationship(resource, id, relationship, existing, row);
        }
        table.put(id, row);
        LOGGER.debug("Saved {}#{}", resourceType.getSimpleName(), id);
        return resource;
    }

    @Override
    public synchronized boolean delete(Object resource) {
        var id = resourceGraph.getId(resource);
        return id != null && deleteById(resourceGraph.resourceTypeOf(resource), id);
    }

    @Override
    public synchronized boolean deleteById(Class<?> resourceType, Object id) {
        var removed = table(resourceType).remove(id);
        if (removed == null) {
            return false;
        }
        // Drop references held by other resources
        for (var entry : tables.entrySet()) {
            for (var relationship : resourceGraph.getRelationships(entry.getKey())) {
                if (relationship.rightType() != resourceType) {
                    continue;
                }
                for (var row : entry.getValue().values()) {
                    if (Objects.equals(row.hasOne.get(relationship.name()), id)) {
                        row.hasOne.put(relationship.name(), null);
                    }
                    var ids = row.hasMany.get(relationship.name());
                    if (ids != null) {
                        ids.remove(id);
                    }
                }
            }
        }
        LOGGER.debug("Deleted {}#{}", resourceType.getSimpleName(), id);
        return true;
    }

    private void writeRelationship(Object resource, Object id, RelationshipAttribute relationship, Row existing, Row row) {
        var name = relationship.name();
        switch (relationship.relationshipType()) {
            case HAS_ONE -> {
                var right = relationship.getValue(resource);
                if (!relationship.mappedBySide()) {
                    var rightId = idOfSaved(right);
                    row.hasOne.put(name, rightId);
                    if (rightId != null && relationship.accessor().field().isAnnotationPresent(OneToOne.class)) {
                        clearOtherHolders(relationship, rightId, id);
                    }
                } else if (right != null) {
                    reconcileInverseSide(relationship, id, List.of(right));
                }
            }
            case HAS_MANY -> {
                var value = relationship.getValue(resource);
                if (relationship.mappedBySide()) {
                    if (value != null) {
                        reconcileInverseSide(relationship, id, TypedCollections.elements(value));
                    }
                } else {
                    row.hasMany.put(name, value != null ? idsOfSaved(TypedCollections.elements(value)) : previousIds(existing, name));
                }
            }
            case HAS_MANY_THROUGH -> {
                if (relationship.through().identifiable()) {
                    writeIdentifiableJoinEntities(resource, id, relationship);
                } else {
                    var value = relationship.getValue(resource);
                    row.hasMany.put(name, value != null ? idsOfSaved(TypedCollections.elements(value)) : previousIds(existing, name));
                }
            }
        }
    }

    private static List<Object> previousIds(Row existing, String name) {
        if (existing == null || existing.hasMany.get(name) == null) {
            return new ArrayList<>();
        }
        return new ArrayList<>(existing.hasMany.get(name));
    }

    // One-to-one: a resource can be referenced by at most one holder
    private void clearOtherHolders(RelationshipAttribute relationship, Object rightId, Object holderId) {
        for (var entry : table(relationship.leftType()).entrySet()) {
            if (!entry.getKey().equals(holderId) && rightId.equals(entry.getValue().hasOne.get(relationship.name()))) {
                entry.getValue().hasOne.put(relationship.name(), null);
            }
        }
    }

    /**
     * Point the owning side of the related resources at {@code id} and detach the
     * resources that are no longer related.
     */
    private void reconcileInverseSide(RelationshipAttribute relationship, Object id, List<Object> rights) {
        var inverse = resourceGraph.getInverse(relationship);
        if (inverse == null) {
            return;
        }
        var rightIds = idsOfSaved(rights);
        for (var entry : table(relationship.rightType()).entrySet()) {
            var row = entry.getValue();
            var related = rightIds.contains(entry.getKey());
            if (inverse.relationshipType() == RelationshipType.HAS_ONE) {
                if (related) {
                    row.hasOne.put(inverse.name(), id);
                } else if (id.equals(row.hasOne.get(inverse.name()))) {
                    row.hasOne.put(inverse.name(), null);
                }
            } else {
                var ids = row.hasMany.computeIfAbsent(inverse.name(), n -> new ArrayList<>());
                if (related && !ids.contains(id)) {
                    ids.add(id);
                } else if (!related) {
                    ids.remove(id);
                }
            }
        }
    }

    private void writeIdentifiableJoinEntities(Object resource, Object id, RelationshipAttribute relationship) {
        var through = relationship.through();
        var joinEntities = (Collection<?>) through.throughField().get(resource);
        if (joinEntities == null) {
            return;
        }
        var keptIds = new ArrayList<Object>();
        for (var joinEntity : joinEntities) {
            through.leftProperty().set(joinEntity, resource);
            save(joinEntity);
            keptIds.add(resourceGraph.getId(joinEntity));
        }
        var joinTable = table(through.throughType());
        joinTable.entrySet().removeIf(entry -> !keptIds.contains(entry.getKey())
                && id.equals(entry.getValue().hasOne.get(through.leftProperty().name())));
    }

    private <T> T materialize(Class<T> resourceType, Object id, List<List<RelationshipAttribute>> include,
                              Map<ResourceKey, Object> context) {
        if (id == null) {
            return null;
        }
        var row = table(resourceType).get(id);
        if (row == null) {
            return null;
        }
        var metadata = resourceGraph.getMetadata(resourceType);
        var key = ResourceKey.of(resourceType, id, null);
        @SuppressWarnings("unchecked")
        T instance = (T) context.get(key);
        if (instance == null) {
            instance = metadata.newInstance();
            metadata.setId(instance, id);
            for (var attribute : metadata.attributes()) {
                attribute.set(instance, row.attributes.get(attribute.name()));
            }
            context.put(key, instance);
        }

        for (var entry : groupByHead(include).entrySet()) {
            var relationship = entry.getKey();
            if (relationship.leftType() != resourceType) {
                throw new ResourceHooksException("Cannot include " + relationship + " on " + resourceType.getSimpleName());
            }
            loadRelationship(instance, id, row, relationship, entry.getValue(), context);
        }
        return instance;
    }

    private void loadRelationship(Object instance, Object id, Row row, RelationshipAttribute relationship,
                                  List<List<RelationshipAttribute>> tails, Map<ResourceKey, Object> context) {
        var rightType = relationship.rightType();
        switch (relationship.relationshipType()) {
            case HAS_ONE -> {
                Object value;
                if (relationship.mappedBySide()) {
                    var holders = findHolders(relationship, id);
                    value = holders.isEmpty() ? null : materialize(rightType, holders.get(0), tails, context);
                } else {
                    value = materialize(rightType, row.hasOne.get(relationship.name()), tails, context);
                }
                relationship.setValue(instance, value);
            }
            case HAS_MANY -> {
                var rightIds = relationship.mappedBySide()
                        ? findHolders(relationship, id)
                        : row.hasMany.getOrDefault(relationship.name(), List.of());
                relationship.setValue(instance, materializeAll(rightType, rightIds, tails, context));
            }
            case HAS_MANY_THROUGH -> {
                if (relationship.through().identifiable()) {
                    loadIdentifiableJoinEntities(instance, id, relationship, tails, context);
                } else {
                    var rightIds = row.hasMany.getOrDefault(relationship.name(), List.of());
                    relationship.setValue(instance, materializeAll(rightType, rightIds, tails, context));
                }
            }
        }
    }

    private void loadIdentifiableJoinEntities(Object instance, Object id, RelationshipAttribute relationship,
                                              List<List<RelationshipAttribute>> tails, Map<ResourceKey, Object> context) {
        var through = relationship.through();
        var rightRelationship = resourceGraph.getRelationship(through.throughType(), through.rightProperty().name());
        var joinInclude = new ArrayList<List<RelationshipAttribute>>();
        if (tails.isEmpty()) {
            joinInclude.add(List.of(rightRelationship));
        }
        for (var tail : tails) {
            var chain = new ArrayList<RelationshipAttribute>();
            chain.add(rightRelationship);
            chain.addAll(tail);
            joinInclude.add(chain);
        }
        var joinIds = new ArrayList<Object>();
        for (var entry : table(through.throughType()).entrySet()) {
            if (id.equals(entry.getValue().hasOne.get(through.leftProperty().name()))) {
                joinIds.add(entry.getKey());
            }
        }
        var joinEntities = materializeAll(through.throughType(), joinIds, joinInclude, context);
        var rights = new ArrayList<Object>();
        for (var joinEntity : joinEntities) {
            through.leftProperty().set(joinEntity, instance);
            var right = through.rightProperty().get(joinEntity);
            if (right != null) {
                rights.add(right);
            }
        }
        through.throughField().set(instance, TypedCollections.copyTo(joinEntities, through.throughField().type()));
        relationship.accessor().set(instance, TypedCollections.copyTo(rights, relationship.accessor().type()));
    }

    /**
     * Ids of the right-side resources whose owning relationship points at {@code id}.
     */
    private List<Object> findHolders(RelationshipAttribute mappedBySide, Object id) {
        var inverse = resourceGraph.getInverse(mappedBySide);
        var holders = new ArrayList<Object>();
        if (inverse == null) {
            return holders;
        }
        for (var entry : table(mappedBySide.rightType()).entrySet()) {
            var row = entry.getValue();
            var references = inverse.relationshipType() == RelationshipType.HAS_ONE
                    ? id.equals(row.hasOne.get(inverse.name()))
                    : row.hasMany.getOrDefault(inverse.name(), List.of()).contains(id);
            if (references) {
                holders.add(entry.getKey());
            }
        }
        return holders;
    }

    private List<Object> materializeAll(Class<?> resourceType, List<Object> ids, List<List<RelationshipAttribute>> include,
                                        Map<ResourceKey, Object> context) {
        var result = new ArrayList<Object>(ids.size());
        for (var id : ids) {
            var resource = materialize(resourceType, id, include, context);
            if (resource != null) {
                result.add(resource);
            }
        }
        return result;
    }

    private static Map<RelationshipAttribute, List<List<RelationshipAttribute>>> groupByHead(List<List<RelationshipAttribute>> include) {
        var grouped = new LinkedHashMap<RelationshipAttribute, List<List<RelationshipAttribute>>>();
        if (include == null) {
            return grouped;
        }
        for (var chain : include) {
            if (chain.isEmpty()) {
                continue;
            }
            var tails = grouped.computeIfAbsent(chain.get(0), r -> new ArrayList<>());
            if (chain.size() > 1) {
                tails.add(chain.subList(1, chain.size()));
            }
        }
        return grouped;
    }

    private Object idOfSaved(Object related) {
        if (related == null) {
            return null;
        }
        var relatedId = resourceGraph.getId(related);
        if (relatedId == null) {
            throw new ResourceHooksException("Related " + related.getClass().getSimpleName()
                    + " must be saved before it can be referenced");
        }
        return relatedId;
    }

    private List<Object> idsOfSaved(List<Object> related) {
        var ids = new ArrayList<Object>(related.size());
        for (var resource : related) {
            ids.add(idOfSaved(resource));
        }
        return ids;
    }

    private Map<Object, Row> table(Class<?> resourceType) {
        return tables.computeIfAbsent(resourceType, type -> new LinkedHashMap<>());
    }

    private Object nextId(Class<?> resourceType, Class<?> idType) {
        if (idType == String.class) {
            return UUID.randomUUID().toString();
        }
        if (idType == UUID.class) {
            return UUID.randomUUID();
        }
        long next = sequences.merge(resourceType, 1L, Long::sum);
        if (idType == Long.class || idType == long.class) {
            return next;
        }
        if (idType == Integer.class || idType == int.class) {
            return (int) next;
        }
        throw new ResourceHooksException("Cannot generate ids of type " + idType.getName()
                + " for " + resourceType.getSimpleName());
    }

    private void advanceSequence(Class<?> resourceType, Object id) {
        if (id instanceof Number number) {
            sequences.merge(resourceType, number.longValue(), Math::max);
        }
    }

    private static final class Row {
        private final Map<String, Object> attributes = new HashMap<>();
        private final Map<String, Object> hasOne = new HashMap<>();
        private final Map<String, List<Object>> hasMany = new HashMap<>();
    }
}
