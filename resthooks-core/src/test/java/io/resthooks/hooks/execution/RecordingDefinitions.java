package io.resthooks.hooks.execution;

import io.resthooks.core.RelationshipAttribute;
import io.resthooks.hooks.LoadDatabaseValues;
import io.resthooks.hooks.RelationshipsDictionary;
import io.resthooks.hooks.ResourceDefinition;
import io.resthooks.hooks.ResourceHashSet;
import io.resthooks.hooks.ResourcePipeline;
import io.resthooks.model.Article;
import io.resthooks.model.Person;
import io.resthooks.model.Tag;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Hook containers that write every call they receive to a shared event list.
 */
final class RecordingDefinitions {

    private RecordingDefinitions() {
    }

    static String ids(Collection<?> resources) {
        return resources.stream()
                .map(RecordingDefinitions::idOf)
                .collect(Collectors.toCollection(TreeSet::new))
                .toString();
    }

    static String groups(Map<RelationshipAttribute, ? extends Set<?>> dictionary) {
        return dictionary.entrySet().stream()
                .map(entry -> entry.getKey().name() + "=" + ids(entry.getValue()))
                .sorted()
                .collect(Collectors.joining(",", "{", "}"));
    }

    private static String idOf(Object resource) {
        if (resource instanceof Article article) {
            return String.valueOf(article.id);
        }
        if (resource instanceof Person person) {
            return String.valueOf(person.id);
        }
        if (resource instanceof Tag tag) {
            return String.valueOf(tag.id);
        }
        return String.valueOf(resource);
    }

    static class PersonDefinition extends ResourceDefinition<Person> {
        private final List<String> events;

        PersonDefinition(List<String> events) {
            this.events = events;
        }

        @Override
        public void beforeRead(ResourcePipeline pipeline, boolean isIncluded, String stringId) {
            events.add("beforeRead Person included=" + isIncluded + " id=" + stringId);
        }

        @Override
        public Set<String> beforeUpdateRelationship(Set<String> ids, RelationshipsDictionary<Person> resourcesByRelationship,
                                                    ResourcePipeline pipeline) {
            events.add("beforeUpdateRelationship Person " + new TreeSet<>(ids) + " " + groups(resourcesByRelationship));
            return ids;
        }

        @Override
        public void beforeImplicitUpdateRelationship(RelationshipsDictionary<Person> resourcesByRelationship,
                                                     ResourcePipeline pipeline) {
            events.add("beforeImplicitUpdateRelationship Person " + groups(resourcesByRelationship));
        }

        @Override
        public void afterRead(Set<Person> resources, ResourcePipeline pipeline, boolean isIncluded) {
            events.add("afterRead Person " + ids(resources) + " included=" + isIncluded);
        }

        @Override
        public void afterUpdateRelationship(RelationshipsDictionary<Person> resourcesByRelationship, ResourcePipeline pipeline) {
            events.add("afterUpdateRelationship Person " + groups(resourcesByRelationship) + " " + pipeline);
        }
    }

    static class ArticleDefinition extends ResourceDefinition<Article> {
        private final List<String> events;

        ArticleDefinition(List<String> events) {
            this.events = events;
        }

        @Override
        public void beforeRead(ResourcePipeline pipeline, boolean isIncluded, String stringId) {
            events.add("beforeRead Article included=" + isIncluded + " id=" + stringId);
        }

        @Override
        @LoadDatabaseValues
        public Collection<Article> beforeDelete(ResourceHashSet<Article> resources, ResourcePipeline pipeline) {
            events.add("beforeDelete Article " + ids(resources) + " titles=" + resources.stream().map(a -> a.title).toList());
            return resources;
        }

        @Override
        public void beforeImplicitUpdateRelationship(RelationshipsDictionary<Article> resourcesByRelationship,
                                                     ResourcePipeline pipeline) {
            events.add("beforeImplicitUpdateRelationship Article " + groups(resourcesByRelationship));
        }

        @Override
        public void afterRead(Set<Article> resources, ResourcePipeline pipeline, boolean isIncluded) {
            events.add("afterRead Article " + ids(resources) + " included=" + isIncluded);
        }

        @Override
        public void afterCreate(Set<Article> resources, ResourcePipeline pipeline) {
            events.add("afterCreate Article " + ids(resources));
        }

        @Override
        public void afterUpdate(Set<Article> resources, ResourcePipeline pipeline) {
            events.add("afterUpdate Article " + ids(resources));
        }

        @Override
        public void afterDelete(Set<Article> resources, ResourcePipeline pipeline, boolean succeeded) {
            events.add("afterDelete Article " + ids(resources) + " succeeded=" + succeeded);
        }
    }

    static class TagDefinition extends ResourceDefinition<Tag> {
        private final List<String> events;

        TagDefinition(List<String> events) {
            this.events = events;
        }

        @Override
        public void beforeRead(ResourcePipeline pipeline, boolean isIncluded, String stringId) {
            events.add("beforeRead Tag included=" + isIncluded + " id=" + stringId);
        }

        @Override
        public Collection<Tag> onReturn(Set<Tag> resources, ResourcePipeline pipeline) {
            events.add("onReturn Tag " + ids(resources));
            return resources.stream().filter(tag -> !"should not be included".equals(tag.name)).toList();
        }
    }
}
