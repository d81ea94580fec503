package io.resthooks.service;

import io.resthooks.core.ResourceHooksConfiguration;
import io.resthooks.core.ResourceHooksException;
import io.resthooks.graph.ResourceGraph;
import io.resthooks.hooks.DefaultResourceHookContainerRegistry;
import io.resthooks.hooks.LoadDatabaseValues;
import io.resthooks.hooks.RelationshipsDictionary;
import io.resthooks.hooks.ResourceDefinition;
import io.resthooks.hooks.ResourceHashSet;
import io.resthooks.hooks.ResourcePipeline;
import io.resthooks.hooks.execution.ResourceHookExecutorFactory;
import io.resthooks.model.Article;
import io.resthooks.model.Models;
import io.resthooks.model.Person;
import io.resthooks.model.Tag;
import io.resthooks.request.DefaultTargetedFields;
import io.resthooks.request.IncludeChainParser;
import io.resthooks.request.IncludeService;
import io.resthooks.store.InMemoryResourceStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DefaultResourceServiceTest {
    private ResourceGraph graph;
    private InMemoryResourceStore store;
    private List<String> events;
    private ResourceHookExecutorFactory factory;
    private DefaultResourceService<Article> articles;

    @BeforeEach
    void setUp() {
        graph = Models.graph();
        store = new InMemoryResourceStore(graph);
        events = new ArrayList<>();
        var registry = new DefaultResourceHookContainerRegistry(
                new ArticleDefinition(events), new PersonDefinition(events), new TagDefinition());
        factory = new ResourceHookExecutorFactory(ResourceHooksConfiguration.builder().build(), graph, registry, store);
        articles = new DefaultResourceService<>(Article.class, graph, store, factory);
    }

    private Article stored(String title, Person author) {
        var article = new Article(null, title);
        article.author = author;
        return store.save(article);
    }

    @Nested
    @DisplayName("Reads")
    class Reads {

        @Test
        void shouldReturnVisibleResourcesWithIncludes() {
            var author = store.save(new Person(null, "author"));
            stored("visible", author);
            stored("secret", author);
            var include = new IncludeChainParser(graph).parseService(Article.class, "author");

            var result = articles.getAll(include);

            assertThat(result).extracting(article -> article.title).containsExactly("visible");
            assertThat(result.get(0).author.name).isEqualTo("author");
            assertThat(events).containsExactly("beforeRead Article GET", "afterRead Article GET");
        }

        @Test
        void shouldGetSingleResource() {
            var article = stored("visible", null);

            assertThat(articles.get(article.id, IncludeService.none()).title).isEqualTo("visible");
            assertThat(events).containsExactly("beforeRead Article GET_SINGLE", "afterRead Article GET_SINGLE");
        }

        @Test
        void shouldReportMissingAndHiddenResourcesAsNotFound() {
            var hidden = stored("secret", null);

            assertThatThrownBy(() -> articles.get(404L, IncludeService.none()))
                    .isInstanceOfSatisfying(ResourceNotFoundException.class, e -> {
                        assertThat(e.resourceType()).isEqualTo(Article.class);
                        assertThat(e.id()).isEqualTo(404L);
                    });
            assertThatThrownBy(() -> articles.get(hidden.id, IncludeService.none()))
                    .isInstanceOf(ResourceNotFoundException.class);
        }

        @Test
        void shouldReadRelationshipValueFilteredByHooks() {
            var kept = store.save(new Tag(null, "kept"));
            var hidden = store.save(new Tag(null, "hidden"));
            var article = store.save(new Article(null, "a").withTags(kept, hidden));

            var value = articles.getRelationship(article.id, "tags");

            assertThat(value).asList().extracting(tag -> ((Tag) tag).name).containsExactly("kept");
        }

        @Test
        void shouldRejectUnknownRelationship() {
            assertThatThrownBy(() -> articles.getRelationship(1L, "missing"))
                    .isInstanceOf(ResourceHooksException.class)
                    .hasMessageContaining("missing");
        }
    }

    @Nested
    @DisplayName("Writes")
    class Writes {

        @Test
        void shouldCreateResource() {
            var created = articles.create(new Article(null, "new"));

            assertThat(created).hasValueSatisfying(article -> assertThat(article.id).isNotNull());
            assertThat(store.findAll(Article.class, List.of())).hasSize(1);
            assertThat(events).contains("afterCreate Article");
        }

        @Test
        void shouldNotStoreResourceFilteredBeforeCreate() {
            assertThat(articles.create(new Article(null, "spam"))).isEmpty();
            assertThat(store.findAll(Article.class, List.of())).isEmpty();
        }

        @Test
        void shouldUpdateOnlyTargetedAttributes() {
            var author = store.save(new Person(null, "author"));
            var article = stored("old", author);
            var changes = new Article(null, "new");
            changes.author = null;

            var updated = articles.update(article.id, changes, new DefaultTargetedFields().addAttribute("title"));

            assertThat(updated).hasValueSatisfying(a -> assertThat(a.title).isEqualTo("new"));
            var reloaded = store.findById(Article.class, article.id,
                    List.of(List.of(graph.getRelationship(Article.class, "author")))).orElseThrow();
            assertThat(reloaded.title).isEqualTo("new");
            assertThat(reloaded.author.id).isEqualTo(author.id);
        }

        @Test
        @DisplayName("Requested related resources are replaced by the tracked instances")
        void shouldAssignTrackedInstanceInsteadOfRequestedReference() {
            var person = store.save(new Person(null, "new owner"));
            var article = stored("a", person);
            var changes = new Article();
            changes.owner = new Person(person.id, null);
            var owner = graph.getRelationship(Article.class, "owner");

            var updated = articles.update(article.id, changes, new DefaultTargetedFields().addRelationship(owner))
                    .orElseThrow();

            assertThat(updated.owner).isSameAs(updated.author);
            assertThat(updated.owner.name).isEqualTo("new owner");
        }

        @Test
        void shouldLoadRequestedRelatedResourcesNotReachableFromStoredResource() {
            var kept = store.save(new Tag(null, "kept"));
            var added = store.save(new Tag(null, "added"));
            var article = store.save(new Article(null, "a").withTags(kept));
            var changes = new Article().withTags(new Tag(kept.id, null), new Tag(added.id, null));
            var tags = graph.getRelationship(Article.class, "tags");

            var updated = articles.update(article.id, changes, new DefaultTargetedFields().addRelationship(tags))
                    .orElseThrow();

            assertThat(updated.tags).extracting(tag -> tag.name).containsExactly("kept", "added");
        }

        @Test
        void shouldRejectAssignmentOfMissingRelatedResource() {
            var article = stored("a", null);

            assertThatThrownBy(() -> articles.updateRelationship(article.id, "author", new Person(404L, null)))
                    .isInstanceOfSatisfying(ResourceNotFoundException.class,
                            e -> assertThat(e.resourceType()).isEqualTo(Person.class));
        }

        @Test
        void shouldRejectUpdateOfMissingResource() {
            assertThatThrownBy(() -> articles.update(404L, new Article(), new DefaultTargetedFields().addAttribute("title")))
                    .isInstanceOf(ResourceNotFoundException.class);
        }

        @Test
        @DisplayName("Relationship hooks see the requested value before it is stored")
        void shouldUpdateRelationship() {
            var previous = store.save(new Person(null, "previous"));
            var next = store.save(new Person(null, "next"));
            var article = stored("a", previous);

            articles.updateRelationship(article.id, "author", new Person(next.id, null));

            var reloaded = store.findById(Article.class, article.id,
                    List.of(List.of(graph.getRelationship(Article.class, "author")))).orElseThrow();
            assertThat(reloaded.author.id).isEqualTo(next.id);
            assertThat(events).containsExactly("beforeUpdateRelationship Person [" + next.id + "]");
        }

        @Test
        void shouldDeleteResource() {
            var article = stored("a", null);

            assertThat(articles.delete(article.id)).isTrue();
            assertThat(store.findAll(Article.class, List.of())).isEmpty();
            assertThat(events).containsExactly("afterDelete Article true");
        }

        @Test
        void shouldKeepResourceProtectedByHook() {
            var article = stored("protected", null);

            assertThat(articles.delete(article.id)).isFalse();
            assertThat(store.findAll(Article.class, List.of())).hasSize(1);
        }

        @Test
        void shouldReportFailedDeletionAfterHooks() {
            var people = new DefaultResourceService<>(Person.class, graph, store, factory);

            assertThatThrownBy(() -> people.delete(404L)).isInstanceOf(ResourceNotFoundException.class);
            assertThat(events).containsExactly("afterDelete Person false");
        }

        @Test
        void shouldTreatMissingResourceAsFilteredWhenHookLoadsStoredValues() {
            assertThat(articles.delete(404L)).isFalse();
            assertThat(events).isEmpty();
        }
    }

    static class ArticleDefinition extends ResourceDefinition<Article> {
        private final List<String> events;

        ArticleDefinition(List<String> events) {
            this.events = events;
        }

        @Override
        public void beforeRead(ResourcePipeline pipeline, boolean isIncluded, String stringId) {
            events.add("beforeRead Article " + pipeline);
        }

        @Override
        public void afterRead(Set<Article> resources, ResourcePipeline pipeline, boolean isIncluded) {
            events.add("afterRead Article " + pipeline);
        }

        @Override
        public Collection<Article> beforeCreate(ResourceHashSet<Article> resources, ResourcePipeline pipeline) {
            return resources.stream().filter(article -> !"spam".equals(article.title)).toList();
        }

        @Override
        public void afterCreate(Set<Article> resources, ResourcePipeline pipeline) {
            events.add("afterCreate Article");
        }

        @Override
        @LoadDatabaseValues
        public Collection<Article> beforeDelete(ResourceHashSet<Article> resources, ResourcePipeline pipeline) {
            return resources.stream().filter(article -> !"protected".equals(article.title)).toList();
        }

        @Override
        public void afterDelete(Set<Article> resources, ResourcePipeline pipeline, boolean succeeded) {
            events.add("afterDelete Article " + succeeded);
        }

        @Override
        public Collection<Article> onReturn(Set<Article> resources, ResourcePipeline pipeline) {
            return resources.stream().filter(article -> !"secret".equals(article.title)).toList();
        }
    }

    static class PersonDefinition extends ResourceDefinition<Person> {
        private final List<String> events;

        PersonDefinition(List<String> events) {
            this.events = events;
        }

        @Override
        public Set<String> beforeUpdateRelationship(Set<String> ids, RelationshipsDictionary<Person> resourcesByRelationship,
                                                    ResourcePipeline pipeline) {
            events.add("beforeUpdateRelationship Person " + new TreeSet<>(ids));
            return ids;
        }

        @Override
        public void afterDelete(Set<Person> resources, ResourcePipeline pipeline, boolean succeeded) {
            events.add("afterDelete Person " + succeeded);
        }
    }

    static class TagDefinition extends ResourceDefinition<Tag> {
        @Override
        public Collection<Tag> onReturn(Set<Tag> resources, ResourcePipeline pipeline) {
            return resources.stream().filter(tag -> !"hidden".equals(tag.name)).toList();
        }
    }
}
