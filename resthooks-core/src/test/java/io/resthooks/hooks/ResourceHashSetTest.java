package io.resthooks.hooks;

import io.resthooks.graph.ResourceGraph;
import io.resthooks.model.Article;
import io.resthooks.model.Models;
import io.resthooks.model.Person;
import io.resthooks.model.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResourceHashSetTest {
    private final ResourceGraph graph = Models.graph();

    @Test
    void shouldExposeResourcesByRelationship() {
        var withAuthor = new Article(1L, "a");
        var withTags = new Article(2L, "b");
        var author = graph.getRelationship(Article.class, "author");
        var tags = graph.getRelationship(Article.class, "tags");

        var set = new ResourceHashSet<>(graph, List.of(withAuthor, withTags),
                Map.of(author, Set.of(withAuthor), tags, Set.of(withTags)));

        assertThat(set).containsExactly(withAuthor, withTags);
        assertThat(set.getAffected("author")).containsExactly(withAuthor);
        assertThat(set.getAffected("owner")).isEmpty();
        assertThat(set.getByRelationship(Person.class)).containsOnlyKeys(author);
        assertThat(set.getByRelationship(Tag.class)).containsOnlyKeys(tags);
    }

    @Test
    void shouldNotAllowChangingRelationshipGroups() {
        var article = new Article(1L, "a");
        var author = graph.getRelationship(Article.class, "author");
        var set = new ResourceHashSet<>(graph, List.of(article), Map.of(author, Set.of(article)));

        assertThatThrownBy(() -> set.affectedRelationships().clear())
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> set.getAffected("author").clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void shouldTreatTargetedAttributesAsAffectingAllResources() {
        var first = new Article(1L, "a");
        var second = new Article(2L, "b");

        var set = new DiffableResourceHashSet<>(graph, List.of(first, second), List.of(), Map.of(), Set.of("title"));

        assertThat(set.getAffected("title")).containsExactly(first, second);
        assertThat(set.getAffected("unknown")).isEmpty();
    }

    @Test
    void shouldRequireLoadedDatabaseValuesForDiffs() {
        var set = new DiffableResourceHashSet<>(graph, List.of(new Article(1L, "a")), null, Map.of(), Set.of());

        assertThatThrownBy(set::getDiffs)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("@LoadDatabaseValues");
    }
}
