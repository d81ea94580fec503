package io.resthooks.request;

import io.resthooks.core.RelationshipAttribute;

import java.util.List;

/**
 * The relationship chains included by the current read request, such as
 * {@code author.articles} as the chain [Article.author, Person.articles].
 */
public interface IncludeService {

    List<List<RelationshipAttribute>> get();

    static IncludeService none() {
        return new DefaultIncludeService(List.of());
    }
}
