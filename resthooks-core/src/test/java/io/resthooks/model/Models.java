package io.resthooks.model;

import io.resthooks.graph.ResourceGraph;
import io.resthooks.graph.ResourceGraphBuilder;

public final class Models {

    private Models() {
    }

    public static ResourceGraph graph() {
        return new ResourceGraphBuilder()
                .add(Article.class)
                .add(Person.class)
                .add(Tag.class)
                .build();
    }
}
