package io.resthooks.model;

import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.ManyToOne;

/**
 * Join entity with an id, traversed as a layer of its own.
 */
@Entity
public class ArticleLabel {
    @Id
    public Long id;

    @ManyToOne
    public Article article;

    @ManyToOne
    public Label label;

    public ArticleLabel() {
    }

    public ArticleLabel(Long id, Label label) {
        this.id = id;
        this.label = label;
    }
}
