package io.resthooks.model;

import io.resthooks.core.HasManyThrough;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.OneToOne;
import jakarta.persistence.Transient;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Entity
public class Article {
    @Id
    public Long id;
    public String title;

    @OneToOne
    public Person owner;

    @ManyToOne
    public Person author;

    // No inverse on Person
    @ManyToOne
    public Person reviewer;

    @Transient
    @HasManyThrough(through = "articleTags")
    public List<Tag> tags;
    public List<ArticleTag> articleTags;

    @Transient
    @HasManyThrough(through = "articleLabels")
    public Set<Label> labels;
    public Set<ArticleLabel> articleLabels;

    public Article() {
    }

    public Article(Long id, String title) {
        this.id = id;
        this.title = title;
    }

    public Article withTags(Tag... tags) {
        this.articleTags = new ArrayList<>();
        for (var tag : tags) {
            this.articleTags.add(new ArticleTag(this, tag));
        }
        return this;
    }

    public Article withLabels(ArticleLabel... articleLabels) {
        this.articleLabels = new LinkedHashSet<>();
        for (var articleLabel : articleLabels) {
            articleLabel.article = this;
            this.articleLabels.add(articleLabel);
        }
        return this;
    }
}
