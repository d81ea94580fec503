package io.resthooks.model;

/**
 * Join entity without an id of its own.
 */
public class ArticleTag {
    public Article article;
    public Tag tag;

    public ArticleTag() {
    }

    public ArticleTag(Article article, Tag tag) {
        this.article = article;
        this.tag = tag;
    }
}
