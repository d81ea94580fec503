package io.resthooks.core;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares a has-many relationship that is stored through a join entity.
 *
 * <p>
 * The annotated field exposes the right-side resources; the collection named by
 * {@link #through()} holds the join entities, each of which references one left-side
 * and one right-side resource through a has-one field.
 *
 * <p>
 * Example usage:
 *
 * <pre>
 * &#64;Entity
 * public class Article {
 *     &#64;Id
 *     private Long id;
 *
 *     &#64;Transient
 *     &#64;HasManyThrough(through = "articleTags")
 *     private List&lt;Tag&gt; tags;
 *
 *     private List&lt;ArticleTag&gt; articleTags;
 * }
 *
 * public class ArticleTag {
 *     &#64;ManyToOne
 *     private Article article;
 *
 *     &#64;ManyToOne
 *     private Tag tag;
 * }
 * </pre>
 *
 * <p>
 * When the join entity declares an id of its own, hook traversal visits the join
 * entities as a layer of their own; otherwise the join layer is skipped.
 */
@Target(ElementType.FIELD)
@Retention(RetentionPolicy.RUNTIME)
public @interface HasManyThrough {

    /**
     * The field on the declaring resource that holds the join entities.
     *
     * @return the join collection field name
     */
    String through();

    /**
     * The has-one field on the join entity that points back to the declaring resource.
     * Inferred from the field type when empty.
     *
     * @return the left property name, or empty to infer
     */
    String leftProperty() default "";

    /**
     * The has-one field on the join entity that points to the related resource.
     * Inferred from the field type when empty.
     *
     * @return the right property name, or empty to infer
     */
    String rightProperty() default "";
}
