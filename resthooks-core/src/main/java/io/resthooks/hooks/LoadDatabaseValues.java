package io.resthooks.hooks;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Overrides the configured database value policy for one hook method.
 * <p>
 * Only {@code beforeUpdate}, {@code beforeUpdateRelationship} and {@code beforeDelete}
 * accept this annotation.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface LoadDatabaseValues {

    /**
     * @return true to load persisted values before the hook runs, false to never load them
     */
    boolean value() default true;
}
