package io.resthooks.core;

/**
 * Immutable configuration for resource hook execution.
 * <p>
 * Use the builder pattern to create custom configurations:
 * <pre>
 * ResourceHooksConfiguration config = ResourceHooksConfiguration.builder()
 *     .loadDatabaseValues(true)
 *     .build();
 * </pre>
 * <p>
 * All configuration is immutable once built.
 *
 * @see io.resthooks.hooks.execution.ResourceHookExecutorFactory
 */
public final class ResourceHooksConfiguration {

    private final boolean enableResourceHooks;

    // Default policy for hooks that do not declare @LoadDatabaseValues
    private final boolean loadDatabaseValues;

    private final ResourceMetadataProvider resourceMetadataProvider;

    private ResourceHooksConfiguration(Builder builder) {
        this.enableResourceHooks = builder.enableResourceHooks;
        this.loadDatabaseValues = builder.loadDatabaseValues;
        this.resourceMetadataProvider = builder.resourceMetadataProvider != null
                ? builder.resourceMetadataProvider
                : MetadataExtractor::extractResourceMetadata;
    }

    /**
     * Create a new builder for ResourceHooksConfiguration.
     *
     * @return a new Builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Check if resource hooks are executed at all.
     * When disabled, executors pass every resource set through untouched.
     *
     * @return true if hooks are enabled (default: true)
     */
    public boolean enableResourceHooks() {
        return enableResourceHooks;
    }

    /**
     * Check if database values are loaded for hooks that do not opt in or out explicitly.
     *
     * @return true if database values are loaded by default (default: false)
     */
    public boolean loadDatabaseValues() {
        return loadDatabaseValues;
    }

    public ResourceMetadataProvider resourceMetadataProvider() {
        return resourceMetadataProvider;
    }

    /**
     * Builder for ResourceHooksConfiguration.
     */
    public static class Builder {
        private boolean enableResourceHooks = true;
        private boolean loadDatabaseValues = false;
        private ResourceMetadataProvider resourceMetadataProvider;

        private Builder() {
        }

        /**
         * Enable or disable hook execution.
         *
         * @param enableResourceHooks true to execute hooks
         * @return this builder for method chaining
         */
        public Builder enableResourceHooks(boolean enableResourceHooks) {
            this.enableResourceHooks = enableResourceHooks;
            return this;
        }

        /**
         * Set the default database value loading policy.
         *
         * @param loadDatabaseValues true to load persisted values before update and delete hooks
         * @return this builder for method chaining
         */
        public Builder loadDatabaseValues(boolean loadDatabaseValues) {
            this.loadDatabaseValues = loadDatabaseValues;
            return this;
        }

        public Builder resourceMetadataProvider(ResourceMetadataProvider resourceMetadataProvider) {
            this.resourceMetadataProvider = resourceMetadataProvider;
            return this;
        }

        /**
         * Build the immutable ResourceHooksConfiguration.
         *
         * @return a new ResourceHooksConfiguration instance
         */
        public ResourceHooksConfiguration build() {
            return new ResourceHooksConfiguration(this);
        }
    }
}
