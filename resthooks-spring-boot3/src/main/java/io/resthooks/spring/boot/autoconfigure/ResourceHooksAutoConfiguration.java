package io.resthooks.spring.boot.autoconfigure;

import io.resthooks.core.ResourceHooksConfiguration;
import io.resthooks.graph.ResourceGraph;
import io.resthooks.graph.ResourceGraphBuilder;
import io.resthooks.hooks.DefaultResourceHookContainerRegistry;
import io.resthooks.hooks.ResourceHookContainer;
import io.resthooks.hooks.ResourceHookContainerRegistry;
import io.resthooks.hooks.execution.ResourceHookExecutorFactory;
import io.resthooks.store.InMemoryResourceStore;
import io.resthooks.store.ResourceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.LinkedHashSet;

/**
 * Auto-configuration for the resource graph, hook container registry and hook executors.
 * <p>
 * Every {@link ResourceHookContainer} bean, usually a
 * {@link io.resthooks.hooks.ResourceDefinition}, is registered for its resource type,
 * and that type joins the resource graph.
 */
@AutoConfiguration
@ConditionalOnClass(ResourceHookExecutorFactory.class)
@EnableConfigurationProperties(ResourceHooksProperties.class)
public class ResourceHooksAutoConfiguration {
    private static final Logger LOGGER = LoggerFactory.getLogger(ResourceHooksAutoConfiguration.class);

    /**
     * Creates the auto-configuration instance.
     */
    public ResourceHooksAutoConfiguration() {
    }

    /**
     * Creates the hook configuration from bound properties.
     *
     * @param properties bound resource hook properties
     * @return resource hooks configuration
     */
    @Bean
    @ConditionalOnMissingBean
    public ResourceHooksConfiguration resourceHooksConfiguration(ResourceHooksProperties properties) {
        return properties.toConfiguration();
    }

    /**
     * Collects every hook container bean.
     *
     * @param containers hook container beans
     * @return hook container registry
     */
    @Bean
    @ConditionalOnMissingBean
    public ResourceHookContainerRegistry resourceHookContainerRegistry(ObjectProvider<ResourceHookContainer<?>> containers) {
        return new DefaultResourceHookContainerRegistry(containers.orderedStream().toList());
    }

    /**
     * Builds the resource graph from the configured resource types and the types of the
     * hook container beans.
     *
     * @param properties bound resource hook properties
     * @param configuration resource hooks configuration
     * @param containers hook container beans
     * @return resource graph
     */
    @Bean
    @ConditionalOnMissingBean
    public ResourceGraph resourceGraph(ResourceHooksProperties properties, ResourceHooksConfiguration configuration,
                                       ObjectProvider<ResourceHookContainer<?>> containers) {
        var resourceTypes = new LinkedHashSet<Class<?>>(properties.getResources());
        containers.orderedStream().forEach(container -> resourceTypes.add(container.resourceType()));
        LOGGER.debug("Building resource graph for {}", resourceTypes);
        return new ResourceGraphBuilder(configuration).addAll(resourceTypes).build();
    }

    /**
     * Creates the in-memory store used when the application provides none.
     *
     * @param resourceGraph resource graph
     * @return resource store
     */
    @Bean
    @ConditionalOnMissingBean
    public ResourceStore resourceStore(ResourceGraph resourceGraph) {
        return new InMemoryResourceStore(resourceGraph);
    }

    /**
     * Creates the factory of per-request hook executors.
     *
     * @param configuration resource hooks configuration
     * @param resourceGraph resource graph
     * @param registry hook container registry
     * @param store resource store
     * @return executor factory
     */
    @Bean
    @ConditionalOnMissingBean
    public ResourceHookExecutorFactory resourceHookExecutorFactory(ResourceHooksConfiguration configuration,
                                                                   ResourceGraph resourceGraph,
                                                                   ResourceHookContainerRegistry registry,
                                                                   ResourceStore store) {
        return new ResourceHookExecutorFactory(configuration, resourceGraph, registry, store);
    }
}
