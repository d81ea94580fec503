package io.resthooks.spring.boot.autoconfigure;

import io.resthooks.core.ResourceHooksConfiguration;
import io.resthooks.graph.ResourceGraph;
import io.resthooks.graph.ResourceGraphBuilder;
import io.resthooks.hooks.ResourceDefinition;
import io.resthooks.hooks.ResourceHook;
import io.resthooks.hooks.ResourceHookContainerRegistry;
import io.resthooks.hooks.ResourcePipeline;
import io.resthooks.hooks.execution.DefaultResourceHookExecutor;
import io.resthooks.hooks.execution.NoopResourceHookExecutor;
import io.resthooks.hooks.execution.ResourceHookExecutorFactory;
import io.resthooks.store.InMemoryResourceStore;
import io.resthooks.store.ResourceStore;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Collection;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ResourceHooksAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ResourceHooksAutoConfiguration.class));

    @Test
    void shouldCreateDefaultBeans() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(ResourceHooksConfiguration.class);
            assertThat(context).hasSingleBean(ResourceHookContainerRegistry.class);
            assertThat(context).hasSingleBean(ResourceGraph.class);
            assertThat(context).hasSingleBean(ResourceHookExecutorFactory.class);
            assertThat(context.getBean(ResourceStore.class)).isInstanceOf(InMemoryResourceStore.class);
            assertThat(context.getBean(ResourceHookExecutorFactory.class).create())
                    .isInstanceOf(DefaultResourceHookExecutor.class);
        });
    }

    @Test
    void shouldBindProperties() {
        contextRunner
                .withPropertyValues(
                        "resthooks.load-database-values=true",
                        "resthooks.resources=io.resthooks.spring.boot.autoconfigure.ResourceHooksAutoConfigurationTest$Shelf")
                .run(context -> {
                    assertThat(context.getBean(ResourceHooksConfiguration.class).loadDatabaseValues()).isTrue();
                    assertThat(context.getBean(ResourceGraph.class).isResource(Shelf.class)).isTrue();
                });
    }

    @Test
    void shouldUseNoopExecutorWhenHooksAreDisabled() {
        contextRunner
                .withPropertyValues("resthooks.enabled=false")
                .run(context -> assertThat(context.getBean(ResourceHookExecutorFactory.class).create())
                        .isSameAs(NoopResourceHookExecutor.INSTANCE));
    }

    @Test
    void shouldRegisterResourceDefinitionBeans() {
        contextRunner
                .withUserConfiguration(DefinitionConfiguration.class)
                .run(context -> {
                    assertThat(context.getBean(ResourceGraph.class).isResource(Book.class)).isTrue();
                    var registry = context.getBean(ResourceHookContainerRegistry.class);
                    assertThat(registry.getContainer(Book.class)).isSameAs(context.getBean(BookDefinition.class));
                    assertThat(registry.getDiscovery(Book.class).implementedHooks()).contains(ResourceHook.ON_RETURN);
                });
    }

    @Test
    void shouldBackOffWhenStoreIsProvided() {
        contextRunner
                .withUserConfiguration(StoreConfiguration.class)
                .run(context -> assertThat(context.getBean(ResourceStore.class))
                        .isSameAs(context.getBean(StoreConfiguration.class).store));
    }

    @Entity
    static class Book {
        @Id
        Long id;
        String title;
    }

    @Entity
    static class Shelf {
        @Id
        Long id;
    }

    static class BookDefinition extends ResourceDefinition<Book> {
        @Override
        public Collection<Book> onReturn(Set<Book> resources, ResourcePipeline pipeline) {
            return resources;
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class DefinitionConfiguration {
        @Bean
        BookDefinition bookDefinition() {
            return new BookDefinition();
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class StoreConfiguration {
        final ResourceStore store = new InMemoryResourceStore(new ResourceGraphBuilder().add(Shelf.class).build());

        @Bean
        ResourceStore customStore() {
            return store;
        }
    }
}
