package io.resthooks.core;

import io.resthooks.model.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ResourceHooksConfigurationTest {

    @Test
    void shouldCreateConfigurationWithDefaults() {
        ResourceHooksConfiguration config = ResourceHooksConfiguration.builder().build();

        assertThat(config.enableResourceHooks()).isTrue();
        assertThat(config.loadDatabaseValues()).isFalse();
        assertThat(config.resourceMetadataProvider().getMetadata(Tag.class).resourceType()).isEqualTo(Tag.class);
    }

    @Test
    void shouldCreateConfigurationWithCustomValues() {
        ResourceMetadataProvider provider = MetadataExtractor::extractResourceMetadata;
        ResourceHooksConfiguration config = ResourceHooksConfiguration.builder()
                .enableResourceHooks(false)
                .loadDatabaseValues(true)
                .resourceMetadataProvider(provider)
                .build();

        assertThat(config.enableResourceHooks()).isFalse();
        assertThat(config.loadDatabaseValues()).isTrue();
        assertThat(config.resourceMetadataProvider()).isSameAs(provider);
    }
}
