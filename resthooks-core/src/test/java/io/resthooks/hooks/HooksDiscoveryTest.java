package io.resthooks.hooks;

import io.resthooks.core.ResourceSetupException;
import io.resthooks.model.Article;
import org.junit.jupiter.api.Test;

import java.util.Collection;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HooksDiscoveryTest {

    @Test
    void shouldDiscoverOnlyOverriddenHooks() {
        var discovery = HooksDiscovery.discover(OnReturnAndUpdate.class);

        assertThat(discovery.implementedHooks())
                .containsExactlyInAnyOrder(ResourceHook.ON_RETURN, ResourceHook.BEFORE_UPDATE);
        assertThat(discovery.isImplemented(ResourceHook.BEFORE_CREATE)).isFalse();
    }

    @Test
    void shouldDiscoverHooksInheritedFromIntermediateClass() {
        var discovery = HooksDiscovery.discover(InheritsOnReturn.class);

        assertThat(discovery.implementedHooks()).containsExactly(ResourceHook.ON_RETURN);
    }

    @Test
    void shouldDiscoverNothingForPlainDefinition() {
        var discovery = HooksDiscovery.discover(Plain.class);

        assertThat(discovery.implementedHooks()).isEmpty();
        assertThat(discovery.databaseValuesEnabledHooks())
                .containsExactly(ResourceHook.BEFORE_IMPLICIT_UPDATE_RELATIONSHIP);
    }

    @Test
    void shouldRecordDatabaseValuePreferences() {
        var discovery = HooksDiscovery.discover(OnReturnAndUpdate.class);

        assertThat(discovery.databaseValuesDisabledHooks()).containsExactly(ResourceHook.BEFORE_UPDATE);
        assertThat(discovery.databaseValuesEnabledHooks())
                .containsExactly(ResourceHook.BEFORE_IMPLICIT_UPDATE_RELATIONSHIP);
    }

    @Test
    void shouldRejectDatabaseValuesOnUnsupportedHook() {
        assertThatThrownBy(() -> HooksDiscovery.discover(MisplacedLoadDatabaseValues.class))
                .isInstanceOf(ResourceSetupException.class)
                .hasMessageContaining("@LoadDatabaseValues is not supported")
                .hasMessageContaining("onReturn");
    }

    @Test
    void shouldResolveResourceTypeFromTypeArgument() {
        assertThat(new Plain().resourceType()).isEqualTo(Article.class);
        assertThat(new InheritsOnReturn().resourceType()).isEqualTo(Article.class);
    }

    static class Plain extends ResourceDefinition<Article> {
    }

    static class OnReturnAndUpdate extends ResourceDefinition<Article> {
        @Override
        public Collection<Article> onReturn(Set<Article> resources, ResourcePipeline pipeline) {
            return resources;
        }

        @Override
        @LoadDatabaseValues(false)
        public Collection<Article> beforeUpdate(DiffableResourceHashSet<Article> resources, ResourcePipeline pipeline) {
            return resources;
        }
    }

    static class BaseWithOnReturn extends ResourceDefinition<Article> {
        @Override
        public Collection<Article> onReturn(Set<Article> resources, ResourcePipeline pipeline) {
            return resources;
        }
    }

    static class InheritsOnReturn extends BaseWithOnReturn {
    }

    static class MisplacedLoadDatabaseValues extends ResourceDefinition<Article> {
        @Override
        @LoadDatabaseValues
        public Collection<Article> onReturn(Set<Article> resources, ResourcePipeline pipeline) {
            return resources;
        }
    }
}
