package io.resthooks.hooks.execution;

import io.resthooks.core.ResourceHooksConfiguration;
import io.resthooks.graph.ResourceGraph;
import io.resthooks.hooks.ResourceHookContainerRegistry;
import io.resthooks.hooks.traversal.DefaultTraversalHelper;
import io.resthooks.request.IncludeService;
import io.resthooks.request.TargetedFields;
import io.resthooks.store.ResourceStore;

/**
 * Creates one executor per request. The graph, registry and store are shared; the
 * traversal state and request state belong to the executor.
 */
public final class ResourceHookExecutorFactory {

    private final ResourceHooksConfiguration configuration;
    private final ResourceGraph resourceGraph;
    private final HookExecutorHelper executorHelper;

    public ResourceHookExecutorFactory(ResourceHooksConfiguration configuration, ResourceGraph resourceGraph,
                                       ResourceHookContainerRegistry registry, ResourceStore store) {
        this.configuration = configuration;
        this.resourceGraph = resourceGraph;
        this.executorHelper = new DefaultHookExecutorHelper(registry, store, resourceGraph, configuration);
    }

    public ResourceHookExecutor create(TargetedFields targetedFields, IncludeService includeService) {
        if (!configuration.enableResourceHooks()) {
            return NoopResourceHookExecutor.INSTANCE;
        }
        return new DefaultResourceHookExecutor(
                executorHelper,
                new DefaultTraversalHelper(resourceGraph, targetedFields),
                targetedFields,
                includeService,
                resourceGraph
        );
    }

    public ResourceHookExecutor create() {
        return create(TargetedFields.none(), IncludeService.none());
    }

    public ResourceGraph resourceGraph() {
        return resourceGraph;
    }
}
