package io.resthooks.hooks;

import io.resthooks.core.ResourceSetupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry over a fixed set of containers. Discovery runs once per container at
 * registration time.
 */
public final class DefaultResourceHookContainerRegistry implements ResourceHookContainerRegistry {
    private static final Logger LOGGER = LoggerFactory.getLogger(DefaultResourceHookContainerRegistry.class);

    private final Map<Class<?>, ResourceHookContainer<?>> containers = new ConcurrentHashMap<>();
    private final Map<Class<?>, HooksDiscovery> discoveries = new ConcurrentHashMap<>();

    public DefaultResourceHookContainerRegistry(Collection<? extends ResourceHookContainer<?>> containers) {
        for (var container : containers) {
            register(container);
        }
    }

    public DefaultResourceHookContainerRegistry(ResourceHookContainer<?>... containers) {
        this(List.of(containers));
    }

    private void register(ResourceHookContainer<?> container) {
        var resourceType = container.resourceType();
        var previous = containers.putIfAbsent(resourceType, container);
        if (previous != null) {
            throw new ResourceSetupException("Multiple hook containers registered for " + resourceType.getName()
                    + ": " + previous.getClass().getName() + " and " + container.getClass().getName());
        }
        var discovery = HooksDiscovery.discover(container.getClass());
        discoveries.put(resourceType, discovery);
        LOGGER.debug("Registered hook container {} for {} implementing {}",
                container.getClass().getSimpleName(), resourceType.getSimpleName(), discovery.implementedHooks());
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> ResourceHookContainer<T> getContainer(Class<T> resourceType) {
        return (ResourceHookContainer<T>) containers.get(resourceType);
    }

    @Override
    public HooksDiscovery getDiscovery(Class<?> resourceType) {
        return discoveries.get(resourceType);
    }
}
