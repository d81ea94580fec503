package io.resthooks.hooks;

import io.resthooks.core.ResourceSetupException;

import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Finds out which hooks a container class implements and which of them opt in or out
 * of loading database values.
 * <p>
 * A hook counts as implemented when the container overrides the pass-through method
 * of {@link ResourceDefinition}. Containers that implement {@link ResourceHookContainer}
 * directly implement every hook.
 */
public final class HooksDiscovery {

    private static final Map<ResourceHook, HookSignature> SIGNATURES = new EnumMap<>(ResourceHook.class);

    // Hooks that receive database values and therefore accept @LoadDatabaseValues
    private static final Set<ResourceHook> DATABASE_VALUES_HOOKS = EnumSet.of(
            ResourceHook.BEFORE_UPDATE,
            ResourceHook.BEFORE_UPDATE_RELATIONSHIP,
            ResourceHook.BEFORE_DELETE
    );

    static {
        SIGNATURES.put(ResourceHook.BEFORE_READ,
                new HookSignature("beforeRead", ResourcePipeline.class, boolean.class, String.class));
        SIGNATURES.put(ResourceHook.BEFORE_CREATE,
                new HookSignature("beforeCreate", ResourceHashSet.class, ResourcePipeline.class));
        SIGNATURES.put(ResourceHook.BEFORE_UPDATE,
                new HookSignature("beforeUpdate", DiffableResourceHashSet.class, ResourcePipeline.class));
        SIGNATURES.put(ResourceHook.BEFORE_DELETE,
                new HookSignature("beforeDelete", ResourceHashSet.class, ResourcePipeline.class));
        SIGNATURES.put(ResourceHook.BEFORE_UPDATE_RELATIONSHIP,
                new HookSignature("beforeUpdateRelationship", Set.class, RelationshipsDictionary.class, ResourcePipeline.class));
        SIGNATURES.put(ResourceHook.BEFORE_IMPLICIT_UPDATE_RELATIONSHIP,
                new HookSignature("beforeImplicitUpdateRelationship", RelationshipsDictionary.class, ResourcePipeline.class));
        SIGNATURES.put(ResourceHook.ON_RETURN,
                new HookSignature("onReturn", Set.class, ResourcePipeline.class));
        SIGNATURES.put(ResourceHook.AFTER_CREATE,
                new HookSignature("afterCreate", Set.class, ResourcePipeline.class));
        SIGNATURES.put(ResourceHook.AFTER_READ,
                new HookSignature("afterRead", Set.class, ResourcePipeline.class, boolean.class));
        SIGNATURES.put(ResourceHook.AFTER_UPDATE,
                new HookSignature("afterUpdate", Set.class, ResourcePipeline.class));
        SIGNATURES.put(ResourceHook.AFTER_DELETE,
                new HookSignature("afterDelete", Set.class, ResourcePipeline.class, boolean.class));
        SIGNATURES.put(ResourceHook.AFTER_UPDATE_RELATIONSHIP,
                new HookSignature("afterUpdateRelationship", RelationshipsDictionary.class, ResourcePipeline.class));
    }

    private final Class<?> containerClass;
    private final Set<ResourceHook> implementedHooks;
    private final Set<ResourceHook> databaseValuesEnabledHooks;
    private final Set<ResourceHook> databaseValuesDisabledHooks;

    private HooksDiscovery(Class<?> containerClass, Set<ResourceHook> implementedHooks,
                           Set<ResourceHook> enabledHooks, Set<ResourceHook> disabledHooks) {
        this.containerClass = containerClass;
        this.implementedHooks = Collections.unmodifiableSet(implementedHooks);
        this.databaseValuesEnabledHooks = Collections.unmodifiableSet(enabledHooks);
        this.databaseValuesDisabledHooks = Collections.unmodifiableSet(disabledHooks);
    }

    /**
     * Inspect a container class.
     *
     * @param containerClass the hook container implementation
     * @return the discovered hooks
     * @throws ResourceSetupException if {@link LoadDatabaseValues} is placed on a hook that cannot use it
     */
    public static HooksDiscovery discover(Class<?> containerClass) {
        var implemented = EnumSet.noneOf(ResourceHook.class);
        // The implicit hook always sees persisted values
        var enabled = EnumSet.of(ResourceHook.BEFORE_IMPLICIT_UPDATE_RELATIONSHIP);
        var disabled = EnumSet.noneOf(ResourceHook.class);

        for (var entry : SIGNATURES.entrySet()) {
            var hook = entry.getKey();
            var method = findImplementation(containerClass, entry.getValue());
            if (method == null || method.getDeclaringClass() == ResourceDefinition.class) {
                continue;
            }
            implemented.add(hook);

            LoadDatabaseValues annotation = method.getAnnotation(LoadDatabaseValues.class);
            if (annotation == null) {
                continue;
            }
            if (!DATABASE_VALUES_HOOKS.contains(hook)) {
                throw new ResourceSetupException("@LoadDatabaseValues is not supported on "
                        + containerClass.getName() + "#" + method.getName()
                        + ": only beforeUpdate, beforeUpdateRelationship and beforeDelete can load database values");
            }
            if (annotation.value()) {
                enabled.add(hook);
            } else {
                disabled.add(hook);
            }
        }
        return new HooksDiscovery(containerClass, implemented, enabled, disabled);
    }

    private static Method findImplementation(Class<?> containerClass, HookSignature signature) {
        for (Class<?> current = containerClass; current != null; current = current.getSuperclass()) {
            for (var method : current.getDeclaredMethods()) {
                if (!method.isBridge()
                        && method.getName().equals(signature.name())
                        && Arrays.equals(method.getParameterTypes(), signature.parameterTypes())) {
                    return method;
                }
            }
        }
        return null;
    }

    public Class<?> containerClass() {
        return containerClass;
    }

    public boolean isImplemented(ResourceHook hook) {
        return implementedHooks.contains(hook);
    }

    public Set<ResourceHook> implementedHooks() {
        return implementedHooks;
    }

    public Set<ResourceHook> databaseValuesEnabledHooks() {
        return databaseValuesEnabledHooks;
    }

    public Set<ResourceHook> databaseValuesDisabledHooks() {
        return databaseValuesDisabledHooks;
    }

    private record HookSignature(String name, Class<?>... parameterTypes) {
    }
}
