package io.resthooks.core;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.reflect.Field;

/**
 * Reads and writes one declared field through method handles resolved once.
 */
public final class FieldAccessor {
    private final String name;
    private final Class<?> type;
    private final Field field;
    private final MethodHandle getter;
    private final MethodHandle setter;

    private FieldAccessor(Field field, MethodHandle getter, MethodHandle setter) {
        this.name = field.getName();
        this.type = field.getType();
        this.field = field;
        this.getter = getter;
        this.setter = setter;
    }

    public static FieldAccessor of(Field field) {
        try {
            var lookup = MethodHandles.privateLookupIn(field.getDeclaringClass(), MethodHandles.lookup());
            return new FieldAccessor(field, lookup.unreflectGetter(field), lookup.unreflectSetter(field));
        } catch (IllegalAccessException e) {
            throw new ResourceSetupException("Failed to access field: "
                    + field.getDeclaringClass().getName() + "#" + field.getName(), e);
        }
    }

    public String name() {
        return name;
    }

    public Class<?> type() {
        return type;
    }

    public Field field() {
        return field;
    }

    public Object get(Object target) {
        try {
            return getter.invoke(target);
        } catch (RuntimeException | Error e) {
            throw e;
        } catch (Throwable t) {
            throw new ResourceHooksException("Failed to read " + describe(), t);
        }
    }

    public void set(Object target, Object value) {
        try {
            setter.invoke(target, value);
        } catch (RuntimeException | Error e) {
            throw e;
        } catch (Throwable t) {
            throw new ResourceHooksException("Failed to write " + describe(), t);
        }
    }

    private String describe() {
        return field.getDeclaringClass().getSimpleName() + "#" + name;
    }

    @Override
    public String toString() {
        return describe();
    }
}
