package io.resthooks.core;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.TreeSet;

/**
 * Builds collections that match a field's declared collection type.
 */
public final class TypedCollections {

    private TypedCollections() {
    }

    /**
     * Copy {@code values} into a new collection assignable to {@code collectionType}.
     *
     * @param values the elements to copy, may be null
     * @param collectionType the declared field type
     * @return a mutable collection of the requested shape
     */
    @SuppressWarnings("unchecked")
    public static Collection<Object> copyTo(Collection<?> values, Class<?> collectionType) {
        Collection<Object> target = newCollection(collectionType);
        if (values != null) {
            target.addAll((Collection<Object>) values);
        }
        return target;
    }

    @SuppressWarnings("unchecked")
    public static Collection<Object> newCollection(Class<?> collectionType) {
        if (collectionType.isAssignableFrom(ArrayList.class)) {
            return new ArrayList<>();
        }
        if (collectionType.isAssignableFrom(LinkedHashSet.class)) {
            return new LinkedHashSet<>();
        }
        if (collectionType.isAssignableFrom(TreeSet.class)) {
            return new TreeSet<>();
        }
        if (!collectionType.isInterface() && !Modifier.isAbstract(collectionType.getModifiers())
                && Collection.class.isAssignableFrom(collectionType)) {
            try {
                return (Collection<Object>) collectionType.getDeclaredConstructor().newInstance();
            } catch (ReflectiveOperationException e) {
                throw new ResourceHooksException("Cannot instantiate collection type " + collectionType.getName(), e);
            }
        }
        throw new ResourceHooksException("Unsupported collection type " + collectionType.getName());
    }

    /**
     * Convert a raw relationship value into a list of elements.
     *
     * @param value null, a single element or a collection
     * @return list of the contained elements, empty for null
     */
    public static List<Object> elements(Object value) {
        if (value == null) {
            return List.of();
        }
        if (value instanceof Collection<?> collection) {
            var result = new ArrayList<Object>(collection.size());
            for (var element : collection) {
                if (element != null) {
                    result.add(element);
                }
            }
            return result;
        }
        return List.of(value);
    }

    static boolean isCollection(Class<?> type) {
        return Collection.class.isAssignableFrom(type);
    }

    static Class<?> elementType(Field field) {
        if (!isCollection(field.getType())) {
            return null;
        }
        Type genericType = field.getGenericType();
        if (genericType instanceof ParameterizedType pt) {
            Type[] args = pt.getActualTypeArguments();
            if (args.length > 0 && args[0] instanceof Class<?> elementClass) {
                return elementClass;
            }
        }
        return null;
    }
}
