package com.example.gridfill.engine.expression;

import com.example.gridfill.exception.ExpressionEvaluationException;

import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reads named properties from mappings and host objects.
 * Mappings are read by key; objects through {@code getX()/isX()} getters, record style {@code x()} accessors
 * or public fields, with the first letter of the name matched case-insensitively ({@code e.Name} and
 * {@code e.name} both reach {@code getName()}).
 */
public final class PropertyAccess {
    private static final Map<Class<?>, Map<String, Optional<Accessor>>> ACCESSORS = new ConcurrentHashMap<>();

    private PropertyAccess() {
    }

    public static boolean has(Object target, String name) {
        if (target instanceof Map) {
            return ((Map<?, ?>) target).containsKey(name);
        }
        if (target == null || ValueKind.of(target) != ValueKind.OBJECT) {
            return false;
        }
        return accessor(target.getClass(), name).isPresent();
    }

    /**
     * Property value, or null when the target is null or has no such property.
     */
    public static Object get(Object target, String name) {
        if (target == null) {
            return null;
        }
        if (target instanceof Map) {
            return ((Map<?, ?>) target).get(name);
        }
        if (ValueKind.of(target) != ValueKind.OBJECT) {
            return null;
        }
        Optional<Accessor> accessor = accessor(target.getClass(), name);
        return accessor.isPresent() ? accessor.get().read(target, name) : null;
    }

    private static Optional<Accessor> accessor(Class<?> type, String name) {
        return ACCESSORS.computeIfAbsent(type, t -> new ConcurrentHashMap<>())
                .computeIfAbsent(name, n -> Optional.ofNullable(findAccessor(type, n)));
    }

    private static Accessor findAccessor(Class<?> type, String name) {
        if (name.isEmpty()) {
            return null;
        }
        String capitalized = name.substring(0, 1).toUpperCase(Locale.ROOT) + name.substring(1);
        String decapitalized = name.substring(0, 1).toLowerCase(Locale.ROOT) + name.substring(1);
        List<String> names = List.of("get" + capitalized, "is" + capitalized, decapitalized, name);
        Method best = null;
        for (Method method : type.getMethods()) {
            if (method.getParameterCount() != 0 || method.getReturnType() == void.class
                    || Modifier.isStatic(method.getModifiers()) || method.getDeclaringClass() == Object.class) {
                continue;
            }
            int rank = names.indexOf(method.getName());
            if (rank >= 0 && (best == null || rank < names.indexOf(best.getName()))) {
                best = method;
            }
        }
        if (best != null) {
            best.trySetAccessible();
            return new MethodAccessor(best);
        }
        for (Field field : type.getFields()) {
            if (!Modifier.isStatic(field.getModifiers())
                    && (field.getName().equals(name) || field.getName().equals(decapitalized))) {
                field.trySetAccessible();
                return new FieldAccessor(field);
            }
        }
        return null;
    }

    private interface Accessor {
        Object read(Object target, String name);
    }

    private static final class MethodAccessor implements Accessor {
        private final Method method;

        MethodAccessor(Method method) {
            this.method = method;
        }

        @Override
        public Object read(Object target, String name) {
            try {
                return method.invoke(target);
            } catch (IllegalAccessException | InvocationTargetException e) {
                throw new ExpressionEvaluationException("TYPE_MISMATCH",
                        "Cannot read property '" + name + "' of " + target.getClass().getSimpleName() + ": " + e.getMessage());
            }
        }
    }

    private static final class FieldAccessor implements Accessor {
        private final Field field;

        FieldAccessor(Field field) {
            this.field = field;
        }

        @Override
        public Object read(Object target, String name) {
            try {
                return field.get(target);
            } catch (IllegalAccessException e) {
                throw new ExpressionEvaluationException("TYPE_MISMATCH",
                        "Cannot read field '" + name + "' of " + target.getClass().getSimpleName());
            }
        }
    }
}
