package io.github.reugn.arbitrary4j.descriptor;

import java.util.Map;

/**
 * Primitive to wrapper mapping used for value type checks.
 */
final class Primitives {

    private static final Map<Class<?>, Class<?>> WRAPPERS = Map.of(
            boolean.class, Boolean.class,
            byte.class, Byte.class,
            short.class, Short.class,
            int.class, Integer.class,
            long.class, Long.class,
            char.class, Character.class,
            float.class, Float.class,
            double.class, Double.class,
            void.class, Void.class);

    private Primitives() {
    }

    static Class<?> wrap(Class<?> type) {
        return type.isPrimitive() ? WRAPPERS.get(type) : type;
    }
}
