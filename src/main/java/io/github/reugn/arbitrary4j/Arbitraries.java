package io.github.reugn.arbitrary4j;

import io.github.reugn.arbitrary4j.descriptor.RecordDescriptor;

/**
 * Static entry point backed by one process-wide {@link ArbitraryGenerator}.
 *
 * <pre>{@code
 * Order order = Arbitraries.generate(Order.class);
 * Order shipped = Arbitraries.generate(Order.class, OverrideSet.of("status", Status.SHIPPED));
 * }</pre>
 *
 * <p>Values are unique for the lifetime of the process. Tests that need an isolated or
 * reproducible counter should build their own {@link ArbitraryGenerator}.
 */
public final class Arbitraries {

    private static final ArbitraryGenerator DEFAULT = ArbitraryGenerator.create();

    private Arbitraries() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static <T> T generate(Class<T> type) {
        return DEFAULT.generate(type);
    }

    public static <T> T generate(Class<T> type, OverrideSet overrides) {
        return DEFAULT.generate(type, overrides);
    }

    /**
     * Adds a custom rule to the process-wide generator.
     */
    public static void registerRule(FieldMatcher matcher, ValueProducer producer) {
        DEFAULT.registerRule(matcher, producer);
    }

    public static void registerDescriptor(RecordDescriptor<?> descriptor) {
        DEFAULT.registerDescriptor(descriptor);
    }

    /**
     * @return the process-wide generator
     */
    public static ArbitraryGenerator generator() {
        return DEFAULT;
    }
}
