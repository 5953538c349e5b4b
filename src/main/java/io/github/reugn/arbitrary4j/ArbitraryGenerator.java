package io.github.reugn.arbitrary4j;

import io.github.reugn.arbitrary4j.descriptor.RecordDescriptor;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Generates fully populated record instances with reasonable, unique values.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * @Arbitrary
 * public record Customer(String name, Integer age, String email) {}
 *
 * ArbitraryGenerator generator = ArbitraryGenerator.create();
 * Customer customer = generator.generate(Customer.class);
 * // Customer[name=arbitrary-1, age=2, email=random-3@example.com]
 *
 * Customer known = generator.generate(Customer.class, OverrideSet.of("email", "x@y.com"));
 * }</pre>
 *
 * <p>Each generator owns a {@link GenerationContext} and therefore its own sequence counter,
 * unless one is shared through {@link Builder#context(GenerationContext)}. Generation is
 * synchronous; a generator may be used from several threads at once.
 *
 * @see Arbitraries
 * @see FieldMatcher
 */
public final class ArbitraryGenerator {

    private final GenerationContext context;
    private final TypeIntrospector introspector;
    private final RuleEngine ruleEngine;
    private final RecordBuilder recordBuilder;
    private final OverrideMerger overrideMerger;

    private ArbitraryGenerator(Builder builder) {
        this.context = builder.buildContext();
        this.introspector = new TypeIntrospector(builder.descriptors, builder.classLoader);
        this.ruleEngine = new RuleEngine(builder.rules);
        this.recordBuilder = new RecordBuilder(introspector, ruleEngine);
        this.overrideMerger = new OverrideMerger(introspector);
    }

    public static ArbitraryGenerator create() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Generates an instance of {@code type} using the generator's own context.
     *
     * @throws io.github.reugn.arbitrary4j.exception.ArbitraryException if any field cannot be generated
     */
    public <T> T generate(Class<T> type) {
        return generate(type, OverrideSet.empty(), context);
    }

    /**
     * Generates an instance of {@code type} and applies {@code overrides} to it.
     */
    public <T> T generate(Class<T> type, OverrideSet overrides) {
        return generate(type, overrides, context);
    }

    /**
     * Generates with an explicit context, e.g. one whose counter is isolated to a single test.
     */
    public <T> T generate(Class<T> type, OverrideSet overrides, GenerationContext context) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(overrides, "overrides");
        Objects.requireNonNull(context, "context");
        FieldPath root = FieldPath.root(type);
        RecordDescriptor<T> descriptor = introspector.describe(type, root);
        T instance = recordBuilder.build(descriptor, root, context);
        return overrideMerger.merge(instance, descriptor, overrides, root);
    }

    /**
     * Adds a custom rule. It takes priority over the built-in rules and over every custom rule
     * registered before it.
     *
     * @return this generator
     */
    public ArbitraryGenerator registerRule(FieldMatcher matcher, ValueProducer producer) {
        ruleEngine.register(new GenerationRule(matcher, producer));
        return this;
    }

    /**
     * Registers or replaces the descriptor of a record type.
     *
     * @return this generator
     */
    public ArbitraryGenerator registerDescriptor(RecordDescriptor<?> descriptor) {
        introspector.register(Objects.requireNonNull(descriptor, "descriptor"));
        return this;
    }

    /**
     * @return the descriptor used for {@code type}
     */
    public <T> RecordDescriptor<T> describe(Class<T> type) {
        return introspector.describe(type);
    }

    public GenerationContext context() {
        return context;
    }

    public static final class Builder {
        private final List<GenerationRule> rules = new ArrayList<>();
        private final List<RecordDescriptor<?>> descriptors = new ArrayList<>();
        private final GenerationContext.Builder contextBuilder = GenerationContext.builder();
        private GenerationContext context;
        private ClassLoader classLoader = Thread.currentThread().getContextClassLoader();

        private Builder() {
        }

        public Builder counterStart(long counterStart) {
            contextBuilder.counterStart(counterStart);
            return this;
        }

        public Builder clock(Clock clock) {
            contextBuilder.clock(clock);
            return this;
        }

        public Builder emailDomain(String emailDomain) {
            contextBuilder.emailDomain(emailDomain);
            return this;
        }

        /**
         * Uses an existing context; counter start, clock and e-mail domain settings are then ignored.
         */
        public Builder context(GenerationContext context) {
            this.context = Objects.requireNonNull(context, "context");
            return this;
        }

        /**
         * Adds a custom rule; rules added later take priority.
         */
        public Builder rule(FieldMatcher matcher, ValueProducer producer) {
            rules.add(new GenerationRule(matcher, producer));
            return this;
        }

        public Builder descriptor(RecordDescriptor<?> descriptor) {
            descriptors.add(Objects.requireNonNull(descriptor, "descriptor"));
            return this;
        }

        /**
         * Class loader used to discover service-listed descriptors.
         */
        public Builder classLoader(ClassLoader classLoader) {
            this.classLoader = classLoader;
            return this;
        }

        public ArbitraryGenerator build() {
            return new ArbitraryGenerator(this);
        }

        private GenerationContext buildContext() {
            return context != null ? context : contextBuilder.build();
        }
    }
}
