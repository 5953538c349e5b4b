package io.github.reugn.arbitrary4j.descriptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Fluent declaration of a {@link RecordDescriptor} for records that cannot be annotated.
 *
 * <p>Fields must be declared in the same order as the record components, since the
 * constructor function receives its arguments in that order.
 *
 * @param <T> the record type
 * @see RecordDescriptor#builder(Class)
 */
public final class RecordDescriptorBuilder<T> {

    private final Class<T> type;
    private final List<FieldDescriptor> fields = new ArrayList<>();
    private final List<Function<? super T, ?>> accessors = new ArrayList<>();
    private Function<Object[], ? extends T> constructor;

    RecordDescriptorBuilder(Class<T> type) {
        this.type = Objects.requireNonNull(type, "type");
    }

    /**
     * Declares the next component.
     *
     * @param name      the component name
     * @param fieldType the declared type
     * @param accessor  reads the component from an instance, typically a method reference
     * @return this builder
     */
    public RecordDescriptorBuilder<T> field(String name, FieldType fieldType, Function<? super T, ?> accessor) {
        Objects.requireNonNull(accessor, "accessor");
        fields.add(FieldDescriptor.of(fields.size(), name, fieldType));
        accessors.add(accessor);
        return this;
    }

    /**
     * Sets the canonical constructor call.
     *
     * @param constructor receives one argument per declared field, in declaration order
     * @return this builder
     */
    public RecordDescriptorBuilder<T> constructor(Function<Object[], ? extends T> constructor) {
        this.constructor = Objects.requireNonNull(constructor, "constructor");
        return this;
    }

    public RecordDescriptor<T> build() {
        if (constructor == null) {
            throw new IllegalStateException("No constructor declared for " + type.getSimpleName());
        }
        return new BuiltRecordDescriptor<>(type, fields, List.copyOf(accessors), constructor);
    }

    private static final class BuiltRecordDescriptor<T> extends AbstractRecordDescriptor<T> {
        private final List<Function<? super T, ?>> accessors;
        private final Function<Object[], ? extends T> constructor;

        BuiltRecordDescriptor(Class<T> type, List<FieldDescriptor> fields,
                              List<Function<? super T, ?>> accessors, Function<Object[], ? extends T> constructor) {
            super(type, fields);
            this.accessors = accessors;
            this.constructor = constructor;
        }

        @Override
        protected T newInstance(Object[] args) {
            return constructor.apply(args);
        }

        @Override
        protected Object component(T instance, int index) {
            return accessors.get(index).apply(instance);
        }
    }
}
