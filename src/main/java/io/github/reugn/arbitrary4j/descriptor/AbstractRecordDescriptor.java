package io.github.reugn.arbitrary4j.descriptor;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Base class for generated and hand-built descriptors.
 *
 * <p>Validates the component list once at construction and checks argument counts and
 * component ownership on every call, leaving subclasses with the two record-specific
 * operations: calling the canonical constructor and reading a component.
 *
 * @param <T> the record type
 */
public abstract class AbstractRecordDescriptor<T> implements RecordDescriptor<T> {

    private final Class<T> type;
    private final List<FieldDescriptor> fields;

    protected AbstractRecordDescriptor(Class<T> type, List<FieldDescriptor> fields) {
        this.type = Objects.requireNonNull(type, "type");
        this.fields = List.copyOf(fields);
        validateFields(type, this.fields);
    }

    private static void validateFields(Class<?> type, List<FieldDescriptor> fields) {
        Set<String> names = new HashSet<>();
        for (int i = 0; i < fields.size(); i++) {
            FieldDescriptor field = fields.get(i);
            if (field.index() != i) {
                throw new IllegalArgumentException("Field '" + field.name() + "' of " + type.getSimpleName()
                        + " has index " + field.index() + " but is declared at position " + i);
            }
            if (!names.add(field.name())) {
                throw new IllegalArgumentException("Duplicate field '" + field.name() + "' in "
                        + type.getSimpleName());
            }
        }
    }

    @Override
    public final Class<T> type() {
        return type;
    }

    @Override
    public final List<FieldDescriptor> fields() {
        return fields;
    }

    @Override
    public final T construct(List<?> arguments) {
        if (arguments.size() != fields.size()) {
            throw new IllegalArgumentException(type.getSimpleName() + " expects " + fields.size()
                    + " constructor arguments, got " + arguments.size());
        }
        return newInstance(arguments.toArray());
    }

    @Override
    public final Object valueOf(T instance, FieldDescriptor field) {
        Objects.requireNonNull(instance, "instance");
        if (field.index() >= fields.size() || !fields.get(field.index()).equals(field)) {
            throw new IllegalArgumentException("Field " + field + " does not belong to " + type.getSimpleName());
        }
        return component(instance, field.index());
    }

    /**
     * Calls the canonical constructor with arguments already checked for count.
     */
    protected abstract T newInstance(Object[] args);

    /**
     * Reads the component at {@code index}.
     */
    protected abstract Object component(T instance, int index);

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + type.getSimpleName() + fields + "]";
    }
}
