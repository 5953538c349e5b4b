package io.github.reugn.arbitrary4j.descriptor;

import java.util.List;
import java.util.Optional;

/**
 * Statically derived description of a record type: its components in declaration order,
 * its canonical constructor and its component accessors.
 *
 * <p>Descriptors are produced in one of two ways:
 * <ul>
 *   <li>Generated by the annotation processor for records annotated with
 *       {@link io.github.reugn.arbitrary4j.annotation.Arbitrary} or listed in
 *       {@link io.github.reugn.arbitrary4j.annotation.IncludeArbitrary}</li>
 *   <li>Declared by hand with {@link #builder(Class)}</li>
 * </ul>
 *
 * <p><b>Manual registration:</b>
 * <pre>{@code
 * RecordDescriptor<Money> money = RecordDescriptor.builder(Money.class)
 *         .field("amount", FieldType.integral(long.class), Money::amount)
 *         .field("currency", FieldType.text(), Money::currency)
 *         .constructor(args -> new Money((long) args[0], (String) args[1]))
 *         .build();
 * }</pre>
 *
 * <p>Implementations are immutable and safe to share between threads.
 *
 * @param <T> the record type
 */
public interface RecordDescriptor<T> {

    /**
     * @return the described record class
     */
    Class<T> type();

    /**
     * @return the components in declaration order; unmodifiable
     */
    List<FieldDescriptor> fields();

    /**
     * Looks up a component by name.
     *
     * @param name the component name
     * @return the component, or empty if the record declares no such component
     */
    default Optional<FieldDescriptor> field(String name) {
        for (FieldDescriptor field : fields()) {
            if (field.name().equals(name)) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }

    /**
     * Invokes the canonical constructor.
     *
     * @param arguments one value per component, in declaration order
     * @return the new instance
     * @throws IllegalArgumentException if the argument count does not match the component count
     */
    T construct(List<?> arguments);

    /**
     * Reads one component of an instance.
     *
     * @param instance the record instance
     * @param field    a component of this descriptor
     * @return the component value
     */
    Object valueOf(T instance, FieldDescriptor field);

    static <T extends Record> RecordDescriptorBuilder<T> builder(Class<T> type) {
        return new RecordDescriptorBuilder<>(type);
    }
}
