package io.github.reugn.arbitrary4j.descriptor;

import java.util.Objects;

/**
 * One record component: its position in the canonical constructor, its name and its declared type.
 *
 * @param index zero-based position in declaration order
 * @param name  the component name
 * @param type  the declared type
 */
public record FieldDescriptor(int index, String name, FieldType type) {

    public FieldDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        if (index < 0) {
            throw new IllegalArgumentException("Field index must not be negative: " + index);
        }
        if (name.isBlank()) {
            throw new IllegalArgumentException("Field name must not be blank");
        }
    }

    public static FieldDescriptor of(int index, String name, FieldType type) {
        return new FieldDescriptor(index, name, type);
    }

    /**
     * @return {@code true} for {@code Optional}-shaped fields, which are generated absent
     */
    public boolean optional() {
        return type.kind() == FieldType.Kind.OPTIONAL;
    }

    @Override
    public String toString() {
        return name + ": " + type.typeName();
    }
}
