package io.github.reugn.arbitrary4j;

import io.github.reugn.arbitrary4j.descriptor.FieldDescriptor;
import io.github.reugn.arbitrary4j.descriptor.FieldType;

import java.util.Locale;
import java.util.Objects;

/**
 * Selects the fields a custom rule applies to, by declared type and/or field name.
 *
 * <pre>{@code
 * generator.registerRule(
 *         FieldMatcher.ofType(UUID.class),
 *         (field, context) -> new UUID(0, context.nextSequence()));
 *
 * generator.registerRule(
 *         FieldMatcher.ofKind(FieldType.Kind.TEXT).and(FieldMatcher.nameContains("phone")),
 *         (field, context) -> "+1-555-" + context.nextSequence());
 * }</pre>
 */
@FunctionalInterface
public interface FieldMatcher {

    boolean matches(FieldDescriptor field);

    default FieldMatcher and(FieldMatcher other) {
        Objects.requireNonNull(other, "other");
        return field -> matches(field) && other.matches(field);
    }

    default FieldMatcher or(FieldMatcher other) {
        Objects.requireNonNull(other, "other");
        return field -> matches(field) || other.matches(field);
    }

    default FieldMatcher negate() {
        return field -> !matches(field);
    }

    /**
     * Matches fields with exactly this name.
     */
    static FieldMatcher named(String name) {
        Objects.requireNonNull(name, "name");
        return field -> field.name().equals(name);
    }

    /**
     * Matches fields whose name contains {@code fragment}, ignoring case.
     */
    static FieldMatcher nameContains(String fragment) {
        String needle = fragment.toLowerCase(Locale.ROOT);
        return field -> field.name().toLowerCase(Locale.ROOT).contains(needle);
    }

    static FieldMatcher ofKind(FieldType.Kind kind) {
        Objects.requireNonNull(kind, "kind");
        return field -> field.type().kind() == kind;
    }

    /**
     * Matches fields whose erased declared type is exactly {@code type}.
     */
    static FieldMatcher ofType(Class<?> type) {
        Objects.requireNonNull(type, "type");
        return field -> field.type().rawType() == type;
    }
}
