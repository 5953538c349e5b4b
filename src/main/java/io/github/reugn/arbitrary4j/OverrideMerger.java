package io.github.reugn.arbitrary4j;

import io.github.reugn.arbitrary4j.descriptor.FieldDescriptor;
import io.github.reugn.arbitrary4j.descriptor.FieldType;
import io.github.reugn.arbitrary4j.descriptor.RecordDescriptor;
import io.github.reugn.arbitrary4j.exception.TypeMismatchException;
import io.github.reugn.arbitrary4j.exception.UnknownFieldException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies an {@link OverrideSet} to a generated instance.
 *
 * <p>Every override is checked before anything is built: unknown names fail with
 * {@link UnknownFieldException}, values of the wrong type with {@link TypeMismatchException}.
 * The result is a new instance; the input is left untouched. Dotted paths rebuild the
 * nested record they lead into.
 */
final class OverrideMerger {

    private final TypeIntrospector introspector;

    OverrideMerger(TypeIntrospector introspector) {
        this.introspector = introspector;
    }

    <T> T merge(T instance, RecordDescriptor<T> descriptor, OverrideSet overrides, FieldPath path) {
        if (overrides.isEmpty()) {
            return instance;
        }
        Map<String, Object> direct = new LinkedHashMap<>();
        Map<String, OverrideSet.Builder> nested = new LinkedHashMap<>();

        for (Map.Entry<String, Object> entry : overrides.values().entrySet()) {
            String key = entry.getKey();
            int dot = key.indexOf('.');
            String name = dot < 0 ? key : key.substring(0, dot);
            FieldDescriptor field = descriptor.field(name).orElseThrow(() -> new UnknownFieldException(
                    descriptor.type().getSimpleName() + " has no field '" + name + "' (override " + path.field(key)
                            + "); known fields: " + descriptor.fields(),
                    descriptor.type().getSimpleName(), path.field(key).toString()));

            if (dot < 0) {
                checkValue(field, entry.getValue(), path.field(name));
                direct.put(name, entry.getValue());
            } else {
                if (field.type().kind() != FieldType.Kind.RECORD) {
                    throw new UnknownFieldException("Override " + path.field(key) + " descends into field "
                            + path.field(name) + " of type " + field.type().typeName() + ", which is not a record",
                            descriptor.type().getSimpleName(), path.field(key).toString());
                }
                nested.computeIfAbsent(name, n -> OverrideSet.builder()).set(key.substring(dot + 1), entry.getValue());
            }
        }

        List<Object> arguments = new ArrayList<>(descriptor.fields().size());
        for (FieldDescriptor field : descriptor.fields()) {
            Object value = direct.containsKey(field.name())
                    ? direct.get(field.name())
                    : descriptor.valueOf(instance, field);
            OverrideSet.Builder nestedOverrides = nested.get(field.name());
            if (nestedOverrides != null) {
                value = mergeNested(value, field, nestedOverrides.build(), path.field(field.name()));
            }
            arguments.add(value);
        }
        return RecordBuilder.instantiate(descriptor, arguments, path);
    }

    private Object mergeNested(Object current, FieldDescriptor field, OverrideSet overrides, FieldPath path) {
        if (current == null) {
            throw new UnknownFieldException("Cannot override fields of " + path + ": the nested record is null",
                    path.ownerName(), path.toString());
        }
        return mergeUnchecked(current, introspector.describe(field.type().rawType(), path), overrides,
                path.enter(field.type().rawType()));
    }

    @SuppressWarnings("unchecked")
    private <T> T mergeUnchecked(Object current, RecordDescriptor<T> descriptor, OverrideSet overrides, FieldPath path) {
        return merge((T) current, descriptor, overrides, path);
    }

    private static void checkValue(FieldDescriptor field, Object value, FieldPath path) {
        if (!field.type().accepts(value)) {
            String actual = value == null ? "null" : value.getClass().getName();
            throw new TypeMismatchException("Override for " + path + " expects " + field.type().typeName()
                    + " but got " + actual, path.ownerName(), path.toString());
        }
    }
}
