package io.github.reugn.arbitrary4j.processor;

import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.CodeBlock;
import com.squareup.javapoet.TypeName;
import io.github.reugn.arbitrary4j.descriptor.FieldType;

import javax.lang.model.element.ElementKind;
import javax.lang.model.element.TypeElement;
import javax.lang.model.type.ArrayType;
import javax.lang.model.type.DeclaredType;
import javax.lang.model.type.TypeKind;
import javax.lang.model.type.TypeMirror;
import javax.lang.model.type.WildcardType;
import javax.lang.model.util.Types;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Translates the declared type of a record component into the {@link FieldType} factory call
 * that recreates it at runtime.
 *
 * <p><b>Examples:</b>
 * <table border="1">
 *   <caption>Declared type to generated expression</caption>
 *   <tr><th>Declared</th><th>Generated</th></tr>
 *   <tr><td>{@code int}</td><td>{@code FieldType.integral(int.class)}</td></tr>
 *   <tr><td>{@code String}</td><td>{@code FieldType.text()}</td></tr>
 *   <tr><td>{@code Optional<Status>}</td><td>{@code FieldType.optional(FieldType.enumeration(Status.class))}</td></tr>
 *   <tr><td>{@code Map<String, List<Long>>}</td>
 *       <td>{@code FieldType.map(FieldType.text(), FieldType.list(FieldType.integral(Long.class)))}</td></tr>
 *   <tr><td>{@code String[]}</td><td>{@code FieldType.array(new String[0], FieldType.text())}</td></tr>
 *   <tr><td>{@code UUID}</td><td>{@code FieldType.other(UUID.class)}</td></tr>
 * </table>
 *
 * <p>Type variables and unbounded wildcards map to {@code Object}.
 */
final class FieldTypeMapper {

    private static final ClassName FIELD_TYPE = ClassName.get(FieldType.class);

    private static final Set<String> INTEGRAL = Set.of(
            "java.lang.Byte", "java.lang.Short", "java.lang.Integer", "java.lang.Long");

    private static final Set<String> TEMPORAL = Set.of(
            "java.time.Instant", "java.time.LocalDate", "java.time.LocalDateTime",
            "java.time.LocalTime", "java.time.OffsetDateTime", "java.time.ZonedDateTime");

    private static final Map<String, String> SEQUENCES = Map.of(
            "java.util.List", "list",
            "java.util.Set", "set",
            "java.util.SortedSet", "sortedSet",
            "java.util.NavigableSet", "navigableSet",
            "java.util.Collection", "collection",
            "java.lang.Iterable", "iterable");

    private static final Map<String, String> MAPPINGS = Map.of(
            "java.util.Map", "map",
            "java.util.SortedMap", "sortedMap",
            "java.util.NavigableMap", "navigableMap");

    private final Types typeUtils;

    FieldTypeMapper(Types typeUtils) {
        this.typeUtils = typeUtils;
    }

    /**
     * @param type the declared component type
     * @return an expression of type {@link FieldType}
     */
    CodeBlock map(TypeMirror type) {
        TypeKind kind = type.getKind();
        if (kind.isPrimitive()) {
            return mapPrimitive(type);
        }
        return switch (kind) {
            case ARRAY -> mapArray((ArrayType) type);
            case DECLARED -> mapDeclared((DeclaredType) type);
            case WILDCARD -> mapWildcard((WildcardType) type);
            default -> other(ClassName.OBJECT);
        };
    }

    private CodeBlock mapPrimitive(TypeMirror type) {
        TypeName primitive = TypeName.get(type);
        return switch (type.getKind()) {
            case BYTE, SHORT, INT, LONG -> CodeBlock.of("$T.integral($T.class)", FIELD_TYPE, primitive);
            case BOOLEAN -> CodeBlock.of("$T.bool($T.class)", FIELD_TYPE, primitive);
            default -> other(primitive);
        };
    }

    private CodeBlock mapArray(ArrayType type) {
        TypeMirror component = type.getComponentType();
        return CodeBlock.of("$T.array($L, $L)", FIELD_TYPE, emptyArray(type), map(component));
    }

    private CodeBlock mapDeclared(DeclaredType type) {
        TypeElement element = (TypeElement) type.asElement();
        String name = element.getQualifiedName().toString();
        TypeName raw = TypeName.get(typeUtils.erasure(type));
        List<? extends TypeMirror> args = type.getTypeArguments();

        if (element.getKind() == ElementKind.ENUM) {
            return CodeBlock.of("$T.enumeration($T.class)", FIELD_TYPE, raw);
        }
        if (element.getKind() == ElementKind.RECORD) {
            return CodeBlock.of("$T.nested($T.class)", FIELD_TYPE, raw);
        }
        if (name.equals("java.lang.String")) {
            return CodeBlock.of("$T.text()", FIELD_TYPE);
        }
        if (INTEGRAL.contains(name)) {
            return CodeBlock.of("$T.integral($T.class)", FIELD_TYPE, raw);
        }
        if (name.equals("java.lang.Boolean")) {
            return CodeBlock.of("$T.bool($T.class)", FIELD_TYPE, raw);
        }
        if (TEMPORAL.contains(name)) {
            return CodeBlock.of("$T.temporal($T.class)", FIELD_TYPE, raw);
        }
        switch (name) {
            case "java.util.Optional":
                return CodeBlock.of("$T.optional($L)", FIELD_TYPE, argument(args, 0));
            case "java.util.OptionalInt":
                return CodeBlock.of("$T.optionalInt()", FIELD_TYPE);
            case "java.util.OptionalLong":
                return CodeBlock.of("$T.optionalLong()", FIELD_TYPE);
            case "java.util.OptionalDouble":
                return CodeBlock.of("$T.optionalDouble()", FIELD_TYPE);
            default:
                break;
        }
        if (SEQUENCES.containsKey(name)) {
            return CodeBlock.of("$T.$L($L)", FIELD_TYPE, SEQUENCES.get(name), argument(args, 0));
        }
        if (MAPPINGS.containsKey(name)) {
            return CodeBlock.of("$T.$L($L, $L)", FIELD_TYPE, MAPPINGS.get(name),
                    argument(args, 0), argument(args, 1));
        }
        return other(raw);
    }

    private CodeBlock mapWildcard(WildcardType type) {
        TypeMirror bound = type.getExtendsBound();
        return bound != null ? map(bound) : other(ClassName.OBJECT);
    }

    private CodeBlock argument(List<? extends TypeMirror> args, int index) {
        // raw types carry no arguments
        return index < args.size() ? map(args.get(index)) : other(ClassName.OBJECT);
    }

    /**
     * Zero-length array of the erased array type; {@code String[][]} becomes {@code new String[0][]}.
     */
    private CodeBlock emptyArray(ArrayType type) {
        int dimensions = 0;
        TypeMirror component = type;
        while (component.getKind() == TypeKind.ARRAY) {
            component = ((ArrayType) component).getComponentType();
            dimensions++;
        }
        return CodeBlock.of("new $T[0]$L", TypeName.get(typeUtils.erasure(component)), "[]".repeat(dimensions - 1));
    }

    private static CodeBlock other(TypeName type) {
        return CodeBlock.of("$T.other($T.class)", FIELD_TYPE, type);
    }
}
