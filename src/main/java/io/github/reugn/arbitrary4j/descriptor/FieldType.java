package io.github.reugn.arbitrary4j.descriptor;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;

/**
 * Declared type of a record field, reduced to the categories that drive value generation.
 *
 * <p>The set of variants is closed. Each variant reports a {@link Kind}, and the rule engine
 * dispatches on that kind with an exhaustive {@code switch}, so adding a kind without a
 * handler does not compile.
 *
 * <p><b>Variants:</b>
 * <table border="1">
 *   <caption>Field type variants</caption>
 *   <tr><th>Kind</th><th>Variant</th><th>Declared types</th></tr>
 *   <tr><td>{@code ENUMERATED}</td><td>{@link EnumType}</td><td>any enum</td></tr>
 *   <tr><td>{@code OPTIONAL}</td><td>{@link OptionalType}</td>
 *       <td>{@code Optional<T>}, {@code OptionalInt}, {@code OptionalLong}, {@code OptionalDouble}</td></tr>
 *   <tr><td>{@code SEQUENCE}</td><td>{@link SequenceType}</td>
 *       <td>{@code List}, {@code Set}, {@code SortedSet}, {@code NavigableSet}, {@code Collection},
 *       {@code Iterable}, arrays</td></tr>
 *   <tr><td>{@code MAPPING}</td><td>{@link MappingType}</td>
 *       <td>{@code Map}, {@code SortedMap}, {@code NavigableMap}</td></tr>
 *   <tr><td>{@code RECORD}</td><td>{@link RecordType}</td><td>nested records</td></tr>
 *   <tr><td>{@code TEXT}</td><td>{@link TextType}</td><td>{@code String}</td></tr>
 *   <tr><td>{@code BOOLEAN}</td><td>{@link BooleanType}</td><td>{@code boolean}, {@code Boolean}</td></tr>
 *   <tr><td>{@code INTEGRAL}</td><td>{@link IntegralType}</td>
 *       <td>{@code byte}, {@code short}, {@code int}, {@code long} and their wrappers</td></tr>
 *   <tr><td>{@code TEMPORAL}</td><td>{@link TemporalType}</td>
 *       <td>{@code Instant}, {@code LocalDate}, {@code LocalDateTime}, {@code LocalTime},
 *       {@code OffsetDateTime}, {@code ZonedDateTime}</td></tr>
 *   <tr><td>{@code OTHER}</td><td>{@link OtherType}</td><td>everything else</td></tr>
 * </table>
 *
 * <p>Descriptors generated by the annotation processor build these through the static
 * factories below; hand-written descriptors use the same factories.
 */
public sealed interface FieldType permits FieldType.EnumType, FieldType.OptionalType, FieldType.SequenceType,
        FieldType.MappingType, FieldType.RecordType, FieldType.TextType, FieldType.BooleanType,
        FieldType.IntegralType, FieldType.TemporalType, FieldType.OtherType {

    /**
     * Declared-type categories, listed in built-in rule priority order.
     */
    enum Kind {
        ENUMERATED,
        OPTIONAL,
        SEQUENCE,
        MAPPING,
        RECORD,
        TEXT,
        BOOLEAN,
        INTEGRAL,
        TEMPORAL,
        OTHER
    }

    Kind kind();

    /**
     * @return the erased declared type, primitive classes included
     */
    Class<?> rawType();

    /**
     * @return a readable rendering of the declared type, such as {@code List<String>}
     */
    default String typeName() {
        return rawType().getSimpleName();
    }

    /**
     * Whether {@code null} is an acceptable value. Primitives and optionals never accept it.
     */
    default boolean nullable() {
        return !rawType().isPrimitive();
    }

    /**
     * Checks that a value can be assigned to a field of this type.
     * <p>
     * Only the erased type is checked; type arguments of collections are not inspected.
     * Primitive fields accept their exact wrapper type only, no widening.
     *
     * @param value the candidate value, possibly {@code null}
     * @return {@code true} if the value can be passed to the canonical constructor
     */
    default boolean accepts(Object value) {
        if (value == null) {
            return nullable();
        }
        return Primitives.wrap(rawType()).isInstance(value);
    }

    // ==================== FACTORIES ====================

    /**
     * Classifies a non-generic class: scalars, strings, temporals, enums and records.
     * Anything else becomes {@link OtherType}.
     *
     * @param type the declared class
     * @return the matching field type
     */
    static FieldType of(Class<?> type) {
        Objects.requireNonNull(type, "type");
        Class<?> boxed = Primitives.wrap(type);
        if (IntegralType.SUPPORTED.contains(boxed)) {
            return new IntegralType(type);
        }
        if (boxed == Boolean.class) {
            return new BooleanType(type);
        }
        if (type == String.class) {
            return new TextType();
        }
        if (TemporalType.SUPPORTED.contains(type)) {
            return new TemporalType(type);
        }
        if (type.isEnum()) {
            return new EnumType(type);
        }
        if (type.isRecord()) {
            return new RecordType(type);
        }
        return new OtherType(type);
    }

    static FieldType text() {
        return new TextType();
    }

    static FieldType integral(Class<?> type) {
        return new IntegralType(type);
    }

    static FieldType bool(Class<?> type) {
        return new BooleanType(type);
    }

    static FieldType temporal(Class<?> type) {
        return new TemporalType(type);
    }

    static FieldType enumeration(Class<? extends Enum<?>> type) {
        return new EnumType(type);
    }

    static FieldType nested(Class<? extends Record> type) {
        return new RecordType(type);
    }

    static FieldType other(Class<?> type) {
        return new OtherType(type);
    }

    static FieldType optional(FieldType element) {
        return new OptionalType(Optional.class, element, Optional.empty());
    }

    static FieldType optionalInt() {
        return new OptionalType(OptionalInt.class, new IntegralType(int.class), OptionalInt.empty());
    }

    static FieldType optionalLong() {
        return new OptionalType(OptionalLong.class, new IntegralType(long.class), OptionalLong.empty());
    }

    static FieldType optionalDouble() {
        return new OptionalType(OptionalDouble.class, new OtherType(double.class), OptionalDouble.empty());
    }

    static FieldType list(FieldType element) {
        return new SequenceType(List.class, element, List.of());
    }

    static FieldType set(FieldType element) {
        return new SequenceType(Set.class, element, Set.of());
    }

    static FieldType sortedSet(FieldType element) {
        return new SequenceType(SortedSet.class, element, Collections.emptyNavigableSet());
    }

    static FieldType navigableSet(FieldType element) {
        return new SequenceType(NavigableSet.class, element, Collections.emptyNavigableSet());
    }

    static FieldType collection(FieldType element) {
        return new SequenceType(Collection.class, element, List.of());
    }

    static FieldType iterable(FieldType element) {
        return new SequenceType(Iterable.class, element, List.of());
    }

    /**
     * Array field type.
     *
     * @param emptyArray a zero-length array of the declared array type, e.g. {@code new String[0]}
     * @param component  the component field type
     * @return the field type
     */
    static FieldType array(Object emptyArray, FieldType component) {
        Objects.requireNonNull(emptyArray, "emptyArray");
        if (!emptyArray.getClass().isArray()) {
            throw new IllegalArgumentException("Expected an array, got " + emptyArray.getClass().getName());
        }
        return new SequenceType(emptyArray.getClass(), component, emptyArray);
    }

    static FieldType map(FieldType key, FieldType value) {
        return new MappingType(Map.class, key, value, Map.of());
    }

    static FieldType sortedMap(FieldType key, FieldType value) {
        return new MappingType(SortedMap.class, key, value, Collections.emptyNavigableMap());
    }

    static FieldType navigableMap(FieldType key, FieldType value) {
        return new MappingType(NavigableMap.class, key, value, Collections.emptyNavigableMap());
    }

    // ==================== VARIANTS ====================

    /**
     * Enum field; generated as its first declared constant.
     */
    record EnumType(Class<?> rawType) implements FieldType {
        public EnumType {
            if (!rawType.isEnum()) {
                throw new IllegalArgumentException(rawType.getName() + " is not an enum");
            }
        }

        @Override
        public Kind kind() {
            return Kind.ENUMERATED;
        }

        /**
         * @return the first declared constant, or {@code null} for an enum without constants
         */
        public Object firstConstant() {
            Object[] constants = rawType.getEnumConstants();
            return constants.length == 0 ? null : constants[0];
        }
    }

    /**
     * {@code Optional} family; generated absent.
     */
    record OptionalType(Class<?> rawType, FieldType element, Object emptyValue) implements FieldType {
        @Override
        public Kind kind() {
            return Kind.OPTIONAL;
        }

        @Override
        public boolean nullable() {
            return false;
        }

        @Override
        public String typeName() {
            return rawType == Optional.class ? "Optional<" + element.typeName() + ">" : rawType.getSimpleName();
        }
    }

    /**
     * Collections and arrays; generated empty.
     */
    record SequenceType(Class<?> rawType, FieldType element, Object emptyValue) implements FieldType {
        @Override
        public Kind kind() {
            return Kind.SEQUENCE;
        }

        @Override
        public String typeName() {
            if (rawType.isArray()) {
                return element.typeName() + "[]";
            }
            return rawType.getSimpleName() + "<" + element.typeName() + ">";
        }
    }

    /**
     * Maps; generated empty.
     */
    record MappingType(Class<?> rawType, FieldType key, FieldType value, Object emptyValue) implements FieldType {
        @Override
        public Kind kind() {
            return Kind.MAPPING;
        }

        @Override
        public String typeName() {
            return rawType.getSimpleName() + "<" + key.typeName() + ", " + value.typeName() + ">";
        }
    }

    /**
     * Nested record; generated recursively.
     */
    record RecordType(Class<?> rawType) implements FieldType {
        public RecordType {
            if (!rawType.isRecord()) {
                throw new IllegalArgumentException(rawType.getName() + " is not a record");
            }
        }

        @Override
        public Kind kind() {
            return Kind.RECORD;
        }
    }

    record TextType() implements FieldType {
        @Override
        public Kind kind() {
            return Kind.TEXT;
        }

        @Override
        public Class<?> rawType() {
            return String.class;
        }
    }

    record BooleanType(Class<?> rawType) implements FieldType {
        public BooleanType {
            if (Primitives.wrap(rawType) != Boolean.class) {
                throw new IllegalArgumentException(rawType.getName() + " is not a boolean type");
            }
        }

        @Override
        public Kind kind() {
            return Kind.BOOLEAN;
        }
    }

    /**
     * Fixed-width signed integers, generated from the sequence counter.
     */
    record IntegralType(Class<?> rawType) implements FieldType {
        static final Set<Class<?>> SUPPORTED = Set.of(Byte.class, Short.class, Integer.class, Long.class);

        public IntegralType {
            if (!SUPPORTED.contains(Primitives.wrap(rawType))) {
                throw new IllegalArgumentException(rawType.getName() + " is not a fixed-width integral type");
            }
        }

        @Override
        public Kind kind() {
            return Kind.INTEGRAL;
        }

        /**
         * Converts a positive sequence value to this type.
         * <p>
         * {@code byte} and {@code short} wrap into {@code [1, MAX_VALUE]}.
         *
         * @param sequence a value drawn from the sequence counter
         * @return the boxed value
         * @throws ArithmeticException if the value does not fit an {@code int}
         */
        public Object fromSequence(long sequence) {
            Class<?> boxed = Primitives.wrap(rawType);
            if (boxed == Byte.class) {
                return (byte) (1 + (sequence - 1) % Byte.MAX_VALUE);
            }
            if (boxed == Short.class) {
                return (short) (1 + (sequence - 1) % Short.MAX_VALUE);
            }
            if (boxed == Integer.class) {
                return Math.toIntExact(sequence);
            }
            return sequence;
        }
    }

    /**
     * Date and time types, generated as the current time of the generation clock.
     */
    record TemporalType(Class<?> rawType) implements FieldType {
        static final Set<Class<?>> SUPPORTED = Set.of(Instant.class, LocalDate.class, LocalDateTime.class,
                LocalTime.class, OffsetDateTime.class, ZonedDateTime.class);

        public TemporalType {
            if (!SUPPORTED.contains(rawType)) {
                throw new IllegalArgumentException(rawType.getName() + " is not a supported temporal type");
            }
        }

        @Override
        public Kind kind() {
            return Kind.TEMPORAL;
        }

        public Object now(Clock clock) {
            if (rawType == Instant.class) {
                return Instant.now(clock);
            }
            if (rawType == LocalDate.class) {
                return LocalDate.now(clock);
            }
            if (rawType == LocalDateTime.class) {
                return LocalDateTime.now(clock);
            }
            if (rawType == LocalTime.class) {
                return LocalTime.now(clock);
            }
            if (rawType == OffsetDateTime.class) {
                return OffsetDateTime.now(clock);
            }
            return ZonedDateTime.now(clock);
        }
    }

    /**
     * Any declared type without a built-in rule. Only custom rules can produce it.
     */
    record OtherType(Class<?> rawType) implements FieldType {
        @Override
        public Kind kind() {
            return Kind.OTHER;
        }
    }
}
