package io.github.reugn.arbitrary4j;

import io.github.reugn.arbitrary4j.descriptor.FieldDescriptor;
import io.github.reugn.arbitrary4j.descriptor.FieldType;
import io.github.reugn.arbitrary4j.exception.ArbitraryException;
import io.github.reugn.arbitrary4j.exception.TypeMismatchException;
import io.github.reugn.arbitrary4j.exception.UnsupportedFieldTypeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Picks the value of a single field.
 *
 * <p>Custom rules are tried first, most recently registered first. When none matches, the
 * built-in rules apply in this priority order:
 * <table border="1">
 *   <caption>Built-in rules</caption>
 *   <tr><th>#</th><th>Field</th><th>Value</th></tr>
 *   <tr><td>1</td><td>enum</td><td>first declared constant</td></tr>
 *   <tr><td>2</td><td>{@code Optional} family</td><td>absent</td></tr>
 *   <tr><td>3</td><td>collection, array or map</td><td>empty, of the declared shape</td></tr>
 *   <tr><td>4</td><td>nested record</td><td>generated recursively</td></tr>
 *   <tr><td>5</td><td>{@code String} named like {@code *email*}</td><td>{@code random-<seq>@<domain>}</td></tr>
 *   <tr><td>6</td><td>boolean</td><td>{@code false}</td></tr>
 *   <tr><td>7</td><td>byte, short, int, long</td><td>next sequence value</td></tr>
 *   <tr><td>8</td><td>date or time</td><td>now, per the context clock</td></tr>
 *   <tr><td>9</td><td>other {@code String}</td><td>{@code arbitrary-<seq>}</td></tr>
 *   <tr><td>10</td><td>anything else</td><td>{@link UnsupportedFieldTypeException}</td></tr>
 * </table>
 *
 * <p>The kinds are disjoint, so the order only matters inside {@code TEXT}, where the e-mail
 * rule precedes the plain string rule. Wrapped types never reach the scalar rules: an
 * {@code Optional<Color>} is an optional, not an enum.
 */
final class RuleEngine {

    private static final Logger log = LoggerFactory.getLogger(RuleEngine.class);

    static final String EMAIL_MARKER = "email";
    static final String EMAIL_PREFIX = "random-";
    static final String TEXT_PREFIX = "arbitrary-";

    private final List<GenerationRule> customRules = new CopyOnWriteArrayList<>();

    RuleEngine(List<GenerationRule> rules) {
        rules.forEach(this::register);
    }

    /**
     * Adds a custom rule ahead of every rule registered so far.
     */
    void register(GenerationRule rule) {
        customRules.add(0, rule);
        log.debug("Registered custom rule {} ({} custom rules)", rule, customRules.size());
    }

    /**
     * Produces the value of one field.
     *
     * @param field   the field to populate
     * @param path    location of the field, for error messages
     * @param context counter, clock and e-mail domain
     * @param nested  builds nested records
     * @return the field value, type-compatible with the field
     */
    Object resolve(FieldDescriptor field, FieldPath path, GenerationContext context, NestedRecords nested) {
        for (GenerationRule rule : customRules) {
            if (rule.matcher().matches(field)) {
                Object value = rule.producer().produce(field, context);
                if (!field.type().accepts(value)) {
                    throw new TypeMismatchException("Custom rule produced " + describe(value) + " for field "
                            + path + " of type " + field.type().typeName(), path.ownerName(), path.toString());
                }
                return value;
            }
        }
        return applyBuiltIn(field, path, context, nested);
    }

    private Object applyBuiltIn(FieldDescriptor field, FieldPath path, GenerationContext context,
                                NestedRecords nested) {
        FieldType type = field.type();
        return switch (type.kind()) {
            case ENUMERATED -> firstConstant((FieldType.EnumType) type, field, path);
            case OPTIONAL -> ((FieldType.OptionalType) type).emptyValue();
            case SEQUENCE -> ((FieldType.SequenceType) type).emptyValue();
            case MAPPING -> ((FieldType.MappingType) type).emptyValue();
            case RECORD -> nested.build(type.rawType(), path);
            case TEXT -> isEmailField(field)
                    ? EMAIL_PREFIX + context.nextSequence() + "@" + context.emailDomain()
                    : TEXT_PREFIX + context.nextSequence();
            case BOOLEAN -> Boolean.FALSE;
            case INTEGRAL -> integral((FieldType.IntegralType) type, path, context);
            case TEMPORAL -> ((FieldType.TemporalType) type).now(context.clock());
            case OTHER -> throw new UnsupportedFieldTypeException("No rule produces a value for field " + path
                    + " of type " + type.typeName() + "; register a custom rule for it",
                    path.ownerName(), path.toString());
        };
    }

    private static Object firstConstant(FieldType.EnumType type, FieldDescriptor field, FieldPath path) {
        Object constant = type.firstConstant();
        if (constant == null) {
            throw new UnsupportedFieldTypeException("Enum " + type.typeName() + " of field " + path
                    + " declares no constants", path.ownerName(), path.toString());
        }
        return constant;
    }

    private static Object integral(FieldType.IntegralType type, FieldPath path, GenerationContext context) {
        long sequence = context.nextSequence();
        try {
            return type.fromSequence(sequence);
        } catch (ArithmeticException e) {
            throw new ArbitraryException("Sequence value " + sequence + " does not fit field " + path
                    + " of type " + type.typeName(), path.ownerName(), path.toString(), e);
        }
    }

    static boolean isEmailField(FieldDescriptor field) {
        return field.name().toLowerCase(Locale.ROOT).contains(EMAIL_MARKER);
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName() + " '" + value + "'";
    }

    /**
     * Callback into the record builder for nested record fields.
     */
    @FunctionalInterface
    interface NestedRecords {
        Object build(Class<?> type, FieldPath path);
    }
}
