package io.github.reugn.arbitrary4j;

import io.github.reugn.arbitrary4j.descriptor.FieldDescriptor;
import io.github.reugn.arbitrary4j.descriptor.RecordDescriptor;
import io.github.reugn.arbitrary4j.exception.ArbitraryException;
import io.github.reugn.arbitrary4j.exception.CyclicRecordTypeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Builds a record instance by resolving every field in declaration order and calling the
 * canonical constructor.
 *
 * <p>Nested record fields recurse through {@link #build}, drawing from the same counter,
 * so values stay unique across the whole object graph. A nested record is described only when
 * recursion reaches it, and recursing into a record that is already being built fails with
 * {@link CyclicRecordTypeException}. Fields taken by a custom rule never recurse.
 */
final class RecordBuilder {

    private static final Logger log = LoggerFactory.getLogger(RecordBuilder.class);

    private final TypeIntrospector introspector;
    private final RuleEngine ruleEngine;

    RecordBuilder(TypeIntrospector introspector, RuleEngine ruleEngine) {
        this.introspector = introspector;
        this.ruleEngine = ruleEngine;
    }

    /**
     * @param descriptor the record to build
     * @param path       where the record sits below the requested root type
     * @param context    counter, clock and e-mail domain
     * @return a fully populated instance
     */
    <T> T build(RecordDescriptor<T> descriptor, FieldPath path, GenerationContext context) {
        return build(descriptor, path, context, new ArrayDeque<>());
    }

    private <T> T build(RecordDescriptor<T> descriptor, FieldPath path, GenerationContext context,
                        Deque<Class<?>> building) {
        building.push(descriptor.type());
        try {
            List<Object> arguments = new ArrayList<>(descriptor.fields().size());
            for (FieldDescriptor field : descriptor.fields()) {
                arguments.add(ruleEngine.resolve(field, path.field(field.name()), context,
                        (nestedType, nestedPath) -> buildNested(nestedType, nestedPath, context, building)));
            }
            T instance = instantiate(descriptor, arguments, path);
            log.debug("Generated {} at {}", descriptor.type().getSimpleName(), path);
            return instance;
        } finally {
            building.pop();
        }
    }

    private Object buildNested(Class<?> type, FieldPath path, GenerationContext context,
                               Deque<Class<?>> building) {
        if (building.contains(type)) {
            throw new CyclicRecordTypeException("Record " + type.getSimpleName()
                    + " refers back to itself through " + path
                    + "; make the field Optional or a collection, or register a custom rule for it",
                    path.ownerName(), path.toString());
        }
        return build(introspector.describe(type, path), path.enter(type), context, building);
    }

    /**
     * Calls the canonical constructor, attaching the record's path to anything it throws.
     */
    static <T> T instantiate(RecordDescriptor<T> descriptor, List<Object> arguments, FieldPath path) {
        try {
            return descriptor.construct(arguments);
        } catch (ArbitraryException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ArbitraryException("Constructor of " + descriptor.type().getSimpleName()
                    + " rejected the values for " + path + ": " + e.getMessage(),
                    descriptor.type().getSimpleName(), path.toString(), e);
        }
    }
}
