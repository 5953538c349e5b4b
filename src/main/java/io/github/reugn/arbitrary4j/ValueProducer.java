package io.github.reugn.arbitrary4j;

import io.github.reugn.arbitrary4j.descriptor.FieldDescriptor;

/**
 * Produces the value of a field matched by a custom rule.
 * <p>
 * A producer that needs a unique value draws it with {@link GenerationContext#nextSequence()}.
 */
@FunctionalInterface
public interface ValueProducer {

    Object produce(FieldDescriptor field, GenerationContext context);
}
