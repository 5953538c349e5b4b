package io.github.reugn.arbitrary4j;

import java.util.Objects;

/**
 * A custom rule: fields accepted by {@code matcher} get their value from {@code producer}.
 *
 * @param matcher  selects the fields this rule applies to
 * @param producer produces the field value
 */
public record GenerationRule(FieldMatcher matcher, ValueProducer producer) {

    public GenerationRule {
        Objects.requireNonNull(matcher, "matcher");
        Objects.requireNonNull(producer, "producer");
    }
}
