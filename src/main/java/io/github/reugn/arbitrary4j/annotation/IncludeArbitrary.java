package io.github.reugn.arbitrary4j.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Generates descriptors for records you cannot annotate directly, such as records from
 * another module or a third-party library.
 *
 * <p><b>Usage:</b>
 * <pre>
 * {@code
 * // External record (you can't modify this)
 * public record Money(Long amount, String currency) {}
 *
 * // Your code
 * @IncludeArbitrary({Money.class, Address.class})
 * class TestRecords {}
 *
 * Money money = Arbitraries.generate(Money.class);
 * }
 * </pre>
 *
 * <p>Descriptors of included records are generated in the package of the annotated class and
 * registered through {@code META-INF/services}; the naming-convention fallback does not find
 * them. Included records must be accessible from that package.
 *
 * @see Arbitrary
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.SOURCE)
public @interface IncludeArbitrary {
    /**
     * The record types to generate descriptors for.
     *
     * @return array of record classes
     */
    Class<?>[] value();
}
