package io.github.reugn.arbitrary4j.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a record whose instances can be generated by
 * {@link io.github.reugn.arbitrary4j.ArbitraryGenerator}.
 * <p>
 * The annotation processor writes a {@code {RecordName}Arbitrary} descriptor next to the record
 * and lists it in {@code META-INF/services/io.github.reugn.arbitrary4j.descriptor.RecordDescriptor}.
 * Nested records are named after their enclosing types, e.g. {@code Outer_InnerArbitrary}.
 *
 * <p><b>Usage:</b>
 * <pre>
 * {@code
 * @Arbitrary
 * public record Customer(String name, Integer age, String email, Optional<String> nickname) {}
 *
 * Customer customer = Arbitraries.generate(Customer.class);
 * // Customer[name=arbitrary-1, age=2, email=random-3@example.com, nickname=Optional.empty]
 * }
 * </pre>
 *
 * <p><b>Requirements:</b>
 * <ul>
 *   <li>The record must not be {@code private}, nor nested inside a {@code private} type</li>
 *   <li>The record must not declare type parameters</li>
 *   <li>The record must not reach itself through nested record components; wrap the
 *       back-reference in an {@code Optional} or a collection instead</li>
 * </ul>
 * Nested record components need a descriptor of their own: annotate their types as well, or
 * list them in {@link IncludeArbitrary}.
 *
 * @see IncludeArbitrary
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.SOURCE)
public @interface Arbitrary {
}
