/**
 * Annotations that request compile-time record descriptors.
 * <p>
 * This package provides:
 * <ul>
 *   <li>{@link io.github.reugn.arbitrary4j.annotation.Arbitrary} - Generate a descriptor for an annotated record</li>
 *   <li>{@link io.github.reugn.arbitrary4j.annotation.IncludeArbitrary} - Generate descriptors for external records</li>
 * </ul>
 * <p>
 * Both are processed by {@link io.github.reugn.arbitrary4j.processor.ArbitraryProcessor}.
 *
 * @see io.github.reugn.arbitrary4j.processor.ArbitraryProcessor
 */
package io.github.reugn.arbitrary4j.annotation;
