/**
 * Annotation processor implementation for arbitrary4j.
 * <p>
 * This package contains the compile-time processor that generates record descriptors
 * for {@link io.github.reugn.arbitrary4j.annotation.Arbitrary} and
 * {@link io.github.reugn.arbitrary4j.annotation.IncludeArbitrary}.
 * <p>
 * <b>Internal implementation</b> - not part of the public API.
 *
 * <p><b>Architecture:</b>
 * <pre>
 * ArbitraryProcessor (entry point)
 *     └── DescriptorGenerator
 *           └── FieldTypeMapper - declared type to FieldType expression
 *
 * Support utilities:
 *     ├── CodeGenUtils    - Record components, canonical constructor, generated names
 *     ├── ValidationUtils - Compile-time validation checks
 *     └── ErrorReporter   - Error reporting interface
 * </pre>
 *
 * @see io.github.reugn.arbitrary4j.annotation
 */
package io.github.reugn.arbitrary4j.processor;
