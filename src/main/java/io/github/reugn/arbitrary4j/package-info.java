/**
 * Reasonable arbitrary instances of Java records, for tests.
 * <p>
 * {@link io.github.reugn.arbitrary4j.ArbitraryGenerator} walks a record's descriptor, gives every
 * field a value chosen by type and name (unique numbers and strings, empty collections, absent
 * optionals, first enum constants, nested records generated recursively) and applies caller
 * overrides afterwards. {@link io.github.reugn.arbitrary4j.Arbitraries} is the static shortcut.
 *
 * <p><b>Architecture:</b>
 * <pre>
 * ArbitraryGenerator (entry point)
 *     ├── TypeIntrospector  - descriptor lookup
 *     ├── RecordBuilder     - per-field resolution, cycle detection, constructor call
 *     │     └── RuleEngine  - custom rules, then built-in rules
 *     └── OverrideMerger    - type-checked field replacement
 *
 * GenerationContext
 *     └── SequenceCounter   - atomic, strictly increasing
 * </pre>
 *
 * @see io.github.reugn.arbitrary4j.annotation.Arbitrary
 * @see io.github.reugn.arbitrary4j.descriptor.RecordDescriptor
 */
package io.github.reugn.arbitrary4j;
