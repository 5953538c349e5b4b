/**
 * Statically derived record descriptors.
 * <p>
 * A {@link io.github.reugn.arbitrary4j.descriptor.RecordDescriptor} lists a record's components
 * as {@link io.github.reugn.arbitrary4j.descriptor.FieldDescriptor}s, each typed by one of the
 * closed {@link io.github.reugn.arbitrary4j.descriptor.FieldType} variants, and knows how to call
 * the canonical constructor. Descriptors are generated at compile time or declared with
 * {@link io.github.reugn.arbitrary4j.descriptor.RecordDescriptor#builder(Class)}; no runtime
 * reflection over constructors is involved.
 */
package io.github.reugn.arbitrary4j.descriptor;
