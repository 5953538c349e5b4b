/**
 * Errors raised by arbitrary4j at generation time.
 * <p>
 * All exceptions are unchecked and extend {@link io.github.reugn.arbitrary4j.exception.ArbitraryException},
 * which carries the requested type name and the dotted path of the offending field.
 */
package io.github.reugn.arbitrary4j.exception;
