package io.github.reugn.arbitrary4j.exception;

/**
 * Thrown when a type has no canonical constructor that arbitrary4j knows about:
 * primitives, interfaces, enums, arrays, or records without a descriptor.
 */
public class NotARecordTypeException extends ArbitraryException {

    public NotARecordTypeException(String message, String typeName, String fieldPath) {
        super(message, typeName, fieldPath);
    }
}
