package io.github.reugn.arbitrary4j.exception;

/**
 * Thrown when an override names a field the record does not declare.
 */
public class UnknownFieldException extends ArbitraryException {

    public UnknownFieldException(String message, String typeName, String fieldPath) {
        super(message, typeName, fieldPath);
    }
}
