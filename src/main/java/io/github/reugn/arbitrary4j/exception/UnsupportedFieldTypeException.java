package io.github.reugn.arbitrary4j.exception;

/**
 * Thrown when neither a custom rule nor a built-in rule can produce a value for a field.
 */
public class UnsupportedFieldTypeException extends ArbitraryException {

    public UnsupportedFieldTypeException(String message, String typeName, String fieldPath) {
        super(message, typeName, fieldPath);
    }
}
