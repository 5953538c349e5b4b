package io.github.reugn.arbitrary4j.exception;

/**
 * Thrown when a value supplied for a field is not assignable to the field's declared type.
 * <p>
 * Raised for override values and for values returned by custom rules.
 */
public class TypeMismatchException extends ArbitraryException {

    public TypeMismatchException(String message, String typeName, String fieldPath) {
        super(message, typeName, fieldPath);
    }
}
