package io.github.reugn.arbitrary4j.exception;

/**
 * Base class of every error raised while generating or overriding an arbitrary instance.
 *
 * <p>Carries the name of the type whose generation failed and, where the failure
 * belongs to a single field, the dotted path of that field starting at the
 * requested root type (for example {@code Order.customer.email}).
 */
public class ArbitraryException extends RuntimeException {

    private final String typeName;
    private final String fieldPath;

    public ArbitraryException(String message, String typeName, String fieldPath) {
        super(message);
        this.typeName = typeName;
        this.fieldPath = fieldPath;
    }

    public ArbitraryException(String message, String typeName, String fieldPath, Throwable cause) {
        super(message, cause);
        this.typeName = typeName;
        this.fieldPath = fieldPath;
    }

    /**
     * @return the simple name of the type that was being generated
     */
    public String typeName() {
        return typeName;
    }

    /**
     * @return the dotted path of the offending field, or {@code null} when the
     * failure is not tied to a field
     */
    public String fieldPath() {
        return fieldPath;
    }
}
