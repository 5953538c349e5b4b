package io.github.reugn.arbitrary4j.exception;

/**
 * Thrown when a record reaches itself through nested record fields, which would make
 * generation recurse forever.
 * <p>
 * Fields wrapped in {@code Optional}, collections or maps do not count, since those
 * are generated empty and never recurse. Neither do fields taken by a custom rule.
 */
public class CyclicRecordTypeException extends ArbitraryException {

    public CyclicRecordTypeException(String message, String typeName, String fieldPath) {
        super(message, typeName, fieldPath);
    }
}
