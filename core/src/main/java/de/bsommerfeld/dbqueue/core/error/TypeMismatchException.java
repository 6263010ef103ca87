package de.bsommerfeld.dbqueue.core.error;

import de.bsommerfeld.dbqueue.core.value.Value;

/**
 * A non-optional typed extraction found a value that its converter cannot
 * decode, {@code NULL} included.
 */
public class TypeMismatchException extends DatabaseException {

    private final transient Value value;

    public TypeMismatchException(String message, Value value) {
        super(message);
        this.value = value;
    }

    /** The stored value that could not be converted. */
    public Value value() {
        return value;
    }
}
