package de.bsommerfeld.dbqueue.core.error;

/**
 * Statement arguments do not match the statement's placeholders, or an
 * argument has no storage representation. Raised before anything executes.
 */
public class BindingException extends DatabaseException {

    public BindingException(String message) {
        super(message);
    }

    public BindingException(String message, Throwable cause) {
        super(message, cause);
    }
}
