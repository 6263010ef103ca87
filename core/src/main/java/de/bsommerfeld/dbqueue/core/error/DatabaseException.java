package de.bsommerfeld.dbqueue.core.error;

/**
 * Base class of every recoverable failure raised by this library. All of them
 * are unchecked; {@link java.sql.SQLException} never leaves the JDBC boundary
 * unwrapped.
 */
public class DatabaseException extends RuntimeException {

    public DatabaseException(String message) {
        super(message);
    }

    public DatabaseException(String message, Throwable cause) {
        super(message, cause);
    }
}
