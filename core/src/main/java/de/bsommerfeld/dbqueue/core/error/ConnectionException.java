package de.bsommerfeld.dbqueue.core.error;

/**
 * The database file could not be opened, created or closed, or the queue that
 * owns the connection is already closed.
 */
public class ConnectionException extends DatabaseException {

    public ConnectionException(String message) {
        super(message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
