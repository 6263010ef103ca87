package de.bsommerfeld.dbqueue.core.error;

/**
 * Programmer misuse that leaves no safe way to continue, such as advancing a
 * cursor after the queue block that created it has returned, or touching a
 * connection from outside its queue.
 *
 * <p>
 * This is an {@link Error}, not a {@link DatabaseException}: the operation is
 * terminated instead of producing a value, and callers are not expected to
 * catch it.
 */
public class DatabaseMisuseError extends Error {

    public DatabaseMisuseError(String message) {
        super(message);
    }
}
