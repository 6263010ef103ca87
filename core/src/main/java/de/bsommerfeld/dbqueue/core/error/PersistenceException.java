package de.bsommerfeld.dbqueue.core.error;

/**
 * A model cannot be persisted because its declaration is incomplete: no table
 * name, or an empty write mapping.
 */
public class PersistenceException extends DatabaseException {

    public PersistenceException(String message) {
        super(message);
    }
}
