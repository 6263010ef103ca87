package de.bsommerfeld.dbqueue.core.error;

/**
 * A write or keyed lookup was requested on a model that cannot address a
 * single row: its primary key is declared as none, or its key columns are
 * unset. Nothing is executed.
 */
public class UnsupportedModelOperationException extends DatabaseException {

    public UnsupportedModelOperationException(String message) {
        super(message);
    }
}
