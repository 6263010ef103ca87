package de.bsommerfeld.dbqueue.core.error;

/**
 * A keyed write affected no row. Only raised by the strict model operations;
 * the default ones report zero affected rows as a return value.
 */
public class RecordNotFoundException extends DatabaseException {

    private final String table;

    public RecordNotFoundException(String table, String message) {
        super(message);
        this.table = table;
    }

    public String table() {
        return table;
    }
}
