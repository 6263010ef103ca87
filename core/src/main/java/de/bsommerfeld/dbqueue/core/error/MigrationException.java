package de.bsommerfeld.dbqueue.core.error;

/**
 * A registered migration failed. Its transaction was rolled back and no
 * migration after it was attempted; the triggering error is the cause.
 */
public class MigrationException extends DatabaseException {

    private final String migrationName;

    public MigrationException(String migrationName, Throwable cause) {
        super("Migration '" + migrationName + "' failed: " + cause.getMessage(), cause);
        this.migrationName = migrationName;
    }

    public String migrationName() {
        return migrationName;
    }
}
