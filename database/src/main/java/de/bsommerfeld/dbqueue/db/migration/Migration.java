package de.bsommerfeld.dbqueue.db.migration;

import de.bsommerfeld.dbqueue.db.DatabaseConnection;

/**
 * One schema change. Runs inside the transaction that also records it as
 * applied; throwing rolls both back.
 */
@FunctionalInterface
public interface Migration {

    void migrate(DatabaseConnection db);
}
