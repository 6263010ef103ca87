package de.bsommerfeld.dbqueue.db;

/**
 * How a transaction block asks for its work to end.
 */
public enum TransactionOutcome {

    COMMIT,
    ROLLBACK
}
