package de.bsommerfeld.dbqueue.db;

/**
 * Locking behaviour of a transaction, mapped onto the engine's
 * {@code BEGIN DEFERRED | IMMEDIATE | EXCLUSIVE}.
 */
public enum TransactionKind {

    /** No lock until the first read or write. */
    DEFERRED("BEGIN DEFERRED TRANSACTION"),
    /** Reserves the write lock immediately. */
    IMMEDIATE("BEGIN IMMEDIATE TRANSACTION"),
    /** Locks out other connections entirely. */
    EXCLUSIVE("BEGIN EXCLUSIVE TRANSACTION");

    private final String beginSql;

    TransactionKind(String beginSql) {
        this.beginSql = beginSql;
    }

    String beginSql() {
        return beginSql;
    }
}
