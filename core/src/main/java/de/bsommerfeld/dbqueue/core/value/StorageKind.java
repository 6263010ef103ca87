package de.bsommerfeld.dbqueue.core.value;

/**
 * The five storage classes of the embedded engine. Every value read from or
 * written to the database file has exactly one of these kinds.
 */
public enum StorageKind {

    NULL,
    INTEGER,
    REAL,
    TEXT,
    BLOB
}
