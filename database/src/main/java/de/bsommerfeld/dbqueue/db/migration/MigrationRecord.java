package de.bsommerfeld.dbqueue.db.migration;

/**
 * A migration recorded as applied.
 *
 * @param name         the name it was registered under
 * @param appliedOrder 1 for the first migration ever applied to the file,
 *                     then increasing by one
 */
public record MigrationRecord(String name, long appliedOrder) {
}
