package de.bsommerfeld.dbqueue.db;

/**
 * A block of database work submitted to a {@link DatabaseQueue}. The
 * connection it receives, and every cursor opened through it, is only valid
 * until the block returns.
 *
 * @param <T> the block's result
 */
@FunctionalInterface
public interface DatabaseWork<T> {

    T run(DatabaseConnection db);
}
