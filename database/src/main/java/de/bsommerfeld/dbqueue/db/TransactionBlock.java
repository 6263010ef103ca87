package de.bsommerfeld.dbqueue.db;

/**
 * Work executed inside a transaction or savepoint. Returning
 * {@link TransactionOutcome#COMMIT} makes its writes durable; returning
 * {@link TransactionOutcome#ROLLBACK} or throwing undoes all of them.
 */
@FunctionalInterface
public interface TransactionBlock {

    TransactionOutcome run(DatabaseConnection db);
}
