/**
 * Serialized access to a SQLite database file.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 *   [Application threads]
 *          │  inDatabase / inTransaction (blocking)
 *          ▼
 *   DatabaseQueue        ← single-thread executor, FIFO
 *          │
 *          ▼
 *   DatabaseConnection   ← one JDBC connection, statement cache
 *      ┌───┴────┐
 *      │        │
 * SqlStatement  Cursor   ← cursor valid only inside its block
 * </pre>
 *
 * <h2>Execution scopes</h2>
 * Every block, nested ones included, runs inside an execution scope. A cursor
 * remembers the scope that opened it and the execution of its statement it
 * belongs to; advancing it once either has ended is a
 * {@link de.bsommerfeld.dbqueue.core.error.DatabaseMisuseError}.
 *
 * <h2>Reserved table</h2>
 *
 * <pre>
 * ┌───────────────────────────────────────────────────────────┐
 * │ dbqueue_migrations                                        │
 * ├──────────────────┬────────────────────────────────────────┤
 * │ identifier (PK)  │ Registered migration name              │
 * │ applied_order    │ 1, 2, 3 ... in order of application    │
 * └──────────────────┴────────────────────────────────────────┘
 * </pre>
 *
 * <h2>SQL File Inventory</h2>
 * The library's own statements live in {@code dbqueue/sql/*.sql}, loaded via
 * {@link de.bsommerfeld.dbqueue.db.SqlLoader}:
 * <ul>
 * <li>{@code create-migrations-table.sql}: CREATE the reserved table</li>
 * <li>{@code select-applied-migrations.sql}: applied records in order</li>
 * <li>{@code next-migration-order.sql}: next applied_order value</li>
 * <li>{@code insert-migration-record.sql}: record one applied migration</li>
 * <li>{@code table-exists.sql}: table or view lookup in sqlite_master</li>
 * <li>{@code last-insert-rowid.sql}: row id of the latest insert</li>
 * <li>{@code changes.sql}: rows changed by the latest write</li>
 * </ul>
 */
package de.bsommerfeld.dbqueue.db;
