package de.bsommerfeld.dbqueue.db;

import de.bsommerfeld.dbqueue.core.bind.Bindings;
import de.bsommerfeld.dbqueue.core.error.SqlExecutionException;
import de.bsommerfeld.dbqueue.core.value.Converters;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TransactionTest {

    @TempDir
    Path tempDir;

    @Mock
    private TransactionBlock block;

    private DatabaseQueue queue;

    @BeforeEach
    void setUp() {
        queue = DatabaseQueue.open(tempDir.resolve("tx.db"), DatabaseOptions.defaults());
        queue.inDatabase(db -> {
            db.executeScript("""
                    CREATE TABLE items (name TEXT PRIMARY KEY);
                    CREATE TABLE parent (id INTEGER PRIMARY KEY);
                    CREATE TABLE child (
                        parent_id INTEGER REFERENCES parent(id) DEFERRABLE INITIALLY DEFERRED
                    );
                    """);
            return null;
        });
    }

    @AfterEach
    void tearDown() {
        queue.close();
    }

    // -- Outcomes --

    @Test
    void inTransaction_shouldCommitWrites() {
        queue.inTransaction(db -> {
            db.execute("INSERT INTO items VALUES ('a')");
            db.execute("INSERT INTO items VALUES ('b')");
            return TransactionOutcome.COMMIT;
        });
        assertEquals(List.of("a", "b"), items());
    }

    @Test
    void inTransaction_shouldRollBackOnRollbackOutcome() {
        queue.inTransaction(db -> {
            db.execute("INSERT INTO items VALUES ('a')");
            return TransactionOutcome.ROLLBACK;
        });
        assertTrue(items().isEmpty());
    }

    @Test
    void inTransaction_shouldRollBackAndRethrowOnException() {
        IllegalArgumentException thrown = assertThrows(IllegalArgumentException.class, () ->
                queue.inTransaction(db -> {
                    db.execute("INSERT INTO items VALUES ('a')");
                    throw new IllegalArgumentException("stop");
                }));

        assertEquals("stop", thrown.getMessage());
        assertEquals(0, thrown.getSuppressed().length);
        assertTrue(items().isEmpty());
    }

    @Test
    void inTransaction_shouldRollBackWhenStatementFails() {
        assertThrows(SqlExecutionException.class, () -> queue.inTransaction(db -> {
            db.execute("INSERT INTO items VALUES ('a')");
            db.execute("INSERT INTO items VALUES ('a')");
            return TransactionOutcome.COMMIT;
        }));
        assertTrue(items().isEmpty());
    }

    @Test
    void inTransaction_shouldTreatNullOutcomeAsFailure() {
        assertThrows(IllegalStateException.class, () -> queue.inTransaction(db -> {
            db.execute("INSERT INTO items VALUES ('a')");
            return null;
        }));
        assertTrue(items().isEmpty());
    }

    @Test
    void inTransaction_shouldRunBlockExactlyOnce() {
        when(block.run(any())).thenReturn(TransactionOutcome.COMMIT);

        queue.inTransaction(block);

        verify(block, times(1)).run(any(DatabaseConnection.class));
    }

    @Test
    void inTransaction_shouldRollBackWhenCommitFails() {
        SqlExecutionException e = assertThrows(SqlExecutionException.class, () -> queue.inTransaction(db -> {
            db.execute("INSERT INTO child VALUES (99)");
            return TransactionOutcome.COMMIT;
        }));

        assertEquals(19, e.resultCode() & 0xFF, "SQLITE_CONSTRAINT");
        long children = queue.inDatabase(db ->
                db.fetchOne("SELECT count(*) FROM child", Bindings.NONE, Converters.LONG).orElseThrow());
        assertEquals(0L, children);
        boolean open = queue.inDatabase(DatabaseConnection::isInTransaction);
        assertFalse(open);
    }

    // -- State --

    @Test
    void isInTransaction_shouldTrackOpenTransaction() {
        boolean before = queue.inDatabase(DatabaseConnection::isInTransaction);
        queue.inTransaction(db -> {
            assertTrue(db.isInTransaction());
            return TransactionOutcome.COMMIT;
        });
        boolean after = queue.inDatabase(DatabaseConnection::isInTransaction);

        assertFalse(before);
        assertFalse(after);
    }

    // -- Nesting --

    @Test
    void nestedTransaction_shouldRollBackOnlyInnerWork() {
        queue.inTransaction(db -> {
            db.execute("INSERT INTO items VALUES ('outer')");
            db.inTransaction(inner -> {
                inner.execute("INSERT INTO items VALUES ('inner')");
                return TransactionOutcome.ROLLBACK;
            });
            assertTrue(db.isInTransaction());
            return TransactionOutcome.COMMIT;
        });
        assertEquals(List.of("outer"), items());
    }

    @Test
    void nestedTransaction_shouldKeepOuterAfterInnerException() {
        queue.inTransaction(db -> {
            db.execute("INSERT INTO items VALUES ('outer')");
            assertThrows(IllegalStateException.class, () -> db.inSavepoint(inner -> {
                inner.execute("INSERT INTO items VALUES ('inner')");
                throw new IllegalStateException("inner failed");
            }));
            db.execute("INSERT INTO items VALUES ('after')");
            return TransactionOutcome.COMMIT;
        });
        assertEquals(List.of("after", "outer"), items());
    }

    @Test
    void nestedTransaction_shouldBeUndoneByOuterRollback() {
        queue.inTransaction(db -> {
            db.inTransaction(inner -> {
                inner.execute("INSERT INTO items VALUES ('inner')");
                return TransactionOutcome.COMMIT;
            });
            return TransactionOutcome.ROLLBACK;
        });
        assertTrue(items().isEmpty());
    }

    @Test
    void inSavepoint_shouldActAsTransactionAtTopLevel() {
        queue.inDatabase(db -> {
            db.inSavepoint(sp -> {
                sp.execute("INSERT INTO items VALUES ('x')");
                return TransactionOutcome.ROLLBACK;
            });
            return null;
        });
        assertTrue(items().isEmpty());
    }

    // -- Kinds --

    @Test
    void immediateTransaction_shouldHoldWriteLock() {
        DatabaseOptions impatient = DatabaseOptions.builder().busyTimeout(Duration.ofMillis(100)).build();
        try (DatabaseQueue other = DatabaseQueue.open(tempDir.resolve("tx.db"), impatient)) {
            queue.inTransaction(TransactionKind.IMMEDIATE, db -> {
                SqlExecutionException busy = assertThrows(SqlExecutionException.class, () ->
                        other.inDatabase(o -> o.execute("INSERT INTO items VALUES ('blocked')")));
                assertEquals(5, busy.resultCode() & 0xFF, "SQLITE_BUSY");
                db.execute("INSERT INTO items VALUES ('holder')");
                return TransactionOutcome.COMMIT;
            });
            other.inDatabase(o -> o.execute("INSERT INTO items VALUES ('later')"));
        }
        assertEquals(List.of("holder", "later"), items());
    }

    @Test
    void exclusiveTransaction_shouldCommit() {
        queue.inTransaction(TransactionKind.EXCLUSIVE, db -> {
            db.execute("INSERT INTO items VALUES ('x')");
            return TransactionOutcome.COMMIT;
        });
        assertEquals(List.of("x"), items());
    }

    @Test
    void defaultTransactionKind_shouldComeFromOptions() {
        try (DatabaseQueue exclusive = DatabaseQueue.open(tempDir.resolve("tx.db"),
                DatabaseOptions.builder().defaultTransactionKind(TransactionKind.EXCLUSIVE).build())) {
            exclusive.inTransaction(db -> {
                db.execute("INSERT INTO items VALUES ('y')");
                return TransactionOutcome.COMMIT;
            });
        }
        assertEquals(List.of("y"), items());
    }

    private List<String> items() {
        return queue.inDatabase(db ->
                db.fetchAll("SELECT name FROM items ORDER BY name", Bindings.NONE, Converters.STRING));
    }
}
