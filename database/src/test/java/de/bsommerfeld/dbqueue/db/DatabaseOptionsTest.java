package de.bsommerfeld.dbqueue.db;

import org.junit.jupiter.api.Test;
import org.sqlite.SQLiteConfig;

import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class DatabaseOptionsTest {

    @Test
    void defaults_shouldMatchDocumentedValues() {
        DatabaseOptions options = DatabaseOptions.defaults();
        assertTrue(options.createIfMissing());
        assertFalse(options.readOnly());
        assertTrue(options.foreignKeys());
        assertEquals(Duration.ofSeconds(5), options.busyTimeout());
        assertNull(options.journalMode());
        assertEquals(64, options.statementCacheSize());
        assertEquals(TransactionKind.DEFERRED, options.defaultTransactionKind());
    }

    @Test
    void build_shouldRejectNegativeValues() {
        assertThrows(IllegalArgumentException.class,
                () -> DatabaseOptions.builder().statementCacheSize(-1).build());
        assertThrows(IllegalArgumentException.class,
                () -> DatabaseOptions.builder().busyTimeout(Duration.ofSeconds(-1)).build());
    }

    @Test
    void toBuilder_shouldCopyAllSettings() {
        DatabaseOptions original = DatabaseOptions.builder()
                .readOnly(true)
                .journalMode(SQLiteConfig.JournalMode.WAL)
                .defaultTransactionKind(TransactionKind.IMMEDIATE)
                .threadName("db")
                .build();
        DatabaseOptions copy = original.toBuilder().build();

        assertTrue(copy.readOnly());
        assertEquals(SQLiteConfig.JournalMode.WAL, copy.journalMode());
        assertEquals(TransactionKind.IMMEDIATE, copy.defaultTransactionKind());
        assertEquals("db", copy.threadName());
    }

    @Test
    void toSQLiteConfig_shouldCarryForeignKeyPragma() {
        Properties enforced = DatabaseOptions.builder().foreignKeys(true).build().toSQLiteConfig().toProperties();
        Properties relaxed = DatabaseOptions.builder().foreignKeys(false).build().toSQLiteConfig().toProperties();

        assertEquals("true", enforced.getProperty(SQLiteConfig.Pragma.FOREIGN_KEYS.pragmaName));
        assertEquals("false", relaxed.getProperty(SQLiteConfig.Pragma.FOREIGN_KEYS.pragmaName));
    }
}
