package de.bsommerfeld.dbqueue.db;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests SqlLoader's ability to load SQL files from classpath resources.
 * Library statements live under "dbqueue/sql/{name}.sql"; application
 * scripts are addressed by their full resource path.
 */
class SqlLoaderTest {

    @Test
    void load_shouldReturnCreateMigrationsTable() {
        String sql = SqlLoader.load("create-migrations-table");
        assertNotNull(sql);
        assertTrue(sql.toLowerCase().contains("create table"));
        assertTrue(sql.contains("dbqueue_migrations"));
    }

    @Test
    void load_shouldReturnInsertMigrationRecord() {
        String sql = SqlLoader.load("insert-migration-record");
        assertTrue(sql.contains(":identifier"));
        assertTrue(sql.contains(":appliedOrder"));
    }

    @Test
    void load_shouldCacheRepeatCalls() {
        String first = SqlLoader.load("table-exists");
        String second = SqlLoader.load("table-exists");
        assertSame(first, second, "Cached calls should return the same String reference");
    }

    @Test
    void load_shouldThrowForNonexistentFile() {
        assertThrows(IllegalStateException.class,
                () -> SqlLoader.load("nonexistent-sql-file"));
    }

    @Test
    void loadResource_shouldReadApplicationScript() {
        String script = SqlLoader.loadResource("migrations/create-pets.sql");
        assertTrue(script.startsWith("CREATE TABLE pets"));
    }

    // -- Script splitting --

    @Test
    void splitStatements_shouldSplitOnLineEndingSemicolons() {
        List<String> statements = SqlLoader.splitStatements(
                "CREATE TABLE a (x);\nCREATE TABLE b (y);\r\n\n  INSERT INTO a VALUES (1);");
        assertEquals(List.of("CREATE TABLE a (x)", "CREATE TABLE b (y)", "INSERT INTO a VALUES (1)"),
                statements);
    }

    @Test
    void splitStatements_shouldKeepInlineSemicolons() {
        List<String> statements = SqlLoader.splitStatements(
                "CREATE TRIGGER t AFTER INSERT ON a BEGIN DELETE FROM b; END;\n");
        assertEquals(1, statements.size());
        assertTrue(statements.get(0).endsWith("END"));
    }

    @Test
    void splitStatements_shouldDropBlankFragments() {
        assertTrue(SqlLoader.splitStatements("  ;\n ;\n").isEmpty());
    }
}
