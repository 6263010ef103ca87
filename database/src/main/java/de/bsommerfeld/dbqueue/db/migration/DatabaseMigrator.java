package de.bsommerfeld.dbqueue.db.migration;

import de.bsommerfeld.dbqueue.core.bind.Bindings;
import de.bsommerfeld.dbqueue.core.error.MigrationException;
import de.bsommerfeld.dbqueue.core.value.Converters;
import de.bsommerfeld.dbqueue.db.DatabaseConnection;
import de.bsommerfeld.dbqueue.db.DatabaseQueue;
import de.bsommerfeld.dbqueue.db.SqlLoader;
import de.bsommerfeld.dbqueue.db.TransactionKind;
import de.bsommerfeld.dbqueue.db.TransactionOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Ordered registry of named schema migrations, each applied at most once per
 * database file.
 *
 * <pre>{@code
 * DatabaseMigrator migrator = new DatabaseMigrator()
 *         .registerMigration("createPersons", db -> db.execute(
 *                 "CREATE TABLE persons (id INTEGER PRIMARY KEY, name TEXT NOT NULL, age INTEGER)"))
 *         .registerMigration("createPets", "migrations/create-pets.sql");
 * migrator.migrate(queue);
 * }</pre>
 *
 * <h3>Application</h3>
 * {@link #migrate(DatabaseQueue)} runs in one queue block. Every migration
 * not yet recorded in {@code dbqueue_migrations} runs in its own transaction,
 * in registration order, and its record is written in that same transaction.
 * A failing migration is rolled back and stops the run; the ones before it
 * stay applied, and the next run resumes with the failed one.
 *
 * <p>
 * Records of migrations that are no longer registered are left untouched.
 */
public final class DatabaseMigrator {

    private static final Logger LOG = LoggerFactory.getLogger(DatabaseMigrator.class);

    private final Map<String, Migration> migrations = new LinkedHashMap<>();

    /**
     * @throws IllegalArgumentException if the name is blank or already
     *                                  registered
     */
    public synchronized DatabaseMigrator registerMigration(String name, Migration migration) {
        Objects.requireNonNull(migration, "migration");
        if (name == null || name.isBlank())
            throw new IllegalArgumentException("Migration name must not be blank");
        if (migrations.containsKey(name))
            throw new IllegalArgumentException("Migration already registered: " + name);
        migrations.put(name, migration);
        return this;
    }

    /**
     * Registers a SQL script from the classpath. The script is read now, so a
     * missing resource fails at registration rather than during migration.
     *
     * @param scriptResource resource path such as
     *                       {@code migrations/create-pets.sql}
     */
    public DatabaseMigrator registerMigration(String name, String scriptResource) {
        Objects.requireNonNull(scriptResource, "scriptResource");
        String script = SqlLoader.loadResource(scriptResource);
        return registerMigration(name, db -> db.executeScript(script));
    }

    /** Registered names in registration order. */
    public synchronized List<String> registeredMigrations() {
        return List.copyOf(migrations.keySet());
    }

    /**
     * Applies every registered migration that is not applied yet.
     *
     * @throws MigrationException naming the migration that failed
     */
    public void migrate(DatabaseQueue queue) {
        migrate(queue, null);
    }

    /**
     * Applies pending migrations up to and including {@code upTo}.
     *
     * @param upTo last migration to apply, {@code null} for all
     * @throws IllegalArgumentException if {@code upTo} is not registered
     * @throws MigrationException       naming the migration that failed
     */
    public void migrate(DatabaseQueue queue, String upTo) {
        Objects.requireNonNull(queue, "queue");
        Map<String, Migration> snapshot;
        synchronized (this) {
            if (upTo != null && !migrations.containsKey(upTo))
                throw new IllegalArgumentException("Unknown migration: " + upTo);
            snapshot = new LinkedHashMap<>(migrations);
        }
        queue.inDatabase(db -> {
            runMigrations(db, snapshot, upTo);
            return null;
        });
    }

    /** Applied migrations in the order they were applied. */
    public List<MigrationRecord> appliedMigrations(DatabaseQueue queue) {
        return queue.inDatabase(DatabaseMigrator::readRecords);
    }

    /** True when every registered migration has been applied. */
    public boolean hasCompletedMigrations(DatabaseQueue queue) {
        Set<String> applied = appliedMigrations(queue).stream()
                .map(MigrationRecord::name)
                .collect(Collectors.toSet());
        return applied.containsAll(registeredMigrations());
    }

    private void runMigrations(DatabaseConnection db, Map<String, Migration> snapshot, String upTo) {
        db.execute(SqlLoader.load("create-migrations-table"), Bindings.NONE);
        Set<String> applied = new LinkedHashSet<>();
        for (MigrationRecord record : readRecords(db))
            applied.add(record.name());

        int count = 0;
        for (Map.Entry<String, Migration> entry : snapshot.entrySet()) {
            String name = entry.getKey();
            if (!applied.contains(name)) {
                apply(db, name, entry.getValue());
                count++;
            }
            if (name.equals(upTo))
                break;
        }
        if (count == 0)
            LOG.info("Database schema is up to date ({} migrations applied).", applied.size());
        else
            LOG.info("Applied {} migration(s).", count);
    }

    private static void apply(DatabaseConnection db, String name, Migration migration) {
        try {
            db.inTransaction(TransactionKind.IMMEDIATE, tx -> {
                migration.migrate(tx);
                long order = tx.fetchOne(SqlLoader.load("next-migration-order"), Bindings.NONE, Converters.LONG)
                        .orElse(1L);
                tx.execute(SqlLoader.load("insert-migration-record"), Bindings.builder()
                        .put("identifier", name)
                        .put("appliedOrder", order)
                        .build());
                LOG.info("Applied migration '{}' as #{}", name, order);
                return TransactionOutcome.COMMIT;
            });
        } catch (RuntimeException e) {
            LOG.error("Migration '{}' failed and was rolled back", name, e);
            throw new MigrationException(name, e);
        }
    }

    private static List<MigrationRecord> readRecords(DatabaseConnection db) {
        if (!db.tableExists("dbqueue_migrations"))
            return List.of();
        return db.fetchAll(SqlLoader.load("select-applied-migrations"), Bindings.NONE,
                row -> new MigrationRecord(
                        row.get("identifier", Converters.STRING),
                        row.get("applied_order", Converters.LONG)));
    }
}
