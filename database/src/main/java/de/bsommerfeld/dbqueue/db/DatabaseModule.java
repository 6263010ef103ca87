package de.bsommerfeld.dbqueue.db;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import de.bsommerfeld.dbqueue.db.migration.DatabaseMigrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Guice wiring for applications that inject their database.
 *
 * <p>
 * Binds the {@link DatabaseOptions} and a singleton {@link DatabaseQueue} on
 * the given file. When a {@link DatabaseMigrator} is supplied, the queue is
 * migrated before it is handed out. The application still owns the queue and
 * closes it on shutdown.
 */
public class DatabaseModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(DatabaseModule.class);

    private final Path databaseFile;
    private final DatabaseOptions options;
    private final DatabaseMigrator migrator;

    public DatabaseModule(Path databaseFile, DatabaseOptions options) {
        this(databaseFile, options, null);
    }

    public DatabaseModule(Path databaseFile, DatabaseOptions options, DatabaseMigrator migrator) {
        this.databaseFile = Objects.requireNonNull(databaseFile, "databaseFile");
        this.options = Objects.requireNonNull(options, "options");
        this.migrator = migrator;
    }

    @Override
    protected void configure() {
        bind(DatabaseOptions.class).toInstance(options);
    }

    @Provides
    @Singleton
    DatabaseQueue provideDatabaseQueue(DatabaseOptions options) {
        LOG.info("Opening database from: {}", databaseFile.toAbsolutePath());
        DatabaseQueue queue = DatabaseQueue.open(databaseFile, options);
        if (migrator != null) {
            try {
                migrator.migrate(queue);
            } catch (RuntimeException e) {
                queue.close();
                throw e;
            }
        }
        return queue;
    }
}
