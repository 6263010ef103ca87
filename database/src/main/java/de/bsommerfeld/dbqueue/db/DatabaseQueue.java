package de.bsommerfeld.dbqueue.db;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.common.util.concurrent.Uninterruptibles;
import de.bsommerfeld.dbqueue.core.error.ConnectionException;
import de.bsommerfeld.dbqueue.core.error.DatabaseException;
import de.bsommerfeld.dbqueue.core.error.DatabaseMisuseError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOError;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Serialized access to one database file.
 *
 * <h3>Threading model</h3>
 * The queue owns a single-thread executor and the one
 * {@link DatabaseConnection} opened on it. Every block submitted through
 * {@link #inDatabase(DatabaseWork)} or {@link #inTransaction(TransactionBlock)}
 * runs on that thread, one at a time, in submission order. The calling thread
 * waits for the result, so code inside a block needs no locking of its own.
 *
 * <p>
 * Calls made from inside a running block run inline instead of being queued,
 * which keeps nested helpers from deadlocking on their own queue.
 *
 * <pre>{@code
 * try (DatabaseQueue queue = DatabaseQueue.open(Path.of("app.db"), DatabaseOptions.defaults())) {
 *     long count = queue.inDatabase(db ->
 *             db.fetchOne("SELECT count(*) FROM player", Bindings.NONE, Converters.LONG).orElse(0L));
 * }
 * }</pre>
 *
 * Queues are independent of each other; two queues on different files run in
 * parallel.
 */
public final class DatabaseQueue implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(DatabaseQueue.class);

    private static final String MEMORY = ":memory:";
    private static final AtomicInteger QUEUE_SEQUENCE = new AtomicInteger();

    private final Path path;
    private final String description;
    private final DatabaseOptions options;
    private final ExecutorService executor;
    private final DatabaseConnection connection;
    private final AtomicBoolean closed = new AtomicBoolean();

    private DatabaseQueue(Path path, String url, String description, DatabaseOptions options) {
        this.path = path;
        this.description = description;
        this.options = options;
        String threadName = options.threadName() != null
                ? options.threadName()
                : "dbqueue-" + QUEUE_SEQUENCE.incrementAndGet() + "-" + shortName(path);
        this.executor = Executors.newSingleThreadExecutor(new ThreadFactoryBuilder()
                .setNameFormat(threadName.replace("%", "%%"))
                .setDaemon(true)
                .build());
        try {
            this.connection = await(executor.submit(() -> DatabaseConnection.open(url, description, options)));
        } catch (RuntimeException | Error e) {
            executor.shutdownNow();
            throw e;
        }
        LOG.info("Opened database queue for {}", description);
    }

    /**
     * Opens a queue on a database file.
     *
     * @throws ConnectionException if the path is malformed or the file cannot
     *                             be opened or created
     */
    public static DatabaseQueue open(Path path, DatabaseOptions options) {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(options, "options");
        Path absolute;
        try {
            absolute = path.toAbsolutePath();
        } catch (IOError | SecurityException e) {
            throw new ConnectionException("Cannot resolve database path: " + path, e);
        }
        return new DatabaseQueue(absolute, "jdbc:sqlite:" + absolute, absolute.toString(), options);
    }

    public static DatabaseQueue open(Path path) {
        return open(path, DatabaseOptions.defaults());
    }

    /**
     * Opens a queue on a path given as text. {@code ":memory:"} opens a
     * private in-memory database.
     *
     * @throws ConnectionException if the path is blank, contains a NUL
     *                             character or is otherwise invalid
     */
    public static DatabaseQueue open(String path, DatabaseOptions options) {
        Objects.requireNonNull(path, "path");
        if (MEMORY.equals(path))
            return inMemory(options);
        if (path.isBlank() || path.indexOf('\0') >= 0)
            throw new ConnectionException("Malformed database path: '" + path.replace('\0', '?') + "'");
        try {
            return open(Paths.get(path), options);
        } catch (InvalidPathException e) {
            throw new ConnectionException("Malformed database path: '" + path + "'", e);
        }
    }

    /** Opens a queue on a private in-memory database, discarded on close. */
    public static DatabaseQueue inMemory(DatabaseOptions options) {
        Objects.requireNonNull(options, "options");
        return new DatabaseQueue(null, "jdbc:sqlite:" + MEMORY, MEMORY, options);
    }

    public static DatabaseQueue inMemory() {
        return inMemory(DatabaseOptions.defaults());
    }

    /**
     * Runs the block on the queue thread and returns its result. Exceptions
     * thrown by the block reach the caller unchanged. Waiting is
     * uninterruptible; an interrupt received meanwhile is restored afterwards.
     *
     * @throws ConnectionException if the queue is closed
     */
    public <T> T inDatabase(DatabaseWork<T> work) {
        Objects.requireNonNull(work, "work");
        if (connection.isOwnedByCurrentThread())
            return runInScope(work);
        if (closed.get())
            throw closedException(null);
        Future<T> future;
        try {
            future = executor.submit(() -> runInScope(work));
        } catch (RejectedExecutionException e) {
            throw closedException(e);
        }
        return await(future);
    }

    /**
     * Runs the block in a transaction of the configured default kind.
     *
     * @see DatabaseConnection#inTransaction(TransactionKind, TransactionBlock)
     */
    public void inTransaction(TransactionBlock block) {
        inTransaction(options.defaultTransactionKind(), block);
    }

    public void inTransaction(TransactionKind kind, TransactionBlock block) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(block, "block");
        inDatabase(db -> {
            db.inTransaction(kind, block);
            return null;
        });
    }

    /** The database file, or {@code null} for an in-memory database. */
    public Path path() {
        return path;
    }

    public DatabaseOptions options() {
        return options;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Lets queued blocks finish, then closes all statements and the
     * connection and stops the queue thread. Waits at most
     * {@link DatabaseOptions#closeTimeout()} before forcing the thread down.
     * Closing twice has no effect.
     *
     * @throws DatabaseMisuseError if called from inside a block of this queue
     */
    @Override
    public void close() {
        if (connection.isOwnedByCurrentThread())
            throw new DatabaseMisuseError("DatabaseQueue.close() called from inside one of its own blocks");
        if (!closed.compareAndSet(false, true))
            return;
        LOG.info("Shutting down database queue for {}...", description);
        Future<?> closing = executor.submit(connection::close);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(options.closeTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warn("Database queue for {} forced shutdown (timed out), closing connection from caller.",
                        description);
                forceClose();
                return;
            }
        } catch (InterruptedException e) {
            forceClose();
            Thread.currentThread().interrupt();
            return;
        }
        await(closing);
    }

    // shutdownNow drops the queued close task, so the handle is released here
    private void forceClose() {
        executor.shutdownNow();
        connection.abandon();
    }

    private <T> T runInScope(DatabaseWork<T> work) {
        if (connection.isClosed())
            throw closedException(null);
        ExecutionScope scope = connection.enterScope();
        try {
            return work.run(connection);
        } finally {
            connection.exitScope(scope);
        }
    }

    private ConnectionException closedException(Throwable cause) {
        return new ConnectionException("Database queue is closed: " + description, cause);
    }

    private static <T> T await(Future<T> future) {
        try {
            return Uninterruptibles.getUninterruptibly(future);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime)
                throw runtime;
            if (cause instanceof Error error)
                throw error;
            throw new DatabaseException("Database block failed", cause);
        }
    }

    private static String shortName(Path path) {
        if (path == null)
            return "memory";
        Path fileName = path.getFileName();
        return fileName == null ? "db" : fileName.toString();
    }

    @Override
    public String toString() {
        return "DatabaseQueue{" + description + '}';
    }
}
