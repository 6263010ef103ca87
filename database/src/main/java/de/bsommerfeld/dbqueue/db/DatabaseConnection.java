package de.bsommerfeld.dbqueue.db;

import de.bsommerfeld.dbqueue.core.bind.Bindings;
import de.bsommerfeld.dbqueue.core.error.ConnectionException;
import de.bsommerfeld.dbqueue.core.error.DatabaseMisuseError;
import de.bsommerfeld.dbqueue.core.row.Row;
import de.bsommerfeld.dbqueue.core.row.RowMapper;
import de.bsommerfeld.dbqueue.core.value.Converters;
import de.bsommerfeld.dbqueue.core.value.ValueConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * The single connection to a database file, owned by one
 * {@link DatabaseQueue}.
 *
 * <p>
 * Instances are only handed to queue blocks and must not escape them. Every
 * method checks that it runs inside a block on the queue's thread and fails
 * with {@link DatabaseMisuseError} otherwise.
 *
 * <h3>Statement caching</h3>
 * {@code execute}, {@code fetch}, {@code fetchAll} and {@code fetchOne} reuse a
 * compiled statement per distinct SQL text. Use {@link #prepare(String)} for a
 * statement you manage yourself.
 *
 * <h3>Transactions</h3>
 * {@link #inTransaction(TransactionBlock)} wraps a block in
 * {@code BEGIN}/{@code COMMIT}. Nested calls become savepoints, so a helper
 * that wants atomicity can open a transaction without knowing whether its
 * caller already did.
 */
public final class DatabaseConnection {

    private static final Logger LOG = LoggerFactory.getLogger(DatabaseConnection.class);

    private static final String COMMIT = "COMMIT TRANSACTION";
    private static final String ROLLBACK = "ROLLBACK TRANSACTION";

    private final Connection connection;
    private final DatabaseOptions options;
    private final String description;
    private final Thread owner;
    private final StatementCache cache;
    private final Set<SqlStatement> prepared = new LinkedHashSet<>();
    private final Deque<ExecutionScope> scopes = new ArrayDeque<>();

    private int transactionDepth;
    private int savepointCounter;
    private volatile boolean closed;

    private DatabaseConnection(Connection connection, DatabaseOptions options, String description) {
        this.connection = connection;
        this.options = options;
        this.description = description;
        this.owner = Thread.currentThread();
        this.cache = new StatementCache(options.statementCacheSize(), this::compile);
    }

    /**
     * Opens the connection on the calling thread, which becomes its only
     * permitted thread.
     *
     * @throws ConnectionException if the file cannot be opened or is not a
     *                             database
     */
    static DatabaseConnection open(String url, String description, DatabaseOptions options) {
        Connection connection;
        try {
            connection = DriverManager.getConnection(url, options.toSQLiteConfig().toProperties());
        } catch (SQLException e) {
            throw new ConnectionException("Failed to open database " + description + ": " + e.getMessage(), e);
        }
        try (Statement probe = connection.createStatement()) {
            // reading the schema fails early on files that are not databases
            probe.executeQuery("SELECT count(*) FROM sqlite_master").close();
        } catch (SQLException e) {
            closeAfterFailedOpen(connection, e);
            throw new ConnectionException("Failed to open database " + description + ": " + e.getMessage(), e);
        }
        LOG.debug("Opened connection to {} with {}", description, options);
        return new DatabaseConnection(connection, options, description);
    }

    // -- execution -----------------------------------------------------------

    /**
     * Executes one statement to completion.
     *
     * @return the number of rows inserted, updated or deleted
     */
    public int execute(String sql, Bindings bindings) {
        Objects.requireNonNull(bindings, "bindings");
        SqlStatement statement = acquire(sql);
        try {
            return statement.execute(bindings);
        } finally {
            if (statement.isTransient())
                statement.close();
        }
    }

    public int execute(String sql, Object... arguments) {
        return execute(sql, Bindings.of(arguments));
    }

    /**
     * Executes a script of several statements, split on semicolons that end a
     * line. Statements run one after the other; the first failure stops the
     * script.
     */
    public void executeScript(String script) {
        Objects.requireNonNull(script, "script");
        checkAccess();
        for (String sql : SqlLoader.splitStatements(script)) {
            try (SqlStatement statement = compile(sql, true)) {
                statement.execute();
            }
        }
    }

    /**
     * Compiles a statement owned by the caller. It stays usable for the
     * lifetime of the connection unless closed earlier.
     */
    public SqlStatement prepare(String sql) {
        SqlStatement statement = compile(sql, false);
        prepared.add(statement);
        return statement;
    }

    // -- fetching ------------------------------------------------------------

    public Cursor<Row> fetch(String sql, Bindings bindings) {
        return fetch(sql, bindings, row -> row);
    }

    public Cursor<Row> fetch(String sql, Object... arguments) {
        return fetch(sql, Bindings.of(arguments));
    }

    /**
     * Cursor over the first column of each row. Elements the converter cannot
     * decode fail with a {@code TypeMismatchException} when pulled.
     */
    public <T> Cursor<T> fetch(String sql, Bindings bindings, ValueConverter<T> converter) {
        Objects.requireNonNull(converter, "converter");
        return fetch(sql, bindings, row -> row.get(0, converter));
    }

    public <T> Cursor<T> fetch(String sql, Bindings bindings, RowMapper<T> mapper) {
        Objects.requireNonNull(bindings, "bindings");
        Objects.requireNonNull(mapper, "mapper");
        SqlStatement statement = acquire(sql);
        try {
            return statement.bind(bindings).fetch(mapper);
        } catch (RuntimeException | Error e) {
            if (statement.isTransient())
                statement.close();
            throw e;
        }
    }

    public List<Row> fetchAll(String sql, Bindings bindings) {
        return fetchAll(sql, bindings, row -> row);
    }

    public List<Row> fetchAll(String sql, Object... arguments) {
        return fetchAll(sql, Bindings.of(arguments));
    }

    public <T> List<T> fetchAll(String sql, Bindings bindings, ValueConverter<T> converter) {
        try (Cursor<T> cursor = fetch(sql, bindings, converter)) {
            return cursor.toList();
        }
    }

    public <T> List<T> fetchAll(String sql, Bindings bindings, RowMapper<T> mapper) {
        try (Cursor<T> cursor = fetch(sql, bindings, mapper)) {
            return cursor.toList();
        }
    }

    /** The first row, without stepping through the rest. */
    public Optional<Row> fetchOne(String sql, Bindings bindings) {
        try (Cursor<Row> cursor = fetch(sql, bindings)) {
            return cursor.hasNext() ? Optional.of(cursor.next()) : Optional.empty();
        }
    }

    public Optional<Row> fetchOne(String sql, Object... arguments) {
        return fetchOne(sql, Bindings.of(arguments));
    }

    /**
     * The first column of the first row. Empty when there is no row, when the
     * value is {@code NULL}, and when the converter cannot decode it.
     */
    public <T> Optional<T> fetchOne(String sql, Bindings bindings, ValueConverter<T> converter) {
        Objects.requireNonNull(converter, "converter");
        return fetchOne(sql, bindings).flatMap(row -> row.getOptional(0, converter));
    }

    public <T> Optional<T> fetchOne(String sql, Bindings bindings, RowMapper<T> mapper) {
        Objects.requireNonNull(mapper, "mapper");
        return fetchOne(sql, bindings).map(mapper::map);
    }

    // -- connection state ----------------------------------------------------

    /** Row id of the most recent successful insert on this connection. */
    public long lastInsertedRowId() {
        return fetchOne(SqlLoader.load("last-insert-rowid"), Bindings.NONE, Converters.LONG).orElse(0L);
    }

    /** Rows changed by the most recent insert, update or delete. */
    public int changesCount() {
        return fetchOne(SqlLoader.load("changes"), Bindings.NONE, Converters.INTEGER).orElse(0);
    }

    /** True inside a block run by {@link #inTransaction} or {@link #inSavepoint}. */
    public boolean isInTransaction() {
        checkAccess();
        return transactionDepth > 0;
    }

    public boolean tableExists(String table) {
        return fetchOne(SqlLoader.load("table-exists"), Bindings.of(table)).isPresent();
    }

    /**
     * Declared columns of a table in declaration order, empty if the table
     * does not exist.
     */
    public List<String> columnNames(String table) {
        List<String> names = new ArrayList<>();
        for (Row row : fetchAll("PRAGMA table_info(" + SqlIdentifiers.quote(table) + ")", Bindings.NONE))
            names.add(row.get("name", Converters.STRING));
        return names;
    }

    public DatabaseOptions options() {
        return options;
    }

    // -- transactions --------------------------------------------------------

    /**
     * Runs the block in a transaction of the configured default kind.
     *
     * @see #inTransaction(TransactionKind, TransactionBlock)
     */
    public void inTransaction(TransactionBlock block) {
        inTransaction(options.defaultTransactionKind(), block);
    }

    /**
     * Runs the block in a transaction. {@link TransactionOutcome#COMMIT}
     * commits; {@link TransactionOutcome#ROLLBACK} or any exception rolls
     * back. An exception is rethrown once the rollback has completed, with a
     * failing rollback attached as suppressed. Inside an open transaction the
     * block runs as a savepoint and {@code kind} is ignored.
     */
    public void inTransaction(TransactionKind kind, TransactionBlock block) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(block, "block");
        checkAccess();
        if (transactionDepth > 0) {
            inSavepoint(block);
            return;
        }
        executeControl(kind.beginSql());
        transactionDepth++;
        try {
            TransactionOutcome outcome = runBlock(block);
            executeControl(outcome == TransactionOutcome.COMMIT ? COMMIT : ROLLBACK);
        } catch (Throwable t) {
            rollbackAfterFailure(t, ROLLBACK);
            throw t;
        } finally {
            transactionDepth--;
        }
    }

    /**
     * Runs the block inside a savepoint. Outside a transaction the savepoint
     * behaves like a deferred transaction.
     */
    public void inSavepoint(TransactionBlock block) {
        Objects.requireNonNull(block, "block");
        checkAccess();
        String name = "dbqueue_savepoint_" + (++savepointCounter);
        String rollback = "ROLLBACK TRANSACTION TO SAVEPOINT " + name;
        String release = "RELEASE SAVEPOINT " + name;
        executeControl("SAVEPOINT " + name);
        transactionDepth++;
        try {
            TransactionOutcome outcome = runBlock(block);
            if (outcome == TransactionOutcome.ROLLBACK)
                executeControl(rollback);
            executeControl(release);
        } catch (Throwable t) {
            rollbackAfterFailure(t, rollback, release);
            throw t;
        } finally {
            transactionDepth--;
        }
    }

    private TransactionOutcome runBlock(TransactionBlock block) {
        TransactionOutcome outcome = block.run(this);
        if (outcome == null)
            throw new IllegalStateException("Transaction block must return COMMIT or ROLLBACK, got null");
        return outcome;
    }

    private void rollbackAfterFailure(Throwable failure, String... statements) {
        for (String sql : statements) {
            try {
                executeControl(sql);
            } catch (RuntimeException e) {
                LOG.warn("Rollback after failed transaction block did not complete: {}", e.getMessage());
                failure.addSuppressed(e);
            }
        }
    }

    private void executeControl(String sql) {
        long start = System.nanoTime();
        try (Statement statement = connection.createStatement()) {
            statement.execute(sql);
        } catch (SQLException e) {
            throw SqliteErrors.translate(e, sql);
        }
        if (LOG.isDebugEnabled())
            LOG.debug("dbqueue.sql_done op=control durationMs={} sql={}",
                    (System.nanoTime() - start) / 1_000_000.0, sql);
    }

    // -- queue plumbing ------------------------------------------------------

    /**
     * @throws ConnectionException  if the connection is closed
     * @throws DatabaseMisuseError if called outside a block of the owning queue
     */
    void checkAccess() {
        if (closed)
            throw new ConnectionException("Database is closed: " + description);
        if (Thread.currentThread() != owner || scopes.isEmpty())
            throw new DatabaseMisuseError("Database connection used outside of its queue: " + description);
    }

    ExecutionScope currentScope() {
        checkAccess();
        return scopes.peek();
    }

    ExecutionScope enterScope() {
        ExecutionScope scope = new ExecutionScope(Thread.currentThread());
        scopes.push(scope);
        return scope;
    }

    void exitScope(ExecutionScope scope) {
        if (scopes.peek() != scope)
            throw new IllegalStateException("Execution scopes exited out of order");
        scopes.pop();
        scope.end();
    }

    void forget(SqlStatement statement) {
        prepared.remove(statement);
        cache.remove(statement);
    }

    boolean isClosed() {
        return closed;
    }

    /** True on the queue thread that opened this connection. */
    boolean isOwnedByCurrentThread() {
        return Thread.currentThread() == owner;
    }

    /** Closes all statements and the driver connection. Idempotent. */
    void close() {
        if (closed)
            return;
        closed = true;
        cache.clear();
        for (SqlStatement statement : new ArrayList<>(prepared))
            statement.closeStatement();
        prepared.clear();
        try {
            connection.close();
        } catch (SQLException e) {
            throw new ConnectionException("Failed to close database " + description, e);
        }
        LOG.debug("Closed connection to {}", description);
    }

    /**
     * Closes the driver connection from a thread other than the owner, after
     * the owner was stopped without running {@link #close()}. Statements are
     * left to the driver, which finalizes them with the connection.
     */
    void abandon() {
        if (closed)
            return;
        closed = true;
        try {
            connection.close();
        } catch (SQLException e) {
            throw new ConnectionException("Failed to close database " + description, e);
        }
        LOG.debug("Closed abandoned connection to {}", description);
    }

    private SqlStatement acquire(String sql) {
        Objects.requireNonNull(sql, "sql");
        checkAccess();
        return cache.acquire(sql);
    }

    private SqlStatement compile(String sql, boolean transientStatement) {
        Objects.requireNonNull(sql, "sql");
        checkAccess();
        if (LOG.isDebugEnabled())
            LOG.debug("dbqueue.sql op=prepare sql={}", sql);
        try {
            return new SqlStatement(this, sql, connection.prepareStatement(sql), transientStatement);
        } catch (SQLException e) {
            throw SqliteErrors.translate(e, sql);
        }
    }

    private static void closeAfterFailedOpen(Connection connection, SQLException failure) {
        try {
            connection.close();
        } catch (SQLException e) {
            failure.addSuppressed(e);
        }
    }

    @Override
    public String toString() {
        return "DatabaseConnection{" + description + '}';
    }
}
