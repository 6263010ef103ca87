package de.bsommerfeld.dbqueue.db;

import de.bsommerfeld.dbqueue.core.bind.Bindings;
import de.bsommerfeld.dbqueue.core.error.BindingException;
import de.bsommerfeld.dbqueue.core.row.Row;
import de.bsommerfeld.dbqueue.core.row.RowMapper;
import de.bsommerfeld.dbqueue.core.value.Value;
import de.bsommerfeld.dbqueue.core.value.ValueConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.List;
import java.util.Objects;

/**
 * A compiled SQL statement owned by one {@link DatabaseConnection}.
 *
 * <p>
 * Statements are reusable: bind new arguments and execute again as often as
 * needed, which is what makes batch inserts cheap.
 *
 * <pre>{@code
 * SqlStatement insert = db.prepare("INSERT INTO player (name, score) VALUES (?, ?)");
 * for (Player p : players)
 *     insert.execute(p.name(), p.score());
 * }</pre>
 *
 * Executing a statement again invalidates the cursor of its previous
 * execution. Statements from {@link DatabaseConnection#prepare(String)}
 * belong to the caller, who may {@link #close()} them; any still open are
 * closed with the connection.
 */
public final class SqlStatement implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(SqlStatement.class);

    private final DatabaseConnection connection;
    private final String sql;
    private final PreparedStatement statement;
    private final ParameterSlots slots;
    private final boolean transientStatement;

    private Bindings bindings = Bindings.NONE;
    private int generation;
    private Cursor<?> openCursor;
    private boolean closed;

    SqlStatement(DatabaseConnection connection, String sql, PreparedStatement statement, boolean transientStatement) {
        this.connection = connection;
        this.sql = sql;
        this.statement = statement;
        this.slots = ParameterSlots.parse(sql);
        this.transientStatement = transientStatement;
    }

    public String sql() {
        return sql;
    }

    /** Number of parameter slots, as the engine numbers them. */
    public int parameterCount() {
        return slots.count();
    }

    /** Placeholder names by slot, {@code null} for anonymous {@code ?} slots. */
    public List<String> parameterNames() {
        return slots.names();
    }

    /** The arguments used by the next execution. */
    public Bindings bindings() {
        return bindings;
    }

    /**
     * Replaces the current arguments.
     *
     * @throws BindingException if the arguments do not match the placeholders
     */
    public SqlStatement bind(Bindings bindings) {
        Objects.requireNonNull(bindings, "bindings");
        ensureOpen();
        slots.resolve(bindings, sql);
        this.bindings = bindings;
        return this;
    }

    public SqlStatement bind(Object... arguments) {
        return bind(Bindings.of(arguments));
    }

    /**
     * Runs the statement to completion with the current arguments.
     *
     * @return the number of rows inserted, updated or deleted
     */
    public int execute() {
        connection.checkAccess();
        ensureOpen();
        generation++;
        openCursor = null;
        List<Value> values = slots.resolve(bindings, sql);
        long start = System.nanoTime();
        try {
            applyValues(values);
            int changes;
            if (statement.execute()) {
                try (ResultSet rs = statement.getResultSet()) {
                    while (rs.next()) {
                        // step to completion
                    }
                }
                changes = 0;
            } else {
                changes = Math.max(statement.getUpdateCount(), 0);
            }
            debugDone("execute", changes, start);
            return changes;
        } catch (SQLException e) {
            throw SqliteErrors.translate(e, sql);
        }
    }

    public int execute(Bindings bindings) {
        return bind(bindings).execute();
    }

    public int execute(Object... arguments) {
        return execute(Bindings.of(arguments));
    }

    /** Executes the query and returns its rows lazily. */
    public Cursor<Row> fetch() {
        return fetch(row -> row);
    }

    public Cursor<Row> fetch(Bindings bindings) {
        return bind(bindings).fetch();
    }

    /**
     * Executes the query and maps each row as it is pulled from the cursor.
     */
    public <T> Cursor<T> fetch(RowMapper<T> mapper) {
        Objects.requireNonNull(mapper, "mapper");
        connection.checkAccess();
        ensureOpen();
        ExecutionScope scope = connection.currentScope();
        int executionGeneration = ++generation;
        List<Value> values = slots.resolve(bindings, sql);
        long start = System.nanoTime();
        try {
            applyValues(values);
            ResultSet rs = statement.executeQuery();
            Cursor<T> cursor = new Cursor<>(this, rs, executionGeneration, mapper, scope);
            openCursor = cursor;
            scope.register(cursor);
            debugDone("fetch", "cursor", start);
            return cursor;
        } catch (SQLException e) {
            throw SqliteErrors.translate(e, sql);
        }
    }

    /**
     * Executes the query and decodes the first column of each row. Values the
     * converter cannot decode, {@code NULL} included, fail with
     * {@link de.bsommerfeld.dbqueue.core.error.TypeMismatchException} when
     * pulled.
     */
    public <T> Cursor<T> fetch(ValueConverter<T> converter) {
        Objects.requireNonNull(converter, "converter");
        return fetch(row -> row.get(0, converter));
    }

    /**
     * Releases the compiled statement. Further use fails with an
     * {@link IllegalStateException}; closing twice has no effect.
     */
    @Override
    public void close() {
        if (closed)
            return;
        closed = true;
        connection.forget(this);
        closeStatement();
    }

    public boolean isClosed() {
        return closed;
    }

    int generation() {
        return generation;
    }

    /** True while a cursor of the latest execution is open. */
    boolean isBusy() {
        return openCursor != null;
    }

    boolean isTransient() {
        return transientStatement;
    }

    void cursorReleased(Cursor<?> cursor) {
        if (openCursor == cursor)
            openCursor = null;
        if (transientStatement && openCursor == null)
            close();
    }

    /** Closes the driver statement without unregistering from the connection. */
    void closeStatement() {
        closed = true;
        try {
            statement.close();
        } catch (SQLException e) {
            LOG.warn("Failed to close statement `{}`", sql, e);
        }
    }

    private void ensureOpen() {
        if (closed)
            throw new IllegalStateException("Statement is closed: " + sql);
    }

    private void applyValues(List<Value> values) throws SQLException {
        statement.clearParameters();
        for (int i = 0; i < values.size(); i++) {
            int index = i + 1;
            Value value = values.get(i);
            switch (value.kind()) {
                case NULL -> statement.setNull(index, Types.NULL);
                case INTEGER -> statement.setLong(index, ((Value.Int64) value).value());
                case REAL -> statement.setDouble(index, ((Value.Real) value).value());
                case TEXT -> statement.setString(index, ((Value.Text) value).value());
                case BLOB -> statement.setBytes(index, ((Value.Blob) value).value());
            }
        }
        if (LOG.isDebugEnabled())
            LOG.debug("dbqueue.sql op=bind argCount={} sql={}", values.size(), sql);
    }

    private void debugDone(String op, Object result, long startNanos) {
        if (!LOG.isDebugEnabled())
            return;
        LOG.debug("dbqueue.sql_done op={} durationMs={} result={}",
                op, (System.nanoTime() - startNanos) / 1_000_000.0, result);
    }
}
