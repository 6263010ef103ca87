package de.bsommerfeld.dbqueue.db;

import de.bsommerfeld.dbqueue.core.error.DatabaseMisuseError;
import de.bsommerfeld.dbqueue.core.row.Row;
import de.bsommerfeld.dbqueue.core.row.RowMapper;
import de.bsommerfeld.dbqueue.core.value.Value;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy, forward-only iteration over the rows of one statement execution.
 *
 * <p>
 * A cursor is bound to the queue block that opened it. Using it after the
 * block has returned, from another thread, or after its statement was executed
 * again is a programming error and fails with {@link DatabaseMisuseError}.
 * Copy what you need with {@link #toList()} before the block ends.
 *
 * @param <T> the element type produced by the row mapper
 */
public final class Cursor<T> implements Iterator<T>, AutoCloseable {

    private enum State {
        UNKNOWN, READY, DONE
    }

    private final SqlStatement statement;
    private final ResultSet resultSet;
    private final int generation;
    private final RowMapper<T> mapper;
    private final ExecutionScope scope;
    private final List<String> columnNames;

    private State state = State.UNKNOWN;

    Cursor(SqlStatement statement, ResultSet resultSet, int generation, RowMapper<T> mapper, ExecutionScope scope)
            throws SQLException {
        this.statement = statement;
        this.resultSet = resultSet;
        this.generation = generation;
        this.mapper = mapper;
        this.scope = scope;
        this.columnNames = readColumnNames(resultSet.getMetaData());
    }

    public List<String> columnNames() {
        return columnNames;
    }

    @Override
    public boolean hasNext() {
        ensureUsable();
        if (state == State.UNKNOWN)
            advance();
        return state == State.READY;
    }

    @Override
    public T next() {
        if (!hasNext())
            throw new NoSuchElementException("Cursor is exhausted: " + statement.sql());
        Row row = currentRow();
        state = State.UNKNOWN;
        return mapper.map(row);
    }

    /** Drains the remaining rows into a list that outlives the block. */
    public List<T> toList() {
        List<T> list = new ArrayList<>();
        while (hasNext())
            list.add(next());
        return list;
    }

    /**
     * The remaining rows as a sequential stream. The stream is subject to the
     * same rules as the cursor: consume it inside the block.
     */
    public Stream<T> stream() {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    /** Stops iteration early. Closing twice has no effect. */
    @Override
    public void close() {
        if (state == State.DONE)
            return;
        ensureUsable();
        release();
    }

    void release() {
        state = State.DONE;
        try {
            // after a re-execution the driver may hand the same result set to the newer cursor
            if (statement.generation() == generation)
                resultSet.close();
        } catch (SQLException e) {
            throw SqliteErrors.translate(e, statement.sql());
        } finally {
            statement.cursorReleased(this);
        }
    }

    private void ensureUsable() {
        if (!scope.isCurrent())
            throw new DatabaseMisuseError("Cursor used outside of the database block that opened it: "
                    + statement.sql());
        if (state != State.DONE && statement.generation() != generation)
            throw new DatabaseMisuseError("Cursor used after its statement was executed again: "
                    + statement.sql());
    }

    private void advance() {
        try {
            if (resultSet.next()) {
                state = State.READY;
            } else {
                release();
            }
        } catch (SQLException e) {
            release();
            throw SqliteErrors.translate(e, statement.sql());
        }
    }

    private Row currentRow() {
        try {
            List<Value> values = new ArrayList<>(columnNames.size());
            for (int i = 1; i <= columnNames.size(); i++)
                values.add(Value.fromJdbcObject(resultSet.getObject(i)));
            return new Row(columnNames, values);
        } catch (SQLException e) {
            throw SqliteErrors.translate(e, statement.sql());
        }
    }

    private static List<String> readColumnNames(ResultSetMetaData meta) throws SQLException {
        int count = meta.getColumnCount();
        List<String> names = new ArrayList<>(count);
        for (int i = 1; i <= count; i++)
            names.add(meta.getColumnLabel(i));
        return names;
    }
}
