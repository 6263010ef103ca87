package de.bsommerfeld.dbqueue.db;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;

/**
 * Least-recently-used cache of compiled statements, keyed by SQL text.
 *
 * <p>
 * A cached statement whose cursor is still open cannot be executed again
 * without invalidating that cursor. {@link #acquire(String)} then hands out a
 * transient statement instead, which closes itself once its cursor is
 * released.
 */
final class StatementCache {

    private final int capacity;
    private final BiFunction<String, Boolean, SqlStatement> compiler;
    private final LinkedHashMap<String, SqlStatement> statements = new LinkedHashMap<>(16, 0.75f, true);

    /**
     * @param compiler compiles SQL text; the flag marks transient statements
     */
    StatementCache(int capacity, BiFunction<String, Boolean, SqlStatement> compiler) {
        this.capacity = capacity;
        this.compiler = compiler;
    }

    SqlStatement acquire(String sql) {
        if (capacity == 0)
            return compiler.apply(sql, true);
        SqlStatement cached = statements.get(sql);
        if (cached != null && !cached.isClosed()) {
            if (cached.isBusy())
                return compiler.apply(sql, true);
            return cached;
        }
        SqlStatement statement = compiler.apply(sql, false);
        statements.put(sql, statement);
        evictOverflow();
        return statement;
    }

    int size() {
        return statements.size();
    }

    void remove(SqlStatement statement) {
        statements.remove(statement.sql(), statement);
    }

    void clear() {
        List<SqlStatement> all = new ArrayList<>(statements.values());
        statements.clear();
        for (SqlStatement statement : all)
            statement.closeStatement();
    }

    private void evictOverflow() {
        Iterator<Map.Entry<String, SqlStatement>> it = statements.entrySet().iterator();
        while (statements.size() > capacity && it.hasNext()) {
            SqlStatement eldest = it.next().getValue();
            if (eldest.isBusy())
                continue;
            it.remove();
            eldest.closeStatement();
        }
    }
}
