package de.bsommerfeld.dbqueue.db;

import de.bsommerfeld.dbqueue.core.error.SqlExecutionException;
import org.sqlite.SQLiteException;

import java.sql.SQLException;

/**
 * Translates driver exceptions into {@link SqlExecutionException}, keeping the
 * engine's extended result code where the driver exposes it.
 */
final class SqliteErrors {

    private SqliteErrors() {
    }

    static SqlExecutionException translate(SQLException e, String sql) {
        int code = e.getErrorCode();
        if (e instanceof SQLiteException sqlite && sqlite.getResultCode() != null)
            code = sqlite.getResultCode().code;
        return new SqlExecutionException(code, e.getMessage(), sql, e);
    }
}
