package de.bsommerfeld.dbqueue.core.error;

/**
 * The engine rejected a statement: syntax error, constraint violation, type
 * error, busy database. Carries the engine's native result code and message
 * along with the offending SQL.
 */
public class SqlExecutionException extends DatabaseException {

    private final int resultCode;
    private final String sql;

    public SqlExecutionException(int resultCode, String message, String sql, Throwable cause) {
        super(format(resultCode, message, sql), cause);
        this.resultCode = resultCode;
        this.sql = sql;
    }

    /** The engine's primary or extended result code, {@code 0} if unknown. */
    public int resultCode() {
        return resultCode;
    }

    /** The SQL text that failed, or {@code null} for connection-level commands. */
    public String sql() {
        return sql;
    }

    private static String format(int resultCode, String message, String sql) {
        StringBuilder sb = new StringBuilder("SQLite error ").append(resultCode);
        if (message != null && !message.isEmpty())
            sb.append(": ").append(message);
        if (sql != null)
            sb.append(" - while executing `").append(sql).append('`');
        return sb.toString();
    }
}
