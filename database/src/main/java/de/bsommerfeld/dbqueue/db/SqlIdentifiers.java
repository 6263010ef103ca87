package de.bsommerfeld.dbqueue.db;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Quoting of table and column names for generated SQL.
 */
public final class SqlIdentifiers {

    private SqlIdentifiers() {
    }

    /** Wraps a name in double quotes, doubling embedded quotes. */
    public static String quote(String identifier) {
        return '"' + identifier.replace("\"", "\"\"") + '"';
    }

    /** Quotes each name and joins them with {@code ", "}. */
    public static String quoteAll(List<String> identifiers) {
        return identifiers.stream().map(SqlIdentifiers::quote).collect(Collectors.joining(", "));
    }
}
