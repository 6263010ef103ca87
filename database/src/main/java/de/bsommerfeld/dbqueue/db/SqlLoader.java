package de.bsommerfeld.dbqueue.db;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Loads and caches SQL text from classpath resources.
 *
 * <p>
 * The library's own statements live under {@code dbqueue/sql/} and are
 * addressed by file stem through {@link #load(String)}, e.g.
 * {@code load("insert-migration-record")}. Application scripts, typically
 * migrations, are addressed by their full resource path through
 * {@link #loadResource(String)}.
 *
 * <p>
 * Each resource is read exactly once and cached for the lifetime of the JVM.
 */
public final class SqlLoader {

    private static final String INTERNAL_PREFIX = "dbqueue/sql/";
    private static final Pattern STATEMENT_END = Pattern.compile(";\\s*(\\r?\\n|$)");
    private static final ConcurrentHashMap<String, String> CACHE = new ConcurrentHashMap<>();

    private SqlLoader() {
    }

    /**
     * Returns the library statement from {@code dbqueue/sql/<name>.sql}.
     *
     * @param name the file stem without path prefix or extension
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public static String load(String name) {
        return loadResource(INTERNAL_PREFIX + name + ".sql");
    }

    /**
     * Returns the trimmed content of any classpath resource.
     *
     * @param path resource path relative to the classpath root, without a
     *             leading slash
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public static String loadResource(String path) {
        return CACHE.computeIfAbsent(path, SqlLoader::readResource);
    }

    /**
     * Splits a script into single statements on semicolons that end a line.
     * Blank fragments are dropped. Statements with a semicolon in the middle
     * of a line, such as trigger bodies written on one line, stay intact.
     */
    public static List<String> splitStatements(String script) {
        List<String> statements = new ArrayList<>();
        for (String sql : STATEMENT_END.split(script)) {
            String trimmed = sql.trim();
            if (!trimmed.isEmpty())
                statements.add(trimmed);
        }
        return statements;
    }

    private static String readResource(String path) {
        try (InputStream in = SqlLoader.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("SQL resource not found: " + path);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read SQL resource: " + path, e);
        }
    }
}
