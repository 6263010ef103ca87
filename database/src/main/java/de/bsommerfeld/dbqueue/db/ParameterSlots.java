package de.bsommerfeld.dbqueue.db;

import de.bsommerfeld.dbqueue.core.bind.Bindings;
import de.bsommerfeld.dbqueue.core.error.BindingException;
import de.bsommerfeld.dbqueue.core.value.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * The parameter slots of one SQL statement, numbered the way the engine
 * numbers them.
 *
 * <p>
 * Rules, mirroring SQLite:
 * <ul>
 * <li>{@code ?} takes the slot after the largest one assigned so far</li>
 * <li>{@code ?NNN} takes slot {@code NNN}</li>
 * <li>{@code :name}, {@code @name} and {@code $name} take a new slot on first
 * use; later occurrences of the same placeholder reuse it. The prefix is part
 * of the identity, so {@code :a} and {@code @a} are two slots, both bound from
 * the name {@code a}</li>
 * </ul>
 * Placeholders inside string literals, quoted identifiers and comments are
 * ignored. The scan is purely lexical; the SQL handed to the driver is never
 * rewritten.
 */
final class ParameterSlots {

    /** Placeholders with their prefix by 0-based slot index; {@code null} marks an anonymous slot. */
    private final List<String> placeholders;
    private final List<String> names;

    private ParameterSlots(List<String> placeholders) {
        this.placeholders = Collections.unmodifiableList(placeholders);
        List<String> stripped = new ArrayList<>(placeholders.size());
        for (String placeholder : placeholders)
            stripped.add(placeholder == null ? null : placeholder.substring(1));
        this.names = Collections.unmodifiableList(stripped);
    }

    static ParameterSlots parse(String sql) {
        List<String> found = new ArrayList<>();
        int length = sql.length();
        int i = 0;
        while (i < length) {
            char ch = sql.charAt(i);
            switch (ch) {
                case '\'', '"', '`' -> i = skipQuoted(sql, i, ch);
                case '[' -> i = skipUntil(sql, i + 1, "]");
                case '-' -> {
                    if (i + 1 < length && sql.charAt(i + 1) == '-')
                        i = skipUntil(sql, i + 2, "\n");
                    else
                        i++;
                }
                case '/' -> {
                    if (i + 1 < length && sql.charAt(i + 1) == '*')
                        i = skipUntil(sql, i + 2, "*/");
                    else
                        i++;
                }
                case '?' -> {
                    int end = i + 1;
                    while (end < length && Character.isDigit(sql.charAt(end)))
                        end++;
                    if (end > i + 1) {
                        int slot = Integer.parseInt(sql.substring(i + 1, end));
                        while (found.size() < slot)
                            found.add(null);
                    } else {
                        found.add(null);
                    }
                    i = end;
                }
                case ':', '@', '$' -> {
                    int end = i + 1;
                    while (end < length && isIdentifierPart(sql.charAt(end)))
                        end++;
                    if (end > i + 1) {
                        String placeholder = sql.substring(i, end);
                        if (!found.contains(placeholder))
                            found.add(placeholder);
                    }
                    i = end;
                }
                default -> i++;
            }
        }
        return new ParameterSlots(found);
    }

    int count() {
        return placeholders.size();
    }

    /**
     * Slot names without their prefix in slot order, {@code null} for
     * anonymous slots. A name repeats when it appears with different prefixes.
     */
    List<String> names() {
        return names;
    }

    /**
     * Resolves the value for every slot, in slot order.
     *
     * @throws BindingException if the bindings do not cover the slots exactly
     *                          (positional) or miss a name (named)
     */
    List<Value> resolve(Bindings bindings, String sql) {
        if (!bindings.isNamed()) {
            if (bindings.size() != placeholders.size())
                throw new BindingException("Wrong number of statement arguments: expected "
                        + placeholders.size() + ", got " + bindings.size() + " - in `" + sql + "`");
            return bindings.values();
        }
        List<Value> values = new ArrayList<>(placeholders.size());
        for (int i = 0; i < placeholders.size(); i++) {
            String placeholder = placeholders.get(i);
            if (placeholder == null)
                throw new BindingException("Positional placeholder at index " + (i + 1)
                        + " cannot be bound by name - in `" + sql + "`");
            Optional<Value> value = bindings.value(placeholder);
            if (value.isEmpty())
                throw new BindingException("Missing statement argument for " + placeholder + " - in `" + sql + "`");
            values.add(value.get());
        }
        return values;
    }

    private static int skipQuoted(String sql, int start, char quote) {
        int i = start + 1;
        while (i < sql.length()) {
            if (sql.charAt(i) == quote) {
                // doubled quote is an escaped quote
                if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return i;
    }

    private static int skipUntil(String sql, int from, String terminator) {
        int end = sql.indexOf(terminator, from);
        return end < 0 ? sql.length() : end + terminator.length();
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
