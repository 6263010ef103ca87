package de.bsommerfeld.dbqueue.core.row;

import com.google.common.collect.ImmutableList;
import de.bsommerfeld.dbqueue.core.error.TypeMismatchException;
import de.bsommerfeld.dbqueue.core.value.Value;
import de.bsommerfeld.dbqueue.core.value.ValueConverter;
import de.bsommerfeld.dbqueue.core.value.Values;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of one fetched record.
 *
 * <p>
 * Columns keep the order and the names the engine reported. Lookup by name is
 * a case-sensitive exact match; when a query yields the same name twice (a
 * join without aliases, for example) the first column wins.
 *
 * <p>
 * Typed access comes in two flavours:
 * <ul>
 * <li>{@link #get(String, ValueConverter)} for required values, throwing
 * {@link TypeMismatchException} on {@code NULL} or on a kind the converter
 * cannot decode</li>
 * <li>{@link #getOptional(String, ValueConverter)} for optional values,
 * returning empty for {@code NULL}, incompatible kinds and missing
 * columns</li>
 * </ul>
 * Rows stay valid after the cursor that produced them has moved on.
 */
public final class Row {

    private final ImmutableList<String> columnNames;
    private final ImmutableList<Value> values;

    public Row(List<String> columnNames, List<Value> values) {
        Objects.requireNonNull(columnNames, "columnNames");
        Objects.requireNonNull(values, "values");
        if (columnNames.size() != values.size())
            throw new IllegalArgumentException("Column count " + columnNames.size()
                    + " does not match value count " + values.size());
        this.columnNames = ImmutableList.copyOf(columnNames);
        this.values = ImmutableList.copyOf(values);
    }

    /**
     * Builds a row from column names and arguments, in map iteration order.
     * Arguments are converted as statement arguments would be.
     */
    public static Row of(Map<String, ?> columns) {
        List<String> names = new ArrayList<>(columns.size());
        List<Value> values = new ArrayList<>(columns.size());
        columns.forEach((name, argument) -> {
            names.add(name);
            values.add(Values.of(argument));
        });
        return new Row(names, values);
    }

    public int size() {
        return values.size();
    }

    public List<String> columnNames() {
        return columnNames;
    }

    public List<Value> values() {
        return values;
    }

    public boolean hasColumn(String name) {
        return columnNames.indexOf(name) >= 0;
    }

    /**
     * Index of the first column with exactly this name, or {@code -1}.
     */
    public int indexOf(String name) {
        return columnNames.indexOf(name);
    }

    /**
     * The raw value at a 0-based column index.
     *
     * @throws IndexOutOfBoundsException if there is no such column
     */
    public Value value(int index) {
        return values.get(index);
    }

    /**
     * The raw value of a named column.
     *
     * @throws IllegalArgumentException if there is no such column
     */
    public Value value(String name) {
        return values.get(requireIndex(name));
    }

    /** The raw value of a named column, empty if there is no such column. */
    public Optional<Value> valueIfPresent(String name) {
        int index = columnNames.indexOf(name);
        return index < 0 ? Optional.empty() : Optional.of(values.get(index));
    }

    public <T> T get(int index, ValueConverter<T> converter) {
        Value value = value(index);
        return converter.fromValue(value).orElseThrow(() -> mismatch(columnNames.get(index), value));
    }

    public <T> T get(String name, ValueConverter<T> converter) {
        return get(requireIndex(name), converter);
    }

    public <T> Optional<T> getOptional(int index, ValueConverter<T> converter) {
        if (index < 0 || index >= values.size())
            return Optional.empty();
        return converter.fromValue(values.get(index));
    }

    public <T> Optional<T> getOptional(String name, ValueConverter<T> converter) {
        return getOptional(columnNames.indexOf(name), converter);
    }

    public boolean isNull(String name) {
        return value(name).isNull();
    }

    /** Column name to value, first occurrence wins for duplicate names. */
    public Map<String, Value> toMap() {
        Map<String, Value> map = new LinkedHashMap<>();
        for (int i = 0; i < values.size(); i++)
            map.putIfAbsent(columnNames.get(i), values.get(i));
        return map;
    }

    private int requireIndex(String name) {
        int index = columnNames.indexOf(name);
        if (index < 0)
            throw new IllegalArgumentException("No such column: " + name + " (available: " + columnNames + ")");
        return index;
    }

    private static TypeMismatchException mismatch(String column, Value value) {
        return new TypeMismatchException("Could not convert " + value + " (" + value.kind()
                + ") in column '" + column + "'", value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Row other))
            return false;
        return columnNames.equals(other.columnNames) && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columnNames, values);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < values.size(); i++) {
            if (i > 0)
                sb.append(' ');
            sb.append(columnNames.get(i)).append(':').append(values.get(i));
        }
        return sb.append(']').toString();
    }
}
