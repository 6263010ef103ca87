package de.bsommerfeld.dbqueue.db.model;

import java.util.List;
import java.util.Objects;

/**
 * How a {@link Model} identifies its rows.
 *
 * <ul>
 * <li>{@link None}: no key; fetch-by-key and all writes are refused</li>
 * <li>{@link RowId}: an {@code INTEGER PRIMARY KEY} column aliasing the
 * engine's row id, assigned on insert and read back</li>
 * <li>{@link Single}: one application-supplied key column</li>
 * <li>{@link Composite}: several key columns, compared in declared order</li>
 * </ul>
 */
public sealed interface PrimaryKey permits PrimaryKey.None, PrimaryKey.RowId, PrimaryKey.Single, PrimaryKey.Composite {

    enum Kind {
        NONE, ROW_ID, SINGLE, COMPOSITE
    }

    Kind kind();

    /** Key columns in declared order, empty for {@link None}. */
    List<String> columns();

    static PrimaryKey none() {
        return None.INSTANCE;
    }

    static PrimaryKey rowId(String column) {
        return new RowId(column);
    }

    static PrimaryKey single(String column) {
        return new Single(column);
    }

    static PrimaryKey composite(String... columns) {
        return new Composite(List.of(columns));
    }

    final class None implements PrimaryKey {

        static final None INSTANCE = new None();

        private None() {
        }

        @Override
        public Kind kind() {
            return Kind.NONE;
        }

        @Override
        public List<String> columns() {
            return List.of();
        }

        @Override
        public String toString() {
            return "None";
        }
    }

    record RowId(String column) implements PrimaryKey {

        public RowId {
            requireColumn(column);
        }

        @Override
        public Kind kind() {
            return Kind.ROW_ID;
        }

        @Override
        public List<String> columns() {
            return List.of(column);
        }
    }

    record Single(String column) implements PrimaryKey {

        public Single {
            requireColumn(column);
        }

        @Override
        public Kind kind() {
            return Kind.SINGLE;
        }

        @Override
        public List<String> columns() {
            return List.of(column);
        }
    }

    record Composite(List<String> columns) implements PrimaryKey {

        public Composite {
            Objects.requireNonNull(columns, "columns");
            if (columns.size() < 2)
                throw new IllegalArgumentException("A composite key needs at least two columns: " + columns);
            columns.forEach(PrimaryKey::requireColumn);
            columns = List.copyOf(columns);
        }

        @Override
        public Kind kind() {
            return Kind.COMPOSITE;
        }
    }

    private static void requireColumn(String column) {
        if (column == null || column.isBlank())
            throw new IllegalArgumentException("Key column name must not be blank");
    }
}
