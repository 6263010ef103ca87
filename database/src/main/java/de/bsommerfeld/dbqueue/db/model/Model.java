package de.bsommerfeld.dbqueue.db.model;

import de.bsommerfeld.dbqueue.core.bind.Bindings;
import de.bsommerfeld.dbqueue.core.error.PersistenceException;
import de.bsommerfeld.dbqueue.core.error.RecordNotFoundException;
import de.bsommerfeld.dbqueue.core.error.UnsupportedModelOperationException;
import de.bsommerfeld.dbqueue.core.row.Row;
import de.bsommerfeld.dbqueue.core.row.RowMapper;
import de.bsommerfeld.dbqueue.core.value.Converters;
import de.bsommerfeld.dbqueue.core.value.Value;
import de.bsommerfeld.dbqueue.core.value.Values;
import de.bsommerfeld.dbqueue.db.Cursor;
import de.bsommerfeld.dbqueue.db.DatabaseConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import static de.bsommerfeld.dbqueue.db.SqlIdentifiers.quote;
import static de.bsommerfeld.dbqueue.db.SqlIdentifiers.quoteAll;

/**
 * Base class for entities persisted one row per instance.
 *
 * <p>
 * A subclass declares four things and inherits CRUD built on plain SQL:
 * <ul>
 * <li>{@link #tableName()}: the table its rows live in</li>
 * <li>{@link #primaryKey()}: how rows are identified</li>
 * <li>{@link #populate(Row)}: reads fields from a fetched row</li>
 * <li>{@link #persistentValues()}: the columns written on insert and
 * update</li>
 * </ul>
 *
 * <pre>{@code
 * class Person extends Model {
 *     Long id;
 *     String name;
 *     int age;
 *
 *     protected String tableName() { return "persons"; }
 *     protected PrimaryKey primaryKey() { return PrimaryKey.rowId("id"); }
 *     protected void populate(Row row) {
 *         id = row.getOptional("id", Converters.LONG).orElse(null);
 *         name = row.getOptional("name", Converters.STRING).orElse(null);
 *         age = row.getOptional("age", Converters.INTEGER).orElse(0);
 *     }
 *     protected Map<String, ?> persistentValues() {
 *         Map<String, Object> values = new LinkedHashMap<>();
 *         values.put("id", id);
 *         values.put("name", name);
 *         values.put("age", age);
 *         return values;
 *     }
 *     protected void didInsert(long rowId, String column) { id = rowId; }
 * }
 * }</pre>
 *
 * <h3>Key handling</h3>
 * Updates, deletes and lookups always filter on the key columns. A key
 * column that is missing from {@link #persistentValues()} or holds
 * {@code null} counts as unset, and the operation is refused with an
 * {@link UnsupportedModelOperationException} rather than running without a
 * {@code WHERE} clause.
 *
 * <h3>Derived shapes</h3>
 * Queries that return extra columns, an aggregate next to the entity for
 * example, are mapped by composition: combine {@link #mapper(Supplier)} with
 * a second mapper reading the extra columns from the same row.
 *
 * <p>
 * Instances are not thread-safe; use them inside queue blocks or hand them
 * between threads with the usual care.
 */
public abstract class Model {

    private static final Logger LOG = LoggerFactory.getLogger(Model.class);

    /** Persistent values as of the last fetch or successful write. */
    private Map<String, Value> referenceValues;

    protected abstract String tableName();

    protected abstract PrimaryKey primaryKey();

    /**
     * Reads fields from a row. Columns the row does not carry must leave their
     * fields untouched.
     */
    protected abstract void populate(Row row);

    /** Column name to argument, in column order. */
    protected abstract Map<String, ?> persistentValues();

    /**
     * Called after an insert into a table with a {@link PrimaryKey.RowId} key,
     * with the row id the engine assigned. The default hands the id to
     * {@link #populate} as a one-column row.
     */
    protected void didInsert(long rowId, String column) {
        populate(new Row(List.of(column), List.of(Value.of(rowId))));
    }

    // -- instance operations -------------------------------------------------

    /**
     * Inserts this entity. With a {@link PrimaryKey.RowId} key the id the
     * engine stored is passed to {@link #didInsert}, which assigns it to the
     * key field.
     *
     * @throws UnsupportedModelOperationException for {@link PrimaryKey.None}
     * @throws PersistenceException               if the table name or the
     *                                            persistent values are missing
     */
    public void insert(DatabaseConnection db) {
        PrimaryKey key = requireKey("insert");
        String table = requireTableName();
        Map<String, Value> values = requireValues();

        Map<String, Value> inserted = new LinkedHashMap<>(values);
        if (key instanceof PrimaryKey.RowId rowId && inserted.getOrDefault(rowId.column(), Value.NULL).isNull())
            inserted.remove(rowId.column());

        String sql;
        if (inserted.isEmpty()) {
            sql = "INSERT INTO " + quote(table) + " DEFAULT VALUES";
        } else {
            sql = "INSERT INTO " + quote(table) + " (" + quoteAll(new ArrayList<>(inserted.keySet()))
                    + ") VALUES (" + placeholders(inserted.size()) + ")";
        }
        db.execute(sql, Bindings.of(new ArrayList<>(inserted.values())));

        if (key instanceof PrimaryKey.RowId rowId) {
            long id = db.lastInsertedRowId();
            didInsert(id, rowId.column());
            LOG.debug("Inserted {} row {}", table, id);
        }
        referenceValues = writeValues();
    }

    /**
     * Updates every persistent column of the row with this entity's key.
     *
     * @return rows affected; {@code 0} when no row has this key
     * @throws UnsupportedModelOperationException for {@link PrimaryKey.None}
     *                                            or an unset key
     */
    public int update(DatabaseConnection db) {
        return updateColumns(db, requireValues(), "update");
    }

    /**
     * Like {@link #update} but treats a missing row as an error.
     *
     * @throws RecordNotFoundException if no row has this entity's key
     */
    public void requireUpdate(DatabaseConnection db) {
        if (update(db) == 0)
            throw new RecordNotFoundException(tableName(),
                    "No row in " + tableName() + " with key " + keyDescription(requireValues()));
    }

    /**
     * Updates only the columns that changed since this entity was last
     * fetched or written. Without a reference snapshot all columns are
     * written.
     *
     * @return rows affected; {@code 0} also when nothing changed
     */
    public int updateChanges(DatabaseConnection db) {
        Map<String, Value> values = requireValues();
        if (referenceValues == null)
            return updateColumns(db, values, "update");
        Map<String, Value> changed = new LinkedHashMap<>();
        values.forEach((column, value) -> {
            if (!Objects.equals(referenceValues.get(column), value))
                changed.put(column, value);
        });
        if (changed.isEmpty())
            return 0;
        List<String> keyColumns = requireKey("update").columns();
        for (String column : keyColumns) {
            Value value = values.get(column);
            if (value != null)
                changed.put(column, value);
        }
        return updateColumns(db, changed, "update");
    }

    /** True if the persistent values differ from the last fetched or written state. */
    public boolean hasChanges() {
        return referenceValues == null || !referenceValues.equals(writeValues());
    }

    /**
     * Updates the row with this entity's key, inserting it when the key is
     * unset or no such row exists.
     */
    public void save(DatabaseConnection db) {
        PrimaryKey key = requireKey("save");
        if (keyValues(key, requireValues()) == null || update(db) == 0)
            insert(db);
    }

    /**
     * Deletes the row with this entity's key.
     *
     * @return whether a row was deleted
     * @throws UnsupportedModelOperationException for {@link PrimaryKey.None}
     *                                            or an unset key
     */
    public boolean delete(DatabaseConnection db) {
        PrimaryKey key = requireKey("delete");
        String table = requireTableName();
        List<Value> keyValues = requireKeyValues(key, writeValues(), "delete");
        int deleted = db.execute("DELETE FROM " + quote(table) + " WHERE " + keyPredicate(key),
                Bindings.of(keyValues));
        if (deleted > 0)
            referenceValues = null;
        return deleted > 0;
    }

    /** Whether a row with this entity's key exists. */
    public boolean exists(DatabaseConnection db) {
        PrimaryKey key = requireKey("exists");
        String table = requireTableName();
        List<Value> keyValues = requireKeyValues(key, writeValues(), "exists");
        return db.fetchOne("SELECT 1 FROM " + quote(table) + " WHERE " + keyPredicate(key) + " LIMIT 1",
                Bindings.of(keyValues)).isPresent();
    }

    // -- static operations ---------------------------------------------------

    /**
     * Fetches the entity with the given key values, in declared key column
     * order. A {@code null} key value matches nothing.
     *
     * @throws UnsupportedModelOperationException for {@link PrimaryKey.None}
     * @throws IllegalArgumentException           if the number of key values
     *                                            does not match the key
     */
    public static <M extends Model> Optional<M> fetchOne(DatabaseConnection db, Supplier<M> factory, Object... key) {
        Model prototype = factory.get();
        PrimaryKey primaryKey = prototype.requireKey("fetch");
        Object[] keyValues = key == null ? new Object[]{null} : key;
        if (keyValues.length != primaryKey.columns().size())
            throw new IllegalArgumentException("Expected " + primaryKey.columns().size() + " key value(s) for "
                    + primaryKey.columns() + ", got " + keyValues.length);
        for (Object value : keyValues) {
            if (Values.of(value).isNull())
                return Optional.empty();
        }
        String sql = "SELECT * FROM " + quote(prototype.requireTableName()) + " WHERE " + keyPredicate(primaryKey);
        return db.fetchOne(sql, Bindings.of(keyValues), mapper(factory));
    }

    /**
     * Fetches the entity whose key columns equal the map's values. The map
     * must name every key column.
     */
    public static <M extends Model> Optional<M> fetchOne(DatabaseConnection db, Supplier<M> factory,
            Map<String, ?> key) {
        Objects.requireNonNull(key, "key");
        Model prototype = factory.get();
        List<String> columns = prototype.requireKey("fetch").columns();
        Object[] ordered = new Object[columns.size()];
        for (int i = 0; i < columns.size(); i++) {
            if (!key.containsKey(columns.get(i)))
                throw new IllegalArgumentException("Missing key column " + columns.get(i) + " in " + key.keySet());
            ordered[i] = key.get(columns.get(i));
        }
        return fetchOne(db, factory, ordered);
    }

    public static <M extends Model> List<M> fetchAll(DatabaseConnection db, Supplier<M> factory) {
        return db.fetchAll("SELECT * FROM " + quote(tableOf(factory)), Bindings.NONE,
                mapper(factory));
    }

    /** Maps every row of a custom query onto fresh entities. */
    public static <M extends Model> List<M> fetchAll(DatabaseConnection db, Supplier<M> factory, String sql,
            Bindings bindings) {
        return db.fetchAll(sql, bindings, mapper(factory));
    }

    public static <M extends Model> Cursor<M> fetch(DatabaseConnection db, Supplier<M> factory, String sql,
            Bindings bindings) {
        return db.fetch(sql, bindings, mapper(factory));
    }

    public static long fetchCount(DatabaseConnection db, Supplier<? extends Model> factory) {
        return db.fetchOne("SELECT count(*) FROM " + quote(tableOf(factory)), Bindings.NONE,
                Converters.LONG).orElse(0L);
    }

    /** Deletes every row of the model's table and returns how many. */
    public static int deleteAll(DatabaseConnection db, Supplier<? extends Model> factory) {
        return db.execute("DELETE FROM " + quote(tableOf(factory)), Bindings.NONE);
    }

    /**
     * Row mapper creating one entity per row. The entity's change tracking
     * starts from the fetched state.
     */
    public static <M extends Model> RowMapper<M> mapper(Supplier<M> factory) {
        Objects.requireNonNull(factory, "factory");
        return row -> {
            M model = factory.get();
            Model base = model;
            base.populate(row);
            base.referenceValues = base.writeValues();
            return model;
        };
    }

    // -- internals -----------------------------------------------------------

    private int updateColumns(DatabaseConnection db, Map<String, Value> values, String operation) {
        PrimaryKey key = requireKey(operation);
        String table = requireTableName();
        List<Value> keyValues = requireKeyValues(key, values, operation);

        List<String> setColumns = new ArrayList<>();
        List<Value> arguments = new ArrayList<>();
        values.forEach((column, value) -> {
            if (!key.columns().contains(column)) {
                setColumns.add(column);
                arguments.add(value);
            }
        });
        String assignments;
        if (setColumns.isEmpty()) {
            // a key-only row still needs a statement that reports whether it exists
            String first = quote(key.columns().get(0));
            assignments = first + " = " + first;
        } else {
            assignments = setColumns.stream().map(c -> quote(c) + " = ?").collect(Collectors.joining(", "));
        }
        arguments.addAll(keyValues);

        int updated = db.execute("UPDATE " + quote(table) + " SET " + assignments + " WHERE " + keyPredicate(key),
                Bindings.of(arguments));
        if (updated > 0)
            referenceValues = writeValues();
        return updated;
    }

    private static String tableOf(Supplier<? extends Model> factory) {
        Model prototype = factory.get();
        return prototype.requireTableName();
    }

    private PrimaryKey requireKey(String operation) {
        PrimaryKey key = primaryKey();
        if (key == null || key.kind() == PrimaryKey.Kind.NONE)
            throw new UnsupportedModelOperationException("Cannot " + operation + " " + tableName()
                    + ": the model declares no primary key");
        return key;
    }

    private String requireTableName() {
        String table = tableName();
        if (table == null || table.isBlank())
            throw new PersistenceException(getClass().getSimpleName() + " declares no table name");
        return table;
    }

    private Map<String, Value> requireValues() {
        Map<String, Value> values = writeValues();
        if (values.isEmpty())
            throw new PersistenceException(getClass().getSimpleName() + " declares no persistent values");
        return values;
    }

    private Map<String, Value> writeValues() {
        Map<String, ?> declared = persistentValues();
        Map<String, Value> values = new LinkedHashMap<>();
        if (declared != null)
            declared.forEach((column, argument) -> values.put(column, Values.of(argument)));
        return values;
    }

    private List<Value> requireKeyValues(PrimaryKey key, Map<String, Value> values, String operation) {
        List<Value> keyValues = keyValues(key, values);
        if (keyValues == null)
            throw new UnsupportedModelOperationException("Cannot " + operation + " " + tableName()
                    + ": primary key " + key.columns() + " is not set");
        return keyValues;
    }

    /** Key values in declared order, {@code null} if any is unset. */
    private static List<Value> keyValues(PrimaryKey key, Map<String, Value> values) {
        List<Value> keyValues = new ArrayList<>();
        for (String column : key.columns()) {
            Value value = values.get(column);
            if (value == null || value.isNull())
                return null;
            keyValues.add(value);
        }
        return keyValues;
    }

    private static String keyPredicate(PrimaryKey key) {
        return key.columns().stream().map(c -> quote(c) + " = ?").collect(Collectors.joining(" AND "));
    }

    private String keyDescription(Map<String, Value> values) {
        Map<String, Value> key = new LinkedHashMap<>();
        for (String column : primaryKey().columns())
            key.put(column, values.get(column));
        return key.toString();
    }

    private static String placeholders(int count) {
        return String.join(", ", Collections.nCopies(count, "?"));
    }
}
