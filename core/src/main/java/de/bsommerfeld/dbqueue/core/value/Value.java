package de.bsommerfeld.dbqueue.core.value;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * A single database value, as stored by the engine.
 *
 * <p>
 * This is a closed variant: the only implementations are {@link Null},
 * {@link Int64}, {@link Real}, {@link Text} and {@link Blob}, one per
 * {@link StorageKind}. Application types never cross the engine boundary
 * directly; they are converted to and from a {@code Value} through a
 * {@link ValueConverter}.
 *
 * <p>
 * Instances are immutable. {@link Blob} copies its bytes on the way in and on
 * the way out.
 */
public sealed interface Value permits Value.Null, Value.Int64, Value.Real, Value.Text, Value.Blob {

    /** The shared SQL {@code NULL}. */
    Value NULL = Null.INSTANCE;

    StorageKind kind();

    default boolean isNull() {
        return kind() == StorageKind.NULL;
    }

    /**
     * Returns the plain Java representation used by the JDBC driver:
     * {@code null}, {@link Long}, {@link Double}, {@link String} or
     * {@code byte[]}.
     */
    Object toJdbcObject();

    static Value of(long value) {
        return new Int64(value);
    }

    static Value of(double value) {
        return new Real(value);
    }

    static Value of(String value) {
        return value == null ? NULL : new Text(value);
    }

    static Value of(byte[] value) {
        return value == null ? NULL : new Blob(value);
    }

    /**
     * Wraps a value as returned by the JDBC driver. Integral numbers widen to
     * {@link Int64}, floating point numbers to {@link Real}.
     *
     * @throws IllegalArgumentException if the object is not one of the
     *                                  driver's storage representations
     */
    static Value fromJdbcObject(Object raw) {
        if (raw == null)
            return NULL;
        if (raw instanceof Long || raw instanceof Integer || raw instanceof Short || raw instanceof Byte)
            return new Int64(((Number) raw).longValue());
        if (raw instanceof Double || raw instanceof Float)
            return new Real(((Number) raw).doubleValue());
        if (raw instanceof String s)
            return new Text(s);
        if (raw instanceof byte[] bytes)
            return new Blob(bytes);
        throw new IllegalArgumentException("Not a storage value: " + raw.getClass().getName());
    }

    /** SQL {@code NULL}. */
    final class Null implements Value {

        private static final Null INSTANCE = new Null();

        private Null() {
        }

        @Override
        public StorageKind kind() {
            return StorageKind.NULL;
        }

        @Override
        public Object toJdbcObject() {
            return null;
        }

        @Override
        public String toString() {
            return "NULL";
        }
    }

    /** 64-bit signed integer. */
    record Int64(long value) implements Value {

        @Override
        public StorageKind kind() {
            return StorageKind.INTEGER;
        }

        @Override
        public Object toJdbcObject() {
            return value;
        }

        @Override
        public String toString() {
            return Long.toString(value);
        }
    }

    /** IEEE 754 double precision number. */
    record Real(double value) implements Value {

        @Override
        public StorageKind kind() {
            return StorageKind.REAL;
        }

        @Override
        public Object toJdbcObject() {
            return value;
        }

        @Override
        public String toString() {
            return Double.toString(value);
        }
    }

    /** UTF-8 text. */
    record Text(String value) implements Value {

        public Text {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public StorageKind kind() {
            return StorageKind.TEXT;
        }

        @Override
        public Object toJdbcObject() {
            return value;
        }

        @Override
        public String toString() {
            return "'" + value.replace("'", "''") + "'";
        }
    }

    /** Binary data. */
    record Blob(byte[] value) implements Value {

        public Blob {
            value = Objects.requireNonNull(value, "value").clone();
        }

        @Override
        public byte[] value() {
            return value.clone();
        }

        @Override
        public StorageKind kind() {
            return StorageKind.BLOB;
        }

        @Override
        public Object toJdbcObject() {
            return value.clone();
        }

        /** Decodes the bytes as UTF-8, the way the engine casts a blob to text. */
        public String asUtf8() {
            return new String(value, StandardCharsets.UTF_8);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Blob other && Arrays.equals(value, other.value);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(value);
        }

        @Override
        public String toString() {
            return "Blob[" + value.length + " bytes]";
        }
    }
}
