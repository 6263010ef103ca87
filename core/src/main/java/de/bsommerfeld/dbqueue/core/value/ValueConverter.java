package de.bsommerfeld.dbqueue.core.value;

import java.util.Optional;

/**
 * Converts between an application type and a database {@link Value}.
 *
 * <p>
 * This is the only extension point for custom column types. Decoding never
 * throws: when the stored value has a kind the converter cannot handle, it
 * returns {@link Optional#empty()} and the caller decides whether absence is
 * acceptable. {@code Row.get} and the non-optional fetch methods turn absence
 * into a {@code TypeMismatchException}; {@code Row.getOptional} and the
 * single-value {@code fetchOne} pass it through.
 *
 * <p>
 * For every non-null {@code v}, {@code fromValue(toValue(v))} must yield a
 * value equal to {@code v}, unless the converter documents itself as lossy.
 *
 * @param <T> the application type
 * @see Converters
 */
public interface ValueConverter<T> {

    /**
     * Encodes a value for binding. {@code null} always encodes to
     * {@link Value#NULL}; implementations only see non-null input.
     */
    Value encode(T value);

    /**
     * Decodes a stored, non-null value. Returns empty when the kind is
     * incompatible.
     */
    Optional<T> decode(Value value);

    /** Null-aware encoding entry point. */
    default Value toValue(T value) {
        return value == null ? Value.NULL : encode(value);
    }

    /** Null-aware decoding entry point: {@code NULL} decodes to empty. */
    default Optional<T> fromValue(Value value) {
        if (value == null || value.isNull())
            return Optional.empty();
        return decode(value);
    }
}
