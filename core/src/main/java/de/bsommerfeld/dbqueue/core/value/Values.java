package de.bsommerfeld.dbqueue.core.value;

import de.bsommerfeld.dbqueue.core.error.BindingException;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

/**
 * Converts loosely typed statement arguments into {@link Value}s.
 */
public final class Values {

    private Values() {
    }

    /**
     * Returns the storage value for a statement argument.
     *
     * <p>
     * Accepted: {@code null}, {@link Value}, {@link ValueConvertible}, boxed
     * integral and floating point numbers, {@link Boolean}, {@link String},
     * {@link Character}, {@code byte[]}, {@link UUID}, {@link Instant},
     * {@link LocalDate}, {@link BigDecimal}, enums (by name) and
     * {@link Optional} of any of these.
     *
     * @throws BindingException for any other type
     */
    public static Value of(Object argument) {
        if (argument == null)
            return Value.NULL;
        if (argument instanceof Value v)
            return v;
        if (argument instanceof ValueConvertible c) {
            Value encoded = c.toValue();
            return encoded == null ? Value.NULL : encoded;
        }
        if (argument instanceof Long || argument instanceof Integer
                || argument instanceof Short || argument instanceof Byte)
            return Value.of(((Number) argument).longValue());
        if (argument instanceof Double || argument instanceof Float)
            return Value.of(((Number) argument).doubleValue());
        if (argument instanceof Boolean b)
            return Converters.BOOLEAN.encode(b);
        if (argument instanceof String s)
            return Value.of(s);
        if (argument instanceof Character c)
            return Value.of(String.valueOf(c));
        if (argument instanceof byte[] bytes)
            return Value.of(bytes);
        if (argument instanceof UUID uuid)
            return Converters.UUID_TEXT.encode(uuid);
        if (argument instanceof Instant instant)
            return Converters.INSTANT.encode(instant);
        if (argument instanceof LocalDate date)
            return Converters.LOCAL_DATE.encode(date);
        if (argument instanceof BigDecimal decimal)
            return Converters.BIG_DECIMAL.encode(decimal);
        if (argument instanceof Enum<?> e)
            return Value.of(e.name());
        if (argument instanceof Optional<?> optional)
            return optional.isPresent() ? of(optional.get()) : Value.NULL;
        throw new BindingException("Unsupported argument type: " + argument.getClass().getName());
    }
}
