package de.bsommerfeld.dbqueue.core.value;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.math.BigDecimal;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Built-in {@link ValueConverter}s for common Java types.
 *
 * <p>
 * Lossy conversions:
 * <ul>
 * <li>{@link #BOOLEAN} decodes any non-zero number to {@code true}</li>
 * <li>{@link #LONG} accepts integral reals, so {@code 3.0} decodes to
 * {@code 3}</li>
 * <li>{@link #INSTANT} also decodes numbers as epoch seconds; values it
 * encodes itself (ISO-8601 text) round-trip exactly</li>
 * </ul>
 */
public final class Converters {

    private static final double MIN_LONG_AS_DOUBLE = -0x1p63;
    private static final double MAX_LONG_AS_DOUBLE = 0x1p63;

    public static final ValueConverter<Long> LONG = new ValueConverter<>() {
        @Override
        public Value encode(Long value) {
            return Value.of(value.longValue());
        }

        @Override
        public Optional<Long> decode(Value value) {
            if (value instanceof Value.Int64 i)
                return Optional.of(i.value());
            if (value instanceof Value.Real r) {
                double d = r.value();
                if (d >= MIN_LONG_AS_DOUBLE && d < MAX_LONG_AS_DOUBLE && d == Math.rint(d))
                    return Optional.of((long) d);
            }
            return Optional.empty();
        }
    };

    public static final ValueConverter<Integer> INTEGER = new ValueConverter<>() {
        @Override
        public Value encode(Integer value) {
            return Value.of(value.longValue());
        }

        @Override
        public Optional<Integer> decode(Value value) {
            return LONG.decode(value)
                    .filter(l -> l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE)
                    .map(Long::intValue);
        }
    };

    public static final ValueConverter<Double> DOUBLE = new ValueConverter<>() {
        @Override
        public Value encode(Double value) {
            return Value.of(value.doubleValue());
        }

        @Override
        public Optional<Double> decode(Value value) {
            if (value instanceof Value.Real r)
                return Optional.of(r.value());
            if (value instanceof Value.Int64 i)
                return Optional.of((double) i.value());
            return Optional.empty();
        }
    };

    public static final ValueConverter<String> STRING = new ValueConverter<>() {
        @Override
        public Value encode(String value) {
            return Value.of(value);
        }

        @Override
        public Optional<String> decode(Value value) {
            if (value instanceof Value.Text t)
                return Optional.of(t.value());
            return Optional.empty();
        }
    };

    /** Blobs, and text as its UTF-8 bytes. */
    public static final ValueConverter<byte[]> BYTES = new ValueConverter<>() {
        @Override
        public Value encode(byte[] value) {
            return Value.of(value);
        }

        @Override
        public Optional<byte[]> decode(Value value) {
            if (value instanceof Value.Blob b)
                return Optional.of(b.value());
            if (value instanceof Value.Text t)
                return Optional.of(t.value().getBytes(StandardCharsets.UTF_8));
            return Optional.empty();
        }
    };

    /** Stored as integer {@code 0} or {@code 1}. */
    public static final ValueConverter<Boolean> BOOLEAN = new ValueConverter<>() {
        @Override
        public Value encode(Boolean value) {
            return Value.of(value ? 1L : 0L);
        }

        @Override
        public Optional<Boolean> decode(Value value) {
            if (value instanceof Value.Int64 i)
                return Optional.of(i.value() != 0);
            if (value instanceof Value.Real r)
                return Optional.of(r.value() != 0.0);
            return Optional.empty();
        }
    };

    /** Canonical text form; 16-byte blobs are accepted on decode. */
    public static final ValueConverter<UUID> UUID_TEXT = new ValueConverter<>() {
        @Override
        public Value encode(UUID value) {
            return Value.of(value.toString());
        }

        @Override
        public Optional<UUID> decode(Value value) {
            if (value instanceof Value.Text t) {
                try {
                    return Optional.of(UUID.fromString(t.value()));
                } catch (IllegalArgumentException e) {
                    return Optional.empty();
                }
            }
            if (value instanceof Value.Blob b) {
                byte[] bytes = b.value();
                if (bytes.length != 16)
                    return Optional.empty();
                ByteBuffer buffer = ByteBuffer.wrap(bytes);
                return Optional.of(new UUID(buffer.getLong(), buffer.getLong()));
            }
            return Optional.empty();
        }
    };

    /** ISO-8601 text; numbers decode as epoch seconds. */
    public static final ValueConverter<Instant> INSTANT = new ValueConverter<>() {
        @Override
        public Value encode(Instant value) {
            return Value.of(value.toString());
        }

        @Override
        public Optional<Instant> decode(Value value) {
            try {
                if (value instanceof Value.Text t)
                    return Optional.of(Instant.parse(t.value()));
                if (value instanceof Value.Int64 i)
                    return Optional.of(Instant.ofEpochSecond(i.value()));
                if (value instanceof Value.Real r) {
                    double seconds = r.value();
                    long whole = (long) Math.floor(seconds);
                    long nanos = Math.round((seconds - whole) * 1_000_000_000L);
                    return Optional.of(Instant.ofEpochSecond(whole, nanos));
                }
            } catch (DateTimeException e) {
                return Optional.empty();
            }
            return Optional.empty();
        }
    };

    /** ISO-8601 {@code yyyy-MM-dd} text. */
    public static final ValueConverter<LocalDate> LOCAL_DATE = new ValueConverter<>() {
        @Override
        public Value encode(LocalDate value) {
            return Value.of(value.toString());
        }

        @Override
        public Optional<LocalDate> decode(Value value) {
            if (value instanceof Value.Text t) {
                try {
                    return Optional.of(LocalDate.parse(t.value()));
                } catch (DateTimeException e) {
                    return Optional.empty();
                }
            }
            return Optional.empty();
        }
    };

    /** Text, so that scale and precision survive the engine's numeric affinity. */
    public static final ValueConverter<BigDecimal> BIG_DECIMAL = new ValueConverter<>() {
        @Override
        public Value encode(BigDecimal value) {
            return Value.of(value.toString());
        }

        @Override
        public Optional<BigDecimal> decode(Value value) {
            if (value instanceof Value.Text t) {
                try {
                    return Optional.of(new BigDecimal(t.value()));
                } catch (NumberFormatException e) {
                    return Optional.empty();
                }
            }
            if (value instanceof Value.Int64 i)
                return Optional.of(BigDecimal.valueOf(i.value()));
            if (value instanceof Value.Real r)
                return Optional.of(BigDecimal.valueOf(r.value()));
            return Optional.empty();
        }
    };

    /** Identity converter, for reading raw values through the typed fetch methods. */
    public static final ValueConverter<Value> RAW = new ValueConverter<>() {
        @Override
        public Value encode(Value value) {
            return value;
        }

        @Override
        public Optional<Value> decode(Value value) {
            return Optional.of(value);
        }
    };

    private Converters() {
    }

    /** Stores the constant's {@link Enum#name()} as text. */
    public static <E extends Enum<E>> ValueConverter<E> forEnum(Class<E> type) {
        Objects.requireNonNull(type, "type");
        return new ValueConverter<>() {
            @Override
            public Value encode(E value) {
                return Value.of(value.name());
            }

            @Override
            public Optional<E> decode(Value value) {
                if (!(value instanceof Value.Text t))
                    return Optional.empty();
                try {
                    return Optional.of(Enum.valueOf(type, t.value()));
                } catch (IllegalArgumentException e) {
                    return Optional.empty();
                }
            }
        };
    }

    /** Stores the value as JSON text through a default {@link ObjectMapper}. */
    public static <T> ValueConverter<T> json(Class<T> type) {
        return new JsonConverter<>(new ObjectMapper(), type);
    }

    /** Stores the value as JSON text through the given mapper. */
    public static <T> ValueConverter<T> json(ObjectMapper mapper, Class<T> type) {
        return new JsonConverter<>(mapper, type);
    }
}
