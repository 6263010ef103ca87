package de.bsommerfeld.dbqueue.core.value;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Round-trip and kind-mismatch behavior of the built-in converters.
 */
class ConvertersTest {

    enum Color {
        RED, GREEN
    }

    public record Address(String street, int number, List<String> tags) {
    }

    // -- Round trips --

    @Test
    void roundTrip_shouldPreserveValues() {
        assertRoundTrip(Converters.LONG, Long.MIN_VALUE);
        assertRoundTrip(Converters.INTEGER, -17);
        assertRoundTrip(Converters.DOUBLE, 0.1);
        assertRoundTrip(Converters.STRING, "Arthur");
        assertRoundTrip(Converters.BOOLEAN, true);
        assertRoundTrip(Converters.UUID_TEXT, UUID.fromString("123e4567-e89b-12d3-a456-426614174000"));
        assertRoundTrip(Converters.INSTANT, Instant.parse("2024-03-01T12:30:45.123Z"));
        assertRoundTrip(Converters.LOCAL_DATE, LocalDate.of(2024, 2, 29));
        assertRoundTrip(Converters.BIG_DECIMAL, new BigDecimal("12.3400"));
        assertRoundTrip(Converters.forEnum(Color.class), Color.GREEN);
        assertRoundTrip(Converters.json(Address.class), new Address("Main", 7, List.of("home")));
    }

    @Test
    void bytes_shouldRoundTripByContent() {
        byte[] bytes = {0, 1, (byte) 0xFF};
        assertArrayEquals(bytes, Converters.BYTES.fromValue(Converters.BYTES.toValue(bytes)).orElseThrow());
    }

    @Test
    void toValue_shouldEncodeNullAsNull() {
        assertSame(Value.NULL, Converters.STRING.toValue(null));
        assertSame(Value.NULL, Converters.LONG.toValue(null));
    }

    @Test
    void fromValue_shouldDecodeNullAsEmpty() {
        assertEquals(Optional.empty(), Converters.LONG.fromValue(Value.NULL));
        assertEquals(Optional.empty(), Converters.RAW.fromValue(Value.NULL));
    }

    // -- Mismatches --

    @Test
    void decode_shouldReturnEmptyForIncompatibleKind() {
        assertTrue(Converters.LONG.fromValue(Value.of("12")).isEmpty());
        assertTrue(Converters.STRING.fromValue(Value.of(12L)).isEmpty());
        assertTrue(Converters.LOCAL_DATE.fromValue(Value.of("not a date")).isEmpty());
        assertTrue(Converters.UUID_TEXT.fromValue(Value.of("nope")).isEmpty());
        assertTrue(Converters.forEnum(Color.class).fromValue(Value.of("BLUE")).isEmpty());
        assertTrue(Converters.json(Address.class).fromValue(Value.of("{broken")).isEmpty());
    }

    @Test
    void integer_shouldRejectOutOfRangeLong() {
        assertTrue(Converters.INTEGER.fromValue(Value.of(Integer.MAX_VALUE + 1L)).isEmpty());
        assertEquals(Optional.of(Integer.MAX_VALUE), Converters.INTEGER.fromValue(Value.of((long) Integer.MAX_VALUE)));
    }

    @Test
    void long_shouldAcceptIntegralRealsOnly() {
        assertEquals(Optional.of(3L), Converters.LONG.fromValue(Value.of(3.0)));
        assertTrue(Converters.LONG.fromValue(Value.of(3.5)).isEmpty());
        assertTrue(Converters.LONG.fromValue(Value.of(1e300)).isEmpty());
    }

    // -- Lossy kinds --

    @Test
    void boolean_shouldTreatAnyNonZeroAsTrue() {
        assertEquals(Optional.of(true), Converters.BOOLEAN.fromValue(Value.of(5L)));
        assertEquals(Optional.of(false), Converters.BOOLEAN.fromValue(Value.of(0L)));
    }

    @Test
    void instant_shouldDecodeEpochSeconds() {
        assertEquals(Optional.of(Instant.ofEpochSecond(1_700_000_000L)),
                Converters.INSTANT.fromValue(Value.of(1_700_000_000L)));
    }

    @Test
    void uuid_shouldDecodeSixteenByteBlob() {
        UUID uuid = UUID.randomUUID();
        java.nio.ByteBuffer buffer = java.nio.ByteBuffer.allocate(16);
        buffer.putLong(uuid.getMostSignificantBits()).putLong(uuid.getLeastSignificantBits());
        assertEquals(Optional.of(uuid), Converters.UUID_TEXT.fromValue(Value.of(buffer.array())));
    }

    @Test
    void double_shouldWidenIntegers() {
        assertEquals(Optional.of(2.0), Converters.DOUBLE.fromValue(Value.of(2L)));
    }

    private static <T> void assertRoundTrip(ValueConverter<T> converter, T value) {
        assertEquals(Optional.of(value), converter.fromValue(converter.toValue(value)),
                "Round trip failed for " + value);
    }
}
