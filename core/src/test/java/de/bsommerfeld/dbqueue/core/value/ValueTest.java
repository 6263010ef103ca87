package de.bsommerfeld.dbqueue.core.value;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class ValueTest {

    @Test
    void of_shouldPickKindFromJavaType() {
        assertEquals(StorageKind.INTEGER, Value.of(42L).kind());
        assertEquals(StorageKind.REAL, Value.of(4.2).kind());
        assertEquals(StorageKind.TEXT, Value.of("x").kind());
        assertEquals(StorageKind.BLOB, Value.of(new byte[]{1}).kind());
        assertEquals(StorageKind.NULL, Value.NULL.kind());
    }

    @Test
    void of_shouldMapNullTextAndBlobToNull() {
        assertSame(Value.NULL, Value.of((String) null));
        assertSame(Value.NULL, Value.of((byte[]) null));
        assertTrue(Value.NULL.isNull());
        assertFalse(Value.of(0L).isNull());
    }

    @Test
    void fromJdbcObject_shouldWidenDriverTypes() {
        assertEquals(Value.of(7L), Value.fromJdbcObject(7));
        assertEquals(Value.of(7L), Value.fromJdbcObject(7L));
        assertEquals(Value.of(1.5), Value.fromJdbcObject(1.5f));
        assertEquals(Value.of("a"), Value.fromJdbcObject("a"));
        assertSame(Value.NULL, Value.fromJdbcObject(null));
    }

    @Test
    void fromJdbcObject_shouldRejectForeignTypes() {
        assertThrows(IllegalArgumentException.class, () -> Value.fromJdbcObject(new Object()));
    }

    @Test
    void blob_shouldCopyBytesAndCompareByContent() {
        byte[] bytes = {1, 2, 3};
        Value.Blob blob = new Value.Blob(bytes);
        bytes[0] = 9;

        assertArrayEquals(new byte[]{1, 2, 3}, blob.value());
        blob.value()[1] = 9;
        assertArrayEquals(new byte[]{1, 2, 3}, blob.value());
        assertEquals(new Value.Blob(new byte[]{1, 2, 3}), blob);
        assertEquals(new Value.Blob(new byte[]{1, 2, 3}).hashCode(), blob.hashCode());
    }

    @Test
    void blob_asUtf8_shouldDecodeText() {
        Value.Blob blob = new Value.Blob("Grüße".getBytes(StandardCharsets.UTF_8));
        assertEquals("Grüße", blob.asUtf8());
    }

    @Test
    void toJdbcObject_shouldReturnDriverRepresentation() {
        assertNull(Value.NULL.toJdbcObject());
        assertEquals(5L, Value.of(5L).toJdbcObject());
        assertEquals("t", Value.of("t").toJdbcObject());
    }

    @Test
    void values_shouldConvertLooseArguments() {
        assertEquals(Value.of(3L), Values.of(3));
        assertEquals(Value.of(3L), Values.of((short) 3));
        assertEquals(Value.of(1L), Values.of(true));
        assertEquals(Value.of("c"), Values.of('c'));
        assertEquals(Value.of("MONDAY"), Values.of(java.time.DayOfWeek.MONDAY));
        assertSame(Value.NULL, Values.of(java.util.Optional.empty()));
        assertEquals(Value.of("x"), Values.of(java.util.Optional.of("x")));
        assertEquals(Value.of(99L), Values.of((ValueConvertible) () -> Value.of(99L)));
    }

    @Test
    void values_shouldRejectUnsupportedArgument() {
        assertThrows(de.bsommerfeld.dbqueue.core.error.BindingException.class,
                () -> Values.of(new StringBuilder("nope")));
    }
}
