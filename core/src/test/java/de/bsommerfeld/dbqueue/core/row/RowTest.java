package de.bsommerfeld.dbqueue.core.row;

import de.bsommerfeld.dbqueue.core.error.TypeMismatchException;
import de.bsommerfeld.dbqueue.core.value.Converters;
import de.bsommerfeld.dbqueue.core.value.Value;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RowTest {

    private final Row row = new Row(
            List.of("id", "name", "note", "id"),
            List.of(Value.of(1L), Value.of("Arthur"), Value.NULL, Value.of(2L)));

    @Test
    void value_shouldResolveDuplicateNamesToFirstColumn() {
        assertEquals(Value.of(1L), row.value("id"));
        assertEquals(0, row.indexOf("id"));
        assertEquals(Value.of(2L), row.value(3));
    }

    @Test
    void value_shouldMatchNamesCaseSensitively() {
        assertTrue(row.hasColumn("name"));
        assertFalse(row.hasColumn("NAME"));
        assertThrows(IllegalArgumentException.class, () -> row.value("NAME"));
        assertEquals(Optional.empty(), row.valueIfPresent("NAME"));
    }

    @Test
    void get_shouldDecodeCompatibleValue() {
        assertEquals("Arthur", row.get("name", Converters.STRING));
        assertEquals(Long.valueOf(1L), row.get(0, Converters.LONG));
    }

    @Test
    void get_shouldThrowTypeMismatchForNullOrWrongKind() {
        TypeMismatchException nullMismatch = assertThrows(TypeMismatchException.class,
                () -> row.get("note", Converters.STRING));
        assertSame(Value.NULL, nullMismatch.value());
        assertThrows(TypeMismatchException.class, () -> row.get("name", Converters.LONG));
    }

    @Test
    void getOptional_shouldYieldEmptyForNullMismatchAndMissingColumn() {
        assertEquals(Optional.empty(), row.getOptional("note", Converters.STRING));
        assertEquals(Optional.empty(), row.getOptional("name", Converters.LONG));
        assertEquals(Optional.empty(), row.getOptional("missing", Converters.LONG));
        assertEquals(Optional.empty(), row.getOptional(42, Converters.LONG));
        assertEquals(Optional.of("Arthur"), row.getOptional("name", Converters.STRING));
    }

    @Test
    void toMap_shouldKeepFirstOccurrence() {
        Map<String, Value> map = row.toMap();
        assertEquals(3, map.size());
        assertEquals(Value.of(1L), map.get("id"));
    }

    @Test
    void constructor_shouldRejectMismatchedSizes() {
        assertThrows(IllegalArgumentException.class, () -> new Row(List.of("a"), List.of()));
    }

    @Test
    void of_shouldConvertArguments() {
        Row built = Row.of(Map.of("age", 36));
        assertEquals(Integer.valueOf(36), built.get("age", Converters.INTEGER));
        assertFalse(built.isNull("age"));
    }
}
