package de.bsommerfeld.dbqueue.db;

import de.bsommerfeld.dbqueue.core.bind.Bindings;
import de.bsommerfeld.dbqueue.core.error.BindingException;
import de.bsommerfeld.dbqueue.core.value.Value;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ParameterSlotsTest {

    @Test
    void parse_shouldCountAnonymousPlaceholders() {
        ParameterSlots slots = ParameterSlots.parse("INSERT INTO t VALUES (?, ?, ?)");
        assertEquals(3, slots.count());
        assertEquals(Arrays.asList(null, null, null), slots.names());
    }

    @Test
    void parse_shouldShareSlotForRepeatedName() {
        ParameterSlots slots = ParameterSlots.parse("SELECT :a + :b + :a + @c + $d");
        assertEquals(List.of("a", "b", "c", "d"), slots.names());
    }

    @Test
    void parse_shouldGiveEachPrefixItsOwnSlot() {
        ParameterSlots slots = ParameterSlots.parse("SELECT :a, @a, $a, :a");
        assertEquals(3, slots.count());
        assertEquals(List.of("a", "a", "a"), slots.names());
    }

    @Test
    void resolve_shouldBindEveryPrefixFromTheSameName() {
        ParameterSlots slots = ParameterSlots.parse("SELECT :a, @a");
        List<Value> values = slots.resolve(Bindings.builder().put("a", 7).build(), "sql");
        assertEquals(List.of(Value.of(7L), Value.of(7L)), values);
    }

    @Test
    void parse_shouldHonorNumberedPlaceholders() {
        ParameterSlots slots = ParameterSlots.parse("SELECT ?3, ?");
        assertEquals(4, slots.count());
    }

    @Test
    void parse_shouldIgnorePlaceholdersInLiteralsAndComments() {
        ParameterSlots slots = ParameterSlots.parse(
                "SELECT '?', 'it''s :no', \"col?\", [x:y], `a@b` -- what?\n"
                        + "/* :skip */ FROM t WHERE a = :real");
        assertEquals(List.of("real"), slots.names());
    }

    @Test
    void parse_shouldIgnoreBarePrefixCharacters() {
        assertEquals(0, ParameterSlots.parse("SELECT 1 WHERE 'a' = 'a' AND x: = 1").count());
    }

    // -- Resolution --

    @Test
    void resolve_shouldRequireExactPositionalCount() {
        ParameterSlots slots = ParameterSlots.parse("SELECT ?, ?");
        assertThrows(BindingException.class, () -> slots.resolve(Bindings.of(1), "sql"));
        assertThrows(BindingException.class, () -> slots.resolve(Bindings.of(1, 2, 3), "sql"));
        assertEquals(List.of(Value.of(1L), Value.of(2L)), slots.resolve(Bindings.of(1, 2), "sql"));
    }

    @Test
    void resolve_shouldOrderNamedValuesBySlot() {
        ParameterSlots slots = ParameterSlots.parse("SELECT :b, :a, :b");
        List<Value> values = slots.resolve(Bindings.named(Map.of("a", 1, "b", 2, "extra", 3)), "sql");
        assertEquals(List.of(Value.of(2L), Value.of(1L)), values);
    }

    @Test
    void resolve_shouldRejectMissingName() {
        ParameterSlots slots = ParameterSlots.parse("SELECT :a, :b");
        BindingException e = assertThrows(BindingException.class,
                () -> slots.resolve(Bindings.named(Map.of("a", 1)), "SELECT :a, :b"));
        assertTrue(e.getMessage().contains(":b"));
    }

    @Test
    void resolve_shouldRejectNamedBindingsForAnonymousSlot() {
        ParameterSlots slots = ParameterSlots.parse("SELECT ?, :a");
        assertThrows(BindingException.class, () -> slots.resolve(Bindings.named(Map.of("a", 1)), "sql"));
    }
}
