package mwtab;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DuplicatesMapTest {

    @Test
    void get_returnsFirstValueWhileIterationKeepsAll() {
        var map = DuplicatesMap.of("CONTRIBUTORS", "Alex", "EMAIL", "a@b.org", "CONTRIBUTORS", "Sam");

        assertEquals("Alex", map.get("CONTRIBUTORS"));
        assertEquals(List.of("Alex", "Sam"), map.getAll("CONTRIBUTORS"));
        assertEquals(List.of("CONTRIBUTORS", "EMAIL"), map.keys());
        assertEquals(List.of("CONTRIBUTORS", "EMAIL", "CONTRIBUTORS"), map.allKeys());
        assertEquals(List.of("CONTRIBUTORS"), map.duplicateKeys());

        var entries = map.entries();
        assertEquals(3, entries.size());
        assertEquals(1, entries.get(2).getDuplicateIndex());
        assertEquals("Sam", entries.get(2).getValue());
    }

    @Test
    void set_replacesFirstOccurrenceOrAppends() {
        var map = DuplicatesMap.of("a", "1", "a", "2");
        map.set("a", "3");
        map.set("b", "4");

        assertEquals(List.of("3", "2"), map.getAll("a"));
        assertEquals("4", map.get("b"));
    }

    @Test
    void remove_dropsEveryOccurrence() {
        var map = DuplicatesMap.of("a", "1", "b", "2", "a", "3");
        map.remove("a");

        assertFalse(map.containsKey("a"));
        assertNull(map.get("a"));
        assertEquals(1, map.size());
    }

    @Test
    void reorder_movesListedKeysFirst() {
        var map = DuplicatesMap.of("x", "1", "Metabolite", "alanine", "y", "2");
        var reordered = map.reorder(List.of("Metabolite"));

        assertEquals(List.of("Metabolite", "x", "y"), reordered.allKeys());
    }

    @Test
    void equals_isOrderSensitive() {
        var first = DuplicatesMap.of("a", "1", "b", "2");
        var second = DuplicatesMap.of("b", "2", "a", "1");

        assertNotEquals(first, second);
        assertEquals(first, new DuplicatesMap(first));
    }

    @Test
    void of_oddArguments_throws() {
        assertThrows(IllegalArgumentException.class, () -> DuplicatesMap.of("a"));
        assertTrue(new DuplicatesMap().isEmpty());
    }
}
