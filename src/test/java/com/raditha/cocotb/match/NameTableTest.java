package com.raditha.cocotb.match;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for NameTable.
 */
class NameTableTest {

    private static NameTable<String> table(String... keysAndValues) {
        Map<String, String> entries = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            entries.put(keysAndValues[i], keysAndValues[i + 1]);
        }
        return NameTable.of(entries);
    }

    @Test
    void testExactMatchWins() {
        NameTable<String> names = table("Clock", "simple", "cocotb.clock.Clock", "exact");

        NameTable.Lookup<String> lookup = names.lookup("cocotb.clock.Clock").orElseThrow();

        assertEquals("exact", lookup.value());
        assertEquals(NameTable.MatchLevel.EXACT, lookup.level());
        assertEquals(List.of("Clock"), lookup.shadowed());
        assertTrue(lookup.isAmbiguous());
    }

    @Test
    void testLongerSuffixBeatsSimpleName() {
        NameTable<String> names = table("Clock", "simple", "clock.Clock", "suffix");

        NameTable.Lookup<String> lookup = names.lookup("cocotb.clock.Clock").orElseThrow();

        assertEquals("clock.Clock", lookup.key());
        assertEquals(NameTable.MatchLevel.SUFFIX, lookup.level());
    }

    @Test
    void testSimpleNameCoversQualifiedSpellings() {
        NameTable<String> names = table("start", "cycles");

        assertEquals(NameTable.MatchLevel.SIMPLE_NAME, names.lookup("self.clk.start").orElseThrow().level());
        assertEquals(NameTable.MatchLevel.EXACT, names.lookup("start").orElseThrow().level());
        assertEquals(Optional.empty(), names.lookup("restart"), "Suffixes only match whole segments");
        assertEquals(Optional.empty(), names.lookup("start.now"));
    }

    @Test
    void testEqualValuesAreNotAmbiguous() {
        NameTable<String> names = table("Timer", "unit", "triggers.Timer", "unit");

        NameTable.Lookup<String> lookup = names.lookup("cocotb.triggers.Timer").orElseThrow();

        assertEquals("triggers.Timer", lookup.key());
        assertFalse(lookup.isAmbiguous());
    }

    @Test
    void testExactOnlyIgnoresSuffixes() {
        NameTable<String> names = table("fork", "cocotb.start_soon");

        assertEquals(Optional.of("cocotb.start_soon"), names.exact("fork"));
        assertEquals(Optional.empty(), names.exact("self.fork"));
    }

    @Test
    void testEntriesKeepDeclarationOrder() {
        NameTable<String> names = table("b", "1", "a", "2", "c", "3");

        assertEquals(List.of("b", "a", "c"), List.copyOf(names.entries().keySet()));
        assertFalse(names.isEmpty());
        assertTrue(NameTable.empty().isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> names.entries().put("d", "4"));
    }
}
