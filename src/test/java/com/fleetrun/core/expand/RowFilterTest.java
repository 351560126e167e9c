package com.fleetrun.core.expand;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RowFilterTest {

    private static final Map<String, String> ADMIN = Map.of("role", "admin", "age", "42", "name", "Ann Lee");
    private static final Map<String, String> GUEST = Map.of("role", "guest", "age", "n/a", "name", "Bo");

    @Test
    @DisplayName("equality compares strings")
    void equality() {
        var filter = RowFilter.compile("role = admin");
        assertTrue(filter.test(ADMIN));
        assertFalse(filter.test(GUEST));
    }

    @Test
    @DisplayName("inequality")
    void inequality() {
        var filter = RowFilter.compile("role!=admin");
        assertFalse(filter.test(ADMIN));
        assertTrue(filter.test(GUEST));
    }

    @Test
    @DisplayName("quoted values are unquoted")
    void quotedValues() {
        assertTrue(RowFilter.compile("name = 'Ann Lee'").test(ADMIN));
        assertTrue(RowFilter.compile("name = \"Ann Lee\"").test(ADMIN));
        assertFalse(RowFilter.compile("name = 'Ann Lee\"").test(ADMIN));
    }

    @Test
    @DisplayName("ordering operators compare numerically")
    void numericComparison() {
        assertTrue(RowFilter.compile("age > 9").test(ADMIN));
        assertTrue(RowFilter.compile("age >= 42").test(ADMIN));
        assertTrue(RowFilter.compile("age <= 42.0").test(ADMIN));
        assertFalse(RowFilter.compile("age < 42").test(ADMIN));
    }

    @Test
    @DisplayName("ordering operators never match non-numeric cells")
    void nonNumericNeverMatches() {
        assertFalse(RowFilter.compile("age > 1").test(GUEST));
        assertFalse(RowFilter.compile("age < 1").test(GUEST));
        assertFalse(RowFilter.compile("role > 1").test(ADMIN));
    }

    @Test
    @DisplayName("missing column compares as empty string")
    void missingColumn() {
        assertTrue(RowFilter.compile("country = ''").test(ADMIN));
        assertFalse(RowFilter.compile("country = us").test(ADMIN));
    }

    @Test
    @DisplayName("malformed or blank expressions accept every row")
    void malformedAcceptsAll() {
        assertTrue(RowFilter.compile("role ~ admin").test(GUEST));
        assertTrue(RowFilter.compile("just words").test(GUEST));
        assertTrue(RowFilter.compile("").test(GUEST));
        assertTrue(RowFilter.compile(null).test(GUEST));
    }

    @Test
    @DisplayName("unquote leaves unbalanced quotes alone")
    void unquote() {
        assertEquals("x", RowFilter.unquote("'x'"));
        assertEquals("'x", RowFilter.unquote("'x"));
        assertEquals("", RowFilter.unquote("\"\""));
    }
}
