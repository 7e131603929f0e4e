package com.fragrance.enrichment.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CategoryLimitTest {

    @Test
    @DisplayName("Should map a prohibition to the sentinel column value and back")
    void testProhibitedColumn() {
        assertEquals(-1.0, CategoryLimit.prohibitedLimit().toColumnValue());
        assertTrue(CategoryLimit.fromColumnValue(-1.0).prohibited());
        assertEquals("P", CategoryLimit.prohibitedLimit().toString());
    }

    @Test
    @DisplayName("Should treat 100% as unrestricted")
    void testUnrestricted() {
        assertSame(CategoryLimit.UNRESTRICTED, CategoryLimit.of(100.0));
        assertTrue(CategoryLimit.fromColumnValue(100.0).isUnrestricted());
        assertFalse(CategoryLimit.of(0.2).isUnrestricted());
        assertEquals(0.2, CategoryLimit.fromColumnValue(0.2).percent());
    }

    @Test
    @DisplayName("Should reject percentages outside 0-100")
    void testRange() {
        assertThrows(IllegalArgumentException.class, () -> CategoryLimit.of(100.5));
        assertThrows(IllegalArgumentException.class, () -> new CategoryLimit(-0.1, false));
        assertDoesNotThrow(() -> CategoryLimit.of(0.0));
    }
}
