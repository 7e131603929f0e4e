package com.fragrance.enrichment.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QueryTest {

    @Nested
    @DisplayName("Query")
    class Queries {

        @Test
        @DisplayName("Should keep the trimmed display name and a normalised key")
        void testOf() {
            Query q = Query.of("  Cis-3-Hexenol ");

            assertEquals("Cis-3-Hexenol", q.getDisplayName());
            assertEquals("cis 3 hexenol", q.getNormalized());
            assertTrue(q.casHintValue().isEmpty());
            assertEquals("cis 3 hexenol", q.cacheKey());
        }

        @Test
        @DisplayName("Should key the cache by name and hint")
        void testHint() {
            Query q = Query.of("Linalool", " CAS 78-70-6 ");

            assertEquals("78-70-6", q.getCasHint());
            assertEquals("linalool|78-70-6", q.cacheKey());
            assertEquals("78-70-6", q.withName("Linalol").getCasHint());
        }

        @Test
        @DisplayName("Should ignore a hint that holds no registry number")
        void testGarbageHint() {
            assertNull(Query.of("Linalool", "n/a").getCasHint());
        }

        @Test
        @DisplayName("Should reject blank or punctuation-only names")
        void testRejected() {
            assertThrows(IllegalArgumentException.class, () -> Query.of("   "));
            assertThrows(IllegalArgumentException.class, () -> Query.of(null));
            assertThrows(IllegalArgumentException.class, () -> Query.of("--"));
        }
    }

    @Nested
    @DisplayName("CasNumbers")
    class Cas {

        @Test
        void testValid() {
            assertTrue(CasNumbers.isValid("78-70-6"));
            assertTrue(CasNumbers.isValid(" 8000-28-0 "));
            assertFalse(CasNumbers.isValid("12-AB-3"));
            assertFalse(CasNumbers.isValid(null));
        }

        @Test
        void testExtractAll() {
            assertEquals(List.of("5392-40-5", "106-26-3"),
                    CasNumbers.extractAll("Citral 5392-40-5; neral 106-26-3"));
            assertTrue(CasNumbers.extract("no number here").isEmpty());
        }
    }
}
