package com.fragrance.enrichment.matching;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NameNormalizerTest {

    @Nested
    @DisplayName("normalize")
    class Normalize {

        @Test
        @DisplayName("Should fold case, accents and punctuation")
        void testFolding() {
            assertEquals("neroli oil", NameNormalizer.normalize("  Néroli   Oil "));
            assertEquals("cis 3 hexenol", NameNormalizer.normalize("cis-3-Hexenol"));
            assertEquals("alpha ionone", NameNormalizer.normalize("(alpha)-Ionone"));
        }

        @Test
        @DisplayName("Should return empty string for null or punctuation-only input")
        void testEmpty() {
            assertEquals("", NameNormalizer.normalize(null));
            assertEquals("", NameNormalizer.normalize(" -- "));
        }
    }

    @Nested
    @DisplayName("searchVariants")
    class SearchVariants {

        @Test
        @DisplayName("Should put the input first and add alias forms")
        void testAliases() {
            List<String> variants = NameNormalizer.searchVariants("Lavender");
            assertEquals("Lavender", variants.get(0));
            assertTrue(variants.contains("lavender oil"));
            assertTrue(variants.contains("lavandula angustifolia"));
        }

        @Test
        @DisplayName("Should strip trade suffixes")
        void testSuffixStripping() {
            List<String> variants = NameNormalizer.searchVariants("Benzoin Resinoid");
            assertEquals(List.of("Benzoin Resinoid", "benzoin"), variants);
        }

        @Test
        @DisplayName("Should resolve aliases through the stripped base name")
        void testAliasAfterStripping() {
            List<String> variants = NameNormalizer.searchVariants("Patchouli essential oil");
            assertEquals("Patchouli essential oil", variants.get(0));
            assertTrue(variants.contains("patchouli oil"));
            assertTrue(variants.contains("patchouli"));
        }

        @Test
        @DisplayName("Should never return more than five variants or duplicates")
        void testBounded() {
            List<String> variants = NameNormalizer.searchVariants("rose");
            assertTrue(variants.size() <= 5);
            assertEquals(variants.size(), variants.stream().map(NameNormalizer::normalize).distinct().count());
        }

        @Test
        @DisplayName("Should return only the input for an unknown name")
        void testPlainName() {
            assertEquals(List.of("Linalool"), NameNormalizer.searchVariants("Linalool"));
        }
    }
}
