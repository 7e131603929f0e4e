package com.fragrance.enrichment.parser;

import com.fragrance.enrichment.model.PartialRecord;
import com.fragrance.enrichment.model.Query;
import com.fragrance.enrichment.model.SourceId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GoodScentsPageParserTest {

    private final GoodScentsPageParser parser = new GoodScentsPageParser();
    private final Query query = Query.of("Linalool");

    private static final String DETAIL = """
            <html><head><title>linalool, 78-70-6</title></head><body>
            <table>
              <tr><td>CAS Number:</td><td>78-70-6</td></tr>
              <tr><td>EINECS/ELINCS:</td><td>201-134-4</td></tr>
              <tr><td>FEMA Number:</td><td>2635 linalool</td></tr>
              <tr><td>Odor Type:</td><td>floral</td></tr>
              <tr><td>Odor Strength:</td><td>medium , recommend smelling in a 10.00 % solution or less</td></tr>
              <tr><td>Odor Description:</td><td>citrus orange floral terpy waxy rose</td></tr>
              <tr><td>Flavor Type:</td><td>citrus</td></tr>
              <tr><td>Appearance:</td><td>colorless clear liquid (est)</td></tr>
              <tr><td>Flash Point:</td><td>174.00 °F. TCC ( 78.89 °C. )</td></tr>
              <tr><td>Soluble in:</td><td>alcohol, water</td></tr>
              <tr><td>logP (o/w):</td><td>2.970</td></tr>
              <tr><td>Substantivity:</td><td>12 hour(s) at 100.00 %</td></tr>
              <tr><td>Synonyms:</td><td>linalol; beta-linalool, licareol</td></tr>
              <tr><td>Odor:</td><td>should not override the description</td></tr>
            </table></body></html>
            """;

    @Nested
    @DisplayName("Search results")
    class SearchResults {

        @Test
        @DisplayName("Should pick the first monograph link")
        void testFindLink() {
            String html = "<html><body><a href=\"/about.html\">about</a>"
                    + "<a href=\"data/rw1005711.html\">linalool</a>"
                    + "<a href=\"data/rw1017021.html\">linalyl acetate</a></body></html>";
            assertEquals("data/rw1005711.html", parser.findDetailLink(html).orElseThrow());
        }

        @Test
        @DisplayName("Should fall back to the raw link pattern")
        void testLinkInScript() {
            String html = "<script>location='/data/rw1005711.html'</script>";
            assertEquals("data/rw1005711.html", parser.findDetailLink(html).orElseThrow());
        }

        @Test
        @DisplayName("Should report no link on an empty result page")
        void testNoLink() {
            assertTrue(parser.findDetailLink("<html><body>No results</body></html>").isEmpty());
            assertTrue(parser.findDetailLink("").isEmpty());
        }
    }

    @Nested
    @DisplayName("Monograph")
    class Monograph {

        @Test
        @DisplayName("Should read every labelled field")
        void testParseDetail() {
            PartialRecord r = parser.parseDetail(DETAIL, query).orElseThrow();

            assertEquals(SourceId.ODOR_PROFILE, r.getSource());
            assertEquals("linalool", r.getName());
            assertEquals("78-70-6", r.getCasNumber());
            assertEquals("201-134-4", r.getEinecs());
            assertEquals("2635 linalool", r.getFema());
            assertEquals("floral", r.getOdorFamily());
            assertEquals("Medium", r.getOdorStrength());
            assertEquals("citrus orange floral terpy waxy rose", r.getOdorDescription());
            assertEquals("colorless clear liquid (est)", r.getAppearance());
            assertEquals("alcohol, water", r.getSolubility());
            assertEquals("2.970", r.getLogP());
            assertEquals("12 hour(s) at 100.00 %", r.getTenacity());
            assertEquals(List.of("linalol", "beta-linalool", "licareol"), r.getSynonyms());
        }

        @Test
        @DisplayName("Should find the registry number in free text when no row carries it")
        void testCasFromText() {
            String html = "<html><body><p>Registry 78-70-6</p><table>"
                    + "<tr><td>Odor Type:</td><td>floral</td></tr></table></body></html>";
            PartialRecord r = parser.parseDetail(html, query).orElseThrow();
            assertEquals("78-70-6", r.getCasNumber());
            assertEquals("floral", r.getOdorFamily());
        }

        @Test
        @DisplayName("Should return empty for a page without usable fields")
        void testNothingUseful() {
            String html = "<html><head><title>Search</title></head><body><table>"
                    + "<tr><td>Appearance:</td><td>liquid</td></tr></table></body></html>";
            assertTrue(parser.parseDetail(html, query).isEmpty());
            assertTrue(parser.parseDetail("  ", query).isEmpty());
        }
    }

    @Test
    @DisplayName("Should map strength wording onto four levels")
    void testNormalizeStrength() {
        assertEquals("Extreme", GoodScentsPageParser.normalizeStrength("Very High"));
        assertEquals("High", GoodScentsPageParser.normalizeStrength("strong"));
        assertEquals("Low", GoodScentsPageParser.normalizeStrength("weak, recommend smelling"));
        assertEquals("Medium", GoodScentsPageParser.normalizeStrength("medium"));
        assertNull(GoodScentsPageParser.normalizeStrength(" "));
    }
}
