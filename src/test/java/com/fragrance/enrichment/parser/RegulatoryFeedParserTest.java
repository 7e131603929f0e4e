package com.fragrance.enrichment.parser;

import com.fragrance.enrichment.model.CategoryLimit;
import com.fragrance.enrichment.model.RegulatoryCategory;
import com.fragrance.enrichment.model.RegulatoryRecord;
import com.fragrance.enrichment.model.RowError;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringReader;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RegulatoryFeedParserTest {

    private final RegulatoryFeedParser parser = new RegulatoryFeedParser();

    private RegulatoryFeedParser.FeedParseResult parse(String feed) throws IOException {
        return parser.parse(new StringReader(feed), "acme");
    }

    @Nested
    @DisplayName("Layouts")
    class Layouts {

        @Test
        @DisplayName("Should read a comma separated feed with a header")
        void testHeaderedCsv() throws IOException {
            String feed = """
                    Name,CAS,Amendment,Type,Risk,Cat1,Cat2,Cat3,Cat4,Cat5,Cat6,Cat7,Cat8,Cat9,Cat10,Cat11,Cat12
                    Lyral,31906-04-4,49,Prohibition,Sensitization,P,P,P,P,P,P,P,P,P,P,P,P
                    Citral,5392-40-5,49,Restriction,Sensitization,0.1,0.1,0.6,0.6,0.6,0.6,0.6,0.6,0.6,0.6,0.6,0.6
                    """;
            RegulatoryFeedParser.FeedParseResult result = parse(feed);

            assertTrue(result.errors().isEmpty());
            assertEquals(2, result.records().size());

            RegulatoryRecord lyral = result.records().get(0);
            assertEquals("31906-04-4", lyral.getCasNumber());
            assertEquals("acme", lyral.getOwner());
            assertEquals("Prohibition", lyral.getRestrictionType());
            assertTrue(lyral.limit(RegulatoryCategory.CAT1).prohibited());
            assertTrue(lyral.limit(RegulatoryCategory.CAT12).prohibited());

            RegulatoryRecord citral = result.records().get(1);
            assertEquals(0.1, citral.limit(RegulatoryCategory.CAT1).percent(), 1e-9);
            assertEquals(0.6, citral.limit(RegulatoryCategory.CAT4).percent(), 1e-9);
            assertEquals("Sensitization", citral.getRiskClass());
        }

        @Test
        @DisplayName("Should accept header aliases, semicolons and column reordering")
        void testAliasedSemicolonFeed() throws IOException {
            String feed = "\uFEFFCAS No.;Material Name;IFRA Cat 4;Category 1\n"
                    + "# comment line\n"
                    + "\n"
                    + "78-70-6;Linalool;1,5 %;\n";
            RegulatoryRecord r = parse(feed).records().get(0);

            assertEquals("Linalool", r.getName());
            assertEquals("78-70-6", r.getCasNumber());
            assertEquals(1.5, r.limit(RegulatoryCategory.CAT4).percent(), 1e-9);
            assertTrue(r.limit(RegulatoryCategory.CAT1).isUnrestricted());
            assertTrue(r.limit(RegulatoryCategory.CAT7).isUnrestricted());
            assertNull(r.getAmendment());
        }

        @Test
        @DisplayName("Should read a tab separated feed without a header positionally")
        void testPositionalTsv() throws IOException {
            String feed = "Coumarin\t91-64-5\t51\tRestriction\tSensitization\t0.16\t0.05\n";
            RegulatoryRecord r = parse(feed).records().get(0);

            assertEquals("Coumarin", r.getName());
            assertEquals("51", r.getAmendment());
            assertEquals(0.16, r.limit(RegulatoryCategory.CAT1).percent(), 1e-9);
            assertEquals(0.05, r.limit(RegulatoryCategory.CAT2).percent(), 1e-9);
            assertTrue(r.limit(RegulatoryCategory.CAT3).isUnrestricted());
        }

        @Test
        @DisplayName("Should read an unrecognised first line as a data row and keep going")
        void testUnrecognisedFirstLine() throws IOException {
            String feed = "Broken,not-a-cas,49,Restriction,Sensitization,1,1\n"
                    + "Lyral,31906-04-4,49,Prohibition,Sensitization,P,P\n"
                    + "Citral,5392-40-5,49,Restriction,Sensitization,0.1,0.1\n";
            RegulatoryFeedParser.FeedParseResult result = parse(feed);

            assertEquals(List.of("31906-04-4", "5392-40-5"),
                    result.records().stream().map(RegulatoryRecord::getCasNumber).toList());
            assertEquals(1, result.errors().size());
            RowError error = result.errors().get(0);
            assertEquals(1, error.line());
            assertEquals("invalid CAS number 'not-a-cas'", error.reason());
        }

        @Test
        @DisplayName("Should report every line of a feed with no usable rows")
        void testNoUsableRows() throws IOException {
            RegulatoryFeedParser.FeedParseResult result = parse("foo,bar,baz\nx,y,z\n");

            assertTrue(result.records().isEmpty());
            assertEquals(List.of(1, 2), result.errors().stream().map(RowError::line).toList());
        }

        @Test
        @DisplayName("Should honour quoted cells")
        void testQuotedCells() throws IOException {
            String feed = "Name,CAS,Cat1\n\"Oakmoss, extract \"\"evernia\"\"\",90028-68-5,0.1\n";
            RegulatoryRecord r = parse(feed).records().get(0);
            assertEquals("Oakmoss, extract \"evernia\"", r.getName());
            assertEquals(0.1, r.limit(RegulatoryCategory.CAT1).percent(), 1e-9);
        }
    }

    @Nested
    @DisplayName("Row errors")
    class RowErrors {

        @Test
        @DisplayName("Should skip bad rows and keep going")
        void testBadRows() throws IOException {
            String feed = """
                    Name,CAS,Cat1
                    ,78-70-6,1
                    Citral,not-a-cas,0.1
                    Eugenol,97-53-0,150
                    Geraniol,106-24-1,5.3
                    """;
            RegulatoryFeedParser.FeedParseResult result = parse(feed);

            assertEquals(1, result.records().size());
            assertEquals("Geraniol", result.records().get(0).getName());

            List<RowError> errors = result.errors();
            assertEquals(3, errors.size());
            assertEquals(2, errors.get(0).line());
            assertEquals("missing material name", errors.get(0).reason());
            assertTrue(errors.get(1).reason().startsWith("invalid CAS number"));
            assertTrue(errors.get(2).reason().contains("cat1 limit out of range"));
            assertEquals("Eugenol,97-53-0,150", errors.get(2).raw());
        }
    }

    @Nested
    @DisplayName("Cell values")
    class Cells {

        @Test
        @DisplayName("Blank means unrestricted")
        void testBlank() {
            assertEquals(CategoryLimit.UNRESTRICTED, RegulatoryFeedParser.parseLimit(RegulatoryCategory.CAT1, "  "));
            assertEquals(CategoryLimit.UNRESTRICTED, RegulatoryFeedParser.parseLimit(RegulatoryCategory.CAT1, null));
        }

        @Test
        @DisplayName("Non-numeric means prohibited")
        void testProhibited() {
            assertTrue(RegulatoryFeedParser.parseLimit(RegulatoryCategory.CAT1, "P").prohibited());
            assertTrue(RegulatoryFeedParser.parseLimit(RegulatoryCategory.CAT1, "Prohibited").prohibited());
        }

        @Test
        @DisplayName("Numbers may carry a percent sign or a decimal comma")
        void testNumbers() {
            assertEquals(0.02, RegulatoryFeedParser.parseLimit(RegulatoryCategory.CAT5, "0.02%").percent(), 1e-9);
            assertEquals(2.5, RegulatoryFeedParser.parseLimit(RegulatoryCategory.CAT5, "2,5").percent(), 1e-9);
            assertEquals(0.0, RegulatoryFeedParser.parseLimit(RegulatoryCategory.CAT5, "0").percent(), 1e-9);
        }

        @Test
        @DisplayName("Out of range numbers are rejected")
        void testOutOfRange() {
            assertThrows(IllegalArgumentException.class,
                    () -> RegulatoryFeedParser.parseLimit(RegulatoryCategory.CAT2, "-1"));
            assertThrows(IllegalArgumentException.class,
                    () -> RegulatoryFeedParser.parseLimit(RegulatoryCategory.CAT2, "100.5"));
        }

        @Test
        @DisplayName("Delimiter detection prefers the most frequent separator")
        void testDelimiter() {
            assertEquals('\t', RegulatoryFeedParser.detectDelimiter("a\tb\tc"));
            assertEquals(';', RegulatoryFeedParser.detectDelimiter("a;b;c,d"));
            assertEquals(',', RegulatoryFeedParser.detectDelimiter("a,b"));
        }
    }
}
