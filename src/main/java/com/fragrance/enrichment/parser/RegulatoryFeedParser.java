package com.fragrance.enrichment.parser;

import com.fragrance.enrichment.model.CasNumbers;
import com.fragrance.enrichment.model.CategoryLimit;
import com.fragrance.enrichment.model.RegulatoryCategory;
import com.fragrance.enrichment.model.RegulatoryRecord;
import com.fragrance.enrichment.model.RowError;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the regulatory standards feed.
 *
 * <p>Expected layout (header optional, delimiter {@code ,} {@code ;} or tab):</p>
 * <pre>
 * Name,CAS,Amendment,Type,Risk,Cat1,Cat2,…,Cat12
 * Lyral,31906-04-4,49,Prohibition,Sensitization,P,P,P,P,P,P,P,P,P,P,P,P
 * Citral,5392-40-5,49,Restriction,Sensitization,0.1,0.1,0.6,…
 * </pre>
 *
 * <p>A blank category cell means "no data" and is read as unrestricted.
 * A non-numeric cell is a prohibition. Rows without a name or a valid CAS
 * number, and rows with a percentage outside 0–100, are reported as
 * {@link RowError}s and skipped.</p>
 */
@Component
@Slf4j
public class RegulatoryFeedParser {

    /** Parsed records and rejected rows, in feed order. */
    public record FeedParseResult(List<RegulatoryRecord> records, List<RowError> errors) {
    }

    /** Column roles other than the twelve categories. */
    enum Column { NAME, CAS, AMENDMENT, TYPE, RISK }

    private static final Pattern CATEGORY_HEADER = Pattern.compile("^(?:cat|category|ifracat|ifracategory)(\\d{1,2})$");

    private static final Map<String, Column> HEADER_ALIASES = Map.ofEntries(
            Map.entry("name", Column.NAME),
            Map.entry("materialname", Column.NAME),
            Map.entry("material", Column.NAME),
            Map.entry("substance", Column.NAME),
            Map.entry("substancename", Column.NAME),
            Map.entry("ingredient", Column.NAME),
            Map.entry("cas", Column.CAS),
            Map.entry("casnumber", Column.CAS),
            Map.entry("casno", Column.CAS),
            Map.entry("casrn", Column.CAS),
            Map.entry("amendment", Column.AMENDMENT),
            Map.entry("amendmentnumber", Column.AMENDMENT),
            Map.entry("amendmentversion", Column.AMENDMENT),
            Map.entry("type", Column.TYPE),
            Map.entry("restrictiontype", Column.TYPE),
            Map.entry("standardtype", Column.TYPE),
            Map.entry("risk", Column.RISK),
            Map.entry("riskclass", Column.RISK),
            Map.entry("riskclassification", Column.RISK),
            Map.entry("intrinsicproperty", Column.RISK));

    private static final int POSITIONAL_FIRST_CATEGORY = Column.values().length;

    /**
     * Reads the whole feed. Never throws for bad rows; only I/O problems
     * propagate. A first line that is not a recognised header is treated as
     * a data row in the fixed positional layout.
     *
     * @param reader feed contents; not closed by this method
     * @param owner  account the records will belong to
     */
    public FeedParseResult parse(final Reader reader, final String owner) throws IOException {
        BufferedReader in = reader instanceof BufferedReader br ? br : new BufferedReader(reader);
        List<RegulatoryRecord> records = new ArrayList<>();
        List<RowError> errors = new ArrayList<>();

        Layout layout = null;
        String line;
        int lineNo = 0;
        while ((line = in.readLine()) != null) {
            lineNo++;
            if (lineNo == 1) {
                line = StringUtils.removeStart(line, "\uFEFF");
            }
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#") || trimmed.startsWith("//")) {
                continue;
            }
            if (layout == null) {
                layout = Layout.detect(line);
                if (layout.hasHeader()) {
                    continue;
                }
            }
            List<String> cells = split(line, layout.delimiter());
            try {
                records.add(toRecord(cells, layout, owner));
            } catch (IllegalArgumentException ex) {
                log.warn("Skipping feed line {}: {}", lineNo, ex.getMessage());
                errors.add(new RowError(lineNo, ex.getMessage(), line));
            }
        }
        log.debug("Feed parsed: {} records, {} rejected rows", records.size(), errors.size());
        return new FeedParseResult(Collections.unmodifiableList(records), Collections.unmodifiableList(errors));
    }

    private RegulatoryRecord toRecord(final List<String> cells, final Layout layout, final String owner) {
        String name = layout.cell(cells, Column.NAME);
        if (StringUtils.isBlank(name)) {
            throw new IllegalArgumentException("missing material name");
        }
        String cas = StringUtils.trimToEmpty(layout.cell(cells, Column.CAS));
        if (!CasNumbers.isValid(cas)) {
            throw new IllegalArgumentException("invalid CAS number '" + cas + "'");
        }

        Map<RegulatoryCategory, CategoryLimit> limits = new EnumMap<>(RegulatoryCategory.class);
        for (RegulatoryCategory category : RegulatoryCategory.values()) {
            limits.put(category, parseLimit(category, layout.categoryCell(cells, category)));
        }

        return RegulatoryRecord.builder()
                .casNumber(cas)
                .owner(owner)
                .name(name.trim())
                .amendment(StringUtils.trimToNull(layout.cell(cells, Column.AMENDMENT)))
                .restrictionType(StringUtils.trimToNull(layout.cell(cells, Column.TYPE)))
                .riskClass(StringUtils.trimToNull(layout.cell(cells, Column.RISK)))
                .limits(RegulatoryCategory.complete(limits))
                .build();
    }

    /**
     * Reads one category cell: blank is unrestricted, a number (optionally
     * with {@code %}) is a limit, anything else is a prohibition.
     */
    static CategoryLimit parseLimit(final RegulatoryCategory category, final String raw) {
        String cell = StringUtils.trimToEmpty(raw);
        if (cell.isEmpty()) {
            return CategoryLimit.UNRESTRICTED;
        }
        String numeric = StringUtils.removeEnd(cell, "%").trim().replace(',', '.');
        double value;
        try {
            value = Double.parseDouble(numeric);
        } catch (NumberFormatException notANumber) {
            return CategoryLimit.prohibitedLimit();
        }
        if (Double.isNaN(value) || value < 0.0 || value > CategoryLimit.UNRESTRICTED_PERCENT) {
            throw new IllegalArgumentException(category.column() + " limit out of range: " + cell);
        }
        return CategoryLimit.of(value);
    }

    /**
     * Splits one line on {@code delimiter}, honouring double-quoted cells and
     * doubled quotes inside them.
     */
    static List<String> split(final String line, final char delimiter) {
        List<String> cells = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quoted) {
                if (c == '"' && i + 1 < line.length() && line.charAt(i + 1) == '"') {
                    current.append('"');
                    i++;
                } else if (c == '"') {
                    quoted = false;
                } else {
                    current.append(c);
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == delimiter) {
                cells.add(current.toString().trim());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        cells.add(current.toString().trim());
        return cells;
    }

    static char detectDelimiter(final String line) {
        int tabs = StringUtils.countMatches(line, '\t');
        int semis = StringUtils.countMatches(line, ';');
        int commas = StringUtils.countMatches(line, ',');
        if (tabs > 0 && tabs >= semis && tabs >= commas) {
            return '\t';
        }
        return semis > commas ? ';' : ',';
    }

    /**
     * Column positions resolved from the header, or the fixed positional
     * layout when the feed starts straight with data.
     */
    record Layout(char delimiter, boolean hasHeader, Map<Column, Integer> columns,
                  Map<RegulatoryCategory, Integer> categories) {

        static Layout detect(final String firstLine) {
            char delimiter = detectDelimiter(firstLine);
            List<String> cells = split(firstLine, delimiter);

            Map<Column, Integer> columns = new EnumMap<>(Column.class);
            Map<RegulatoryCategory, Integer> categories = new EnumMap<>(RegulatoryCategory.class);
            for (int i = 0; i < cells.size(); i++) {
                String key = cells.get(i).toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
                Column column = HEADER_ALIASES.get(key);
                if (column != null) {
                    columns.putIfAbsent(column, i);
                    continue;
                }
                Matcher m = CATEGORY_HEADER.matcher(key);
                if (m.matches()) {
                    int n = Integer.parseInt(m.group(1));
                    if (n >= 1 && n <= RegulatoryCategory.values().length) {
                        categories.putIfAbsent(RegulatoryCategory.values()[n - 1], i);
                    }
                }
            }

            if (columns.containsKey(Column.NAME) && columns.containsKey(Column.CAS)) {
                return new Layout(delimiter, true, columns, categories);
            }
            // Anything else is read as data; a bad first row is rejected like any other row.
            return positional(delimiter);
        }

        static Layout positional(final char delimiter) {
            Map<Column, Integer> columns = new EnumMap<>(Column.class);
            for (Column c : Column.values()) {
                columns.put(c, c.ordinal());
            }
            Map<RegulatoryCategory, Integer> categories = new EnumMap<>(RegulatoryCategory.class);
            for (RegulatoryCategory c : RegulatoryCategory.values()) {
                categories.put(c, POSITIONAL_FIRST_CATEGORY + c.ordinal());
            }
            return new Layout(delimiter, false, columns, categories);
        }

        String cell(final List<String> cells, final Column column) {
            return at(cells, columns.get(column));
        }

        String categoryCell(final List<String> cells, final RegulatoryCategory category) {
            return at(cells, categories.get(category));
        }

        private static String at(final List<String> cells, final Integer index) {
            return index == null || index >= cells.size() ? null : cells.get(index);
        }
    }
}
