package com.fragrance.enrichment.parser;

import com.fragrance.enrichment.model.CasNumbers;
import com.fragrance.enrichment.model.PartialRecord;
import com.fragrance.enrichment.model.Query;
import com.fragrance.enrichment.model.SourceId;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * <h2>The Good Scents Company page parser</h2>
 *
 * <p>TGSC has no API. A search result page links to a monograph under
 * {@code data/rw…html}; the monograph is a loose set of two-column tables
 * where the first cell is a label ("CAS Number:", "Odor Description:") and
 * the second its value. Labels drift over time, so they are matched by
 * substring and first occurrence wins.</p>
 */
@Component
@Slf4j
public class GoodScentsPageParser {

    private static final Pattern DETAIL_LINK = Pattern.compile("data/rw\\d+\\.html");

    private static final Pattern ODOR_FALLBACK =
            Pattern.compile("odor[:\\s]+([a-zA-Z\\s,]+?)(?:flavor|\\n|$)", Pattern.CASE_INSENSITIVE);

    private static final int MAX_SYNONYMS = 20;

    /**
     * Label fragment → setter. Order matters: "odor type" and "odor strength"
     * must be tried before the bare "odor".
     */
    private static final Map<String, BiConsumer<PartialRecord.PartialRecordBuilder, String>> LABELS;

    static {
        Map<String, BiConsumer<PartialRecord.PartialRecordBuilder, String>> m = new LinkedHashMap<>();
        m.put("cas", (b, v) -> CasNumbers.extract(v).ifPresent(b::casNumber));
        m.put("einecs", PartialRecord.PartialRecordBuilder::einecs);
        m.put("fema", PartialRecord.PartialRecordBuilder::fema);
        m.put("odor type", PartialRecord.PartialRecordBuilder::odorFamily);
        m.put("odor family", PartialRecord.PartialRecordBuilder::odorFamily);
        m.put("odor strength", (b, v) -> b.odorStrength(normalizeStrength(v)));
        m.put("flavor", (b, v) -> { });
        m.put("odor", PartialRecord.PartialRecordBuilder::odorDescription);
        m.put("formula", PartialRecord.PartialRecordBuilder::molecularFormula);
        m.put("molecular weight", PartialRecord.PartialRecordBuilder::molecularWeight);
        m.put("appearance", PartialRecord.PartialRecordBuilder::appearance);
        m.put("flash point", PartialRecord.PartialRecordBuilder::flashPoint);
        m.put("soluble", PartialRecord.PartialRecordBuilder::solubility);
        m.put("solubility", PartialRecord.PartialRecordBuilder::solubility);
        m.put("logp", PartialRecord.PartialRecordBuilder::logP);
        m.put("shelf life", PartialRecord.PartialRecordBuilder::shelfLife);
        m.put("substantivity", PartialRecord.PartialRecordBuilder::tenacity);
        m.put("tenacity", PartialRecord.PartialRecordBuilder::tenacity);
        m.put("synonyms", (b, v) -> Arrays.stream(v.split("[,;]"))
                .map(String::trim)
                .filter(StringUtils::isNotBlank)
                .limit(MAX_SYNONYMS)
                .forEach(b::synonym));
        LABELS = m;
    }

    /**
     * Finds the first monograph link on a search result page.
     *
     * @return the link as found in the page (usually relative), or empty
     */
    public Optional<String> findDetailLink(final String searchHtml) {
        if (StringUtils.isBlank(searchHtml)) {
            return Optional.empty();
        }
        Document doc = Jsoup.parse(searchHtml);
        Element link = doc.selectFirst("a[href*=data/rw]");
        if (link != null) {
            return Optional.of(link.attr("href"));
        }
        Matcher m = DETAIL_LINK.matcher(searchHtml);
        return m.find() ? Optional.of(m.group()) : Optional.empty();
    }

    /**
     * Parses a monograph page.
     *
     * @return the record, or empty when the page carries none of the fields we read
     */
    public Optional<PartialRecord> parseDetail(final String html, final Query query) {
        if (StringUtils.isBlank(html)) {
            return Optional.empty();
        }
        Document doc = Jsoup.parse(html);
        PartialRecord.PartialRecordBuilder b = PartialRecord.builder()
                .source(SourceId.ODOR_PROFILE)
                .query(query)
                .name(titleName(doc));

        Set<String> seen = new HashSet<>();
        for (Element row : doc.select("tr")) {
            Elements cells = row.children();
            if (cells.size() < 2) {
                continue;
            }
            String label = StringUtils.removeEnd(cells.get(0).text().trim(), ":").toLowerCase(Locale.ROOT);
            String value = cells.get(1).text().trim();
            if (label.isEmpty() || value.isEmpty() || label.length() > 40) {
                continue;
            }
            for (Map.Entry<String, BiConsumer<PartialRecord.PartialRecordBuilder, String>> e : LABELS.entrySet()) {
                if (label.contains(e.getKey())) {
                    if (seen.add(e.getKey())) {
                        e.getValue().accept(b, value);
                    }
                    break;
                }
            }
        }

        PartialRecord partial = b.build();
        String text = doc.text();
        if (partial.getCasNumber() == null) {
            partial = CasNumbers.extract(text).map(c -> b.casNumber(c).build()).orElse(partial);
        }
        if (partial.getOdorDescription() == null) {
            Matcher m = ODOR_FALLBACK.matcher(text);
            if (m.find() && StringUtils.isNotBlank(m.group(1))) {
                partial = b.odorDescription(m.group(1).trim()).build();
            }
        }
        if (partial.getCasNumber() == null && partial.getOdorDescription() == null
                && partial.getOdorFamily() == null) {
            log.debug("TGSC page for '{}' carried no usable fields", query.getDisplayName());
            return Optional.empty();
        }
        return Optional.of(partial);
    }

    /**
     * Maps TGSC's free-form strength wording onto Low / Medium / High / Extreme.
     */
    public static String normalizeStrength(final String raw) {
        if (StringUtils.isBlank(raw)) {
            return null;
        }
        String s = raw.toLowerCase(Locale.ROOT);
        if (s.contains("extreme") || s.contains("very high")) {
            return "Extreme";
        }
        if (s.contains("high") || s.contains("strong")) {
            return "High";
        }
        if (s.contains("low") || s.contains("weak")) {
            return "Low";
        }
        return "Medium";
    }

    /** Monograph titles read "linalool, 78-70-6"; keep the part before the comma. */
    private static String titleName(final Document doc) {
        String title = doc.title();
        if (StringUtils.isBlank(title)) {
            return null;
        }
        String head = StringUtils.substringBefore(title, ",").trim();
        return head.isEmpty() || CasNumbers.isValid(head) ? null : head;
    }
}
