package com.fragrance.enrichment.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fragrance.enrichment.model.CasNumbers;
import com.fragrance.enrichment.model.PartialRecord;
import com.fragrance.enrichment.model.Query;
import com.fragrance.enrichment.model.SourceId;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * <h2>PubChem PUG REST parser</h2>
 *
 * <p>Reads the two payloads the chemical adapter requests:</p>
 * <pre>
 * {"PropertyTable":{"Properties":[{"CID":6549,"MolecularFormula":"C10H18O",
 *   "MolecularWeight":"154.25","IUPACName":"3,7-dimethylocta-1,6-dien-3-ol",
 *   "Title":"Linalool"}]}}
 *
 * {"InformationList":{"Information":[{"CID":6549,"Synonym":["linalool","78-70-6",…]}]}}
 * </pre>
 *
 * <p>Missing or renamed members are treated as absent. Only a payload
 * without any compound id is treated as "nothing found".</p>
 */
@Component
@Slf4j
public class PubChemJsonParser {

    /** Synonym lists can run to hundreds of trade names; keep the head. */
    public static final int MAX_SYNONYMS = 20;

    /**
     * Parses the property table into a partial record.
     *
     * @param root  complete JSON document, may be {@code null}
     * @param query the originating query
     * @return the record, or empty when the payload holds no compound
     */
    public Optional<PartialRecord> parseProperties(final JsonNode root, final Query query) {
        if (root == null || root.has("Fault")) {
            return Optional.empty();
        }
        JsonNode props = root.path("PropertyTable").path("Properties");
        if (!props.isArray() || props.isEmpty()) {
            return Optional.empty();
        }
        JsonNode first = props.get(0);
        JsonNode cid = first.path("CID");
        if (!cid.canConvertToLong()) {
            return Optional.empty();
        }
        return Optional.of(PartialRecord.builder()
                .source(SourceId.CHEMICAL)
                .query(query)
                .compoundId(cid.asLong())
                .name(textOrNull(first, "Title"))
                .molecularFormula(textOrNull(first, "MolecularFormula"))
                .molecularWeight(textOrNull(first, "MolecularWeight"))
                .iupacName(textOrNull(first, "IUPACName"))
                .build());
    }

    /**
     * Extracts the synonym list, in the order PubChem ranks it.
     *
     * @return synonyms, possibly empty, never {@code null}
     */
    public List<String> parseSynonyms(final JsonNode root) {
        if (root == null) {
            return List.of();
        }
        JsonNode info = root.path("InformationList").path("Information");
        if (!info.isArray() || info.isEmpty()) {
            return List.of();
        }
        JsonNode synonyms = info.get(0).path("Synonym");
        if (!synonyms.isArray()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        synonyms.forEach(s -> {
            if (s.isTextual() && StringUtils.isNotBlank(s.asText())) {
                out.add(s.asText().trim());
            }
        });
        return Collections.unmodifiableList(out);
    }

    /**
     * Adds the registry number and the leading synonyms to {@code record}.
     * The registry number is the first synonym that is one.
     */
    public PartialRecord withSynonyms(final PartialRecord record, final List<String> synonyms) {
        PartialRecord.PartialRecordBuilder b = record.toBuilder();
        String cas = synonyms.stream().filter(CasNumbers::isValid).findFirst().orElse(null);
        if (cas != null) {
            b.casNumber(cas);
        }
        synonyms.stream()
                .filter(s -> !CasNumbers.isValid(s))
                .limit(MAX_SYNONYMS)
                .forEach(b::synonym);
        return b.build();
    }

    private static String textOrNull(final JsonNode n, final String field) {
        JsonNode v = n.get(field);
        if (v == null || v.isNull() || v.isContainerNode()) {
            return null;
        }
        String text = v.asText();
        return StringUtils.isBlank(text) ? null : text.trim();
    }
}
