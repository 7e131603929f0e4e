package com.fragrance.enrichment.model;

import com.fragrance.enrichment.matching.Identifiable;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Union of the partial records judged to describe one substance, with every
 * field resolved by source priority.
 */
@Value
@Builder
public class MergedCandidate implements Identifiable {

    /** Name the candidate will be stored under. */
    @NonNull
    String name;

    /** Resolved field values; absent keys mean no source reported the field. */
    @Singular
    Map<IngredientField, Object> fields;

    /** Which source supplied each resolved field. */
    @Singular("fieldSource")
    Map<IngredientField, SourceId> fieldSources;

    /** Every source that contributed a record to this candidate. */
    @Singular
    Set<SourceId> provenances;

    @Singular
    List<String> synonyms;

    public Object value(final IngredientField field) {
        return fields.get(field);
    }

    public String text(final IngredientField field) {
        Object v = fields.get(field);
        return v == null ? null : v.toString();
    }

    public Map<IngredientField, Object> fieldMap() {
        return fields.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(fields));
    }

    @Override
    public String identityName() {
        return name;
    }

    @Override
    public Optional<String> registryNumber() {
        return Optional.ofNullable(text(IngredientField.CAS_NUMBER));
    }

    /** Comma-separated source labels, used in audit notes. */
    public String provenanceNote() {
        return provenances.stream()
                .sorted()
                .map(SourceId::label)
                .reduce((a, b) -> a + ", " + b)
                .orElse("");
    }
}
