package com.fragrance.enrichment.model;

import com.fragrance.enrichment.matching.Identifiable;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Stored ingredient, unique per (name, owner).
 */
@Value
@Builder(toBuilder = true)
public class IngredientRecord implements Identifiable {

    Long id;

    @NonNull
    String name;

    @NonNull
    String owner;

    /** Enrichable attributes; a missing key is an empty column. */
    @NonNull
    Map<IngredientField, Object> fields;

    @NonNull
    Map<RegulatoryCategory, CategoryLimit> limits;

    boolean allergen;

    String notes;

    Instant createdAt;

    Instant updatedAt;

    public Object value(final IngredientField field) {
        return fields.get(field);
    }

    public String text(final IngredientField field) {
        Object v = fields.get(field);
        return v == null ? null : v.toString();
    }

    public boolean isEmpty(final IngredientField field) {
        return IngredientField.isEmptyValue(fields.get(field));
    }

    public CategoryLimit limit(final RegulatoryCategory category) {
        return limits.getOrDefault(category, CategoryLimit.UNRESTRICTED);
    }

    @Override
    public String identityName() {
        return name;
    }

    @Override
    public Optional<String> registryNumber() {
        return Optional.ofNullable(text(IngredientField.CAS_NUMBER)).filter(s -> !s.isBlank());
    }
}
