package com.fragrance.enrichment.merge;

import com.fragrance.enrichment.model.IngredientField;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Result of writing a merged candidate to the store.
 */
@Value
@Builder
public class UpsertOutcome {

    long ingredientId;

    boolean created;

    /** An existing record had at least one field written. */
    boolean updated;

    /** Nothing was left to fill on an existing record. */
    boolean duplicate;

    /** CAS number the stored record carries after the write, if any. */
    String casNumber;

    @Singular
    List<IngredientField> writtenFields;

    /** Human-readable notes about values that were kept or refused. */
    @Singular
    List<String> conflicts;

    public boolean changed() {
        return created || updated;
    }
}
