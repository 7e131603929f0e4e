package com.fragrance.enrichment.regulatory;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fragrance.enrichment.model.RowError;

import java.util.List;

/**
 * Outcome of a regulatory feed import.
 *
 * @param inserted  standards that did not exist for the owner before
 * @param updated   existing standards that had at least one value changed
 * @param unchanged existing standards the feed row left as they were
 * @param errors    rejected rows and store failures, in feed order
 */
public record ImportResult(int inserted, int updated, int unchanged, List<RowError> errors) {

    public ImportResult {
        errors = List.copyOf(errors);
    }

    public static ImportResult failed(final RowError error) {
        return new ImportResult(0, 0, 0, List.of(error));
    }

    /** Rows accepted into the standards table. */
    @JsonProperty("count")
    public int count() {
        return inserted + updated + unchanged;
    }

    /** Rows that could not be imported. */
    @JsonProperty("skipped")
    public int skipped() {
        return errors.size();
    }
}
