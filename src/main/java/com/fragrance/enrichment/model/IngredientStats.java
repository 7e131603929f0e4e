package com.fragrance.enrichment.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Enrichment coverage of one owner's ingredients.
 *
 * @param owner             the owner the counts are for
 * @param total             stored ingredients
 * @param withCas           ingredients with a CAS number
 * @param withOdorProfile   ingredients with an odor description
 * @param allergens         ingredients flagged as allergens
 * @param missingEnrichment ingredients lacking a CAS number, formula or odor description
 */
public record IngredientStats(String owner,
                              int total,
                              int withCas,
                              int withOdorProfile,
                              int allergens,
                              int missingEnrichment) {

    @JsonProperty("casCoverage")
    public double casCoverage() {
        return percentOfTotal(withCas);
    }

    @JsonProperty("odorProfileCoverage")
    public double odorProfileCoverage() {
        return percentOfTotal(withOdorProfile);
    }

    /** Share of {@code count} in {@link #total()}, in percent to one decimal; 0 for an empty store. */
    private double percentOfTotal(final int count) {
        if (total == 0) {
            return 0.0;
        }
        return Math.round(count * 1000.0 / total) / 10.0;
    }
}
