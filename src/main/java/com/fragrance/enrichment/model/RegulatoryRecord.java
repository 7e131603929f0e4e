package com.fragrance.enrichment.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.Map;

/**
 * One row of the regulatory standards table, unique per (CAS number, owner).
 */
@Value
@Builder(toBuilder = true)
public class RegulatoryRecord {

    Long id;

    @NonNull
    String casNumber;

    @NonNull
    String owner;

    String name;

    String amendment;

    /** Prohibition, Restriction, Specification. */
    String restrictionType;

    /** Sensitisation, phototoxicity, … */
    String riskClass;

    @NonNull
    Map<RegulatoryCategory, CategoryLimit> limits;

    public CategoryLimit limit(final RegulatoryCategory category) {
        return limits.getOrDefault(category, CategoryLimit.UNRESTRICTED);
    }
}
