package com.fragrance.enrichment.dto;

import jakarta.validation.constraints.Positive;

import java.util.List;

/**
 * Request payload for a bulk enrichment. Exactly one of {@code names},
 * {@code file} or {@code allMissing} selects the work list.
 *
 * @param names      explicit ingredient names
 * @param file       path of a text file with one name per line
 * @param allMissing enrich every stored ingredient lacking CAS, formula or odor
 * @param ownerId    owning account, defaults to the configured owner
 * @param limit      cap on names processed
 * @param overwrite  replace populated fields
 */
public record BulkEnrichRequest(
        List<String> names,
        String file,
        boolean allMissing,
        String ownerId,
        @Positive Integer limit,
        Boolean overwrite
) {}
