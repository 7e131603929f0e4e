package com.fragrance.enrichment.dto;

import java.util.List;
import java.util.Map;

/**
 * Outcome of a bulk enrichment run.
 *
 * @param total  names processed
 * @param counts status → number of items
 * @param items  per-name results, in input order
 */
public record BulkResult(
        int total,
        Map<ItemStatus, Long> counts,
        List<EnrichResult> items
) {}
