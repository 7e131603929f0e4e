package com.fragrance.enrichment.regulatory;

/**
 * Totals of a bulk regulatory pass.
 *
 * @param matched ingredients that received limits
 * @param skipped ingredients with no regulatory row for their CAS number
 * @param failed  ingredients whose write failed
 */
public record SyncSummary(int matched, int skipped, int failed) {
}
