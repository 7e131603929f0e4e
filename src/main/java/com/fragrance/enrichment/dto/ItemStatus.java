package com.fragrance.enrichment.dto;

/**
 * Per-ingredient result of an enrich call.
 */
public enum ItemStatus {
    CREATED,
    UPDATED,
    /** Record exists and nothing was written. */
    UNCHANGED,
    /** No source knew the name. */
    NOT_FOUND,
    FAILED
}
