package com.fragrance.enrichment.model;

/**
 * Result class of one source lookup.
 */
public enum FetchStatus {
    /** The source returned a usable record. */
    FOUND,
    /** The source answered but knows nothing about the query. Cached. */
    NOT_FOUND,
    /** Network or parse failure after retries. Never cached. */
    UNAVAILABLE
}
