package com.fragrance.enrichment.model;

/**
 * A feed row that could not be imported.
 *
 * @param line   1-based physical line number in the feed
 * @param reason why the row was rejected
 * @param raw    the row as read
 */
public record RowError(int line, String reason, String raw) {
}
