package com.fragrance.enrichment.service;

import java.util.EnumSet;
import java.util.Set;

/**
 * States of one search or enrich request.
 *
 * <pre>
 * START → CACHE_LOOKUP → USE_CACHE | FETCH_ALL_SOURCES → MERGED
 *       → RETURN_PREVIEW                                  (search)
 *       → UPSERT → [CROSS_SYNC] → DONE                    (enrich)
 * </pre>
 * Any non-terminal state may move to {@link #FAILED}.
 */
public enum PipelineState {
    START,
    CACHE_LOOKUP,
    USE_CACHE,
    FETCH_ALL_SOURCES,
    MERGED,
    RETURN_PREVIEW,
    UPSERT,
    CROSS_SYNC,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == RETURN_PREVIEW || this == DONE || this == FAILED;
    }

    /** Legal successors, {@link #FAILED} excluded. */
    Set<PipelineState> successors() {
        return switch (this) {
            case START -> EnumSet.of(CACHE_LOOKUP);
            case CACHE_LOOKUP -> EnumSet.of(USE_CACHE, FETCH_ALL_SOURCES);
            case USE_CACHE, FETCH_ALL_SOURCES -> EnumSet.of(MERGED);
            case MERGED -> EnumSet.of(RETURN_PREVIEW, UPSERT, DONE);
            case UPSERT -> EnumSet.of(CROSS_SYNC, DONE);
            case CROSS_SYNC -> EnumSet.of(DONE);
            default -> EnumSet.noneOf(PipelineState.class);
        };
    }

    public boolean canMoveTo(final PipelineState next) {
        if (isTerminal()) {
            return false;
        }
        return next == FAILED || successors().contains(next);
    }
}
