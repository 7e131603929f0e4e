package com.fragrance.enrichment.service.core;

import com.fragrance.enrichment.model.FetchOutcome;
import com.fragrance.enrichment.model.Query;
import com.fragrance.enrichment.model.SourceId;

/**
 * Defines a contract for looking an ingredient up in one external source.
 * <p>
 * Implementations encapsulate the request building, pacing, retrying and
 * parsing needed for a specific source, and return whatever the source knew
 * as a partial record.
 * </p>
 */
public interface SourceAdapter {

    /**
     * @return the source this adapter talks to
     */
    SourceId source();

    /**
     * Looks up one query.
     *
     * @param query the normalised lookup request; never {@code null}
     * @return a found, not-found or unavailable outcome. Never {@code null},
     *     never throws for source-side failures.
     */
    FetchOutcome fetch(Query query);
}
