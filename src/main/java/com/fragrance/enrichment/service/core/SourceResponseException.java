package com.fragrance.enrichment.service.core;

import com.fragrance.enrichment.model.SourceId;

/**
 * The source answered, but with something we cannot use: a 4xx other than
 * 404, or a body that does not parse. Never retried.
 */
public class SourceResponseException extends SourceException {

    public SourceResponseException(final SourceId source, final String message) {
        super(source, message, null);
    }

    public SourceResponseException(final SourceId source, final String message, final Throwable cause) {
        super(source, message, cause);
    }
}
