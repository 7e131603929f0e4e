package com.fragrance.enrichment.service.core;

import com.fragrance.enrichment.model.SourceId;

/**
 * Timeout, connection failure, HTTP 429 or 5xx. Worth retrying.
 */
public class TransientSourceException extends SourceException {

    public TransientSourceException(final SourceId source, final String message) {
        super(source, message, null);
    }

    public TransientSourceException(final SourceId source, final String message, final Throwable cause) {
        super(source, message, cause);
    }
}
