package com.fragrance.enrichment.service.core;

import com.fragrance.enrichment.model.SourceId;
import lombok.Getter;

/**
 * Base class for failures talking to an external source.
 */
@Getter
public abstract class SourceException extends RuntimeException {

    private final SourceId source;

    protected SourceException(final SourceId source, final String message, final Throwable cause) {
        super(message, cause);
        this.source = source;
    }
}
