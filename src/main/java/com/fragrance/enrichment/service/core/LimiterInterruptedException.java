package com.fragrance.enrichment.service.core;

/**
 * Thrown when a thread waiting for its rate-limit slot is interrupted,
 * typically because the request that owns it timed out.
 */
public class LimiterInterruptedException extends RuntimeException {

    public LimiterInterruptedException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
