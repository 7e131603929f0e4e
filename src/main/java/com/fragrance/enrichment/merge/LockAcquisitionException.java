package com.fragrance.enrichment.merge;

/**
 * Runtime exception thrown when an ingredient lock cannot be acquired
 * within the configured timeout.
 */
public class LockAcquisitionException extends RuntimeException {

    public LockAcquisitionException(final String message) {
        super(message);
    }

    public LockAcquisitionException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
