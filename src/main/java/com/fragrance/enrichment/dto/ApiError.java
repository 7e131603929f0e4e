package com.fragrance.enrichment.dto;

/**
 * Error body returned by the REST layer.
 */
public record ApiError(boolean success, String error) {

    public static ApiError of(final String message) {
        return new ApiError(false, message);
    }
}
