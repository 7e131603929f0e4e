package com.fragrance.enrichment.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Request payload for a regulatory feed import.
 *
 * @param feedPath        path of the feed on the server; must not be blank
 * @param ownerId         owning account, defaults to the configured owner
 * @param fillMissingOnly keep stored values and only fill blanks and unrestricted categories
 */
public record ImportStandardsRequest(
        @NotBlank String feedPath,
        String ownerId,
        Boolean fillMissingOnly
) {}
