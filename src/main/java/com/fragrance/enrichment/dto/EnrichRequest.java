package com.fragrance.enrichment.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Request payload for a single-ingredient enrichment.
 *
 * @param name      ingredient name as the user knows it; must not be blank
 * @param ownerId   owning account, defaults to the configured owner
 * @param overwrite replace populated fields, defaults to the configured policy
 * @param casHint   optional CAS number that pins the chemical lookup
 */
public record EnrichRequest(
        @NotBlank String name,
        String ownerId,
        Boolean overwrite,
        String casHint
) {}
