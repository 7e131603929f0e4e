package com.fragrance.enrichment.dto;

import java.util.List;
import java.util.Map;

/**
 * Outcome of enriching one ingredient.
 *
 * @param name             the requested name
 * @param status           summary status
 * @param created          a new ingredient row was inserted
 * @param updated          an existing row had fields written
 * @param duplicate        the row existed and had nothing left to fill (fill-missing mode only)
 * @param ingredientId     stored id, {@code null} when nothing was stored
 * @param conflicts        values kept or refused during the write
 * @param sources          source label → found
 * @param regulatorySynced regulatory limits were applied afterwards
 * @param error            failure reason for {@link ItemStatus#FAILED}
 */
public record EnrichResult(
        String name,
        ItemStatus status,
        boolean created,
        boolean updated,
        boolean duplicate,
        Long ingredientId,
        List<String> conflicts,
        Map<String, Boolean> sources,
        boolean regulatorySynced,
        String error
) {

    public static EnrichResult failed(final String name, final Map<String, Boolean> sources, final String error) {
        return new EnrichResult(name, ItemStatus.FAILED, false, false, false, null, List.of(), sources, false, error);
    }

    public static EnrichResult notFound(final String name, final Map<String, Boolean> sources) {
        return new EnrichResult(name, ItemStatus.NOT_FOUND, false, false, false, null, List.of(), sources, false, null);
    }
}
