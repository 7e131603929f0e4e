package com.fragrance.enrichment.dto;

import com.fragrance.enrichment.model.MergedCandidate;

import java.util.List;
import java.util.Map;

/**
 * Read-only preview of what the sources know about a name.
 *
 * @param name       the searched name
 * @param found      whether any source returned a record
 * @param candidate  merged best match, {@code null} when nothing was found
 * @param sources    source label → whether that source found the name
 * @param errors     source label → failure reason, for unavailable sources
 * @param ambiguous  some records were kept apart from the candidate
 * @param alternates the records kept apart, merged per identity
 */
public record SearchResult(
        String name,
        boolean found,
        MergedCandidate candidate,
        Map<String, Boolean> sources,
        Map<String, String> errors,
        boolean ambiguous,
        List<MergedCandidate> alternates
) {}
