package com.fragrance.enrichment.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;

import java.util.Optional;

/**
 * What a source adapter hands back for one query. Adapters never throw; any
 * failure is folded into an {@link FetchStatus#UNAVAILABLE} outcome.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class FetchOutcome {

    @NonNull
    SourceId source;

    @NonNull
    FetchStatus status;

    PartialRecord record;

    /** Failure reason for unavailable outcomes. */
    String detail;

    /** Whether the outcome was served by the response cache. */
    boolean cached;

    public static FetchOutcome found(final PartialRecord record) {
        return new FetchOutcome(record.getSource(), FetchStatus.FOUND, record, null, false);
    }

    public static FetchOutcome notFound(final SourceId source) {
        return new FetchOutcome(source, FetchStatus.NOT_FOUND, null, null, false);
    }

    public static FetchOutcome unavailable(final SourceId source, final String detail) {
        return new FetchOutcome(source, FetchStatus.UNAVAILABLE, null, detail, false);
    }

    public FetchOutcome asCached() {
        return new FetchOutcome(source, status, record, detail, true);
    }

    public Optional<PartialRecord> partialRecord() {
        return Optional.ofNullable(record);
    }

    public boolean isFound() {
        return status == FetchStatus.FOUND;
    }
}
