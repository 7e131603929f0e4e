package com.fragrance.enrichment.merge;

import com.fragrance.enrichment.model.MergedCandidate;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Output of {@link MergeEngine#merge}: the candidate that best matches the
 * query, and any groups the identity matcher refused to fold into it.
 */
@Value
@Builder
public class MergeResult {

    /** Best-matching candidate, {@code null} when there were no records. */
    MergedCandidate primary;

    /** Candidates that were kept apart from the primary one. */
    @Singular
    List<MergedCandidate> alternates;

    /** Whether some records were declined for identity reasons. */
    boolean ambiguous;

    public Optional<MergedCandidate> primaryCandidate() {
        return Optional.ofNullable(primary);
    }

    public static MergeResult empty() {
        return MergeResult.builder().build();
    }
}
