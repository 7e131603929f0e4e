package com.fragrance.enrichment.matching;

/**
 * Outcome of comparing two records.
 */
public enum IdentityVerdict {
    /** Same registry number, or names similar beyond the identity threshold. */
    SAME,
    /** Names close enough to be suspicious but not close enough to merge. */
    AMBIGUOUS,
    /** Different registry numbers, or unrelated names. */
    DIFFERENT;

    public boolean isSame() {
        return this == SAME;
    }
}
