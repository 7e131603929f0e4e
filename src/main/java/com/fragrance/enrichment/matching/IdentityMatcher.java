package com.fragrance.enrichment.matching;

import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Decides whether two records describe the same substance.
 *
 * <ol>
 *   <li>Both carry a registry number: equal means {@link IdentityVerdict#SAME},
 *       different means {@link IdentityVerdict#DIFFERENT}, whatever the names say.</li>
 *   <li>Otherwise the normalised names are scored; only a score strictly above
 *       {@link #IDENTITY_THRESHOLD} counts as the same substance.</li>
 *   <li>Scores in the ambiguity band are {@link IdentityVerdict#AMBIGUOUS}, which
 *       callers treat as "not the same".</li>
 * </ol>
 */
@Slf4j
public class IdentityMatcher {

    public static final double IDENTITY_THRESHOLD = 0.85;

    public static final double AMBIGUITY_FLOOR = 0.70;

    private final NameSimilarity similarity;

    public IdentityMatcher() {
        this(new NameSimilarity());
    }

    public IdentityMatcher(final NameSimilarity similarity) {
        this.similarity = similarity;
    }

    /** Raw name score, for ranking candidates against a query. */
    public double nameScore(final String a, final String b) {
        return similarity.score(a, b);
    }

    public boolean sameIdentity(final Identifiable a, final Identifiable b) {
        return compare(a, b).isSame();
    }

    public IdentityVerdict compare(final Identifiable a, final Identifiable b) {
        Optional<String> casA = a.registryNumber().map(String::trim).filter(s -> !s.isEmpty());
        Optional<String> casB = b.registryNumber().map(String::trim).filter(s -> !s.isEmpty());
        if (casA.isPresent() && casB.isPresent()) {
            return casA.get().equals(casB.get()) ? IdentityVerdict.SAME : IdentityVerdict.DIFFERENT;
        }

        double score = similarity.score(a.identityName(), b.identityName());
        IdentityVerdict verdict;
        if (score > IDENTITY_THRESHOLD) {
            verdict = IdentityVerdict.SAME;
        } else if (score > AMBIGUITY_FLOOR) {
            verdict = IdentityVerdict.AMBIGUOUS;
        } else {
            verdict = IdentityVerdict.DIFFERENT;
        }
        log.debug("Identity '{}' vs '{}': score={} verdict={}",
                a.identityName(), b.identityName(), String.format("%.3f", score), verdict);
        return verdict;
    }
}
