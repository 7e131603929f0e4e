package com.fragrance.enrichment.matching;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Name similarity used by the identity matcher.
 * Formula: score = 0.5 * tokenSetJaccard + 0.5 * levenshteinRatio,
 * both computed on normalised names.
 */
public class NameSimilarity {

    private static final double TOKEN_WEIGHT = 0.5;
    private static final double EDIT_WEIGHT = 0.5;

    public double score(final String a, final String b) {
        String s1 = NameNormalizer.normalize(a);
        String s2 = NameNormalizer.normalize(b);
        if (s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        return TOKEN_WEIGHT * tokenSetJaccard(s1, s2) + EDIT_WEIGHT * levenshteinRatio(s1, s2);
    }

    /**
     * |intersection| / |union| of whitespace tokens.
     */
    double tokenSetJaccard(final String s1, final String s2) {
        Set<String> t1 = tokens(s1);
        Set<String> t2 = tokens(s2);
        if (t1.isEmpty() || t2.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(t1);
        intersection.retainAll(t2);
        int union = t1.size() + t2.size() - intersection.size();
        return (double) intersection.size() / union;
    }

    /**
     * 1 - (edit_distance / max_length).
     */
    double levenshteinRatio(final String s1, final String s2) {
        int maxLength = Math.max(s1.length(), s2.length());
        if (maxLength == 0) {
            return 1.0;
        }
        return 1.0 - ((double) levenshteinDistance(s1, s2) / maxLength);
    }

    private static Set<String> tokens(final String s) {
        return Arrays.stream(s.split("\\s+"))
                .filter(t -> !t.isEmpty())
                .collect(Collectors.toSet());
    }

    /**
     * Wagner-Fischer with two rows.
     */
    private static int levenshteinDistance(final String a, final String b) {
        String shorter = a.length() <= b.length() ? a : b;
        String longer = shorter == a ? b : a;
        int m = shorter.length();

        int[] previous = new int[m + 1];
        int[] current = new int[m + 1];
        for (int i = 0; i <= m; i++) {
            previous[i] = i;
        }
        for (int j = 1; j <= longer.length(); j++) {
            current[0] = j;
            for (int i = 1; i <= m; i++) {
                int cost = shorter.charAt(i - 1) == longer.charAt(j - 1) ? 0 : 1;
                current[i] = Math.min(Math.min(current[i - 1] + 1, previous[i] + 1), previous[i - 1] + cost);
            }
            int[] tmp = previous;
            previous = current;
            current = tmp;
        }
        return previous[m];
    }
}
