package com.fragrance.enrichment.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Chemical registry (CAS-style) number helpers.
 */
public final class CasNumbers {

    /** Registry number as it appears inside free text. */
    public static final Pattern CAS_PATTERN = Pattern.compile("\\b(\\d{2,7}-\\d{2}-\\d)\\b");

    private static final Pattern CAS_EXACT = Pattern.compile("\\d{2,7}-\\d{2}-\\d");

    private CasNumbers() {
    }

    public static boolean isValid(final String candidate) {
        return candidate != null && CAS_EXACT.matcher(candidate.trim()).matches();
    }

    /**
     * First registry number found anywhere in {@code text}.
     *
     * @param text raw page text or cell value, may be {@code null}
     * @return the number, or empty when none is present
     */
    public static Optional<String> extract(final String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        Matcher m = CAS_PATTERN.matcher(text);
        return m.find() ? Optional.of(m.group(1)) : Optional.empty();
    }

    public static List<String> extractAll(final String text) {
        List<String> out = new ArrayList<>();
        if (text == null) {
            return out;
        }
        Matcher m = CAS_PATTERN.matcher(text);
        while (m.find()) {
            out.add(m.group(1));
        }
        return out;
    }
}
