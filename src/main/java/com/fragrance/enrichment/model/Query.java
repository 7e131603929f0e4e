package com.fragrance.enrichment.model;

import com.fragrance.enrichment.matching.NameNormalizer;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;
import org.apache.commons.lang3.StringUtils;

import java.util.Optional;

/**
 * One lookup request: the name as the user typed it, its normalised form
 * and an optional CAS number hint. Built once per request and never changed.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Query {

    /** Trimmed input, used as the stored ingredient name. */
    String displayName;

    /** Case-folded, punctuation-collapsed form used for cache keys and matching. */
    String normalized;

    /** Optional chemical registry number supplied by the caller. */
    String casHint;

    public static Query of(final String name) {
        return of(name, null);
    }

    public static Query of(final String name, final String casHint) {
        if (StringUtils.isBlank(name)) {
            throw new IllegalArgumentException("Ingredient name must not be blank");
        }
        String display = StringUtils.normalizeSpace(name);
        String normalized = NameNormalizer.normalize(display);
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("Ingredient name has no searchable characters: " + name);
        }
        String hint = CasNumbers.extract(casHint).orElse(null);
        return new Query(display, normalized, hint);
    }

    public Optional<String> casHintValue() {
        return Optional.ofNullable(casHint);
    }

    /** Derives a query for an alternative spelling, carrying the same hint. */
    public Query withName(final String alternative) {
        return of(alternative, casHint);
    }

    /** Key under which source responses for this query are cached. */
    public String cacheKey() {
        return casHint == null ? normalized : normalized + "|" + casHint;
    }
}
