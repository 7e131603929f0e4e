package com.fragrance.enrichment.matching;

import java.util.Optional;

/**
 * Anything the identity matcher can compare: partial records, merged
 * candidates and stored ingredients.
 */
public interface Identifiable {

    /** The name to compare, before normalisation. */
    String identityName();

    /** Chemical registry number, when known. */
    Optional<String> registryNumber();
}
