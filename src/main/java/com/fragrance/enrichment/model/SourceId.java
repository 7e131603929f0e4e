package com.fragrance.enrichment.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * The two external sources the pipeline knows about. The id doubles as the
 * provenance tag on every partial record and as the key of the source's
 * {@code sources.configs.<key>} section.
 */
public enum SourceId {

    /** Chemical-properties database (PubChem PUG REST). */
    CHEMICAL("pubchem", "PubChem"),

    /** Odor-profile database (The Good Scents Company). */
    ODOR_PROFILE("goodscents", "TGSC");

    private final String configKey;
    private final String label;

    SourceId(final String configKey, final String label) {
        this.configKey = configKey;
        this.label = label;
    }

    public String configKey() {
        return configKey;
    }

    /** Short name used in audit notes and API responses. */
    public String label() {
        return label;
    }

    public static Optional<SourceId> fromLabel(final String label) {
        return Arrays.stream(values())
                .filter(s -> s.label.equalsIgnoreCase(label) || s.configKey.equals(label.toLowerCase(Locale.ROOT)))
                .findFirst();
    }
}
