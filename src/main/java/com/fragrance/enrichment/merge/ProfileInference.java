package com.fragrance.enrichment.merge;

import com.fragrance.enrichment.matching.NameNormalizer;

import java.util.List;
import java.util.Optional;

/**
 * Keyword heuristics for the attributes no source reports reliably:
 * the ingredient type and, when the odor source is silent, its tenacity.
 * Used only to fill gaps; a sourced value always wins.
 */
public final class ProfileInference {

    public static final String ESSENTIAL_OIL = "EO";
    public static final String AROMA_CHEMICAL = "AC";
    public static final String SOLVENT = "Solvent";
    public static final String CARRIER = "Carrier";

    public static final String BASE_NOTE_TENACITY = "24+ hours";
    public static final String TOP_NOTE_TENACITY = "2-4 hours";
    public static final String HEART_NOTE_TENACITY = "6-12 hours";

    private static final List<String> NATURAL_EXTRACT = List.of(
            "essential oil", " eo ", "oil of", "absolute", "concrete", "resinoid");
    private static final List<String> SOLVENTS = List.of("alcohol", "ethanol", "dpg", "ipm");
    private static final List<String> CARRIERS = List.of("fractionated coconut", "jojoba", "carrier");
    private static final List<String> SYNTHETICS = List.of(
            "musk", "aldehyde", "ketone", "ester", "acetate", "ionone", "coumarin", "vanillin", "heliotropin");

    private static final List<String> BASE_NOTES = List.of(
            "musk", "amber", "sandalwood", "vetiver", "patchouli", "oud", "benzoin",
            "vanilla", "tonka", "labdanum", "cedarwood", "oak", "leather");
    private static final List<String> TOP_NOTES = List.of(
            "lemon", "bergamot", "grapefruit", "mandarin", "lime", "eucalyptus", "mint", "basil");
    private static final List<String> HEART_NOTES = List.of(
            "rose", "jasmine", "ylang", "geranium", "lavender", "iris", "violet");

    private ProfileInference() {
    }

    /**
     * Classifies by name first, then by words in the odor description.
     *
     * @return one of {@link #ESSENTIAL_OIL}, {@link #AROMA_CHEMICAL},
     *         {@link #SOLVENT}, {@link #CARRIER}; empty when nothing matches
     */
    public static Optional<String> inferType(final String name, final String odorDescription) {
        String n = padded(name);
        if (containsAny(n, NATURAL_EXTRACT)) {
            return Optional.of(ESSENTIAL_OIL);
        }
        if (containsAny(n, SOLVENTS)) {
            return Optional.of(SOLVENT);
        }
        if (containsAny(n, CARRIERS)) {
            return Optional.of(CARRIER);
        }
        if (containsAny(n, SYNTHETICS)) {
            return Optional.of(AROMA_CHEMICAL);
        }
        String profile = padded(odorDescription);
        if (containsAny(profile, List.of("synthetic", "aroma chemical"))) {
            return Optional.of(AROMA_CHEMICAL);
        }
        if (containsAny(profile, List.of("natural", "botanical"))) {
            return Optional.of(ESSENTIAL_OIL);
        }
        return Optional.empty();
    }

    /**
     * Rough longevity on skin from the note a name suggests. Base notes are
     * checked before top and heart notes.
     */
    public static Optional<String> inferTenacity(final String name) {
        String n = padded(name);
        if (containsAny(n, BASE_NOTES)) {
            return Optional.of(BASE_NOTE_TENACITY);
        }
        if (containsAny(n, TOP_NOTES)) {
            return Optional.of(TOP_NOTE_TENACITY);
        }
        if (containsAny(n, HEART_NOTES)) {
            return Optional.of(HEART_NOTE_TENACITY);
        }
        return Optional.empty();
    }

    private static String padded(final String text) {
        return " " + NameNormalizer.normalize(text) + " ";
    }

    private static boolean containsAny(final String text, final List<String> keywords) {
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
