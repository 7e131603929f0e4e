package com.fragrance.enrichment.matching;

import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Name normalisation and search-variant generation for ingredient names.
 */
public final class NameNormalizer {

    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]+");

    private static final int MAX_VARIANTS = 5;

    /** Trade suffixes that databases usually leave off. Longest first. */
    private static final List<String> STRIPPABLE_SUFFIXES = List.of(
            " essential oil",
            " co2 extract",
            " absolute",
            " resinoid",
            " concrete",
            " oil"
    );

    /**
     * Common material → preferred search forms. The first alias is the form
     * that databases are most likely to index.
     */
    private static final Map<String, List<String>> ALIASES = new LinkedHashMap<>();

    static {
        ALIASES.put("bergamot", List.of("bergamot oil", "citrus bergamia"));
        ALIASES.put("lavender", List.of("lavender oil", "lavandula angustifolia"));
        ALIASES.put("rose", List.of("rose oil", "rosa damascena", "rose absolute"));
        ALIASES.put("jasmine", List.of("jasmine absolute", "jasminum grandiflorum"));
        ALIASES.put("sandalwood", List.of("sandalwood oil", "santalum album"));
        ALIASES.put("vanilla", List.of("vanilla absolute", "vanillin"));
        ALIASES.put("patchouli", List.of("patchouli oil", "pogostemon cablin"));
        ALIASES.put("vetiver", List.of("vetiver oil", "vetiveria zizanioides"));
        ALIASES.put("cedarwood", List.of("cedarwood oil", "cedrus atlantica"));
        ALIASES.put("lemon", List.of("lemon oil", "citrus limon"));
        ALIASES.put("orange", List.of("orange oil", "citrus sinensis"));
        ALIASES.put("ylang ylang", List.of("ylang ylang oil", "cananga odorata"));
        ALIASES.put("geranium", List.of("geranium oil", "pelargonium graveolens"));
        ALIASES.put("frankincense", List.of("frankincense oil", "boswellia sacra", "olibanum"));
        ALIASES.put("tonka", List.of("tonka bean absolute", "coumarin"));
    }

    private NameNormalizer() {
    }

    /**
     * Trims, case-folds, strips accents and collapses every run of
     * punctuation or whitespace into one space.
     *
     * @param name raw name, may be {@code null}
     * @return normalised name, never {@code null}
     */
    public static String normalize(final String name) {
        if (name == null) {
            return "";
        }
        String folded = StringUtils.stripAccents(name).toLowerCase(Locale.ROOT);
        return NON_WORD.matcher(folded).replaceAll(" ").trim();
    }

    /**
     * Alternative spellings to try when a source has nothing for the
     * name as given. The input itself always comes first.
     *
     * @param name display name
     * @return up to five distinct variants
     */
    public static List<String> searchVariants(final String name) {
        String display = StringUtils.normalizeSpace(name);
        Set<String> seen = new LinkedHashSet<>();
        List<String> variants = new ArrayList<>();
        addVariant(display, seen, variants);

        String normalized = normalize(display);
        String base = stripSuffix(normalized);

        List<String> aliases = aliasesFor(normalized);
        if (aliases.isEmpty() && !base.equals(normalized)) {
            aliases = aliasesFor(base);
        }
        aliases.forEach(a -> addVariant(a, seen, variants));

        if (!base.equals(normalized)) {
            addVariant(base, seen, variants);
        }
        return variants.size() > MAX_VARIANTS ? variants.subList(0, MAX_VARIANTS) : variants;
    }

    private static List<String> aliasesFor(final String normalized) {
        for (Map.Entry<String, List<String>> e : ALIASES.entrySet()) {
            if (e.getKey().equals(normalized) || e.getValue().contains(normalized)) {
                return e.getValue();
            }
        }
        return List.of();
    }

    private static String stripSuffix(final String normalized) {
        for (String suffix : STRIPPABLE_SUFFIXES) {
            if (normalized.endsWith(suffix) && normalized.length() > suffix.length()) {
                return normalized.substring(0, normalized.length() - suffix.length()).trim();
            }
        }
        return normalized;
    }

    private static void addVariant(final String variant, final Set<String> seen, final List<String> out) {
        if (StringUtils.isNotBlank(variant) && seen.add(normalize(variant))) {
            out.add(variant);
        }
    }
}
