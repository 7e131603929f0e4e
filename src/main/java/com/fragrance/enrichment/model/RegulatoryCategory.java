package com.fragrance.enrichment.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * The twelve standard product categories a regulatory limit applies to.
 */
public enum RegulatoryCategory {
    CAT1, CAT2, CAT3, CAT4, CAT5, CAT6, CAT7, CAT8, CAT9, CAT10, CAT11, CAT12;

    /** Store column, e.g. {@code cat1}. */
    public String column() {
        return "cat" + number();
    }

    public int number() {
        return ordinal() + 1;
    }

    /** A full map with every category unrestricted. */
    public static Map<RegulatoryCategory, CategoryLimit> unrestricted() {
        Map<RegulatoryCategory, CategoryLimit> limits = new EnumMap<>(RegulatoryCategory.class);
        for (RegulatoryCategory c : values()) {
            limits.put(c, CategoryLimit.UNRESTRICTED);
        }
        return limits;
    }

    /** Copies {@code source} over an all-unrestricted map and freezes it. */
    public static Map<RegulatoryCategory, CategoryLimit> complete(final Map<RegulatoryCategory, CategoryLimit> source) {
        Map<RegulatoryCategory, CategoryLimit> limits = unrestricted();
        if (source != null) {
            limits.putAll(source);
        }
        return Collections.unmodifiableMap(limits);
    }
}
