package com.fragrance.enrichment.model;

/**
 * Maximum usage percentage of a substance in one product category.
 *
 * @param percent    permitted concentration, 0–100; meaningless when prohibited
 * @param prohibited whether the substance may not be used in the category at all
 */
public record CategoryLimit(double percent, boolean prohibited) {

    /** Column value that stands for a prohibition. */
    public static final double PROHIBITED_COLUMN_VALUE = -1.0;

    public static final double UNRESTRICTED_PERCENT = 100.0;

    public static final CategoryLimit UNRESTRICTED = new CategoryLimit(UNRESTRICTED_PERCENT, false);

    private static final CategoryLimit PROHIBITED = new CategoryLimit(0.0, true);

    public CategoryLimit {
        if (!prohibited && (percent < 0.0 || percent > UNRESTRICTED_PERCENT)) {
            throw new IllegalArgumentException("Category limit out of range: " + percent);
        }
    }

    public static CategoryLimit of(final double percent) {
        return percent == UNRESTRICTED_PERCENT ? UNRESTRICTED : new CategoryLimit(percent, false);
    }

    public static CategoryLimit prohibitedLimit() {
        return PROHIBITED;
    }

    public boolean isUnrestricted() {
        return !prohibited && percent == UNRESTRICTED_PERCENT;
    }

    public double toColumnValue() {
        return prohibited ? PROHIBITED_COLUMN_VALUE : percent;
    }

    public static CategoryLimit fromColumnValue(final double value) {
        return value < 0 ? PROHIBITED : of(value);
    }

    @Override
    public String toString() {
        return prohibited ? "P" : Double.toString(percent);
    }
}
