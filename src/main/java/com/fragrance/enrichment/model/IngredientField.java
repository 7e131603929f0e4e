package com.fragrance.enrichment.model;

import org.apache.commons.lang3.StringUtils;

import java.util.Arrays;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * Enrichable ingredient attributes. Each constant names the store column it
 * lives in and the source that is trusted first when both sources report it.
 * Identity columns (name, owner) and regulatory columns are deliberately absent.
 */
public enum IngredientField {

    CAS_NUMBER("cas", SourceId.CHEMICAL, 32, PartialRecord::getCasNumber),
    COMPOUND_ID("cid", SourceId.CHEMICAL, 0, PartialRecord::getCompoundId),
    MOLECULAR_FORMULA("formula", SourceId.CHEMICAL, 128, PartialRecord::getMolecularFormula),
    MOLECULAR_WEIGHT("molecular_weight", SourceId.CHEMICAL, 64, PartialRecord::getMolecularWeight),
    IUPAC_NAME("chemical_name", SourceId.CHEMICAL, 1024, PartialRecord::getIupacName),

    ODOR_DESCRIPTION("odor_description", SourceId.ODOR_PROFILE, 2000, PartialRecord::getOdorDescription),
    ODOR_FAMILY("odor_family", SourceId.ODOR_PROFILE, 255, PartialRecord::getOdorFamily),
    ODOR_STRENGTH("strength", SourceId.ODOR_PROFILE, 32, PartialRecord::getOdorStrength),
    APPEARANCE("appearance", SourceId.ODOR_PROFILE, 512, PartialRecord::getAppearance),
    FLASH_POINT("flash_point", SourceId.ODOR_PROFILE, 128, PartialRecord::getFlashPoint),
    SOLUBILITY("soluble", SourceId.ODOR_PROFILE, 1024, PartialRecord::getSolubility),
    LOG_P("logp", SourceId.ODOR_PROFILE, 64, PartialRecord::getLogP),
    SHELF_LIFE("shelf_life", SourceId.ODOR_PROFILE, 255, PartialRecord::getShelfLife),
    TENACITY("tenacity", SourceId.ODOR_PROFILE, 255, PartialRecord::getTenacity),
    EINECS("einecs", SourceId.ODOR_PROFILE, 64, PartialRecord::getEinecs),
    FEMA("fema", SourceId.ODOR_PROFILE, 64, PartialRecord::getFema),

    /** No source reports it; the merge infers it from the name and odor profile. */
    INGREDIENT_TYPE("ingredient_type", SourceId.ODOR_PROFILE, 32, r -> null);

    private final String column;
    private final SourceId authority;
    private final int maxLength;
    private final Function<PartialRecord, Object> extractor;

    IngredientField(final String column,
                    final SourceId authority,
                    final int maxLength,
                    final Function<PartialRecord, Object> extractor) {
        this.column = column;
        this.authority = authority;
        this.maxLength = maxLength;
        this.extractor = extractor;
    }

    public String column() {
        return column;
    }

    /** Source consulted first for this field; the other one is the fallback. */
    public SourceId authority() {
        return authority;
    }

    /**
     * Reads this field from a partial record, treating blank text as absent.
     */
    public Object valueOf(final PartialRecord record) {
        Object v = extractor.apply(record);
        if (v instanceof String s && s.isBlank()) {
            return null;
        }
        return v;
    }

    /** Column width in characters; 0 for non-text columns. */
    public int maxLength() {
        return maxLength;
    }

    /**
     * Shortens text that would not fit the column. Other values pass through.
     */
    public Object fit(final Object value) {
        if (maxLength > 0 && value instanceof String s && s.length() > maxLength) {
            return StringUtils.abbreviate(s, maxLength);
        }
        return value;
    }

    public static Stream<IngredientField> stream() {
        return Arrays.stream(values());
    }

    /** True for {@code null}, blank strings and nothing else. */
    public static boolean isEmptyValue(final Object value) {
        return value == null || (value instanceof String s && s.isBlank());
    }
}
