package com.fragrance.enrichment.store;

import com.fragrance.enrichment.model.CategoryLimit;
import com.fragrance.enrichment.model.IngredientField;
import com.fragrance.enrichment.model.IngredientRecord;
import com.fragrance.enrichment.model.IngredientStats;
import com.fragrance.enrichment.model.RegulatoryCategory;
import org.apache.commons.lang3.StringUtils;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Persistent ingredient store. Names are unique per owner, compared
 * case-insensitively after whitespace normalisation.
 */
public interface IngredientStore {

    Optional<IngredientRecord> findByNameOwner(String name, String owner);

    Optional<IngredientRecord> findById(long id);

    /** Every ingredient of {@code owner} that has a CAS number, in id order. */
    List<IngredientRecord> findWithRegistryNumber(String owner);

    /**
     * Names of ingredients lacking a CAS number, a formula or an odor
     * description, oldest first.
     */
    List<String> findNamesMissingEnrichment(String owner, int limit);

    /** Coverage counts over every ingredient of {@code owner}. */
    IngredientStats statistics(String owner);

    /**
     * Inserts a new ingredient.
     *
     * @return the generated id
     * @throws org.springframework.dao.DuplicateKeyException if (name, owner) exists
     */
    long insert(IngredientRecord record);

    /** Writes the given columns; keys absent from {@code fields} are left alone. */
    void updateFields(long id, Map<IngredientField, Object> fields);

    void updateLimits(long id, Map<RegulatoryCategory, CategoryLimit> limits, boolean allergen);

    /**
     * Adds synonyms not yet recorded for the ingredient.
     *
     * @return how many were new
     */
    int addSynonyms(long id, Collection<String> synonyms, String source);

    List<String> findSynonyms(long id);

    static String nameKey(final String name) {
        return StringUtils.normalizeSpace(name).toLowerCase(Locale.ROOT);
    }
}
