package com.fragrance.enrichment.regulatory;

import com.fragrance.enrichment.model.CategoryLimit;
import com.fragrance.enrichment.model.IngredientRecord;
import com.fragrance.enrichment.model.RegulatoryCategory;
import com.fragrance.enrichment.model.RegulatoryRecord;
import com.fragrance.enrichment.model.RowError;
import com.fragrance.enrichment.parser.RegulatoryFeedParser;
import com.fragrance.enrichment.store.IngredientStore;
import com.fragrance.enrichment.store.RegulatoryStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <h2>Regulatory cross-sync</h2>
 *
 * <p>Loads the standards table from a tabular feed and copies the twelve
 * category limits of a standard onto every ingredient that carries its CAS
 * number. An ingredient that receives limits is flagged as an allergen;
 * one without a matching standard keeps its unrestricted defaults.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RegulatorySyncService {

    private final RegulatoryFeedParser parser;

    private final RegulatoryStore regulatoryStore;

    private final IngredientStore ingredientStore;

    /**
     * Imports a feed file, replacing stored standards.
     *
     * @throws IOException if the file cannot be read
     */
    public ImportResult importStandards(final Path feed, final String owner) throws IOException {
        return importStandards(feed, owner, false);
    }

    /**
     * Imports a feed file.
     *
     * @param fillMissingOnly when set, an existing standard only takes values
     *                        for its blank text columns and unrestricted categories
     * @throws IOException if the file cannot be read
     */
    public ImportResult importStandards(final Path feed, final String owner, final boolean fillMissingOnly)
            throws IOException {
        try (Reader reader = Files.newBufferedReader(feed, StandardCharsets.UTF_8)) {
            return importStandards(reader, owner, fillMissingOnly);
        }
    }

    public ImportResult importStandards(final Reader feed, final String owner) throws IOException {
        return importStandards(feed, owner, false);
    }

    /**
     * Parses the feed and upserts one standard per (CAS number, owner). Bad
     * rows are skipped and reported; a store failure on one row is reported
     * against that row and the import carries on.
     */
    public ImportResult importStandards(final Reader feed, final String owner, final boolean fillMissingOnly)
            throws IOException {
        RegulatoryFeedParser.FeedParseResult parsed = parser.parse(feed, owner);

        List<RowError> errors = new ArrayList<>(parsed.errors());
        int inserted = 0;
        int updated = 0;
        int unchanged = 0;
        for (RegulatoryRecord record : parsed.records()) {
            try {
                Optional<RegulatoryRecord> existing = regulatoryStore.findByRegistry(record.getCasNumber(), owner);
                if (existing.isEmpty()) {
                    regulatoryStore.upsert(record);
                    inserted++;
                    continue;
                }
                RegulatoryRecord target = fillMissingOnly ? fillMissing(existing.get(), record) : record;
                if (sameContent(existing.get(), target)) {
                    unchanged++;
                } else {
                    regulatoryStore.upsert(target);
                    updated++;
                }
            } catch (DataAccessException ex) {
                log.warn("Could not store standard for CAS {}: {}", record.getCasNumber(), ex.getMessage());
                errors.add(new RowError(0, "store failure: " + ex.getMessage(), record.getCasNumber()));
            }
        }
        ImportResult result = new ImportResult(inserted, updated, unchanged, errors);
        log.info("Regulatory import for owner {}: {} inserted, {} updated, {} unchanged, {} skipped",
                owner, inserted, updated, unchanged, result.skipped());
        return result;
    }

    /** Keeps every stored value except blank text and unrestricted categories. */
    static RegulatoryRecord fillMissing(final RegulatoryRecord stored, final RegulatoryRecord incoming) {
        Map<RegulatoryCategory, CategoryLimit> limits = new EnumMap<>(RegulatoryCategory.class);
        for (RegulatoryCategory category : RegulatoryCategory.values()) {
            CategoryLimit current = stored.limit(category);
            limits.put(category, current.isUnrestricted() ? incoming.limit(category) : current);
        }
        return stored.toBuilder()
                .name(StringUtils.defaultIfBlank(stored.getName(), incoming.getName()))
                .amendment(StringUtils.defaultIfBlank(stored.getAmendment(), incoming.getAmendment()))
                .restrictionType(StringUtils.defaultIfBlank(stored.getRestrictionType(), incoming.getRestrictionType()))
                .riskClass(StringUtils.defaultIfBlank(stored.getRiskClass(), incoming.getRiskClass()))
                .limits(limits)
                .build();
    }

    private static boolean sameContent(final RegulatoryRecord a, final RegulatoryRecord b) {
        if (!Objects.equals(a.getName(), b.getName())
                || !Objects.equals(a.getAmendment(), b.getAmendment())
                || !Objects.equals(a.getRestrictionType(), b.getRestrictionType())
                || !Objects.equals(a.getRiskClass(), b.getRiskClass())) {
            return false;
        }
        for (RegulatoryCategory category : RegulatoryCategory.values()) {
            if (!a.limit(category).equals(b.limit(category))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Applies the standard for {@code casNumber} to an ingredient.
     *
     * @return {@code true} when a standard was found and applied
     */
    public boolean syncIngredient(final long ingredientId, final String casNumber, final String owner) {
        if (StringUtils.isBlank(casNumber)) {
            return false;
        }
        Optional<RegulatoryRecord> standard = regulatoryStore.findByRegistry(casNumber.trim(), owner);
        if (standard.isEmpty()) {
            log.debug("No regulatory standard for CAS {} (owner {})", casNumber, owner);
            return false;
        }
        RegulatoryRecord r = standard.get();
        ingredientStore.updateLimits(ingredientId, r.getLimits(), true);
        log.info("Applied regulatory limits of '{}' ({}) to ingredient #{}: cat1={}",
                r.getName(), r.getCasNumber(), ingredientId, r.limit(RegulatoryCategory.CAT1));
        return true;
    }

    /**
     * Looks the ingredient's CAS number up first.
     *
     * @throws IllegalArgumentException if the ingredient does not exist or belongs to someone else
     */
    public boolean syncIngredient(final long ingredientId, final String owner) {
        IngredientRecord ingredient = ingredientStore.findById(ingredientId)
                .filter(i -> i.getOwner().equals(owner))
                .orElseThrow(() -> new IllegalArgumentException(
                        "No ingredient #" + ingredientId + " for owner " + owner));
        return ingredient.registryNumber()
                .map(cas -> syncIngredient(ingredientId, cas, owner))
                .orElse(false);
    }

    /**
     * Runs {@link #syncIngredient(long, String, String)} over every
     * ingredient of the owner that has a CAS number.
     */
    public SyncSummary syncAll(final String owner) {
        int matched = 0;
        int skipped = 0;
        int failed = 0;
        for (IngredientRecord ingredient : ingredientStore.findWithRegistryNumber(owner)) {
            try {
                String cas = ingredient.registryNumber().orElse(null);
                if (syncIngredient(ingredient.getId(), cas, owner)) {
                    matched++;
                } else {
                    skipped++;
                }
            } catch (DataAccessException ex) {
                failed++;
                log.warn("Regulatory sync failed for ingredient #{}: {}", ingredient.getId(), ex.getMessage());
            }
        }
        log.info("Regulatory pass for owner {}: {} matched, {} skipped, {} failed", owner, matched, skipped, failed);
        return new SyncSummary(matched, skipped, failed);
    }
}
