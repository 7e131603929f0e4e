package com.fragrance.enrichment.merge;

import com.fragrance.enrichment.matching.IdentityMatcher;
import com.fragrance.enrichment.matching.IdentityVerdict;
import com.fragrance.enrichment.model.IngredientField;
import com.fragrance.enrichment.model.IngredientRecord;
import com.fragrance.enrichment.model.MergedCandidate;
import com.fragrance.enrichment.model.PartialRecord;
import com.fragrance.enrichment.model.Query;
import com.fragrance.enrichment.model.RegulatoryCategory;
import com.fragrance.enrichment.store.IngredientStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <h2>Merge engine</h2>
 *
 * <p>{@link #merge(Query, List)} groups partial records by identity
 * (transitively) and resolves each group into a {@link MergedCandidate},
 * taking every field from its authoritative source first and from the
 * other source when the authority has nothing. Type and tenacity fall
 * back to {@link ProfileInference} when no source reports them; inferred
 * values carry no field source.</p>
 *
 * <p>{@link #upsert(MergedCandidate, String, boolean)} writes a candidate to
 * the store under a per-(name, owner) lock. Without {@code overwrite} only
 * empty stored fields are filled; with it, candidate values replace stored
 * ones. Name and owner are never rewritten, and a stored CAS number that
 * disagrees with the candidate's blocks the write altogether.</p>
 */
@Slf4j
public class MergeEngine {

    public static final int MAX_SYNONYMS = 20;

    private final IdentityMatcher matcher;

    private final IngredientStore store;

    private final KeyedLock lock;

    private final TransactionTemplate tx;

    public MergeEngine(final IdentityMatcher matcher,
                       final IngredientStore store,
                       final KeyedLock lock,
                       final TransactionTemplate tx) {
        this.matcher = matcher;
        this.store = store;
        this.lock = lock;
        this.tx = tx;
    }

    /**
     * Merges records that all answer the same query; the candidate takes the
     * first record's query name.
     */
    public MergeResult merge(final List<PartialRecord> records) {
        if (records.isEmpty()) {
            return MergeResult.empty();
        }
        return merge(records.get(0).getQuery(), records);
    }

    public MergeResult merge(final Query query, final List<PartialRecord> records) {
        if (records.isEmpty()) {
            return MergeResult.empty();
        }

        List<List<PartialRecord>> groups = group(records);
        groups.sort(Comparator.comparingDouble((List<PartialRecord> g) -> relevance(query, g)).reversed());

        MergeResult.MergeResultBuilder result = MergeResult.builder()
                .primary(resolve(query.getDisplayName(), groups.get(0)))
                .ambiguous(groups.size() > 1);
        for (int i = 1; i < groups.size(); i++) {
            List<PartialRecord> g = groups.get(i);
            result.alternate(resolve(g.get(0).identityName(), g));
        }
        if (groups.size() > 1) {
            log.warn("Ambiguous identity for '{}': {} groups kept apart", query.getDisplayName(), groups.size());
        }
        return result.build();
    }

    /**
     * Union-find over pairwise verdicts. A union that would put two
     * different CAS numbers in one group is refused, so transitivity cannot
     * smuggle in a merge the direct comparison would reject.
     */
    List<List<PartialRecord>> group(final List<PartialRecord> records) {
        int n = records.size();
        int[] parent = new int[n];
        String[] groupCas = new String[n];
        for (int i = 0; i < n; i++) {
            parent[i] = i;
            groupCas[i] = records.get(i).registryNumber().orElse(null);
        }

        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                int ri = find(parent, i);
                int rj = find(parent, j);
                if (ri == rj) {
                    continue;
                }
                IdentityVerdict verdict = matcher.compare(records.get(i), records.get(j));
                if (!verdict.isSame()) {
                    continue;
                }
                if (groupCas[ri] != null && groupCas[rj] != null && !groupCas[ri].equals(groupCas[rj])) {
                    log.debug("Refusing transitive merge of CAS {} and {}", groupCas[ri], groupCas[rj]);
                    continue;
                }
                parent[rj] = ri;
                if (groupCas[ri] == null) {
                    groupCas[ri] = groupCas[rj];
                }
            }
        }

        Map<Integer, List<PartialRecord>> byRoot = new LinkedHashMap<>();
        for (int i = 0; i < n; i++) {
            byRoot.computeIfAbsent(find(parent, i), k -> new ArrayList<>()).add(records.get(i));
        }
        return new ArrayList<>(byRoot.values());
    }

    private static int find(final int[] parent, final int i) {
        int root = i;
        while (parent[root] != root) {
            root = parent[root];
        }
        parent[i] = root;
        return root;
    }

    /** Hint match first, then name closeness, then group size. */
    private double relevance(final Query query, final List<PartialRecord> group) {
        boolean hintMatch = query.casHintValue()
                .map(hint -> group.stream().anyMatch(r -> r.registryNumber().filter(hint::equals).isPresent()))
                .orElse(false);
        double bestName = group.stream()
                .mapToDouble(r -> matcher.nameScore(query.getDisplayName(), r.identityName()))
                .max()
                .orElse(0.0);
        return (hintMatch ? 10.0 : 0.0) + bestName + group.size() * 0.01;
    }

    MergedCandidate resolve(final String name, final List<PartialRecord> group) {
        MergedCandidate.MergedCandidateBuilder b = MergedCandidate.builder().name(name);
        group.forEach(r -> b.provenance(r.getSource()));

        for (IngredientField field : IngredientField.values()) {
            PartialRecord chosen = pick(field, group);
            if (chosen != null) {
                b.field(field, field.fit(field.valueOf(chosen)));
                b.fieldSource(field, chosen.getSource());
            } else if (field == IngredientField.INGREDIENT_TYPE) {
                String profile = group.stream()
                        .map(IngredientField.ODOR_DESCRIPTION::valueOf)
                        .filter(Objects::nonNull)
                        .map(Object::toString)
                        .findFirst()
                        .orElse(null);
                ProfileInference.inferType(name, profile).ifPresent(t -> b.field(field, t));
            } else if (field == IngredientField.TENACITY) {
                ProfileInference.inferTenacity(name).ifPresent(t -> b.field(field, t));
            }
        }

        Map<String, String> synonyms = new LinkedHashMap<>();
        String ownKey = IngredientStore.nameKey(name);
        for (PartialRecord r : group) {
            for (String s : r.getSynonyms()) {
                String key = IngredientStore.nameKey(s);
                if (!key.isEmpty() && !key.equals(ownKey) && synonyms.size() < MAX_SYNONYMS) {
                    synonyms.putIfAbsent(key, s.trim());
                }
            }
        }
        b.synonyms(synonyms.values());
        return b.build();
    }

    private static PartialRecord pick(final IngredientField field, final List<PartialRecord> group) {
        PartialRecord fallback = null;
        for (PartialRecord r : group) {
            if (field.valueOf(r) == null) {
                continue;
            }
            if (r.getSource() == field.authority()) {
                return r;
            }
            if (fallback == null) {
                fallback = r;
            }
        }
        return fallback;
    }

    /**
     * Writes {@code candidate} for {@code owner}.
     *
     * @throws LockAcquisitionException if the (name, owner) lock times out
     * @throws org.springframework.dao.DataAccessException on store failure
     */
    public UpsertOutcome upsert(final MergedCandidate candidate, final String owner, final boolean overwrite) {
        String key = owner + "|" + IngredientStore.nameKey(candidate.getName());
        return lock.withLock(key, () -> tx.execute(status -> write(candidate, owner, overwrite)));
    }

    private UpsertOutcome write(final MergedCandidate candidate, final String owner, final boolean overwrite) {
        Optional<IngredientRecord> found = store.findByNameOwner(candidate.getName(), owner);
        if (found.isEmpty()) {
            return insert(candidate, owner);
        }

        IngredientRecord existing = found.get();
        UpsertOutcome.UpsertOutcomeBuilder outcome = UpsertOutcome.builder()
                .ingredientId(existing.getId())
                .created(false);

        Optional<String> storedCas = existing.registryNumber();
        Optional<String> sourcedCas = candidate.registryNumber();
        if (storedCas.isPresent() && sourcedCas.isPresent() && !storedCas.get().equals(sourcedCas.get())) {
            log.warn("'{}' (owner {}): stored CAS {} differs from sourced {}, record left untouched",
                    existing.getName(), owner, storedCas.get(), sourcedCas.get());
            return outcome
                    .casNumber(storedCas.get())
                    .conflict("cas: stored " + storedCas.get() + " differs from sourced " + sourcedCas.get())
                    .build();
        }

        Map<IngredientField, Object> updates = new EnumMap<>(IngredientField.class);
        for (Map.Entry<IngredientField, Object> e : candidate.fieldMap().entrySet()) {
            IngredientField field = e.getKey();
            Object stored = existing.value(field);
            if (overwrite) {
                if (!sameValue(stored, e.getValue())) {
                    updates.put(field, e.getValue());
                }
            } else if (existing.isEmpty(field)) {
                updates.put(field, e.getValue());
            } else if (!sameValue(stored, e.getValue())) {
                outcome.conflict(field.column() + ": kept stored value");
            }
        }

        if (!updates.isEmpty()) {
            store.updateFields(existing.getId(), updates);
            log.info("Updated '{}' (owner {}): {}", existing.getName(), owner, updates.keySet());
        } else {
            log.info("'{}' (owner {}) already up to date", existing.getName(), owner);
        }
        store.addSynonyms(existing.getId(), candidate.getSynonyms(), candidate.provenanceNote());

        String cas = updates.containsKey(IngredientField.CAS_NUMBER)
                ? candidate.text(IngredientField.CAS_NUMBER)
                : storedCas.orElse(null);
        return outcome
                .updated(!updates.isEmpty())
                .duplicate(!overwrite && updates.isEmpty())
                .casNumber(cas)
                .writtenFields(updates.keySet())
                .build();
    }

    private UpsertOutcome insert(final MergedCandidate candidate, final String owner) {
        IngredientRecord record = IngredientRecord.builder()
                .name(candidate.getName())
                .owner(owner)
                .fields(candidate.fieldMap())
                .limits(RegulatoryCategory.unrestricted())
                .allergen(false)
                .notes("Enriched from " + candidate.provenanceNote())
                .build();
        long id = store.insert(record);
        store.addSynonyms(id, candidate.getSynonyms(), candidate.provenanceNote());
        log.info("Created ingredient #{} '{}' (owner {}) from {}", id, candidate.getName(), owner,
                candidate.provenanceNote());
        return UpsertOutcome.builder()
                .ingredientId(id)
                .created(true)
                .casNumber(candidate.text(IngredientField.CAS_NUMBER))
                .writtenFields(candidate.fieldMap().keySet())
                .build();
    }

    /** Numbers read back from the store may differ in type from freshly parsed ones. */
    private static boolean sameValue(final Object a, final Object b) {
        if (a == null || b == null) {
            return a == b;
        }
        return Objects.equals(a.toString().trim(), b.toString().trim());
    }
}
