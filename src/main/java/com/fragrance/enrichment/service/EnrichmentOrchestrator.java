package com.fragrance.enrichment.service;

import com.fragrance.enrichment.config.EnrichmentProperties;
import com.fragrance.enrichment.dto.BulkResult;
import com.fragrance.enrichment.dto.EnrichResult;
import com.fragrance.enrichment.dto.ItemStatus;
import com.fragrance.enrichment.dto.SearchResult;
import com.fragrance.enrichment.matching.NameNormalizer;
import com.fragrance.enrichment.merge.LockAcquisitionException;
import com.fragrance.enrichment.merge.MergeEngine;
import com.fragrance.enrichment.merge.MergeResult;
import com.fragrance.enrichment.merge.UpsertOutcome;
import com.fragrance.enrichment.model.FetchOutcome;
import com.fragrance.enrichment.model.FetchStatus;
import com.fragrance.enrichment.model.IngredientStats;
import com.fragrance.enrichment.model.MergedCandidate;
import com.fragrance.enrichment.model.PartialRecord;
import com.fragrance.enrichment.model.Query;
import com.fragrance.enrichment.model.RowError;
import com.fragrance.enrichment.model.SourceId;
import com.fragrance.enrichment.regulatory.ImportResult;
import com.fragrance.enrichment.regulatory.RegulatorySyncService;
import com.fragrance.enrichment.regulatory.SyncSummary;
import com.fragrance.enrichment.service.core.ResponseCache;
import com.fragrance.enrichment.service.core.SourceAdapter;
import com.fragrance.enrichment.service.core.SourceAdapterRegistry;
import com.fragrance.enrichment.store.IngredientStore;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * <h2>Enrichment orchestrator</h2>
 *
 * <p>Entry point for the boundary operations. A request fans out to every
 * registered source adapter on the shared source executor, one task per
 * source, so each source paces itself through its own rate limiter. The
 * request's deadline cancels only that request's tasks. Found records are
 * merged, and for enrich calls written to the store; a write that changed
 * a record with a CAS number triggers the regulatory cross-sync.</p>
 *
 * <p>No operation here throws for source or row level problems. Those are
 * folded into the returned results.</p>
 */
@Slf4j
@Service
public class EnrichmentOrchestrator {

    private final SourceAdapterRegistry adapters;

    private final ResponseCache cache;

    private final MergeEngine mergeEngine;

    private final RegulatorySyncService regulatory;

    private final IngredientStore store;

    private final EnrichmentProperties props;

    private final ExecutorService sourceExecutor;

    private final ExecutorService bulkExecutor;

    public EnrichmentOrchestrator(final SourceAdapterRegistry adapters,
                                  final ResponseCache cache,
                                  final MergeEngine mergeEngine,
                                  final RegulatorySyncService regulatory,
                                  final IngredientStore store,
                                  final EnrichmentProperties props,
                                  @Qualifier("sourceExecutor") final ExecutorService sourceExecutor,
                                  @Qualifier("bulkExecutor") final ExecutorService bulkExecutor) {
        this.adapters = adapters;
        this.cache = cache;
        this.mergeEngine = mergeEngine;
        this.regulatory = regulatory;
        this.store = store;
        this.props = props;
        this.sourceExecutor = sourceExecutor;
        this.bulkExecutor = bulkExecutor;
    }

    /**
     * What every source returned for a query, and their merge.
     */
    record Resolution(Map<SourceId, FetchOutcome> outcomes, MergeResult merge) {

        boolean found() {
            return merge.getPrimary() != null;
        }

        Map<String, Boolean> sourceFlags() {
            Map<String, Boolean> flags = new TreeMap<>();
            outcomes.forEach((source, o) -> flags.put(source.label(), o.isFound()));
            return flags;
        }

        Map<String, String> errors() {
            return outcomes.values().stream()
                    .filter(o -> o.getStatus() == FetchStatus.UNAVAILABLE)
                    .collect(Collectors.toMap(o -> o.getSource().label(),
                            o -> StringUtils.defaultString(o.getDetail(), "unavailable"),
                            (a, b) -> a, TreeMap::new));
        }

        boolean allUnavailable() {
            return !outcomes.isEmpty()
                    && outcomes.values().stream().allMatch(o -> o.getStatus() == FetchStatus.UNAVAILABLE);
        }
    }

    /* ------------------------------------------------------------------ */
    /*  Search                                                             */
    /* ------------------------------------------------------------------ */

    /**
     * Read-only preview; nothing is persisted.
     *
     * @throws IllegalArgumentException if {@code name} is blank
     */
    public SearchResult search(final String name) {
        return search(name, null);
    }

    public SearchResult search(final String name, final String casHint) {
        Query query = Query.of(name, casHint);
        PipelineRun run = new PipelineRun(query.getDisplayName());
        Resolution resolution = resolve(query, run);
        run.moveTo(PipelineState.RETURN_PREVIEW);

        MergeResult merge = resolution.merge();
        return new SearchResult(query.getDisplayName(), resolution.found(), merge.getPrimary(),
                resolution.sourceFlags(), resolution.errors(), merge.isAmbiguous(), merge.getAlternates());
    }

    /* ------------------------------------------------------------------ */
    /*  Enrich                                                             */
    /* ------------------------------------------------------------------ */

    public EnrichResult enrich(final String name, final String owner, final Boolean overwrite) {
        return enrich(name, owner, overwrite, null);
    }

    /**
     * Search, merge and write one ingredient.
     *
     * @throws IllegalArgumentException if {@code name} is blank
     */
    public EnrichResult enrich(final String name, final String owner, final Boolean overwrite, final String casHint) {
        Query query = Query.of(name, casHint);
        String ownerId = ownerOrDefault(owner);
        boolean overwriteMode = overwrite != null ? overwrite : props.isOverwriteDefault();
        PipelineRun run = new PipelineRun(query.getDisplayName());

        Resolution resolution = resolve(query, run);
        Map<String, Boolean> sources = resolution.sourceFlags();
        if (!resolution.found()) {
            if (resolution.allUnavailable()) {
                run.moveTo(PipelineState.FAILED);
                return EnrichResult.failed(query.getDisplayName(), sources,
                        "all sources unavailable: " + resolution.errors());
            }
            run.moveTo(PipelineState.DONE);
            log.info("'{}': not found at any source", query.getDisplayName());
            return EnrichResult.notFound(query.getDisplayName(), sources);
        }

        MergedCandidate candidate = resolution.merge().getPrimary();
        UpsertOutcome outcome;
        run.moveTo(PipelineState.UPSERT);
        try {
            outcome = mergeEngine.upsert(candidate, ownerId, overwriteMode);
        } catch (DataAccessException | LockAcquisitionException ex) {
            run.moveTo(PipelineState.FAILED);
            log.warn("'{}': write failed for owner {}: {}", query.getDisplayName(), ownerId, ex.getMessage());
            return EnrichResult.failed(query.getDisplayName(), sources, ex.getMessage());
        }

        List<String> conflicts = new ArrayList<>(outcome.getConflicts());
        if (resolution.merge().isAmbiguous()) {
            conflicts.add("ambiguous identity: " + resolution.merge().getAlternates().size()
                    + " record group(s) kept apart");
        }

        boolean synced = false;
        if (outcome.changed() && StringUtils.isNotBlank(outcome.getCasNumber())) {
            run.moveTo(PipelineState.CROSS_SYNC);
            try {
                synced = regulatory.syncIngredient(outcome.getIngredientId(), outcome.getCasNumber(), ownerId);
            } catch (DataAccessException ex) {
                log.warn("'{}': regulatory sync failed: {}", query.getDisplayName(), ex.getMessage());
                conflicts.add("regulatory sync failed: " + ex.getMessage());
            }
        }
        run.moveTo(PipelineState.DONE);

        ItemStatus status = outcome.isCreated() ? ItemStatus.CREATED
                : outcome.isUpdated() ? ItemStatus.UPDATED
                : ItemStatus.UNCHANGED;
        return new EnrichResult(query.getDisplayName(), status, outcome.isCreated(), outcome.isUpdated(),
                outcome.isDuplicate(), outcome.getIngredientId(), List.copyOf(conflicts), sources, synced, null);
    }

    /* ------------------------------------------------------------------ */
    /*  Bulk                                                               */
    /* ------------------------------------------------------------------ */

    public BulkResult bulkEnrich(final List<String> names, final String owner,
                                 final Integer limit, final Boolean overwrite) {
        String ownerId = ownerOrDefault(owner);
        List<String> work = distinct(names).stream()
                .limit(limitOrDefault(limit))
                .collect(Collectors.toList());
        log.info("Bulk enrich of {} name(s) for owner {}", work.size(), ownerId);

        List<Future<EnrichResult>> futures = new ArrayList<>();
        for (String name : work) {
            futures.add(bulkExecutor.submit(() -> enrichSafely(name, ownerId, overwrite)));
        }

        List<EnrichResult> items = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            items.add(await(work.get(i), futures.get(i)));
        }
        Map<ItemStatus, Long> counts = items.stream()
                .collect(Collectors.groupingBy(EnrichResult::status,
                        () -> new EnumMap<>(ItemStatus.class), Collectors.counting()));
        log.info("Bulk enrich done: {}", counts);
        return new BulkResult(items.size(), counts, items);
    }

    /**
     * Bulk run over a text file, one name per line; blank lines and lines
     * starting with {@code #} are ignored.
     *
     * @throws IllegalArgumentException if the file cannot be read
     */
    public BulkResult bulkEnrichFile(final Path file, final String owner,
                                     final Integer limit, final Boolean overwrite) {
        List<String> names;
        try {
            names = Files.readAllLines(file, StandardCharsets.UTF_8).stream()
                    .map(String::trim)
                    .filter(l -> !l.isEmpty() && !l.startsWith("#"))
                    .collect(Collectors.toList());
        } catch (IOException ex) {
            throw new IllegalArgumentException("Cannot read name file " + file + ": " + ex.getMessage(), ex);
        }
        return bulkEnrich(names, owner, limit, overwrite);
    }

    /** Bulk run over stored ingredients lacking a CAS number, a formula or an odor description. */
    public BulkResult bulkEnrichMissing(final String owner, final Integer limit, final Boolean overwrite) {
        String ownerId = ownerOrDefault(owner);
        List<String> names = store.findNamesMissingEnrichment(ownerId, limitOrDefault(limit));
        return bulkEnrich(names, ownerId, limit, overwrite);
    }

    /** Enrichment coverage of the owner's stored ingredients. */
    public IngredientStats statistics(final String owner) {
        return store.statistics(ownerOrDefault(owner));
    }

    private EnrichResult enrichSafely(final String name, final String owner, final Boolean overwrite) {
        try {
            return enrich(name, owner, overwrite);
        } catch (RuntimeException ex) {
            log.warn("Bulk item '{}' failed: {}", name, ex.toString());
            return EnrichResult.failed(name, Map.of(), ex.getMessage());
        }
    }

    private EnrichResult await(final String name, final Future<EnrichResult> future) {
        try {
            return future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return EnrichResult.failed(name, Map.of(), "interrupted");
        } catch (ExecutionException ex) {
            return EnrichResult.failed(name, Map.of(), String.valueOf(ex.getCause()));
        }
    }

    /* ------------------------------------------------------------------ */
    /*  Regulatory                                                         */
    /* ------------------------------------------------------------------ */

    public ImportResult importStandards(final Path feed, final String owner) {
        return importStandards(feed, owner, null);
    }

    /**
     * Imports a regulatory feed file; an unreadable file is reported in the result.
     *
     * @param fillMissingOnly {@code null} or {@code false} replaces stored standards
     */
    public ImportResult importStandards(final Path feed, final String owner, final Boolean fillMissingOnly) {
        String ownerId = ownerOrDefault(owner);
        try {
            return regulatory.importStandards(feed, ownerId, Boolean.TRUE.equals(fillMissingOnly));
        } catch (IOException ex) {
            log.warn("Cannot read regulatory feed {}: {}", feed, ex.getMessage());
            return ImportResult.failed(new RowError(0, "cannot read feed: " + ex.getMessage(), null));
        }
    }

    /**
     * @throws IllegalArgumentException if the ingredient is not the owner's
     */
    public boolean syncIngredientLimits(final long ingredientId, final String owner) {
        return regulatory.syncIngredient(ingredientId, ownerOrDefault(owner));
    }

    public SyncSummary syncAllIngredientLimits(final String owner) {
        return regulatory.syncAll(ownerOrDefault(owner));
    }

    /* ------------------------------------------------------------------ */
    /*  Pipeline                                                           */
    /* ------------------------------------------------------------------ */

    Resolution resolve(final Query query, final PipelineRun run) {
        run.moveTo(PipelineState.CACHE_LOOKUP);
        boolean allCached = adapters.all().stream()
                .allMatch(a -> cache.get(query, a.source()).isPresent());
        run.moveTo(allCached ? PipelineState.USE_CACHE : PipelineState.FETCH_ALL_SOURCES);

        Map<SourceId, FetchOutcome> outcomes = fetchAll(query);

        List<PartialRecord> records = new ArrayList<>();
        for (FetchOutcome outcome : outcomes.values()) {
            outcome.partialRecord()
                    .filter(r -> matchesHint(query, r))
                    .ifPresent(records::add);
        }
        MergeResult merge = mergeEngine.merge(query, records);
        run.moveTo(PipelineState.MERGED);
        return new Resolution(outcomes, merge);
    }

    private Map<SourceId, FetchOutcome> fetchAll(final Query query) {
        Map<SourceId, Future<FetchOutcome>> futures = new LinkedHashMap<>();
        for (SourceAdapter adapter : adapters.all()) {
            futures.put(adapter.source(), sourceExecutor.submit(() -> fetchWithVariants(adapter, query)));
        }

        long deadline = System.nanoTime() + props.getRequestTimeout().toNanos();
        Map<SourceId, FetchOutcome> outcomes = new EnumMap<>(SourceId.class);
        for (Map.Entry<SourceId, Future<FetchOutcome>> e : futures.entrySet()) {
            outcomes.put(e.getKey(), awaitSource(e.getKey(), e.getValue(), deadline));
        }
        return outcomes;
    }

    private FetchOutcome awaitSource(final SourceId source, final Future<FetchOutcome> future, final long deadline) {
        try {
            return future.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            log.warn("{} timed out after {}", source.label(), props.getRequestTimeout());
            return FetchOutcome.unavailable(source, "request timed out");
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return FetchOutcome.unavailable(source, "interrupted");
        } catch (CancellationException ex) {
            return FetchOutcome.unavailable(source, "cancelled");
        } catch (ExecutionException ex) {
            return FetchOutcome.unavailable(source, String.valueOf(ex.getCause()));
        }
    }

    /**
     * Tries the query's spelling variants in order until one is found or the
     * source becomes unavailable. A CAS hint replaces the name search for the
     * chemical source, so only the first variant is tried there.
     */
    private FetchOutcome fetchWithVariants(final SourceAdapter adapter, final Query query) {
        List<String> variants = NameNormalizer.searchVariants(query.getDisplayName());
        if (query.getCasHint() != null && adapter.source() == SourceId.CHEMICAL) {
            variants = variants.subList(0, 1);
        }
        FetchOutcome last = FetchOutcome.notFound(adapter.source());
        for (String variant : variants) {
            Query q = variant.equals(query.getDisplayName()) ? query : query.withName(variant);
            last = adapter.fetch(q);
            if (last.getStatus() != FetchStatus.NOT_FOUND) {
                return last;
            }
        }
        return last;
    }

    private static boolean matchesHint(final Query query, final PartialRecord record) {
        if (query.getCasHint() == null || record.getCasNumber() == null
                || query.getCasHint().equals(record.getCasNumber())) {
            return true;
        }
        log.info("Discarding {} record for '{}': CAS {} does not match hint {}",
                record.getSource().label(), query.getDisplayName(), record.getCasNumber(), query.getCasHint());
        return false;
    }

    private String ownerOrDefault(final String owner) {
        return StringUtils.isBlank(owner) ? props.getDefaultOwner() : owner.trim();
    }

    private int limitOrDefault(final Integer limit) {
        return limit != null && limit > 0 ? limit : props.getBulk().getDefaultLimit();
    }

    private static List<String> distinct(final List<String> names) {
        if (names == null) {
            return List.of();
        }
        return new ArrayList<>(names.stream()
                .filter(StringUtils::isNotBlank)
                .map(StringUtils::normalizeSpace)
                .collect(Collectors.toMap(n -> n.toLowerCase(Locale.ROOT), Function.identity(),
                        (a, b) -> a, LinkedHashMap::new))
                .values());
    }
}
