package com.fragrance.enrichment.controller;

import com.fragrance.enrichment.dto.BulkEnrichRequest;
import com.fragrance.enrichment.dto.BulkResult;
import com.fragrance.enrichment.dto.EnrichRequest;
import com.fragrance.enrichment.dto.EnrichResult;
import com.fragrance.enrichment.dto.SearchResult;
import com.fragrance.enrichment.model.IngredientStats;
import com.fragrance.enrichment.model.SourceId;
import com.fragrance.enrichment.service.EnrichmentOrchestrator;
import com.fragrance.enrichment.service.core.ResponseCache;
import com.fragrance.enrichment.service.core.SourceAdapterRegistry;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * REST controller exposing ingredient search and enrichment.
 * <p>
 * Routing only: every call is handed to {@link EnrichmentOrchestrator}.
 * </p>
 *
 * <h3>Example Request</h3>
 * <pre>{@code
 * POST /api/enrichment/enrich
 * Content-Type: application/json
 *
 * { "name": "Linalool", "ownerId": "42", "overwrite": false }
 * }</pre>
 *
 * <h3>Example Response</h3>
 * <pre>{@code
 * { "name": "Linalool", "status": "CREATED", "created": true, "updated": false, "duplicate": false,
 *   "ingredientId": 17, "conflicts": [], "sources": {"PubChem": true, "TGSC": true},
 *   "regulatorySynced": false, "error": null }
 * }</pre>
 */
@RestController
@RequestMapping("/api/enrichment")
@RequiredArgsConstructor
public class EnrichmentController {

    private final EnrichmentOrchestrator orchestrator;

    private final SourceAdapterRegistry adapters;

    private final ResponseCache cache;

    /**
     * Read-only preview across all sources.
     *
     * @param name    ingredient name
     * @param casHint optional CAS number to pin the chemical lookup
     */
    @GetMapping(path = "/search", produces = MediaType.APPLICATION_JSON_VALUE)
    public SearchResult search(@RequestParam("name") final String name,
                               @RequestParam(name = "cas", required = false) final String casHint) {
        return orchestrator.search(name, casHint);
    }

    @PostMapping(path = "/enrich",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public EnrichResult enrich(@RequestBody @Validated final EnrichRequest request) {
        return orchestrator.enrich(request.name(), request.ownerId(), request.overwrite(), request.casHint());
    }

    /**
     * Bulk enrichment over explicit names, a name file, or every stored
     * ingredient missing enrichment.
     */
    @PostMapping(path = "/bulk",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public BulkResult bulk(@RequestBody @Validated final BulkEnrichRequest request) {
        if (request.allMissing()) {
            return orchestrator.bulkEnrichMissing(request.ownerId(), request.limit(), request.overwrite());
        }
        if (StringUtils.isNotBlank(request.file())) {
            return orchestrator.bulkEnrichFile(Path.of(request.file()), request.ownerId(),
                    request.limit(), request.overwrite());
        }
        if (request.names() == null || request.names().isEmpty()) {
            throw new IllegalArgumentException("One of names, file or allMissing is required");
        }
        return orchestrator.bulkEnrich(request.names(), request.ownerId(), request.limit(), request.overwrite());
    }

    /**
     * Enrichment coverage for one owner.
     *
     * @param ownerId owner to report on; the configured default when absent
     */
    @GetMapping(path = "/stats", produces = MediaType.APPLICATION_JSON_VALUE)
    public IngredientStats stats(@RequestParam(name = "ownerId", required = false) final String ownerId) {
        return orchestrator.statistics(ownerId);
    }

    @GetMapping(path = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "UP");
        body.put("sources", adapters.supportedSources().stream()
                .map(SourceId::label)
                .collect(Collectors.toList()));
        body.put("cacheHits", cache.hitCount());
        return body;
    }
}
