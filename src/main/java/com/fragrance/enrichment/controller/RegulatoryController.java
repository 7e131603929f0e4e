package com.fragrance.enrichment.controller;

import com.fragrance.enrichment.dto.ImportStandardsRequest;
import com.fragrance.enrichment.regulatory.ImportResult;
import com.fragrance.enrichment.regulatory.SyncSummary;
import com.fragrance.enrichment.service.EnrichmentOrchestrator;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.util.Map;

/**
 * REST controller for the regulatory standards table and the limit sync.
 * <p>
 * Endpoints: <code>POST /api/regulatory/import</code>,
 * <code>POST /api/regulatory/sync/{ingredientId}</code>,
 * <code>POST /api/regulatory/sync-all</code>.
 * </p>
 */
@RestController
@RequestMapping("/api/regulatory")
@RequiredArgsConstructor
public class RegulatoryController {

    private final EnrichmentOrchestrator orchestrator;

    @PostMapping(path = "/import",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ImportResult importStandards(@RequestBody @Validated final ImportStandardsRequest request) {
        return orchestrator.importStandards(Path.of(request.feedPath()), request.ownerId(), request.fillMissingOnly());
    }

    @PostMapping(path = "/sync/{ingredientId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> sync(@PathVariable("ingredientId") final long ingredientId,
                                    @RequestParam(name = "ownerId", required = false) final String ownerId) {
        boolean applied = orchestrator.syncIngredientLimits(ingredientId, ownerId);
        return Map.of("ingredientId", ingredientId, "applied", applied);
    }

    @PostMapping(path = "/sync-all", produces = MediaType.APPLICATION_JSON_VALUE)
    public SyncSummary syncAll(@RequestParam(name = "ownerId", required = false) final String ownerId) {
        return orchestrator.syncAllIngredientLimits(ownerId);
    }
}
