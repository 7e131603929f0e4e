package com.fragrance.enrichment.controller;

import com.fragrance.enrichment.model.RowError;
import com.fragrance.enrichment.regulatory.ImportResult;
import com.fragrance.enrichment.regulatory.SyncSummary;
import com.fragrance.enrichment.service.EnrichmentOrchestrator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.file.Path;
import java.util.List;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class RegulatoryControllerTest {

    private EnrichmentOrchestrator orchestrator;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        orchestrator = mock(EnrichmentOrchestrator.class);
        mvc = MockMvcBuilders.standaloneSetup(new RegulatoryController(orchestrator))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("POST /import reports insert, update and skip counts")
    void testImport() throws Exception {
        when(orchestrator.importStandards(Path.of("/data/ifra.csv"), "1", null))
                .thenReturn(new ImportResult(1, 1, 0, List.of(new RowError(4, "invalid CAS number '12-AB-3'", "Broken"))));

        mvc.perform(post("/api/regulatory/import")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"feedPath\":\"/data/ifra.csv\",\"ownerId\":\"1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(2))
                .andExpect(jsonPath("$.inserted").value(1))
                .andExpect(jsonPath("$.updated").value(1))
                .andExpect(jsonPath("$.skipped").value(1))
                .andExpect(jsonPath("$.errors[0].line").value(4));
    }

    @Test
    @DisplayName("POST /import passes the fill-missing flag through")
    void testImportFillMissing() throws Exception {
        when(orchestrator.importStandards(Path.of("/data/ifra.csv"), null, true))
                .thenReturn(new ImportResult(0, 0, 3, List.of()));

        mvc.perform(post("/api/regulatory/import")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"feedPath\":\"/data/ifra.csv\",\"fillMissingOnly\":true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.unchanged").value(3))
                .andExpect(jsonPath("$.skipped").value(0));
    }

    @Test
    @DisplayName("POST /import without a feed path is a bad request")
    void testImportWithoutPath() throws Exception {
        mvc.perform(post("/api/regulatory/import")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"ownerId\":\"1\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    @DisplayName("POST /sync/{id} reports whether limits were applied")
    void testSync() throws Exception {
        when(orchestrator.syncIngredientLimits(7L, "1")).thenReturn(true);

        mvc.perform(post("/api/regulatory/sync/7").param("ownerId", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ingredientId").value(7))
                .andExpect(jsonPath("$.applied").value(true));
    }

    @Test
    @DisplayName("POST /sync/{id} for an unknown ingredient is a bad request")
    void testSyncUnknown() throws Exception {
        when(orchestrator.syncIngredientLimits(99L, null))
                .thenThrow(new IllegalArgumentException("No ingredient #99 for owner 1"));

        mvc.perform(post("/api/regulatory/sync/99"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("No ingredient #99 for owner 1"));
    }

    @Test
    @DisplayName("POST /sync-all returns the pass totals")
    void testSyncAll() throws Exception {
        when(orchestrator.syncAllIngredientLimits(null)).thenReturn(new SyncSummary(3, 5, 0));

        mvc.perform(post("/api/regulatory/sync-all"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.matched").value(3))
                .andExpect(jsonPath("$.skipped").value(5));
    }
}
