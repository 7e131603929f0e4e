package com.fragrance.enrichment.controller;

import com.fragrance.enrichment.dto.BulkResult;
import com.fragrance.enrichment.dto.EnrichResult;
import com.fragrance.enrichment.dto.ItemStatus;
import com.fragrance.enrichment.dto.SearchResult;
import com.fragrance.enrichment.model.IngredientField;
import com.fragrance.enrichment.model.IngredientStats;
import com.fragrance.enrichment.model.MergedCandidate;
import com.fragrance.enrichment.model.SourceId;
import com.fragrance.enrichment.service.EnrichmentOrchestrator;
import com.fragrance.enrichment.service.core.ResponseCache;
import com.fragrance.enrichment.service.core.SourceAdapterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class EnrichmentControllerTest {

    private EnrichmentOrchestrator orchestrator;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        orchestrator = mock(EnrichmentOrchestrator.class);
        SourceAdapterRegistry registry = mock(SourceAdapterRegistry.class);
        when(registry.supportedSources()).thenReturn(EnumSet.allOf(SourceId.class));
        ResponseCache cache = mock(ResponseCache.class);
        when(cache.hitCount()).thenReturn(3L);

        mvc = MockMvcBuilders.standaloneSetup(new EnrichmentController(orchestrator, registry, cache))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    private static EnrichResult created() {
        return new EnrichResult("Linalool", ItemStatus.CREATED, true, false, false, 17L, List.of(),
                Map.of("PubChem", true, "TGSC", true), false, null);
    }

    @Nested
    @DisplayName("GET /search")
    class Search {

        @Test
        @DisplayName("Should return the preview")
        void testSearch() throws Exception {
            MergedCandidate candidate = MergedCandidate.builder()
                    .name("Linalool")
                    .field(IngredientField.CAS_NUMBER, "78-70-6")
                    .provenance(SourceId.CHEMICAL)
                    .build();
            when(orchestrator.search("Linalool", null)).thenReturn(new SearchResult("Linalool", true, candidate,
                    Map.of("PubChem", true, "TGSC", false), Map.of("TGSC", "HTTP 503 from /search.php"),
                    false, List.of()));

            mvc.perform(get("/api/enrichment/search").param("name", "Linalool"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.found").value(true))
                    .andExpect(jsonPath("$.candidate.name").value("Linalool"))
                    .andExpect(jsonPath("$.candidate.fields.CAS_NUMBER").value("78-70-6"))
                    .andExpect(jsonPath("$.errors.TGSC").value(containsString("503")));
        }

        @Test
        @DisplayName("Should pass the CAS hint through")
        void testSearchWithHint() throws Exception {
            when(orchestrator.search("Linalool", "78-70-6")).thenReturn(
                    new SearchResult("Linalool", false, null, Map.of(), Map.of(), false, List.of()));

            mvc.perform(get("/api/enrichment/search").param("name", "Linalool").param("cas", "78-70-6"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.found").value(false));
            verify(orchestrator).search("Linalool", "78-70-6");
        }

        @Test
        @DisplayName("Should answer 400 without a name")
        void testMissingName() throws Exception {
            mvc.perform(get("/api/enrichment/search"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.success").value(false));
        }

        @Test
        @DisplayName("Should answer 400 when the name is rejected")
        void testRejectedName() throws Exception {
            when(orchestrator.search(anyString(), isNull()))
                    .thenThrow(new IllegalArgumentException("Ingredient name must not be blank"));

            mvc.perform(get("/api/enrichment/search").param("name", " "))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.success").value(false))
                    .andExpect(jsonPath("$.error").value("Ingredient name must not be blank"));
        }
    }

    @Nested
    @DisplayName("POST /enrich")
    class Enrich {

        @Test
        @DisplayName("Should enrich with the requested owner and policy")
        void testEnrich() throws Exception {
            when(orchestrator.enrich("Linalool", "42", true, null)).thenReturn(created());

            mvc.perform(post("/api/enrichment/enrich")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"name\":\"Linalool\",\"ownerId\":\"42\",\"overwrite\":true}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("CREATED"))
                    .andExpect(jsonPath("$.duplicate").value(false))
                    .andExpect(jsonPath("$.ingredientId").value(17));
        }

        @Test
        @DisplayName("Should answer 400 for a blank name")
        void testBlankName() throws Exception {
            mvc.perform(post("/api/enrichment/enrich")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"name\":\"\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.success").value(false))
                    .andExpect(jsonPath("$.error").value(containsString("name")));
            verify(orchestrator, never()).enrich(any(), any(), any(), any());
        }
    }

    @Nested
    @DisplayName("POST /bulk")
    class Bulk {

        @Test
        @DisplayName("Should run over explicit names")
        void testNames() throws Exception {
            when(orchestrator.bulkEnrich(List.of("Linalool", "Citral"), null, 10, null))
                    .thenReturn(new BulkResult(1, Map.of(ItemStatus.CREATED, 1L), List.of(created())));

            mvc.perform(post("/api/enrichment/bulk")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"names\":[\"Linalool\",\"Citral\"],\"limit\":10}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.total").value(1))
                    .andExpect(jsonPath("$.counts.CREATED").value(1));
        }

        @Test
        @DisplayName("Should prefer the missing-enrichment mode when requested")
        void testAllMissing() throws Exception {
            when(orchestrator.bulkEnrichMissing("7", null, false))
                    .thenReturn(new BulkResult(0, Map.of(), List.of()));

            mvc.perform(post("/api/enrichment/bulk")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"allMissing\":true,\"ownerId\":\"7\",\"overwrite\":false,\"names\":[\"x\"]}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.total").value(0));
            verify(orchestrator, never()).bulkEnrich(any(), any(), any(), any());
        }

        @Test
        @DisplayName("Should answer 400 when no work list is given")
        void testNothingToDo() throws Exception {
            mvc.perform(post("/api/enrichment/bulk")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error").value("One of names, file or allMissing is required"));
        }

        @Test
        @DisplayName("Should answer 400 for a non-positive limit")
        void testBadLimit() throws Exception {
            mvc.perform(post("/api/enrichment/bulk")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"names\":[\"Linalool\"],\"limit\":0}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.success").value(false));
        }
    }

    @Test
    @DisplayName("GET /stats reports coverage for the requested owner")
    void testStats() throws Exception {
        when(orchestrator.statistics("7")).thenReturn(new IngredientStats("7", 4, 3, 1, 0, 3));

        mvc.perform(get("/api/enrichment/stats").param("ownerId", "7"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.owner").value("7"))
                .andExpect(jsonPath("$.total").value(4))
                .andExpect(jsonPath("$.withCas").value(3))
                .andExpect(jsonPath("$.casCoverage").value(75.0))
                .andExpect(jsonPath("$.odorProfileCoverage").value(25.0));
    }

    @Test
    @DisplayName("GET /health lists the sources and cache hits")
    void testHealth() throws Exception {
        mvc.perform(get("/api/enrichment/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.sources", contains("PubChem", "TGSC")))
                .andExpect(jsonPath("$.cacheHits").value(3));
    }
}
