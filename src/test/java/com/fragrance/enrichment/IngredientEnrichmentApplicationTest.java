package com.fragrance.enrichment;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fragrance.enrichment.config.SourceConfigFactory;
import com.fragrance.enrichment.model.SourceId;
import com.fragrance.enrichment.service.EnrichmentOrchestrator;
import com.fragrance.enrichment.service.core.RateLimiter;
import com.fragrance.enrichment.service.core.SourceAdapterRegistry;
import io.github.resilience4j.retry.RetryRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {
        "spring.datasource.url=jdbc:h2:mem:context-test;DB_CLOSE_DELAY=-1",
        "enrichment.retry.max-attempts=2",
        "sources.configs.pubchem.min-interval=400ms"
})
class IngredientEnrichmentApplicationTest {

    @Autowired
    private SourceAdapterRegistry registry;

    @Autowired
    private RateLimiter limiter;

    @Autowired
    private RetryRegistry retries;

    @Autowired
    private ObjectMapper mapper;

    @Autowired
    private SourceConfigFactory configs;

    @Autowired
    private JdbcTemplate jdbc;

    @Autowired
    private EnrichmentOrchestrator orchestrator;

    @Test
    @DisplayName("Should wire one adapter per source")
    void testAdapters() {
        assertNotNull(orchestrator);
        assertEquals(EnumSet.allOf(SourceId.class), registry.supportedSources());
    }

    @Test
    @DisplayName("Should bind pacing and retry settings from properties")
    void testBinding() {
        assertEquals(400, limiter.budget(SourceId.CHEMICAL).currentIntervalMillis());
        assertEquals(2, retries.getDefaultConfig().getMaxAttempts());
        assertEquals("/search.php", configs.forSource("goodscents").getSearchPath());
    }

    @Test
    @DisplayName("Should use the enrichment mapper and apply the schema")
    void testInfrastructure() {
        assertFalse(mapper.isEnabled(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS));
        assertEquals(0, jdbc.queryForObject("SELECT COUNT(*) FROM ingredients", Integer.class));
    }
}
