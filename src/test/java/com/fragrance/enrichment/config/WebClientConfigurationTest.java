package com.fragrance.enrichment.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WebClientConfigurationTest {

    private static SourceCfg source(Duration timeout, boolean enabled) {
        SourceCfg cfg = new SourceCfg();
        cfg.setBaseUrl("https://source.test");
        cfg.setTimeout(timeout);
        cfg.setEnabled(enabled);
        return cfg;
    }

    @Test
    @DisplayName("Should size the response timeout from the slowest enabled source")
    void testResponseTimeout() {
        SourceProperties sources = new SourceProperties();
        sources.getConfigs().put("pubchem", source(Duration.ofSeconds(15), true));
        sources.getConfigs().put("goodscents", source(Duration.ofSeconds(45), true));
        sources.getConfigs().put("archived", source(Duration.ofMinutes(5), false));

        List<SourceCfg> enabled = WebClientConfiguration.enabledSources(sources);

        assertEquals(2, enabled.size());
        assertEquals(Duration.ofSeconds(45), WebClientConfiguration.responseTimeout(enabled));
        assertEquals(Duration.ofSeconds(30), WebClientConfiguration.responseTimeout(List.of()));
    }

    @Test
    @DisplayName("Should cap the connect timeout")
    void testConnectTimeout() {
        assertEquals(Duration.ofSeconds(3), WebClientConfiguration.connectTimeout(Duration.ofSeconds(3)));
        assertEquals(WebClientConfiguration.MAX_CONNECT_TIMEOUT,
                WebClientConfiguration.connectTimeout(Duration.ofMinutes(1)));
    }

    @Test
    @DisplayName("Should give every bulk worker a connection pair per source")
    void testMaxConnections() {
        assertEquals(8, WebClientConfiguration.maxConnections(2, 2));
        assertEquals(2, WebClientConfiguration.maxConnections(0, 0));
    }

    @Test
    @DisplayName("Should build a client from the configured sources")
    void testBuilder() {
        SourceProperties sources = new SourceProperties();
        sources.getConfigs().put("pubchem", source(Duration.ofSeconds(20), true));

        assertNotNull(new WebClientConfiguration()
                .sourceWebClientBuilder(new ObjectMapper(), sources, new EnrichmentProperties())
                .build());
    }
}
