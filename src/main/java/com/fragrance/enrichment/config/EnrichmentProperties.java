package com.fragrance.enrichment.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Pipeline-wide settings bound from the {@code enrichment} prefix.
 *
 * <p>Example application.yml snippet:
 * <pre>
 * enrichment:
 *   default-owner: ${OWNER_ID:1}
 *   overwrite-default: false
 *   cache:
 *     ttl: 24h
 *   retry:
 *     max-attempts: 3
 *     max-backoff-multiplier: 8
 * </pre>
 * </p>
 */
@Data
@Validated
@ConfigurationProperties(prefix = "enrichment")
public class EnrichmentProperties {

    /** Owner used when a request does not name one. */
    @NotBlank
    private String defaultOwner = "1";

    /** Whether enrich requests replace populated fields unless told otherwise. */
    private boolean overwriteDefault = false;

    /** Upper bound for one search or enrich request across all sources. */
    @NotNull
    private Duration requestTimeout = Duration.ofSeconds(90);

    private Cache cache = new Cache();

    private Retry retry = new Retry();

    private Bulk bulk = new Bulk();

    /** How long to wait for the per-ingredient upsert lock. */
    @NotNull
    private Duration lockTimeout = Duration.ofSeconds(10);

    @Data
    public static class Cache {

        /** Time-to-live of a cached source lookup, found or not. */
        @NotNull
        private Duration ttl = Duration.ofHours(24);

        @Min(1)
        private long maxSize = 10_000;
    }

    @Data
    public static class Retry {

        /** Total attempts per source call, first try included. */
        @Min(1)
        private int maxAttempts = 3;

        /** Ceiling for the doubling backoff multiplier. */
        @Min(1)
        private int maxBackoffMultiplier = 8;
    }

    @Data
    public static class Bulk {

        /** Ingredients enriched in parallel during a bulk run. */
        @Min(1)
        private int concurrency = 2;

        /** Default cap on names processed by one bulk run. */
        @Min(1)
        private int defaultLimit = 500;
    }
}
