package com.fragrance.enrichment.config;

import com.fragrance.enrichment.service.core.TransientSourceException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * <h2>Resilience4j Configuration</h2>
 *
 * <p>
 * Exposes the {@link RetryRegistry} the source adapters pull their named
 * {@link Retry} instances from (one per source, keyed by the source's config
 * key). Only {@link TransientSourceException} is retried. The pause between
 * attempts is left to the per-source rate limiter, which already stretches
 * its interval after every failure, so the retry itself waits only a token
 * millisecond.
 * </p>
 */
@Slf4j
@Configuration
public class Resilience4jConfig {

    private static final Duration MIN_RETRY_WAIT = Duration.ofMillis(1);

    /**
     * Creates the global {@link RetryRegistry}.
     *
     * @param props pipeline settings supplying the attempt ceiling
     * @return a registry whose default config applies to every source
     */
    @Bean
    public RetryRegistry retryRegistry(final EnrichmentProperties props) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(props.getRetry().getMaxAttempts())
                .waitDuration(MIN_RETRY_WAIT)
                .retryExceptions(TransientSourceException.class)
                .build();
        RetryRegistry registry = RetryRegistry.of(config);
        registry.getEventPublisher().onEntryAdded(e -> e.getAddedEntry().getEventPublisher()
                .onRetry(ev -> log.debug("Retry {} attempt {} after {}", ev.getName(),
                        ev.getNumberOfRetryAttempts(), String.valueOf(ev.getLastThrowable()))));
        return registry;
    }
}
