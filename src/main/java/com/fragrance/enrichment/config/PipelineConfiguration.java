package com.fragrance.enrichment.config;

import com.fragrance.enrichment.matching.IdentityMatcher;
import com.fragrance.enrichment.merge.KeyedLock;
import com.fragrance.enrichment.merge.MergeEngine;
import com.fragrance.enrichment.model.SourceId;
import com.fragrance.enrichment.service.core.RateLimiter;
import com.fragrance.enrichment.service.core.ResponseCache;
import com.fragrance.enrichment.service.core.SourceAdapter;
import com.fragrance.enrichment.service.core.SourceAdapterRegistry;
import com.fragrance.enrichment.store.IngredientStore;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Process-wide pipeline state and workers: the rate limiter and response
 * cache shared by every request, the merge engine with its lock registry,
 * and the two executors (per-source fetch lanes, bulk workers).
 */
@Configuration
public class PipelineConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RateLimiter rateLimiter(final SourceProperties sources, final EnrichmentProperties props) {
        Map<SourceId, Duration> intervals = new EnumMap<>(SourceId.class);
        for (SourceId id : SourceId.values()) {
            SourceCfg cfg = sources.forName(id.configKey());
            if (cfg != null) {
                intervals.put(id, cfg.getMinInterval());
            }
        }
        return new RateLimiter(intervals, props.getRetry().getMaxBackoffMultiplier());
    }

    @Bean
    public ResponseCache responseCache(final EnrichmentProperties props) {
        return new ResponseCache(props.getCache().getMaxSize());
    }

    @Bean
    public IdentityMatcher identityMatcher() {
        return new IdentityMatcher();
    }

    @Bean
    public MergeEngine mergeEngine(final IdentityMatcher matcher,
                                   final IngredientStore store,
                                   final EnrichmentProperties props,
                                   final PlatformTransactionManager txManager) {
        return new MergeEngine(matcher, store, new KeyedLock(props.getLockTimeout()),
                new TransactionTemplate(txManager));
    }

    @Bean
    public SourceAdapterRegistry sourceAdapterRegistry(final List<SourceAdapter> adapters) {
        return new SourceAdapterRegistry(adapters);
    }

    /** Fetch lanes: each request uses one task per source, bulk runs multiply that. */
    @Bean(destroyMethod = "shutdownNow")
    @Qualifier("sourceExecutor")
    public ExecutorService sourceExecutor(final EnrichmentProperties props) {
        int lanes = SourceId.values().length * props.getBulk().getConcurrency();
        return Executors.newFixedThreadPool(lanes, new CustomizableThreadFactory("source-lane-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    @Qualifier("bulkExecutor")
    public ExecutorService bulkExecutor(final EnrichmentProperties props) {
        return Executors.newFixedThreadPool(props.getBulk().getConcurrency(),
                new CustomizableThreadFactory("bulk-enrich-"));
    }
}
