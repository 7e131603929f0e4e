package com.fragrance.enrichment.service.core;

import com.fragrance.enrichment.model.FetchOutcome;
import com.fragrance.enrichment.model.PartialRecord;
import com.fragrance.enrichment.model.Query;
import com.fragrance.enrichment.model.SourceId;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Time-bounded memo of source lookups keyed by (normalised query, source).
 *
 * <p>Negative results are cached as well. Each entry carries its own TTL;
 * an expired entry is reported as a miss and dropped by Caffeine on access,
 * no background sweep is scheduled.</p>
 */
@Slf4j
public class ResponseCache {

    /**
     * Cached lookup. A {@code null} record means the source had nothing.
     */
    public record CacheEntry(PartialRecord record, Instant cachedAt, Duration ttl) {

        public boolean isNegative() {
            return record == null;
        }

        public FetchOutcome toOutcome(final SourceId source) {
            return (record == null ? FetchOutcome.notFound(source) : FetchOutcome.found(record)).asCached();
        }
    }

    record CacheKey(String query, SourceId source) {
    }

    private final Cache<CacheKey, CacheEntry> cache;

    private final Clock clock;

    public ResponseCache(final long maxSize) {
        this(maxSize, Ticker.systemTicker(), Clock.systemUTC());
    }

    public ResponseCache(final long maxSize, final Ticker ticker, final Clock clock) {
        this.clock = clock;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .ticker(ticker)
                .expireAfter(new Expiry<CacheKey, CacheEntry>() {
                    @Override
                    public long expireAfterCreate(final CacheKey key, final CacheEntry value, final long currentTime) {
                        return value.ttl().toNanos();
                    }

                    @Override
                    public long expireAfterUpdate(final CacheKey key, final CacheEntry value,
                                                  final long currentTime, final long currentDuration) {
                        return value.ttl().toNanos();
                    }

                    @Override
                    public long expireAfterRead(final CacheKey key, final CacheEntry value,
                                                final long currentTime, final long currentDuration) {
                        return currentDuration;
                    }
                })
                .recordStats()
                .build();
        log.info("ResponseCache initialized: maxSize={}", maxSize);
    }

    public Optional<CacheEntry> get(final Query query, final SourceId source) {
        CacheEntry entry = cache.getIfPresent(new CacheKey(query.cacheKey(), source));
        if (entry != null) {
            log.debug("Cache hit: {} @ {} (negative={})", query.cacheKey(), source, entry.isNegative());
        }
        return Optional.ofNullable(entry);
    }

    /**
     * Stores a lookup result.
     *
     * @param record the record, or {@code null} for "source had nothing"
     */
    public void put(final Query query, final SourceId source, final PartialRecord record, final Duration ttl) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            return;
        }
        cache.put(new CacheKey(query.cacheKey(), source), new CacheEntry(record, clock.instant(), ttl));
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    public long hitCount() {
        return cache.stats().hitCount();
    }
}
