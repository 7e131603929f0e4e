package com.fragrance.enrichment.service.core;

import com.fragrance.enrichment.model.SourceId;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * <h2>Per-source pacing and backoff</h2>
 *
 * <p>{@link #acquire(SourceId)} blocks until the source's minimum interval
 * (scaled by its backoff multiplier) has passed since the previously granted
 * request. Slots are reserved under the source's own lock and waited for
 * outside of it, so concurrent callers queue up in reservation order and one
 * slow source never holds up the other.</p>
 *
 * <p>{@link #reportFailure(SourceId)} doubles the multiplier up to the
 * configured ceiling; {@link #reportSuccess(SourceId)} resets it to 1.
 * Bookkeeping survives cancelled requests: a reserved slot stays reserved.</p>
 */
@Slf4j
public class RateLimiter {

    /**
     * Sleeping strategy, replaceable in tests.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final Map<SourceId, RateBudget> budgets;

    private final int maxBackoffMultiplier;

    private final Clock clock;

    private final Sleeper sleeper;

    public RateLimiter(final Map<SourceId, Duration> minIntervals, final int maxBackoffMultiplier) {
        this(minIntervals, maxBackoffMultiplier, Clock.systemUTC(), d -> Thread.sleep(d.toMillis()));
    }

    public RateLimiter(final Map<SourceId, Duration> minIntervals,
                       final int maxBackoffMultiplier,
                       final Clock clock,
                       final Sleeper sleeper) {
        if (maxBackoffMultiplier < 1) {
            throw new IllegalArgumentException("maxBackoffMultiplier must be >= 1");
        }
        Map<SourceId, RateBudget> map = new EnumMap<>(SourceId.class);
        for (SourceId source : SourceId.values()) {
            map.put(source, new RateBudget(minIntervals.getOrDefault(source, Duration.ZERO)));
        }
        this.budgets = Collections.unmodifiableMap(map);
        this.maxBackoffMultiplier = maxBackoffMultiplier;
        this.clock = Objects.requireNonNull(clock);
        this.sleeper = Objects.requireNonNull(sleeper);
    }

    /**
     * Waits for the next request slot of {@code source} and claims it.
     *
     * @param source source about to be called
     * @throws LimiterInterruptedException if the waiting thread is interrupted
     */
    public void acquire(final SourceId source) {
        long waitMillis = budget(source).reserve(clock.millis());
        if (waitMillis <= 0) {
            return;
        }
        log.debug("Rate limiting {}: waiting {}ms", source, waitMillis);
        try {
            sleeper.sleep(Duration.ofMillis(waitMillis));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LimiterInterruptedException("Interrupted while waiting for " + source, e);
        }
    }

    public void reportFailure(final SourceId source) {
        RateBudget b = budget(source);
        b.failure(maxBackoffMultiplier);
        log.debug("Backoff for {} raised to x{}", source, b.getMultiplier());
    }

    public void reportSuccess(final SourceId source) {
        budget(source).success();
    }

    public RateBudget budget(final SourceId source) {
        return budgets.get(source);
    }
}
