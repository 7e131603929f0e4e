package com.fragrance.enrichment.service.core;

import lombok.Getter;

import java.time.Duration;

/**
 * Pacing state of one source: when the last request slot was granted, the
 * configured minimum spacing and the current backoff multiplier.
 * All mutators are synchronised on the instance, so each source has its own lock.
 */
@Getter
public class RateBudget {

    private final Duration minInterval;

    /** Epoch millis of the most recently granted slot, or -1 before the first one. */
    private long lastGrantedAt = -1L;

    private int multiplier = 1;

    public RateBudget(final Duration minInterval) {
        if (minInterval == null || minInterval.isNegative()) {
            throw new IllegalArgumentException("minInterval must be >= 0");
        }
        this.minInterval = minInterval;
    }

    /**
     * Books the next free slot at or after {@code nowMillis} and records it as
     * granted.
     *
     * @return how long the caller must wait before using the slot, in millis
     */
    synchronized long reserve(final long nowMillis) {
        long slot = nowMillis;
        if (lastGrantedAt >= 0) {
            slot = Math.max(nowMillis, lastGrantedAt + currentIntervalMillis());
        }
        lastGrantedAt = slot;
        return slot - nowMillis;
    }

    synchronized void failure(final int ceiling) {
        multiplier = Math.min(multiplier * 2, ceiling);
    }

    synchronized void success() {
        multiplier = 1;
    }

    public synchronized long currentIntervalMillis() {
        return minInterval.toMillis() * multiplier;
    }

    public synchronized int getMultiplier() {
        return multiplier;
    }

    public synchronized long getLastGrantedAt() {
        return lastGrantedAt;
    }
}
