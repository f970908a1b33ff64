package com.futures.monitor.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * Immutable cache tuple. {@code stale} is set when the value is served past its TTL
 * because a refresh failed or is still running.
 */
public record CacheEntry<T>(T value, Instant fetchedAt, Duration ttl, boolean stale) {

    public static <T> CacheEntry<T> fresh(T value, Instant fetchedAt, Duration ttl) {
        return new CacheEntry<>(value, fetchedAt, ttl, false);
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(fetchedAt.plus(ttl));
    }

    /**
     * True once the entry is too old to be worth serving even as a stale fallback.
     */
    public boolean isEvictable(Instant now, int retentionFactor) {
        return !now.isBefore(fetchedAt.plus(ttl.multipliedBy(retentionFactor)));
    }

    public Duration age(Instant now) {
        Duration age = Duration.between(fetchedAt, now);
        return age.isNegative() ? Duration.ZERO : age;
    }

    public CacheEntry<T> asStale() {
        return stale ? this : new CacheEntry<>(value, fetchedAt, ttl, true);
    }
}
