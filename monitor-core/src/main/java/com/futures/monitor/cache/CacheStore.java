package com.futures.monitor.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keyed store of immutable cache entries with per-key TTL.
 *
 * Entries are replaced as whole tuples, so a reader sees either the old or the new entry.
 * Values handed out must be immutable; the store never exposes a mutable reference.
 *
 * An expired entry stays available as stale fallback until it is {@code retentionFactor}
 * TTLs old. After that it is evicted: on lookup, and by a sweep on every put and stats call.
 */
public class CacheStore {
    private static final Logger logger = LoggerFactory.getLogger(CacheStore.class);

    public static final int DEFAULT_RETENTION_FACTOR = 10;

    private final Map<CacheKey, CacheEntry<?>> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final int retentionFactor;

    public CacheStore(Clock clock) {
        this(clock, DEFAULT_RETENTION_FACTOR);
    }

    public CacheStore(Clock clock, int retentionFactor) {
        if (retentionFactor < 1) {
            throw new IllegalArgumentException("Retention factor must be at least 1: " + retentionFactor);
        }
        this.clock = clock;
        this.retentionFactor = retentionFactor;
    }

    @SuppressWarnings("unchecked")
    public <T> Optional<CacheEntry<T>> get(CacheKey key) {
        CacheEntry<T> entry = (CacheEntry<T>) entries.get(key);
        if (entry != null && entry.isEvictable(clock.instant(), retentionFactor)) {
            entries.remove(key, entry);
            logger.debug("Evicted {} on lookup", key);
            return Optional.empty();
        }
        return Optional.ofNullable(entry);
    }

    public <T> CacheEntry<T> put(CacheKey key, T value, Duration ttl) {
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("TTL must be positive for " + key);
        }
        var entry = CacheEntry.fresh(value, clock.instant(), ttl);
        entries.put(key, entry);
        evictExpired();
        return entry;
    }

    public boolean isFresh(CacheKey key) {
        CacheEntry<?> entry = entries.get(key);
        return entry != null && !entry.isExpired(clock.instant());
    }

    public void invalidate(CacheKey key) {
        if (entries.remove(key) != null) {
            logger.debug("Invalidated {}", key);
        }
    }

    public void invalidateCategory(DataCategory category) {
        entries.keySet().removeIf(key -> key.category() == category);
        logger.debug("Invalidated category {}", category);
    }

    public void invalidateGroup(DataCategory.Group group) {
        entries.keySet().removeIf(key -> key.category().group() == group);
        logger.debug("Invalidated group {}", group);
    }

    public void invalidateAll() {
        int count = entries.size();
        entries.clear();
        logger.info("Invalidated all {} cache entries", count);
    }

    /**
     * Drop entries past their stale retention window.
     *
     * @return number of entries evicted
     */
    public int evictExpired() {
        Instant now = clock.instant();
        int evicted = 0;
        for (var it = entries.values().iterator(); it.hasNext(); ) {
            if (it.next().isEvictable(now, retentionFactor)) {
                it.remove();
                evicted++;
            }
        }
        if (evicted > 0) {
            logger.debug("Evicted {} expired cache entries", evicted);
        }
        return evicted;
    }

    public CacheStats stats() {
        evictExpired();
        Instant now = clock.instant();
        int total = 0;
        int expired = 0;
        for (CacheEntry<?> entry : entries.values()) {
            total++;
            if (entry.isExpired(now)) {
                expired++;
            }
        }
        return new CacheStats(total, expired, total - expired);
    }
}
