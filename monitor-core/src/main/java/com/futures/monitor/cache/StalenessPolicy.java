package com.futures.monitor.cache;

import com.futures.monitor.api.ExchangeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Optional;

/**
 * Decides what a failed refresh returns.
 *
 * With a previous value: that value, flagged stale, with its age and the failure kind.
 * Without one: the original typed exception, unchanged.
 */
public class StalenessPolicy {
    private static final Logger logger = LoggerFactory.getLogger(StalenessPolicy.class);

    public <T> CacheResult<T> onFailure(CacheKey key, Optional<CacheEntry<T>> prior,
                                        ExchangeException failure, Instant now) {
        if (prior.isEmpty()) {
            logger.warn("Refresh of {} failed with no cached value ({}): {}",
                key, failure.kind(), failure.getMessage());
            throw failure;
        }
        CacheEntry<T> entry = prior.get();
        logger.warn("Refresh of {} failed ({}), serving value from {}s ago",
            key, failure.kind(), entry.age(now).toSeconds());
        return CacheResult.stale(entry.asStale(), now, failure.kind());
    }
}
