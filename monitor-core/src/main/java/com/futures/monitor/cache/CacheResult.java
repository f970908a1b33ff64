package com.futures.monitor.cache;

import com.futures.monitor.api.ErrorKind;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Function;

/**
 * What a consumer receives for a dataset: the value, whether it is stale, when it was fetched,
 * and, for stale results, what prevented the refresh.
 *
 * <p>A stale result must not drive alerting thresholds (liquidation warnings, margin alerts)
 * unless the caller has checked {@link #stale()} first. The core does not enforce this.
 */
public record CacheResult<T>(T value, boolean stale, Instant fetchedAt, Duration age, Optional<ErrorKind> failure) {

    public static <T> CacheResult<T> fresh(CacheEntry<T> entry, Instant now) {
        return new CacheResult<>(entry.value(), false, entry.fetchedAt(), entry.age(now), Optional.empty());
    }

    public static <T> CacheResult<T> stale(CacheEntry<T> entry, Instant now, ErrorKind failure) {
        return new CacheResult<>(entry.value(), true, entry.fetchedAt(), entry.age(now), Optional.ofNullable(failure));
    }

    /**
     * Same freshness metadata, transformed value.
     */
    public <R> CacheResult<R> map(Function<? super T, ? extends R> mapper) {
        return new CacheResult<>(mapper.apply(value), stale, fetchedAt, age, failure);
    }
}
