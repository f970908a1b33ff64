package com.futures.monitor.cache;

import com.futures.monitor.api.ExchangeException;
import com.futures.monitor.api.RateLimitException;
import com.futures.monitor.api.TransientException;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Fetch-if-stale-else-return-cached, per cache key, with single-flight refreshes.
 *
 * <ul>
 *   <li>Fresh entry: returned immediately, no fetch.</li>
 *   <li>Expired, refresh already running: the previous value is returned stale right away;
 *       without a previous value the caller waits for the running refresh.</li>
 *   <li>Expired, nothing running: one refresh is started on the refresh executor and awaited.</li>
 *   <li>Key in rate-limit backoff: no fetch until the hint has elapsed.</li>
 * </ul>
 *
 * Refreshes run on their own threads so that a caller giving up (interrupt) does not abort
 * the fetch; the result still lands in the cache for the next caller.
 *
 * Invalidation detaches the affected refreshes: callers arriving afterwards start their own
 * instead of joining one that may be fetching with outdated credentials. A detached refresh
 * still hands its result to the callers already waiting on it, but never stores it.
 */
public class RefreshCoordinator implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(RefreshCoordinator.class);

    private final CacheStore store;
    private final StalenessPolicy stalenessPolicy;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final ExecutorService refreshExecutor;

    private final Map<CacheKey, CompletableFuture<?>> inFlight = new ConcurrentHashMap<>();
    private final Map<CacheKey, Instant> backoffUntil = new ConcurrentHashMap<>();

    public RefreshCoordinator(CacheStore store, StalenessPolicy stalenessPolicy, Clock clock,
                              MeterRegistry meterRegistry) {
        this(store, stalenessPolicy, clock, meterRegistry, Executors.newCachedThreadPool(refreshThreadFactory()));
    }

    public RefreshCoordinator(CacheStore store, StalenessPolicy stalenessPolicy, Clock clock,
                              MeterRegistry meterRegistry, ExecutorService refreshExecutor) {
        this.store = store;
        this.stalenessPolicy = stalenessPolicy;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        this.refreshExecutor = refreshExecutor;
    }

    /**
     * Return the cached value for the key, refreshing it through the fetcher when expired.
     *
     * @throws ExchangeException the original typed failure when no previous value exists
     */
    public <T> CacheResult<T> getOrRefresh(CacheKey key, Supplier<T> fetcher, Duration ttl) {
        Instant now = clock.instant();
        Optional<CacheEntry<T>> cached = store.get(key);

        if (cached.isPresent() && !cached.get().isExpired(now)) {
            record(key, "hit");
            logger.debug("Cache hit for {} (age {}ms)", key, cached.get().age(now).toMillis());
            return CacheResult.fresh(cached.get(), now);
        }

        Optional<Duration> backoff = remainingBackoff(key, now);
        if (backoff.isPresent()) {
            record(key, "backoff");
            return stalenessPolicy.onFailure(key, cached,
                new RateLimitException(key.toString(), backoff.get(),
                    "Rate limit backoff for " + key + ", " + backoff.get().toMillis() + "ms remaining"),
                now);
        }

        var promise = new CompletableFuture<CacheEntry<T>>();
        @SuppressWarnings("unchecked")
        var running = (CompletableFuture<CacheEntry<T>>) inFlight.putIfAbsent(key, promise);

        if (running != null) {
            if (cached.isPresent()) {
                // Someone is already refreshing; don't wait when there is something to show
                record(key, "stale-while-refreshing");
                return CacheResult.stale(cached.get().asStale(), now, null);
            }
            record(key, "joined");
            logger.debug("Joining in-flight refresh of {}", key);
            return await(key, running);
        }

        // A refresh may have stored its result between our read and putIfAbsent
        Optional<CacheEntry<T>> latest = store.get(key);
        if (latest.isPresent() && !latest.get().isExpired(clock.instant())) {
            inFlight.remove(key, promise);
            promise.complete(latest.get());
            record(key, "hit");
            return CacheResult.fresh(latest.get(), clock.instant());
        }

        record(key, "refresh");
        startRefresh(key, fetcher, ttl, promise);
        return await(key, promise);
    }

    public RefreshState stateOf(CacheKey key) {
        if (store.isFresh(key)) {
            return RefreshState.FRESH;
        }
        return inFlight.containsKey(key) ? RefreshState.EXPIRED_IN_FLIGHT : RefreshState.EXPIRED_NO_FLIGHT;
    }

    public void invalidate(CacheKey key) {
        inFlight.remove(key);
        store.invalidate(key);
    }

    public void invalidateCategory(DataCategory category) {
        inFlight.keySet().removeIf(key -> key.category() == category);
        store.invalidateCategory(category);
    }

    /**
     * Drop every cached value. Refreshes still running will not write their results.
     */
    public void invalidateAll() {
        inFlight.clear();
        store.invalidateAll();
        backoffUntil.clear();
    }

    public CacheStats stats() {
        return store.stats();
    }

    @Override
    public void close() {
        refreshExecutor.shutdown();
        try {
            if (!refreshExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                refreshExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            refreshExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private <T> void startRefresh(CacheKey key, Supplier<T> fetcher, Duration ttl,
                                  CompletableFuture<CacheEntry<T>> promise) {
        logger.info("🔄 Refreshing {}", key);

        Runnable refresh = () -> {
            try {
                T value = fetcher.get();
                CacheEntry<T> entry = storeIfOwner(key, value, ttl, promise);
                backoffUntil.remove(key);
                inFlight.remove(key, promise);
                promise.complete(entry);
            } catch (Throwable t) {
                ExchangeException failure = ExchangeException.wrap(key.toString(), t);
                if (failure instanceof RateLimitException rateLimited && inFlight.get(key) == promise) {
                    backoffUntil.put(key, clock.instant().plus(rateLimited.retryAfter()));
                }
                inFlight.remove(key, promise);
                promise.completeExceptionally(failure);
                if (t instanceof Error error) {
                    throw error;
                }
            }
        };

        try {
            refreshExecutor.execute(refresh);
        } catch (RuntimeException e) {
            inFlight.remove(key, promise);
            promise.completeExceptionally(new TransientException(key.toString(), "Refresh rejected", e));
        }
    }

    /**
     * Store the result only while this flight is still registered for the key. Invalidation
     * removes the flight before clearing the store, so a put racing an invalidation is undone.
     */
    private <T> CacheEntry<T> storeIfOwner(CacheKey key, T value, Duration ttl,
                                           CompletableFuture<CacheEntry<T>> promise) {
        if (inFlight.get(key) != promise) {
            logger.info("{} was invalidated during refresh, result not cached", key);
            return CacheEntry.fresh(value, clock.instant(), ttl);
        }
        CacheEntry<T> entry = store.put(key, value, ttl);
        if (inFlight.get(key) != promise) {
            store.invalidate(key);
        }
        return entry;
    }

    private <T> CacheResult<T> await(CacheKey key, CompletableFuture<CacheEntry<T>> flight) {
        try {
            CacheEntry<T> entry = flight.get();
            return CacheResult.fresh(entry, clock.instant());
        } catch (ExecutionException e) {
            ExchangeException failure = ExchangeException.wrap(key.toString(), e.getCause());
            record(key, "failure");
            Optional<CacheEntry<T>> prior = store.get(key);
            return stalenessPolicy.onFailure(key, prior, failure, clock.instant());
        } catch (InterruptedException e) {
            // The refresh keeps running and will populate the cache for the next caller
            Thread.currentThread().interrupt();
            Optional<CacheEntry<T>> prior = store.get(key);
            return stalenessPolicy.onFailure(key, prior,
                new TransientException(key.toString(), "Interrupted while waiting for refresh", e),
                clock.instant());
        }
    }

    private Optional<Duration> remainingBackoff(CacheKey key, Instant now) {
        Instant until = backoffUntil.get(key);
        if (until == null || !now.isBefore(until)) {
            return Optional.empty();
        }
        return Optional.of(Duration.between(now, until));
    }

    private void record(CacheKey key, String outcome) {
        meterRegistry.counter("monitor.cache.requests",
            "category", key.category().name(),
            "outcome", outcome).increment();
    }

    private static ThreadFactory refreshThreadFactory() {
        var counter = new AtomicInteger();
        return runnable -> {
            var thread = new Thread(runnable, "cache-refresh-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
