package com.futures.monitor.api;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Retry policy for exchange calls, parameterized by error kind.
 *
 * Transient failures are retried with exponential backoff; rate-limit failures are retried
 * after the hinted delay; auth and protocol failures are surfaced on the first occurrence.
 * Each kind has its own ceiling, after which the last typed exception propagates unchanged.
 */
public final class RetryPolicy {
    private static final Logger logger = LoggerFactory.getLogger(RetryPolicy.class);
    private static final double BACKOFF_MULTIPLIER = 2.0;

    private final int transientMaxRetries;
    private final int rateLimitMaxRetries;
    private final Duration transientBaseDelay;

    public RetryPolicy(int transientMaxRetries, int rateLimitMaxRetries, Duration transientBaseDelay) {
        if (transientMaxRetries < 0 || rateLimitMaxRetries < 0) {
            throw new IllegalArgumentException("Retry ceilings must not be negative");
        }
        this.transientMaxRetries = transientMaxRetries;
        this.rateLimitMaxRetries = rateLimitMaxRetries;
        this.transientBaseDelay = transientBaseDelay;
    }

    /**
     * Run the call under the policy. Chain: rate-limit retry -> transient retry -> call.
     */
    public <T> T execute(String operation, Supplier<T> call) {
        Retry transientRetry = Retry.of(operation + "-transient", transientConfig());
        Retry rateLimitRetry = Retry.of(operation + "-rate-limit", rateLimitConfig());

        transientRetry.getEventPublisher().onRetry(event ->
            logger.warn("{} failed transiently (attempt {}/{}), retrying in {}ms: {}",
                operation, event.getNumberOfRetryAttempts(), transientMaxRetries,
                event.getWaitInterval().toMillis(), messageOf(event.getLastThrowable())));
        rateLimitRetry.getEventPublisher().onRetry(event ->
            logger.warn("{} rate limited (attempt {}/{}), backing off {}ms",
                operation, event.getNumberOfRetryAttempts(), rateLimitMaxRetries,
                event.getWaitInterval().toMillis()));

        Supplier<T> decorated = Retry.decorateSupplier(rateLimitRetry,
            Retry.decorateSupplier(transientRetry, call));
        return decorated.get();
    }

    private RetryConfig transientConfig() {
        return RetryConfig.custom()
            .maxAttempts(transientMaxRetries + 1)
            .intervalFunction(IntervalFunction.ofExponentialBackoff(
                Math.max(1, transientBaseDelay.toMillis()), BACKOFF_MULTIPLIER))
            .retryOnException(e -> e instanceof TransientException)
            .build();
    }

    private RetryConfig rateLimitConfig() {
        return RetryConfig.custom()
            .maxAttempts(rateLimitMaxRetries + 1)
            .intervalBiFunction((attempt, outcome) -> {
                if (outcome.isLeft() && outcome.getLeft() instanceof RateLimitException rateLimited) {
                    return Math.max(1L, rateLimited.retryAfter().toMillis());
                }
                return 1000L;
            })
            .retryOnException(e -> e instanceof RateLimitException)
            .build();
    }

    private static String messageOf(Throwable throwable) {
        return throwable != null ? throwable.getMessage() : "unknown";
    }
}
