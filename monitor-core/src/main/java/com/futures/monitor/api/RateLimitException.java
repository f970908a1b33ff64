package com.futures.monitor.api;

import java.time.Duration;

public class RateLimitException extends ExchangeException {
    private final Duration retryAfter;

    public RateLimitException(String endpoint, Duration retryAfter, String message) {
        super(endpoint, message, null);
        this.retryAfter = retryAfter;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.RATE_LIMIT;
    }

    /**
     * Minimum time to wait before the same endpoint may be called again.
     */
    public Duration retryAfter() {
        return retryAfter;
    }
}
