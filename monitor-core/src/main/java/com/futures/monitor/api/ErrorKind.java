package com.futures.monitor.api;

/**
 * Failure taxonomy for calls to the exchange.
 */
public enum ErrorKind {
    /** Bad or expired credentials, or clock skew beyond the receive window. Never retried. */
    AUTH,
    /** HTTP 429/418 or exchange rate-limit code. Retried after the hinted delay. */
    RATE_LIMIT,
    /** Network failure, timeout or 5xx. Retried with exponential backoff. */
    TRANSIENT,
    /** Malformed or unexpected response. Never retried. */
    PROTOCOL
}
