package com.futures.monitor.cache;

/**
 * Refresh state of a single cache key.
 *
 * <pre>
 * EXPIRED_NO_FLIGHT --fetch start--> EXPIRED_IN_FLIGHT
 * EXPIRED_IN_FLIGHT --success------> FRESH
 * EXPIRED_IN_FLIGHT --failure------> EXPIRED_NO_FLIGHT
 * FRESH             --ttl elapses--> EXPIRED_NO_FLIGHT
 * any               --invalidate---> EXPIRED_NO_FLIGHT (a running fetch is detached)
 * </pre>
 */
public enum RefreshState {
    FRESH,
    EXPIRED_NO_FLIGHT,
    EXPIRED_IN_FLIGHT
}
