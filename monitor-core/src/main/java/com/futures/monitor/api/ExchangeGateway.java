package com.futures.monitor.api;

import java.util.Map;

/**
 * Authenticated, rate-limit aware access to the exchange account API.
 * Implementations own signing, retry and request pacing.
 */
public interface ExchangeGateway {

    /**
     * Issue a request and return its parsed body.
     *
     * @throws AuthException credentials rejected or clock skew
     * @throws RateLimitException rate limit hit; carries the retry-after hint
     * @throws TransientException network failure, timeout or server error
     * @throws ProtocolException malformed or unexpected response
     */
    RawPayload fetch(Endpoint endpoint, Map<String, String> params);

    /**
     * Check connectivity with an unsigned call.
     */
    boolean isReachable();
}
