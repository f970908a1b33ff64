package com.futures.monitor.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.futures.monitor.config.MonitorConfig;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * BINANCE USD-M FUTURES GATEWAY
 *
 * Read-only access to the futures account API.
 *
 * Features:
 * - HMAC-SHA256 request signing with strictly increasing timestamps
 * - Per-endpoint sliding-window weight budget
 * - Per-endpoint backoff gate after rate-limit responses
 * - Retry policy by error kind (transient vs rate limit)
 * - Auth latch: once credentials are rejected, no further network calls are made
 *
 * One instance is bound to one credential pair. Rotation replaces the instance.
 */
public class BinanceFuturesGateway implements ExchangeGateway {
    private static final Logger logger = LoggerFactory.getLogger(BinanceFuturesGateway.class);

    private static final String API_KEY_HEADER = "X-MBX-APIKEY";
    private static final Duration DEFAULT_RETRY_AFTER = Duration.ofSeconds(1);
    private static final Duration WEIGHT_WINDOW = Duration.ofMinutes(1);

    // Exchange error codes
    private static final int CODE_TOO_MANY_REQUESTS = -1003;
    private static final int CODE_TIMESTAMP_OUTSIDE_WINDOW = -1021;
    private static final int CODE_INVALID_SIGNATURE = -1022;
    private static final int CODE_API_KEY_FORMAT = -2014;
    private static final int CODE_INVALID_KEY_IP_PERMISSIONS = -2015;

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final MonitorConfig config;
    private final RequestSigner signer;
    private final SlidingWindowWeightBudget weightBudget;
    private final RetryPolicy retryPolicy;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    private final Map<Endpoint, Instant> backoffUntil = new ConcurrentHashMap<>();
    private final AtomicReference<AuthException> authFailure = new AtomicReference<>();

    public BinanceFuturesGateway(MonitorConfig config, Clock clock, MeterRegistry meterRegistry) {
        this(config,
            HttpClient.newBuilder().connectTimeout(config.requestTimeout()).build(),
            clock,
            Sleeper.PARKING,
            meterRegistry);
    }

    public BinanceFuturesGateway(MonitorConfig config, HttpClient httpClient, Clock clock,
                                 Sleeper sleeper, MeterRegistry meterRegistry) {
        this.config = config;
        this.httpClient = httpClient;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        this.objectMapper = new ObjectMapper();
        this.signer = new RequestSigner(config.apiSecret(), clock, config.recvWindowMs());
        this.weightBudget = new SlidingWindowWeightBudget(
            config.weightLimitPerMinute(), WEIGHT_WINDOW, clock, sleeper);
        this.retryPolicy = new RetryPolicy(
            config.transientMaxRetries(), config.rateLimitMaxRetries(), config.transientBaseDelay());

        logger.info("Binance futures gateway initialized for {} (API Key: {})",
            config.baseUrl(), config.maskedApiKey());
    }

    @Override
    public RawPayload fetch(Endpoint endpoint, Map<String, String> params) {
        Timer timer = Timer.builder("monitor.gateway.call")
            .tag("endpoint", endpoint.name())
            .register(meterRegistry);

        try {
            RawPayload payload = timer.record(() ->
                retryPolicy.execute(endpoint.name(), () -> attempt(endpoint, params)));
            meterRegistry.counter("monitor.gateway.success", "endpoint", endpoint.name()).increment();
            return payload;
        } catch (ExchangeException e) {
            meterRegistry.counter("monitor.gateway.failure",
                "endpoint", endpoint.name(),
                "kind", e.kind().name()).increment();
            throw e;
        }
    }

    @Override
    public boolean isReachable() {
        try {
            fetch(Endpoint.SERVER_TIME, Map.of());
            return true;
        } catch (ExchangeException e) {
            logger.warn("Exchange not reachable: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Remaining backoff for an endpoint after a rate-limit response, if any.
     */
    public Optional<Duration> remainingBackoff(Endpoint endpoint) {
        Instant until = backoffUntil.get(endpoint);
        if (until == null) {
            return Optional.empty();
        }
        Duration remaining = Duration.between(clock.instant(), until);
        return remaining.isNegative() || remaining.isZero() ? Optional.empty() : Optional.of(remaining);
    }

    /**
     * Whether credentials were rejected and the gateway refuses further calls.
     */
    public boolean isAuthFailed() {
        return authFailure.get() != null;
    }

    private RawPayload attempt(Endpoint endpoint, Map<String, String> params) {
        AuthException latched = authFailure.get();
        if (latched != null) {
            throw latched;
        }

        Optional<Duration> remaining = remainingBackoff(endpoint);
        if (remaining.isPresent()) {
            throw new RateLimitException(endpoint.name(), remaining.get(),
                "Endpoint " + endpoint + " in rate limit backoff for " + remaining.get().toMillis() + "ms");
        }

        try {
            weightBudget.acquire(endpoint);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientException(endpoint.name(), "Interrupted while waiting for weight budget", e);
        }

        HttpResponse<String> response = send(endpoint, buildRequest(endpoint, params));
        return handleResponse(endpoint, response);
    }

    private HttpRequest buildRequest(Endpoint endpoint, Map<String, String> params) {
        String query = endpoint.signed() ? signer.signedQuery(params) : RequestSigner.encode(params);
        String url = config.baseUrl() + endpoint.path() + (query.isEmpty() ? "" : "?" + query);

        var builder = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .timeout(config.requestTimeout())
            .header("Accept", "application/json")
            .GET();
        if (endpoint.signed()) {
            builder.header(API_KEY_HEADER, config.apiKey());
        }
        return builder.build();
    }

    private HttpResponse<String> send(Endpoint endpoint, HttpRequest request) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new TransientException(endpoint.name(),
                "Request timed out after " + config.requestTimeout().toSeconds() + "s", e);
        } catch (IOException e) {
            throw new TransientException(endpoint.name(), "Network failure: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientException(endpoint.name(), "Interrupted during request", e);
        }
    }

    private RawPayload handleResponse(Endpoint endpoint, HttpResponse<String> response) {
        int status = response.statusCode();
        String body = response.body();

        if (status >= 200 && status < 300) {
            try {
                JsonNode json = objectMapper.readTree(body);
                if (json == null || json.isMissingNode()) {
                    throw new ProtocolException(endpoint.name(), "Empty response body");
                }
                return new RawPayload(endpoint, json, clock.instant());
            } catch (JsonProcessingException e) {
                throw new ProtocolException(endpoint.name(), "Malformed JSON response", e);
            }
        }

        ApiError error = parseError(body);

        if (status == 429 || status == 418 || error.code() == CODE_TOO_MANY_REQUESTS) {
            Duration retryAfter = retryAfter(response);
            backoffUntil.put(endpoint, clock.instant().plus(retryAfter));
            logger.warn("🛑 Rate limit on {} (HTTP {}), backing off {}s", endpoint, status, retryAfter.toSeconds());
            throw new RateLimitException(endpoint.name(), retryAfter,
                "Rate limited (HTTP " + status + "): " + error.message());
        }

        if (status == 401 || status == 403 || isAuthCode(error.code())) {
            var auth = new AuthException(endpoint.name(), error.code(), describeAuthFailure(error));
            authFailure.compareAndSet(null, auth);
            logger.error("❌ Credentials rejected on {}: {} - reconfigure credentials", endpoint, auth.getMessage());
            throw auth;
        }

        if (status >= 500) {
            throw new TransientException(endpoint.name(),
                "Server error " + status + ": " + error.message(), null);
        }

        throw new ProtocolException(endpoint.name(),
            "Request rejected with HTTP " + status + " code " + error.code() + ": " + error.message());
    }

    private static boolean isAuthCode(int code) {
        return code == CODE_TIMESTAMP_OUTSIDE_WINDOW
            || code == CODE_INVALID_SIGNATURE
            || code == CODE_API_KEY_FORMAT
            || code == CODE_INVALID_KEY_IP_PERMISSIONS;
    }

    private static String describeAuthFailure(ApiError error) {
        return switch (error.code()) {
            case CODE_TIMESTAMP_OUTSIDE_WINDOW ->
                "Clock skew beyond receive window. Sync system clock: " + error.message();
            case CODE_INVALID_SIGNATURE -> "Invalid signature. Check API secret: " + error.message();
            case CODE_API_KEY_FORMAT, CODE_INVALID_KEY_IP_PERMISSIONS ->
                "API key rejected. Check key, IP whitelist and permissions: " + error.message();
            default -> "Unauthorized: " + error.message();
        };
    }

    private static Duration retryAfter(HttpResponse<String> response) {
        return response.headers().firstValue("Retry-After")
            .flatMap(BinanceFuturesGateway::parseSeconds)
            .orElse(DEFAULT_RETRY_AFTER);
    }

    private static Optional<Duration> parseSeconds(String value) {
        try {
            long seconds = Long.parseLong(value.trim());
            return seconds >= 0 ? Optional.of(Duration.ofSeconds(seconds)) : Optional.empty();
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private ApiError parseError(String body) {
        if (body == null || body.isBlank()) {
            return new ApiError(0, "empty body");
        }
        try {
            JsonNode json = objectMapper.readTree(body);
            return new ApiError(json.path("code").asInt(0), json.path("msg").asText(body));
        } catch (JsonProcessingException e) {
            return new ApiError(0, body);
        }
    }

    private record ApiError(int code, String message) {}
}
