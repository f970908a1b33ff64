package com.futures.monitor.api;

import com.futures.monitor.config.MonitorConfig;
import com.futures.monitor.testing.Fixtures;
import com.futures.monitor.testing.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("BinanceFuturesGateway Tests")
class BinanceFuturesGatewayTest {

    private static final String ACCOUNT_JSON = """
        {"totalWalletBalance":"1000.0","availableBalance":"800.0","totalUnrealizedProfit":"50.0",
         "totalMarginBalance":"1050.0","totalMaintMargin":"10.0","totalInitialMargin":"200.0","assets":[]}
        """;

    @Mock
    private HttpClient httpClient;

    private MutableClock clock;
    private SimpleMeterRegistry meterRegistry;
    private BinanceFuturesGateway gateway;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-03-01T12:00:00Z");
        meterRegistry = new SimpleMeterRegistry();
        gateway = gatewayWith(Fixtures.config());
    }

    private BinanceFuturesGateway gatewayWith(MonitorConfig config) {
        return new BinanceFuturesGateway(config, httpClient, clock, clock::advance, meterRegistry);
    }

    @SuppressWarnings("unchecked")
    private static HttpResponse<String> response(int status, String body, Map<String, List<String>> headers) {
        HttpResponse<String> response = mock(HttpResponse.class);
        lenient().when(response.statusCode()).thenReturn(status);
        lenient().when(response.body()).thenReturn(body);
        lenient().when(response.headers()).thenReturn(HttpHeaders.of(headers, (k, v) -> true));
        return response;
    }

    private static HttpResponse<String> response(int status, String body) {
        return response(status, body, Map.of());
    }

    private HttpRequest lastRequest() throws Exception {
        var captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient, atLeastOnce()).send(captor.capture(), any());
        return captor.getValue();
    }

    @Nested
    @DisplayName("Successful calls")
    class Success {

        @Test
        @DisplayName("Should sign account requests and send the API key header")
        void signedRequest() throws Exception {
            doReturn(response(200, ACCOUNT_JSON)).when(httpClient).send(any(), any());

            RawPayload payload = gateway.fetch(Endpoint.ACCOUNT, Map.of());

            assertThat(payload.endpoint()).isEqualTo(Endpoint.ACCOUNT);
            assertThat(payload.body().path("totalWalletBalance").asText()).isEqualTo("1000.0");
            assertThat(payload.receivedAt()).isEqualTo(clock.instant());

            HttpRequest request = lastRequest();
            assertThat(request.uri().toString())
                .startsWith("https://testnet.binancefuture.com/fapi/v2/account?recvWindow=5000&timestamp=")
                .contains("&signature=");
            assertThat(request.headers().firstValue("X-MBX-APIKEY")).contains("test-api-key-0001");
        }

        @Test
        @DisplayName("Should call server time unsigned")
        void unsignedRequest() throws Exception {
            doReturn(response(200, "{\"serverTime\":1709294400000}")).when(httpClient).send(any(), any());

            assertThat(gateway.isReachable()).isTrue();

            HttpRequest request = lastRequest();
            assertThat(request.uri().toString()).isEqualTo("https://testnet.binancefuture.com/fapi/v1/time");
            assertThat(request.headers().firstValue("X-MBX-APIKEY")).isEmpty();
        }

        @Test
        @DisplayName("Should record call metrics")
        void metrics() throws Exception {
            doReturn(response(200, ACCOUNT_JSON)).when(httpClient).send(any(), any());

            gateway.fetch(Endpoint.ACCOUNT, Map.of());

            assertThat(meterRegistry.counter("monitor.gateway.success", "endpoint", "ACCOUNT").count()).isEqualTo(1.0);
            assertThat(meterRegistry.timer("monitor.gateway.call", "endpoint", "ACCOUNT").count()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Rate limits")
    class RateLimits {

        @Test
        @DisplayName("Should surface 429 with the Retry-After hint and gate the endpoint")
        void retryAfterGate() throws Exception {
            doReturn(response(429, "{\"code\":-1003,\"msg\":\"Too many requests\"}",
                Map.of("Retry-After", List.of("5")))).when(httpClient).send(any(), any());

            assertThatThrownBy(() -> gateway.fetch(Endpoint.INCOME, Map.of()))
                .isInstanceOfSatisfying(RateLimitException.class,
                    e -> assertThat(e.retryAfter()).isEqualTo(Duration.ofSeconds(5)));

            clock.advanceSeconds(3);
            assertThatThrownBy(() -> gateway.fetch(Endpoint.INCOME, Map.of()))
                .isInstanceOfSatisfying(RateLimitException.class,
                    e -> assertThat(e.retryAfter()).isEqualTo(Duration.ofSeconds(2)));
            verify(httpClient, times(1)).send(any(), any());

            clock.advanceSeconds(2);
            doReturn(response(200, "[]")).when(httpClient).send(any(), any());
            assertThat(gateway.fetch(Endpoint.INCOME, Map.of()).body().isArray()).isTrue();
            verify(httpClient, times(2)).send(any(), any());
        }

        @Test
        @DisplayName("Should only gate the endpoint that was rate limited")
        void gateIsPerEndpoint() throws Exception {
            HttpResponse<String> limited = response(429, "", Map.of("Retry-After", List.of("30")));
            HttpResponse<String> ok = response(200, ACCOUNT_JSON);
            doReturn(limited)
                .doReturn(ok)
                .when(httpClient).send(any(), any());

            assertThatThrownBy(() -> gateway.fetch(Endpoint.INCOME, Map.of()))
                .isInstanceOf(RateLimitException.class);

            assertThat(gateway.fetch(Endpoint.ACCOUNT, Map.of())).isNotNull();
            assertThat(gateway.remainingBackoff(Endpoint.INCOME)).contains(Duration.ofSeconds(30));
            assertThat(gateway.remainingBackoff(Endpoint.ACCOUNT)).isEmpty();
        }

        @Test
        @DisplayName("Should treat code -1003 as a rate limit with a default hint")
        void exchangeCode() throws Exception {
            doReturn(response(400, "{\"code\":-1003,\"msg\":\"Way too many requests\"}"))
                .when(httpClient).send(any(), any());

            assertThatThrownBy(() -> gateway.fetch(Endpoint.ACCOUNT, Map.of()))
                .isInstanceOfSatisfying(RateLimitException.class,
                    e -> assertThat(e.retryAfter()).isEqualTo(Duration.ofSeconds(1)));
        }
    }

    @Nested
    @DisplayName("Auth failures")
    class AuthFailures {

        @Test
        @DisplayName("Should latch after rejected credentials and stop calling the exchange")
        void latch() throws Exception {
            doReturn(response(401, "{\"code\":-2015,\"msg\":\"Invalid API-key, IP, or permissions for action.\"}"))
                .when(httpClient).send(any(), any());

            assertThatThrownBy(() -> gateway.fetch(Endpoint.ACCOUNT, Map.of()))
                .isInstanceOfSatisfying(AuthException.class,
                    e -> assertThat(e.exchangeCode()).isEqualTo(-2015));
            assertThatThrownBy(() -> gateway.fetch(Endpoint.POSITION_RISK, Map.of()))
                .isInstanceOf(AuthException.class);

            assertThat(gateway.isAuthFailed()).isTrue();
            verify(httpClient, times(1)).send(any(), any());
        }

        @Test
        @DisplayName("Should report clock skew as an auth failure")
        void clockSkew() throws Exception {
            doReturn(response(400, "{\"code\":-1021,\"msg\":\"Timestamp for this request is outside of the recvWindow.\"}"))
                .when(httpClient).send(any(), any());

            assertThatThrownBy(() -> gateway.fetch(Endpoint.ACCOUNT, Map.of()))
                .isInstanceOf(AuthException.class)
                .hasMessageContaining("Clock skew");
        }

        @Test
        @DisplayName("Should not retry auth failures even with retries enabled")
        void noRetry() throws Exception {
            var props = Fixtures.baseProperties();
            props.setProperty("TRANSIENT_MAX_RETRIES", "3");
            gateway = gatewayWith(MonitorConfig.forTest(props));
            doReturn(response(403, "")).when(httpClient).send(any(), any());

            assertThatThrownBy(() -> gateway.fetch(Endpoint.ACCOUNT, Map.of()))
                .isInstanceOf(AuthException.class);
            verify(httpClient, times(1)).send(any(), any());
        }
    }

    @Nested
    @DisplayName("Transient and protocol failures")
    class OtherFailures {

        @Test
        @DisplayName("Should map 5xx to a transient failure")
        void serverError() throws Exception {
            doReturn(response(503, "Service Unavailable")).when(httpClient).send(any(), any());

            assertThatThrownBy(() -> gateway.fetch(Endpoint.ACCOUNT, Map.of()))
                .isInstanceOf(TransientException.class)
                .hasMessageContaining("503");
            assertThat(meterRegistry.counter("monitor.gateway.failure",
                "endpoint", "ACCOUNT", "kind", "TRANSIENT").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should retry transient failures up to the configured ceiling")
        void transientRetried() throws Exception {
            var props = Fixtures.baseProperties();
            props.setProperty("TRANSIENT_MAX_RETRIES", "2");
            gateway = gatewayWith(MonitorConfig.forTest(props));
            HttpResponse<String> badGateway = response(502, "");
            HttpResponse<String> ok = response(200, ACCOUNT_JSON);
            doReturn(badGateway).doReturn(ok)
                .when(httpClient).send(any(), any());

            assertThat(gateway.fetch(Endpoint.ACCOUNT, Map.of())).isNotNull();
            verify(httpClient, times(2)).send(any(), any());
        }

        @Test
        @DisplayName("Should map timeouts and I/O errors to transient failures")
        void networkFailures() throws Exception {
            when(httpClient.send(any(), any()))
                .thenThrow(new HttpTimeoutException("request timed out"))
                .thenThrow(new IOException("connection reset"));

            assertThatThrownBy(() -> gateway.fetch(Endpoint.ACCOUNT, Map.of()))
                .isInstanceOf(TransientException.class)
                .hasMessageContaining("timed out");
            assertThatThrownBy(() -> gateway.fetch(Endpoint.ACCOUNT, Map.of()))
                .isInstanceOf(TransientException.class)
                .hasMessageContaining("connection reset");
        }

        @Test
        @DisplayName("Should map malformed JSON to a protocol failure")
        void malformedJson() throws Exception {
            doReturn(response(200, "{not json")).when(httpClient).send(any(), any());

            assertThatThrownBy(() -> gateway.fetch(Endpoint.ACCOUNT, Map.of()))
                .isInstanceOf(ProtocolException.class);
        }

        @Test
        @DisplayName("Should map other 4xx to a protocol failure")
        void badRequest() throws Exception {
            doReturn(response(400, "{\"code\":-1102,\"msg\":\"Mandatory parameter 'symbol' was not sent\"}"))
                .when(httpClient).send(any(), any());

            assertThatThrownBy(() -> gateway.fetch(Endpoint.USER_TRADES, Map.of()))
                .isInstanceOf(ProtocolException.class)
                .hasMessageContaining("-1102");
        }

        @Test
        @DisplayName("Should report unreachable exchange without throwing")
        void unreachable() throws Exception {
            when(httpClient.send(any(), any())).thenThrow(new IOException("no route to host"));

            assertThat(gateway.isReachable()).isFalse();
        }
    }
}
