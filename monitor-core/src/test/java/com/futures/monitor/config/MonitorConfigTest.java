package com.futures.monitor.config;

import com.futures.monitor.testing.Fixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Properties;

import static org.assertj.core.api.Assertions.*;

@DisplayName("MonitorConfig Tests")
class MonitorConfigTest {

    @Nested
    @DisplayName("Defaults")
    class Defaults {

        @Test
        @DisplayName("Should apply per-category TTL defaults")
        void cacheTtlDefaults() {
            var props = new Properties();
            props.setProperty("BINANCE_API_KEY", "key");
            props.setProperty("BINANCE_SECRET_KEY", "secret");

            MonitorConfig config = MonitorConfig.forTest(props);

            assertThat(config.accountTtl()).isEqualTo(Duration.ofSeconds(30));
            assertThat(config.positionsTtl()).isEqualTo(Duration.ofSeconds(30));
            assertThat(config.tradesTtl()).isEqualTo(Duration.ofSeconds(60));
            assertThat(config.incomeTtl()).isEqualTo(Duration.ofSeconds(300));
        }

        @Test
        @DisplayName("Should default retry ceilings and risk threshold")
        void retryAndRiskDefaults() {
            var props = new Properties();
            props.setProperty("BINANCE_API_KEY", "key");
            props.setProperty("BINANCE_SECRET_KEY", "secret");

            MonitorConfig config = MonitorConfig.forTest(props);

            assertThat(config.transientMaxRetries()).isEqualTo(3);
            assertThat(config.rateLimitMaxRetries()).isEqualTo(2);
            assertThat(config.transientBaseDelay()).isEqualTo(Duration.ofMillis(500));
            assertThat(config.marginRatioAlertThreshold()).isEqualTo(0.8);
            assertThat(config.requestTimeout()).isEqualTo(Duration.ofSeconds(30));
            assertThat(config.baseCurrency()).isEqualTo("USDT");
        }

        @Test
        @DisplayName("Should pick the base URL from the testnet switch")
        void baseUrlFollowsTestnet() {
            var props = new Properties();
            props.setProperty("BINANCE_API_KEY", "key");
            props.setProperty("BINANCE_SECRET_KEY", "secret");
            assertThat(MonitorConfig.forTest(props).baseUrl()).isEqualTo("https://fapi.binance.com");

            props.setProperty("USE_TESTNET", "true");
            assertThat(MonitorConfig.forTest(props).baseUrl()).isEqualTo("https://testnet.binancefuture.com");
        }
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("Should reject missing credentials")
        void missingCredentials() {
            assertThatThrownBy(() -> MonitorConfig.forTest(new Properties()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("apiKey")
                .hasMessageContaining("apiSecret");
        }

        @Test
        @DisplayName("Should reject a non-HTTPS base URL")
        void plainHttpRejected() {
            var props = Fixtures.baseProperties();
            props.setProperty("BINANCE_BASE_URL", "http://localhost:8080");

            assertThatThrownBy(() -> MonitorConfig.forTest(props))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("HTTPS");
        }

        @Test
        @DisplayName("Should reject a zero TTL")
        void zeroTtlRejected() {
            var props = Fixtures.baseProperties();
            props.setProperty("ACCOUNT_TTL_SECONDS", "0");

            assertThatThrownBy(() -> MonitorConfig.forTest(props))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("accountTtlSeconds");
        }

        @Test
        @DisplayName("Should report unparsable numbers with their key")
        void badNumber() {
            var props = Fixtures.baseProperties();
            props.setProperty("TRANSIENT_MAX_RETRIES", "three");

            assertThatThrownBy(() -> MonitorConfig.forTest(props))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("TRANSIENT_MAX_RETRIES");
        }

        @Test
        @DisplayName("Should reject integer settings that overflow instead of truncating them")
        void intOverflowRejected() {
            var props = Fixtures.baseProperties();
            props.setProperty("TRADE_WINDOW_SIZE", "4294967297");

            assertThatThrownBy(() -> MonitorConfig.forTest(props))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("TRADE_WINDOW_SIZE")
                .hasMessageContaining("4294967297");
        }
    }

    @Test
    @DisplayName("Should rotate credentials into a new instance")
    void withCredentials() {
        MonitorConfig original = Fixtures.config();

        MonitorConfig rotated = original.withCredentials("rotated-key-9999", "rotated-secret");

        assertThat(rotated).isNotSameAs(original);
        assertThat(rotated.apiKey()).isEqualTo("rotated-key-9999");
        assertThat(rotated.apiSecret()).isEqualTo("rotated-secret");
        assertThat(rotated.baseUrl()).isEqualTo(original.baseUrl());
        assertThat(original.apiKey()).isEqualTo("test-api-key-0001");
    }

    @Test
    @DisplayName("Should mask the API key for logging")
    void maskedApiKey() {
        assertThat(Fixtures.config().maskedApiKey()).isEqualTo("test-api...");
    }
}
