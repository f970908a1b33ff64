package com.futures.monitor.config;

import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import java.util.Properties;

/**
 * Immutable configuration for the futures account monitor.
 *
 * Values are resolved from environment variables first, then from
 * {@code monitor.properties} in the working directory, then defaults.
 * Credentials are never mutated: rotation goes through {@link #withCredentials}
 * which yields a new instance.
 */
public final class MonitorConfig {
    private static final Logger logger = LoggerFactory.getLogger(MonitorConfig.class);
    private static final String CONFIG_FILE = "monitor.properties";

    static final String MAINNET_BASE_URL = "https://fapi.binance.com";
    static final String TESTNET_BASE_URL = "https://testnet.binancefuture.com";

    @NotBlank(message = "API key is required")
    private final String apiKey;

    @NotBlank(message = "API secret is required")
    private final String apiSecret;

    private final boolean useTestnet;

    @NotBlank(message = "Base currency is required")
    private final String baseCurrency;

    @Min(value = 1, message = "Request timeout must be at least 1 second")
    private final long requestTimeoutSeconds;

    @Min(value = 1, message = "recvWindow must be positive")
    private final long recvWindowMs;

    // Cache TTLs per data category (account data changes fastest, income slowest)
    @Min(1) private final long accountTtlSeconds;
    @Min(1) private final long positionsTtlSeconds;
    @Min(1) private final long tradesTtlSeconds;
    @Min(1) private final long incomeTtlSeconds;

    // Expired entries are kept as stale fallback for this many TTLs, then evicted
    @Min(1) private final int staleRetentionFactor;

    // Retry ceilings before a failure is surfaced to the caller
    @Min(0) private final int transientMaxRetries;
    @Min(0) private final int rateLimitMaxRetries;
    @Min(1) private final long transientBaseDelayMs;

    @Min(value = 1, message = "Weight limit must be positive")
    private final int weightLimitPerMinute;

    @DecimalMin("0.0")
    private final double marginRatioAlertThreshold;

    @Min(1) private final int tradeWindowSize;

    @Pattern(regexp = "^https://.*", message = "Base URL must use HTTPS")
    private final String baseUrl;

    private MonitorConfig(Properties props, boolean readEnvironment) {
        var source = new Source(props, readEnvironment);
        this.apiKey = source.get("BINANCE_API_KEY", null);
        this.apiSecret = source.get("BINANCE_SECRET_KEY", null);
        this.useTestnet = Boolean.parseBoolean(source.get("USE_TESTNET", "false"));
        this.baseCurrency = source.get("BASE_CURRENCY", "USDT");
        this.requestTimeoutSeconds = source.getLong("REQUEST_TIMEOUT_SECONDS", 30);
        this.recvWindowMs = source.getLong("RECV_WINDOW_MS", 5000);
        this.accountTtlSeconds = source.getLong("ACCOUNT_TTL_SECONDS", 30);
        this.positionsTtlSeconds = source.getLong("POSITIONS_TTL_SECONDS", 30);
        this.tradesTtlSeconds = source.getLong("TRADES_TTL_SECONDS", 60);
        this.incomeTtlSeconds = source.getLong("INCOME_TTL_SECONDS", 300);
        this.staleRetentionFactor = source.getInt("STALE_RETENTION_FACTOR", 10);
        this.transientMaxRetries = source.getInt("TRANSIENT_MAX_RETRIES", 3);
        this.rateLimitMaxRetries = source.getInt("RATE_LIMIT_MAX_RETRIES", 2);
        this.transientBaseDelayMs = source.getLong("TRANSIENT_BASE_DELAY_MS", 500);
        this.weightLimitPerMinute = source.getInt("WEIGHT_LIMIT_PER_MINUTE", 2400);
        this.marginRatioAlertThreshold = source.getDouble("MARGIN_RATIO_ALERT_THRESHOLD", 0.8);
        this.tradeWindowSize = source.getInt("TRADE_WINDOW_SIZE", 1000);
        this.baseUrl = source.get("BINANCE_BASE_URL", useTestnet ? TESTNET_BASE_URL : MAINNET_BASE_URL);
    }

    private MonitorConfig(MonitorConfig other, String apiKey, String apiSecret) {
        this.apiKey = apiKey;
        this.apiSecret = apiSecret;
        this.useTestnet = other.useTestnet;
        this.baseCurrency = other.baseCurrency;
        this.requestTimeoutSeconds = other.requestTimeoutSeconds;
        this.recvWindowMs = other.recvWindowMs;
        this.accountTtlSeconds = other.accountTtlSeconds;
        this.positionsTtlSeconds = other.positionsTtlSeconds;
        this.tradesTtlSeconds = other.tradesTtlSeconds;
        this.incomeTtlSeconds = other.incomeTtlSeconds;
        this.staleRetentionFactor = other.staleRetentionFactor;
        this.transientMaxRetries = other.transientMaxRetries;
        this.rateLimitMaxRetries = other.rateLimitMaxRetries;
        this.transientBaseDelayMs = other.transientBaseDelayMs;
        this.weightLimitPerMinute = other.weightLimitPerMinute;
        this.marginRatioAlertThreshold = other.marginRatioAlertThreshold;
        this.tradeWindowSize = other.tradeWindowSize;
        this.baseUrl = other.baseUrl;
    }

    /**
     * Load from environment and {@code monitor.properties}, then validate.
     */
    public static MonitorConfig load() {
        var config = new MonitorConfig(loadProperties(), true);
        config.validate();
        logger.info("Configuration loaded: testnet={}, baseCurrency={}, timeout={}s",
            config.useTestnet, config.baseCurrency, config.requestTimeoutSeconds);
        return config;
    }

    /**
     * Build a validated configuration from explicit properties only.
     * The environment is not consulted.
     */
    public static MonitorConfig forTest(Properties props) {
        var config = new MonitorConfig(props, false);
        config.validate();
        return config;
    }

    /**
     * Copy of this configuration bound to a different credential pair.
     */
    public MonitorConfig withCredentials(String newApiKey, String newApiSecret) {
        var rotated = new MonitorConfig(this, newApiKey, newApiSecret);
        rotated.validate();
        return rotated;
    }

    private static Properties loadProperties() {
        var props = new Properties();
        var file = Path.of(CONFIG_FILE);
        if (!Files.exists(file)) {
            logger.debug("No {} found, using environment and defaults", CONFIG_FILE);
            return props;
        }
        try (var reader = Files.newBufferedReader(file)) {
            props.load(reader);
            logger.debug("Loaded properties from {}", CONFIG_FILE);
        } catch (IOException e) {
            throw new IllegalStateException("Could not read " + CONFIG_FILE, e);
        }
        return props;
    }

    /**
     * Validate configuration using Bean Validation.
     * Throws IllegalStateException if validation fails.
     */
    private void validate() {
        Validator validator = Validation.buildDefaultValidatorFactory().getValidator();
        var violations = validator.validate(this);

        if (!violations.isEmpty()) {
            var errorMessages = violations.stream()
                .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                .sorted()
                .toList();

            throw new IllegalStateException(
                "Configuration validation failed: " + String.join(", ", errorMessages)
            );
        }
    }

    public String apiKey() {
        return apiKey;
    }

    public String apiSecret() {
        return apiSecret;
    }

    public boolean useTestnet() {
        return useTestnet;
    }

    public String baseCurrency() {
        return baseCurrency;
    }

    public String baseUrl() {
        return baseUrl;
    }

    public Duration requestTimeout() {
        return Duration.ofSeconds(requestTimeoutSeconds);
    }

    public long recvWindowMs() {
        return recvWindowMs;
    }

    public Duration accountTtl() {
        return Duration.ofSeconds(accountTtlSeconds);
    }

    public Duration positionsTtl() {
        return Duration.ofSeconds(positionsTtlSeconds);
    }

    public Duration tradesTtl() {
        return Duration.ofSeconds(tradesTtlSeconds);
    }

    public Duration incomeTtl() {
        return Duration.ofSeconds(incomeTtlSeconds);
    }

    public int staleRetentionFactor() {
        return staleRetentionFactor;
    }

    public int transientMaxRetries() {
        return transientMaxRetries;
    }

    public int rateLimitMaxRetries() {
        return rateLimitMaxRetries;
    }

    public Duration transientBaseDelay() {
        return Duration.ofMillis(transientBaseDelayMs);
    }

    public int weightLimitPerMinute() {
        return weightLimitPerMinute;
    }

    public double marginRatioAlertThreshold() {
        return marginRatioAlertThreshold;
    }

    public int tradeWindowSize() {
        return tradeWindowSize;
    }

    /**
     * API key prefix safe for logging.
     */
    public String maskedApiKey() {
        return apiKey.substring(0, Math.min(8, apiKey.length())) + "...";
    }

    private static final class Source {
        private final Properties properties;
        private final boolean readEnvironment;

        Source(Properties properties, boolean readEnvironment) {
            this.properties = properties;
            this.readEnvironment = readEnvironment;
        }

        String get(String key, String defaultValue) {
            var fromEnv = readEnvironment ? Optional.ofNullable(System.getenv(key)) : Optional.<String>empty();
            return fromEnv
                .or(() -> Optional.ofNullable(properties.getProperty(key)))
                .map(String::trim)
                .orElse(defaultValue);
        }

        long getLong(String key, long defaultValue) {
            var value = get(key, null);
            if (value == null || value.isEmpty()) {
                return defaultValue;
            }
            try {
                return Long.parseLong(value);
            } catch (NumberFormatException e) {
                throw new IllegalStateException("Invalid number for " + key + ": " + value, e);
            }
        }

        int getInt(String key, int defaultValue) {
            long value = getLong(key, defaultValue);
            if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
                throw new IllegalStateException("Number out of range for " + key + ": " + value);
            }
            return (int) value;
        }

        double getDouble(String key, double defaultValue) {
            var value = get(key, null);
            if (value == null || value.isEmpty()) {
                return defaultValue;
            }
            try {
                return Double.parseDouble(value);
            } catch (NumberFormatException e) {
                throw new IllegalStateException("Invalid number for " + key + ": " + value, e);
            }
        }
    }
}
