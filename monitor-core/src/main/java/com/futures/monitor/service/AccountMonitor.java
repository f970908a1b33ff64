package com.futures.monitor.service;

import com.futures.monitor.api.BinanceFuturesGateway;
import com.futures.monitor.api.BinanceMapper;
import com.futures.monitor.api.Endpoint;
import com.futures.monitor.api.ExchangeException;
import com.futures.monitor.api.ExchangeGateway;
import com.futures.monitor.cache.CacheKey;
import com.futures.monitor.cache.CacheResult;
import com.futures.monitor.cache.CacheStats;
import com.futures.monitor.cache.CacheStore;
import com.futures.monitor.cache.DataCategory;
import com.futures.monitor.cache.RefreshCoordinator;
import com.futures.monitor.cache.StalenessPolicy;
import com.futures.monitor.cache.TradeWindow;
import com.futures.monitor.config.MonitorConfig;
import com.futures.monitor.model.AccountSnapshot;
import com.futures.monitor.model.IncomeRecord;
import com.futures.monitor.model.Position;
import com.futures.monitor.model.Trade;
import com.futures.monitor.portfolio.DerivedMetrics;
import com.futures.monitor.portfolio.IncomeSummary;
import com.futures.monitor.portfolio.PortfolioAggregator;
import com.futures.monitor.portfolio.TradingStatistics;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicReference;

/**
 * FUTURES ACCOUNT MONITOR
 *
 * Entry point for dashboards and reports. Every read goes through the refresh coordinator,
 * so callers get cached data while it is fresh, one fetch per expired dataset, and the
 * previous value (flagged stale) when the exchange is unavailable.
 *
 * Callers must check {@link CacheResult#stale()} before acting on a value for alerting.
 */
public class AccountMonitor implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(AccountMonitor.class);

    // userTrades returns at most this many rows per call
    private static final int MAX_TRADES_PER_REQUEST = 1000;

    private final GatewayFactory gatewayFactory;
    private final RefreshCoordinator coordinator;
    private final BinanceMapper mapper = new BinanceMapper();
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    private final AtomicReference<Session> session = new AtomicReference<>();

    public AccountMonitor(MonitorConfig config) {
        this(config, Clock.systemUTC(), new SimpleMeterRegistry());
    }

    public AccountMonitor(MonitorConfig config, Clock clock, MeterRegistry meterRegistry) {
        this(config, cfg -> new BinanceFuturesGateway(cfg, clock, meterRegistry), clock, meterRegistry);
    }

    public AccountMonitor(MonitorConfig config, GatewayFactory gatewayFactory, Clock clock,
                          MeterRegistry meterRegistry) {
        this(config, gatewayFactory, clock, meterRegistry,
            new RefreshCoordinator(new CacheStore(clock, config.staleRetentionFactor()), new StalenessPolicy(),
                clock, meterRegistry));
    }

    AccountMonitor(MonitorConfig config, GatewayFactory gatewayFactory, Clock clock,
                   MeterRegistry meterRegistry, RefreshCoordinator coordinator) {
        this.gatewayFactory = gatewayFactory;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        this.coordinator = coordinator;
        this.session.set(Session.open(config, gatewayFactory));
        logger.info("📊 Account monitor started ({}, API Key: {})",
            config.useTestnet() ? "testnet" : "mainnet", config.maskedApiKey());
    }

    public CacheResult<AccountSnapshot> getAccountSnapshot() {
        return coordinator.getOrRefresh(CacheKey.of(DataCategory.ACCOUNT),
            () -> mapper.toAccountSnapshot(session.get().gateway().fetch(Endpoint.ACCOUNT, Map.of())),
            session.get().config().accountTtl());
    }

    /**
     * Open positions matching the filter. All positions are cached together; filtering is
     * applied on read.
     */
    public CacheResult<List<Position>> getPositions(PositionFilter filter) {
        CacheResult<List<Position>> all = coordinator.getOrRefresh(CacheKey.of(DataCategory.POSITIONS),
            () -> mapper.toPositions(session.get().gateway().fetch(Endpoint.POSITION_RISK, Map.of())),
            session.get().config().positionsTtl());
        return all.map(positions -> positions.stream().filter(filter::matches).toList());
    }

    public CacheResult<List<Position>> getPositions() {
        return getPositions(PositionFilter.ALL);
    }

    /**
     * Most recent trades, oldest first.
     *
     * The exchange only returns trades per symbol. Without a symbol, trades are fetched for
     * every symbol with an open position or already present in the trade window.
     *
     * @param symbol optional symbol; empty for all symbols
     */
    public CacheResult<List<Trade>> getRecentTrades(Optional<String> symbol, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("Trade limit must be positive: " + limit);
        }
        Duration ttl = session.get().config().tradesTtl();

        if (symbol.isPresent()) {
            String s = symbol.get().toUpperCase();
            CacheResult<List<Trade>> cached = coordinator.getOrRefresh(CacheKey.of(DataCategory.TRADES, s),
                () -> {
                    Session current = session.get();
                    TradeWindow window = current.tradeWindow();
                    window.merge(fetchTrades(current, s));
                    return window.recent(s, current.config().tradeWindowSize());
                },
                ttl);
            return cached.map(trades -> tail(trades, limit));
        }

        CacheResult<List<Trade>> cached = coordinator.getOrRefresh(CacheKey.of(DataCategory.TRADES),
            () -> {
                Session current = session.get();
                TradeWindow window = current.tradeWindow();
                var symbols = new TreeSet<>(window.symbols());
                getPositions().value().forEach(p -> symbols.add(p.symbol()));
                for (String s : symbols) {
                    window.merge(fetchTrades(current, s));
                }
                logger.debug("Trade window holds {} trades across {} symbols", window.size(), symbols.size());
                return window.recent(Integer.MAX_VALUE);
            },
            ttl);
        return cached.map(trades -> tail(trades, limit));
    }

    public CacheResult<List<IncomeRecord>> getIncomeHistory(IncomeQuery query) {
        return coordinator.getOrRefresh(CacheKey.of(DataCategory.INCOME, query.qualifier()),
            () -> mapper.toIncome(session.get().gateway().fetch(Endpoint.INCOME, query.toParams())),
            session.get().config().incomeTtl());
    }

    /**
     * Equity, margin ratio, ROE and leverage breakdown, recomputed on every call.
     * Stale when either the account snapshot or the positions are stale.
     */
    public CacheResult<DerivedMetrics> getDerivedMetrics() {
        CacheResult<AccountSnapshot> account = getAccountSnapshot();
        CacheResult<List<Position>> positions = getPositions();
        DerivedMetrics metrics = session.get().aggregator().computeMetrics(account.value(), positions.value());

        if (metrics.elevatedRisk()) {
            if (account.stale()) {
                logger.warn("Margin ratio {} above threshold on stale data (as of {})",
                    metrics.marginRatio(), account.fetchedAt());
            } else {
                logger.warn("⚠️ Margin ratio {} above alert threshold", metrics.marginRatio());
            }
        }
        return combine(account, positions, metrics);
    }

    /**
     * Trading statistics over the cached trade window for {@code [from, to)}.
     */
    public CacheResult<TradingStatistics> getTradingStatistics(Instant from, Instant to) {
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("Statistics window ends before it starts");
        }
        return getRecentTrades(Optional.empty(), Integer.MAX_VALUE)
            .map(trades -> PortfolioAggregator.tradingStatistics(trades, from, to));
    }

    public CacheResult<IncomeSummary> getIncomeSummary(IncomeQuery query) {
        return getIncomeHistory(query).map(PortfolioAggregator::incomeSummary);
    }

    /**
     * Check that the exchange is reachable and the credentials are accepted.
     * Bypasses the cache.
     */
    public boolean testConnection() {
        ExchangeGateway gateway = session.get().gateway();
        if (!gateway.isReachable()) {
            return false;
        }
        try {
            mapper.toAccountSnapshot(gateway.fetch(Endpoint.ACCOUNT, Map.of()));
            logger.info("✅ Connection test passed");
            return true;
        } catch (ExchangeException e) {
            logger.error("❌ Connection test failed ({}): {}", e.kind(), e.getMessage());
            return false;
        }
    }

    public void invalidate(DataCategory category) {
        if (category == DataCategory.TRADES) {
            // A refresh still merging into the old window cannot refill the new one
            session.updateAndGet(Session::withEmptyTradeWindow);
        }
        coordinator.invalidateCategory(category);
        logger.info("Invalidated {} cache", category);
    }

    public void invalidate(DataCategory.Group group) {
        for (DataCategory category : DataCategory.values()) {
            if (category.group() == group) {
                invalidate(category);
            }
        }
    }

    /**
     * Switch to new credentials. A new gateway is built and every cached value is dropped,
     * so no data fetched under the old credentials is served afterwards.
     *
     * The session is swapped before the cache is invalidated: fetchers read the session when
     * they run, so a refresh that could still see the old gateway is always detached.
     */
    public synchronized void rotateCredentials(MonitorConfig newConfig) {
        Session previous = session.getAndSet(Session.open(newConfig, gatewayFactory));
        coordinator.invalidateAll();
        meterRegistry.counter("monitor.credentials.rotations").increment();
        logger.info("🔑 Credentials rotated: {} -> {}",
            previous.config().maskedApiKey(), newConfig.maskedApiKey());
    }

    public void rotateCredentials(String apiKey, String apiSecret) {
        rotateCredentials(session.get().config().withCredentials(apiKey, apiSecret));
    }

    public CacheStats cacheStats() {
        return coordinator.stats();
    }

    public MonitorConfig config() {
        return session.get().config();
    }

    @Override
    public void close() {
        coordinator.close();
        logger.info("Account monitor stopped");
    }

    private List<Trade> fetchTrades(Session current, String symbol) {
        int limit = Math.min(MAX_TRADES_PER_REQUEST, current.config().tradeWindowSize());
        return mapper.toTrades(current.gateway().fetch(Endpoint.USER_TRADES,
            Map.of("symbol", symbol, "limit", Integer.toString(limit))));
    }

    private CacheResult<DerivedMetrics> combine(CacheResult<AccountSnapshot> account,
                                                CacheResult<List<Position>> positions,
                                                DerivedMetrics metrics) {
        boolean stale = account.stale() || positions.stale();
        Instant fetchedAt = account.fetchedAt().isBefore(positions.fetchedAt())
            ? account.fetchedAt() : positions.fetchedAt();
        Duration age = Duration.between(fetchedAt, clock.instant());
        return new CacheResult<>(metrics, stale, fetchedAt, age.isNegative() ? Duration.ZERO : age,
            account.failure().or(positions::failure));
    }

    private static List<Trade> tail(List<Trade> trades, int limit) {
        if (trades.size() <= limit) {
            return trades;
        }
        return List.copyOf(trades.subList(trades.size() - limit, trades.size()));
    }

    /**
     * Everything bound to one credential pair. Replaced as a whole on rotation and when trades
     * are invalidated, so a refresh still running against the old session cannot write into
     * the new trade window.
     */
    private record Session(MonitorConfig config, ExchangeGateway gateway, PortfolioAggregator aggregator,
                           TradeWindow tradeWindow) {
        static Session open(MonitorConfig config, GatewayFactory factory) {
            return new Session(config, factory.create(config),
                new PortfolioAggregator(config.marginRatioAlertThreshold()),
                new TradeWindow(config.tradeWindowSize()));
        }

        Session withEmptyTradeWindow() {
            return new Session(config, gateway, aggregator, new TradeWindow(config.tradeWindowSize()));
        }
    }
}
