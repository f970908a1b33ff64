package com.futures.monitor.testing;

import com.futures.monitor.config.MonitorConfig;
import com.futures.monitor.model.MarginMode;
import com.futures.monitor.model.Position;
import com.futures.monitor.model.PositionSide;
import com.futures.monitor.model.Trade;
import com.futures.monitor.model.TradeSide;

import java.time.Instant;
import java.util.Properties;

/**
 * Shared test data builders.
 */
public final class Fixtures {

    public static final Instant T0 = Instant.parse("2024-03-01T12:00:00Z");

    private Fixtures() {
    }

    public static Properties baseProperties() {
        var props = new Properties();
        props.setProperty("BINANCE_API_KEY", "test-api-key-0001");
        props.setProperty("BINANCE_SECRET_KEY", "test-secret-0001");
        props.setProperty("USE_TESTNET", "true");
        // Keep retries out of unit tests unless a test opts in
        props.setProperty("TRANSIENT_MAX_RETRIES", "0");
        props.setProperty("RATE_LIMIT_MAX_RETRIES", "0");
        props.setProperty("TRANSIENT_BASE_DELAY_MS", "1");
        return props;
    }

    public static MonitorConfig config() {
        return MonitorConfig.forTest(baseProperties());
    }

    public static Position longPosition(String symbol, double entry, double amount, int leverage, double pnl) {
        return new Position(symbol, PositionSide.LONG, entry, entry, amount, leverage, 0.0, pnl,
            MarginMode.CROSS, entry * amount, T0);
    }

    public static Position shortPosition(String symbol, double entry, double mark, double amount, int leverage) {
        double pnl = (entry - mark) * Math.abs(amount);
        return new Position(symbol, PositionSide.SHORT, entry, mark, -Math.abs(amount), leverage, 0.0, pnl,
            MarginMode.ISOLATED, -mark * Math.abs(amount), T0);
    }

    public static Trade trade(long id, String symbol, Instant time, double quoteQty, double commission, double pnl) {
        return new Trade(id, id * 10, symbol, TradeSide.BUY, 100.0, quoteQty / 100.0, quoteQty,
            commission, "USDT", pnl, false, time);
    }
}
