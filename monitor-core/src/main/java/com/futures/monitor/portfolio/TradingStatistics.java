package com.futures.monitor.portfolio;

import com.futures.monitor.model.Trade;

import java.time.LocalDate;
import java.util.Map;

/**
 * Windowed aggregate over account trades.
 */
public record TradingStatistics(
    int count,
    double volume,
    double commission,
    double realizedPnl,
    double averageTradeSize,
    Map<String, Breakdown> bySymbol,
    Map<LocalDate, Breakdown> byDay,
    Performance performance
) {
    public TradingStatistics {
        bySymbol = Map.copyOf(bySymbol);
        byDay = Map.copyOf(byDay);
    }

    public static TradingStatistics empty() {
        return new TradingStatistics(0, 0.0, 0.0, 0.0, 0.0, Map.of(), Map.of(), Performance.empty());
    }

    public record Breakdown(int count, double volume, double commission) {
        static Breakdown of(Trade trade) {
            return new Breakdown(1, trade.quoteQuantity(), trade.commission());
        }

        Breakdown plus(Breakdown other) {
            return new Breakdown(count + other.count, volume + other.volume, commission + other.commission);
        }
    }

    /**
     * Win/loss figures over trades with a non-zero realized P&L.
     * Profit factor is infinite when there are wins and no losses.
     */
    public record Performance(
        double winRatePercent,
        double profitFactor,
        double averageWin,
        double averageLoss,
        double largestWin,
        double largestLoss
    ) {
        public static Performance empty() {
            return new Performance(0.0, 0.0, 0.0, 0.0, 0.0, 0.0);
        }
    }
}
