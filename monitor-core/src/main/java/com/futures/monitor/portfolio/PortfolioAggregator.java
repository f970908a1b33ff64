package com.futures.monitor.portfolio;

import com.futures.monitor.model.AccountSnapshot;
import com.futures.monitor.model.IncomeRecord;
import com.futures.monitor.model.IncomeType;
import com.futures.monitor.model.Position;
import com.futures.monitor.model.Trade;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Portfolio-level figures derived from account data.
 * Stateless apart from the alert threshold; every method is a pure function of its inputs.
 */
public class PortfolioAggregator {

    private final double marginRatioAlertThreshold;

    public PortfolioAggregator(double marginRatioAlertThreshold) {
        if (marginRatioAlertThreshold < 0) {
            throw new IllegalArgumentException("Margin ratio threshold must not be negative");
        }
        this.marginRatioAlertThreshold = marginRatioAlertThreshold;
    }

    public DerivedMetrics computeMetrics(AccountSnapshot account, List<Position> positions) {
        double unrealizedPnl = 0.0;
        var perPosition = new ArrayList<PositionMetrics>(positions.size());
        for (Position position : positions) {
            unrealizedPnl += position.unrealizedPnl();
            perPosition.add(positionMetrics(position));
        }

        double marginRatio = account.marginRatio();
        return new DerivedMetrics(
            totalEquity(account.walletBalance(), positions),
            unrealizedPnl,
            marginRatio,
            marginRatio > marginRatioAlertThreshold,
            perPosition,
            leverageDistribution(positions),
            summarize(positions, account.walletBalance()),
            account.asOf()
        );
    }

    /**
     * Wallet balance plus the unrealized P&L of every open position.
     */
    public static double totalEquity(double walletBalance, List<Position> positions) {
        double equity = walletBalance;
        for (Position position : positions) {
            equity += position.unrealizedPnl();
        }
        return equity;
    }

    public boolean isElevatedRisk(double marginRatio) {
        return marginRatio > marginRatioAlertThreshold;
    }

    public static PositionMetrics positionMetrics(Position position) {
        double margin = initialMargin(position);
        return new PositionMetrics(
            position,
            roePercent(position.unrealizedPnl(), position.entryPrice(), position.size(), position.leverage()),
            priceChangePercent(position),
            position.absoluteNotional(),
            margin
        );
    }

    /**
     * Unrealized P&L over initial margin, in percent. The sign comes from the P&L, which
     * the exchange already reports relative to the position side.
     *
     * @return 0 when the position carries no margin
     */
    public static double roePercent(double unrealizedPnl, double entryPrice, double size, int leverage) {
        if (leverage <= 0) {
            return 0.0;
        }
        double margin = entryPrice * Math.abs(size) / leverage;
        if (margin == 0.0) {
            return 0.0;
        }
        return unrealizedPnl / margin * 100.0;
    }

    /**
     * Mark against entry in percent, positive when the move is in the position's favour.
     */
    public static double priceChangePercent(Position position) {
        if (position.entryPrice() == 0.0) {
            return 0.0;
        }
        double change = (position.markPrice() - position.entryPrice()) / position.entryPrice() * 100.0;
        return position.isLong() ? change : -change;
    }

    public static Map<LeverageBucket, Double> leverageDistribution(List<Position> positions) {
        var distribution = new EnumMap<LeverageBucket, Double>(LeverageBucket.class);
        for (Position position : positions) {
            distribution.merge(LeverageBucket.of(position.leverage()), position.absoluteNotional(), Double::sum);
        }
        return distribution;
    }

    public static PositionSummary summarize(List<Position> positions, double walletBalance) {
        if (positions.isEmpty()) {
            return PositionSummary.empty();
        }
        int longs = 0;
        int shorts = 0;
        double leverageSum = 0.0;
        double notional = 0.0;
        double pnl = 0.0;
        for (Position position : positions) {
            if (position.isLong()) {
                longs++;
            } else {
                shorts++;
            }
            leverageSum += position.leverage();
            notional += position.absoluteNotional();
            pnl += position.unrealizedPnl();
        }
        double usage = walletBalance > 0 ? notional / walletBalance : 0.0;
        return new PositionSummary(longs, shorts, leverageSum / positions.size(), notional, pnl, usage);
    }

    /**
     * Aggregate the trades executed in {@code [from, to)}.
     * An empty selection yields zeroed statistics.
     */
    public static TradingStatistics tradingStatistics(List<Trade> trades, Instant from, Instant to) {
        var window = trades.stream()
            .filter(t -> !t.time().isBefore(from) && t.time().isBefore(to))
            .toList();
        if (window.isEmpty()) {
            return TradingStatistics.empty();
        }

        double volume = 0.0;
        double commission = 0.0;
        double realized = 0.0;
        Map<String, TradingStatistics.Breakdown> bySymbol = new TreeMap<>();
        Map<LocalDate, TradingStatistics.Breakdown> byDay = new TreeMap<>();

        for (Trade trade : window) {
            volume += trade.quoteQuantity();
            commission += trade.commission();
            realized += trade.realizedPnl();
            var single = TradingStatistics.Breakdown.of(trade);
            bySymbol.merge(trade.symbol(), single, TradingStatistics.Breakdown::plus);
            byDay.merge(utcDay(trade.time()), single, TradingStatistics.Breakdown::plus);
        }

        return new TradingStatistics(
            window.size(),
            volume,
            commission,
            realized,
            volume / window.size(),
            bySymbol,
            byDay,
            performance(window)
        );
    }

    static TradingStatistics.Performance performance(List<Trade> trades) {
        int wins = 0;
        int losses = 0;
        double grossProfit = 0.0;
        double grossLoss = 0.0;
        double largestWin = 0.0;
        double largestLoss = 0.0;

        for (Trade trade : trades) {
            double pnl = trade.realizedPnl();
            if (pnl > 0) {
                wins++;
                grossProfit += pnl;
                largestWin = Math.max(largestWin, pnl);
            } else if (pnl < 0) {
                losses++;
                grossLoss += -pnl;
                largestLoss = Math.max(largestLoss, -pnl);
            }
        }

        int closed = wins + losses;
        if (closed == 0) {
            // Opening fills carry no realized P&L
            return TradingStatistics.Performance.empty();
        }

        double profitFactor;
        if (grossLoss > 0) {
            profitFactor = grossProfit / grossLoss;
        } else {
            profitFactor = grossProfit > 0 ? Double.POSITIVE_INFINITY : 0.0;
        }

        return new TradingStatistics.Performance(
            (double) wins / closed * 100.0,
            profitFactor,
            wins > 0 ? grossProfit / wins : 0.0,
            losses > 0 ? grossLoss / losses : 0.0,
            largestWin,
            largestLoss
        );
    }

    public static IncomeSummary incomeSummary(List<IncomeRecord> records) {
        if (records.isEmpty()) {
            return IncomeSummary.empty();
        }
        double total = 0.0;
        var byType = new EnumMap<IncomeType, Double>(IncomeType.class);
        Map<LocalDate, Double> byDay = new TreeMap<>();
        for (IncomeRecord record : records) {
            total += record.amount();
            byType.merge(record.type(), record.amount(), Double::sum);
            byDay.merge(utcDay(record.time()), record.amount(), Double::sum);
        }
        return new IncomeSummary(total, byType, byDay);
    }

    private static double initialMargin(Position position) {
        return position.leverage() > 0 ? position.entryPrice() * position.size() / position.leverage() : 0.0;
    }

    private static LocalDate utcDay(Instant instant) {
        return LocalDate.ofInstant(instant, ZoneOffset.UTC);
    }
}
