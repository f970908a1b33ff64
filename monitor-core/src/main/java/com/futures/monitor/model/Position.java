package com.futures.monitor.model;

import java.time.Instant;

/**
 * Immutable record representing an open futures position.
 * Identity is (symbol, side); the amount is signed and never zero.
 */
public record Position(
    String symbol,
    PositionSide side,
    double entryPrice,
    double markPrice,
    double positionAmount,
    int leverage,
    double liquidationPrice,
    double unrealizedPnl,
    MarginMode marginMode,
    double notional,
    Instant updatedAt
) {
    public Position {
        if (positionAmount == 0.0) {
            throw new IllegalArgumentException("Zero-size position for " + symbol + " must be pruned");
        }
    }

    public Key key() {
        return new Key(symbol, side);
    }

    public double size() {
        return Math.abs(positionAmount);
    }

    /**
     * Absolute notional at the mark price.
     */
    public double absoluteNotional() {
        return notional != 0.0 ? Math.abs(notional) : size() * markPrice;
    }

    public boolean isLong() {
        return side == PositionSide.LONG;
    }

    public record Key(String symbol, PositionSide side) {}
}
