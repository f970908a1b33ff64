package com.futures.monitor.portfolio;

import com.futures.monitor.model.Position;

/**
 * Derived figures for one open position.
 *
 * @param roePercent       unrealized P&L over initial margin, in percent
 * @param priceChangePercent mark vs entry in percent, positive when the move favours the side
 * @param notional         absolute notional at mark price
 * @param margin           initial margin (entry x size / leverage)
 */
public record PositionMetrics(
    Position position,
    double roePercent,
    double priceChangePercent,
    double notional,
    double margin
) {}
