package com.futures.monitor.model;

import java.time.Instant;

/**
 * Executed account trade. Historical records are never mutated.
 */
public record Trade(
    long id,
    long orderId,
    String symbol,
    TradeSide side,
    double price,
    double quantity,
    double quoteQuantity,
    double commission,
    String commissionAsset,
    double realizedPnl,
    boolean maker,
    Instant time
) {}
