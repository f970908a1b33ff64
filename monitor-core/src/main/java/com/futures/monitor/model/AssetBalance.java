package com.futures.monitor.model;

/**
 * Balance of a single margin asset inside the futures wallet.
 */
public record AssetBalance(
    String asset,
    double walletBalance,
    double unrealizedPnl,
    double marginBalance,
    double availableBalance
) {}
