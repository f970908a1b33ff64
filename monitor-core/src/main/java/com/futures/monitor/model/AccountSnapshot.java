package com.futures.monitor.model;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time view of the futures account. Replaced wholesale on refresh.
 */
public record AccountSnapshot(
    double walletBalance,
    double availableBalance,
    double unrealizedPnl,
    double marginBalance,
    double maintenanceMargin,
    double initialMargin,
    List<AssetBalance> assets,
    Instant asOf
) {
    public AccountSnapshot {
        assets = List.copyOf(assets);
    }

    /**
     * Maintenance margin required over margin balance; 0 when there is no margin balance.
     */
    public double marginRatio() {
        return marginBalance > 0 ? maintenanceMargin / marginBalance : 0.0;
    }
}
