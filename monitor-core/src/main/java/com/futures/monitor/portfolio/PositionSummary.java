package com.futures.monitor.portfolio;

public record PositionSummary(
    int longPositions,
    int shortPositions,
    double averageLeverage,
    double totalNotional,
    double totalUnrealizedPnl,
    double leverageUsage
) {
    public static PositionSummary empty() {
        return new PositionSummary(0, 0, 1.0, 0.0, 0.0, 0.0);
    }
}
