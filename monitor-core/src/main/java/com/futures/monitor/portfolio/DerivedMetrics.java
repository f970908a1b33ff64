package com.futures.monitor.portfolio;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Metrics derived from an account snapshot and its positions. Never cached on its own:
 * always recomputed from the inputs it was built from.
 */
public record DerivedMetrics(
    double totalEquity,
    double totalUnrealizedPnl,
    double marginRatio,
    boolean elevatedRisk,
    List<PositionMetrics> positions,
    Map<LeverageBucket, Double> leverageDistribution,
    PositionSummary summary,
    Instant asOf
) {
    public DerivedMetrics {
        positions = List.copyOf(positions);
        // Keeps bucket order for display
        var buckets = new EnumMap<LeverageBucket, Double>(LeverageBucket.class);
        buckets.putAll(leverageDistribution);
        leverageDistribution = Collections.unmodifiableMap(buckets);
    }
}
