package com.futures.monitor.portfolio;

import com.futures.monitor.model.IncomeType;

import java.time.LocalDate;
import java.util.Map;

public record IncomeSummary(
    double totalIncome,
    Map<IncomeType, Double> byType,
    Map<LocalDate, Double> byDay
) {
    public IncomeSummary {
        byType = Map.copyOf(byType);
        byDay = Map.copyOf(byDay);
    }

    public static IncomeSummary empty() {
        return new IncomeSummary(0.0, Map.of(), Map.of());
    }
}
