package com.futures.monitor.model;

import java.time.Instant;

public record IncomeRecord(
    long transactionId,
    IncomeType type,
    String symbol,
    String asset,
    double amount,
    Instant time
) {}
