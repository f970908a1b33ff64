package com.futures.monitor.service;

import com.futures.monitor.model.IncomeType;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Parameters for an income history lookup. Each distinct query is cached separately.
 *
 * @param limit number of records, 1 to 1000
 */
public record IncomeQuery(
    Optional<IncomeType> type,
    Optional<String> symbol,
    Optional<Instant> startTime,
    Optional<Instant> endTime,
    int limit
) {
    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 1000;

    public IncomeQuery {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("Income limit must be between 1 and " + MAX_LIMIT + ": " + limit);
        }
        if (type.isPresent() && type.get() == IncomeType.UNKNOWN) {
            throw new IllegalArgumentException("Cannot query income of unknown type");
        }
        if (startTime.isPresent() && endTime.isPresent() && endTime.get().isBefore(startTime.get())) {
            throw new IllegalArgumentException("Income query ends before it starts");
        }
    }

    public static IncomeQuery recent(int limit) {
        return new IncomeQuery(Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty(), limit);
    }

    public static IncomeQuery defaults() {
        return recent(DEFAULT_LIMIT);
    }

    public IncomeQuery ofType(IncomeType incomeType) {
        return new IncomeQuery(Optional.of(incomeType), symbol, startTime, endTime, limit);
    }

    public IncomeQuery forSymbol(String querySymbol) {
        return new IncomeQuery(type, Optional.of(querySymbol), startTime, endTime, limit);
    }

    public IncomeQuery between(Instant start, Instant end) {
        return new IncomeQuery(type, symbol, Optional.of(start), Optional.of(end), limit);
    }

    Map<String, String> toParams() {
        var params = new LinkedHashMap<String, String>();
        symbol.ifPresent(s -> params.put("symbol", s));
        type.ifPresent(t -> params.put("incomeType", t.name()));
        startTime.ifPresent(t -> params.put("startTime", Long.toString(t.toEpochMilli())));
        endTime.ifPresent(t -> params.put("endTime", Long.toString(t.toEpochMilli())));
        params.put("limit", Integer.toString(limit));
        return params;
    }

    /**
     * Cache qualifier: identical queries share a cache entry.
     */
    String qualifier() {
        var params = toParams();
        var joined = new StringBuilder();
        params.forEach((k, v) -> {
            if (joined.length() > 0) {
                joined.append('&');
            }
            joined.append(k).append('=').append(v);
        });
        return joined.toString();
    }
}
