package com.futures.monitor.cache;

import java.util.Objects;

/**
 * Identifies one cached dataset: a category plus an optional qualifier
 * (symbol, query range) that distinguishes variants of the same category.
 */
public record CacheKey(DataCategory category, String qualifier) {

    public CacheKey {
        Objects.requireNonNull(category, "category");
        qualifier = qualifier == null ? "" : qualifier;
    }

    public static CacheKey of(DataCategory category) {
        return new CacheKey(category, "");
    }

    public static CacheKey of(DataCategory category, String qualifier) {
        return new CacheKey(category, qualifier);
    }

    @Override
    public String toString() {
        return qualifier.isEmpty() ? category.name() : category.name() + "[" + qualifier + "]";
    }
}
