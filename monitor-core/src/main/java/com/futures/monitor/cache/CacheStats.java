package com.futures.monitor.cache;

public record CacheStats(int totalEntries, int expiredEntries, int validEntries) {}
