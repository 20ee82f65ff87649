package com.gentoro.mcprouter.cache;

/** Point-in-time cache counters. */
public record CacheStats(
    boolean enabled,
    long hits,
    long misses,
    long evictions,
    int entries,
    long ttlMs,
    int maxEntries) {}
