package com.gentoro.mcprouter.cache;

/**
 * A live cache entry.
 *
 * @param payload cached value
 * @param ageMs time since the value was stored
 */
public record CacheHit<V>(V payload, long ageMs) {}
