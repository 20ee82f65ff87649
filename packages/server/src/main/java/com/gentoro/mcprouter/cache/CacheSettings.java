package com.gentoro.mcprouter.cache;

import com.gentoro.mcprouter.exception.ConfigException;
import org.apache.commons.configuration2.Configuration;

/** {@code cache.*} configuration. */
public record CacheSettings(boolean enabled, long ttlMs, int maxEntries) {
  public static final long DEFAULT_TTL_MS = 300_000L;
  public static final int DEFAULT_MAX_ENTRIES = 1000;

  public CacheSettings {
    if (ttlMs <= 0) {
      throw new ConfigException("cache.ttl-ms must be positive: " + ttlMs);
    }
    if (maxEntries <= 0) {
      throw new ConfigException("cache.max-entries must be positive: " + maxEntries);
    }
  }

  public static CacheSettings defaults() {
    return new CacheSettings(true, DEFAULT_TTL_MS, DEFAULT_MAX_ENTRIES);
  }

  public static CacheSettings fromConfiguration(Configuration configuration) {
    return new CacheSettings(
        configuration.getBoolean("cache.enabled", true),
        configuration.getLong("cache.ttl-ms", DEFAULT_TTL_MS),
        configuration.getInt("cache.max-entries", DEFAULT_MAX_ENTRIES));
  }
}
