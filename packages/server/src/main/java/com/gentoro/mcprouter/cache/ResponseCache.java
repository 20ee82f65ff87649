package com.gentoro.mcprouter.cache;

import java.util.Optional;

/** Time-bounded cache of routing results keyed by request fingerprint. */
public interface ResponseCache<V> {
  /** Live entry for the key; entries older than the TTL are treated as absent. */
  Optional<CacheHit<V>> get(Fingerprint key);

  void put(Fingerprint key, V value);

  void evict(Fingerprint key);

  /** Remove every expired entry and return how many were removed. */
  int evictExpired();

  void clear();

  int size();

  CacheStats stats();
}
