package com.gentoro.mcprouter.cache;

import java.time.Clock;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link ResponseCache} backed by an insertion-ordered map. Expired entries are hidden on read and
 * physically removed when the map grows past {@code maxEntries}; this is a TTL cache, not an LRU,
 * so live entries are never dropped to make room.
 */
public class InMemoryResponseCache<V> implements ResponseCache<V> {
  private static final org.slf4j.Logger log =
      com.gentoro.mcprouter.logging.LoggingService.getLogger(InMemoryResponseCache.class);

  private final ReentrantLock lock = new ReentrantLock();
  private final Map<Fingerprint, Entry<V>> entries = new LinkedHashMap<>();
  private final CacheSettings settings;
  private final Clock clock;

  private long hits;
  private long misses;
  private long evictions;

  public InMemoryResponseCache(CacheSettings settings, Clock clock) {
    this.settings = settings;
    this.clock = clock;
  }

  public InMemoryResponseCache(CacheSettings settings) {
    this(settings, Clock.systemUTC());
  }

  @Override
  public Optional<CacheHit<V>> get(Fingerprint key) {
    lock.lock();
    try {
      Entry<V> entry = entries.get(key);
      long now = clock.millis();
      if (entry == null || isExpired(entry, now)) {
        misses++;
        return Optional.empty();
      }
      hits++;
      return Optional.of(new CacheHit<>(entry.value(), now - entry.storedAt()));
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void put(Fingerprint key, V value) {
    lock.lock();
    try {
      // re-insert so iteration order stays oldest-first
      entries.remove(key);
      entries.put(key, new Entry<>(value, clock.millis()));
      if (entries.size() > settings.maxEntries()) {
        int removed = sweepExpired();
        if (removed > 0) {
          log.debug("Swept {} expired cache entries", removed);
        }
      }
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void evict(Fingerprint key) {
    lock.lock();
    try {
      if (entries.remove(key) != null) {
        evictions++;
      }
    } finally {
      lock.unlock();
    }
  }

  @Override
  public int evictExpired() {
    lock.lock();
    try {
      return sweepExpired();
    } finally {
      lock.unlock();
    }
  }

  private int sweepExpired() {
    long now = clock.millis();
    int removed = 0;
    Iterator<Entry<V>> it = entries.values().iterator();
    while (it.hasNext()) {
      if (isExpired(it.next(), now)) {
        it.remove();
        removed++;
      }
    }
    evictions += removed;
    return removed;
  }

  private boolean isExpired(Entry<V> entry, long now) {
    return now - entry.storedAt() >= settings.ttlMs();
  }

  @Override
  public void clear() {
    lock.lock();
    try {
      evictions += entries.size();
      entries.clear();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public int size() {
    lock.lock();
    try {
      return entries.size();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public CacheStats stats() {
    lock.lock();
    try {
      return new CacheStats(
          settings.enabled(),
          hits,
          misses,
          evictions,
          entries.size(),
          settings.ttlMs(),
          settings.maxEntries());
    } finally {
      lock.unlock();
    }
  }

  private record Entry<V>(V value, long storedAt) {}
}
