package com.gentoro.mcprouter.cache;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.mcprouter.exception.ConfigException;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryResponseCacheTest {

  private MutableClock clock;
  private InMemoryResponseCache<String> cache;

  @BeforeEach
  void setUp() {
    clock = new MutableClock();
    cache = new InMemoryResponseCache<>(new CacheSettings(true, 1_000, 2), clock);
  }

  private static Fingerprint key(String value) {
    return new Fingerprint(RequestFingerprinter.sha256(value), value);
  }

  @Test
  void hitReportsAge() {
    cache.put(key("a"), "A");
    clock.advanceMillis(250);

    Optional<CacheHit<String>> hit = cache.get(key("a"));

    assertTrue(hit.isPresent());
    assertEquals("A", hit.get().payload());
    assertEquals(250, hit.get().ageMs());
  }

  @Test
  void entriesExpireAtTtl() {
    cache.put(key("a"), "A");
    clock.advanceMillis(999);
    assertTrue(cache.get(key("a")).isPresent());

    clock.advanceMillis(1);
    assertTrue(cache.get(key("a")).isEmpty());
  }

  @Test
  void putRefreshesTimestamp() {
    cache.put(key("a"), "A");
    clock.advanceMillis(800);
    cache.put(key("a"), "A2");
    clock.advanceMillis(800);

    Optional<CacheHit<String>> hit = cache.get(key("a"));
    assertEquals("A2", hit.orElseThrow().payload());
    assertEquals(800, hit.get().ageMs());
  }

  @Test
  void growingPastCapacitySweepsExpiredEntries() {
    cache.put(key("a"), "A");
    cache.put(key("b"), "B");
    clock.advanceMillis(1_000);

    cache.put(key("c"), "C");

    assertEquals(1, cache.size());
    assertEquals(2, cache.stats().evictions());
  }

  @Test
  void liveEntriesAreNotDroppedForCapacity() {
    cache.put(key("a"), "A");
    cache.put(key("b"), "B");
    cache.put(key("c"), "C");

    assertEquals(3, cache.size());
    assertTrue(cache.get(key("a")).isPresent());
  }

  @Test
  void statsCountHitsAndMisses() {
    cache.put(key("a"), "A");
    cache.get(key("a"));
    cache.get(key("a"));
    cache.get(key("missing"));

    CacheStats stats = cache.stats();
    assertTrue(stats.enabled());
    assertEquals(2, stats.hits());
    assertEquals(1, stats.misses());
    assertEquals(1, stats.entries());
    assertEquals(1_000, stats.ttlMs());
    assertEquals(2, stats.maxEntries());
  }

  @Test
  void evictAndClear() {
    cache.put(key("a"), "A");
    cache.put(key("b"), "B");

    cache.evict(key("a"));
    assertTrue(cache.get(key("a")).isEmpty());
    assertEquals(1, cache.size());

    cache.clear();
    assertEquals(0, cache.size());
    assertEquals(2, cache.stats().evictions());
  }

  @Test
  void evictExpiredReturnsRemovedCount() {
    cache.put(key("a"), "A");
    clock.advanceMillis(500);
    cache.put(key("b"), "B");
    clock.advanceMillis(600);

    assertEquals(1, cache.evictExpired());
    assertTrue(cache.get(key("b")).isPresent());
  }

  @Test
  void settingsRejectNonPositiveValues() {
    assertThrows(ConfigException.class, () -> new CacheSettings(true, 0, 10));
    assertThrows(ConfigException.class, () -> new CacheSettings(true, 1_000, 0));
    assertEquals(300_000L, CacheSettings.defaults().ttlMs());
  }
}
