package com.gentoro.mcprouter.parse;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import org.junit.jupiter.api.Test;

class EntityExtractorTest {

  private final EntityExtractor extractor = new EntityExtractor();

  @Test
  void extractsLocationAfterPreposition() {
    assertEquals(
        "Seoul", extractor.extract("what's the weather in Seoul").get(EntityExtractor.LOCATION));
    assertEquals(
        "New York",
        extractor.extract("What's the weather in New York").get(EntityExtractor.LOCATION));
    assertEquals(
        "paris", extractor.extract("is it raining in paris").get(EntityExtractor.LOCATION));
  }

  @Test
  void extractsCapitalizedPlaceWithoutPreposition() {
    assertEquals("Tokyo", extractor.extract("forecast for Tokyo").get(EntityExtractor.LOCATION));
  }

  @Test
  void extractsCryptocurrencyLowercased() {
    Map<String, String> entities = extractor.extract("Price of BTC today");
    assertEquals("btc", entities.get(EntityExtractor.CRYPTOCURRENCY));
    // crypto symbols are not tickers
    assertFalse(entities.containsKey(EntityExtractor.STOCK_SYMBOL));
    assertFalse(entities.containsKey(EntityExtractor.LOCATION));
  }

  @Test
  void extractsTicker() {
    Map<String, String> entities = extractor.extract("AAPL stock price");
    assertEquals("AAPL", entities.get(EntityExtractor.STOCK_SYMBOL));
    assertFalse(entities.containsKey(EntityExtractor.LOCATION));
  }

  @Test
  void missesAreOmitted() {
    assertTrue(extractor.extract("hello there").isEmpty());
    assertTrue(extractor.extract("").isEmpty());
    assertTrue(extractor.extract(null).isEmpty());
  }
}
