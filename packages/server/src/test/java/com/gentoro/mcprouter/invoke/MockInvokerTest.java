package com.gentoro.mcprouter.invoke;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.mcprouter.cache.MutableClock;
import com.gentoro.mcprouter.catalog.ProviderRecord;
import com.gentoro.mcprouter.catalog.ToolDescriptor;
import com.gentoro.mcprouter.parse.Intents;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MockInvokerTest {

  private final MutableClock clock = new MutableClock();
  private final MockInvoker invoker = new MockInvoker(clock);
  private final ProviderRecord provider =
      new ProviderRecord(
          "@test/p", "Test", "", "", List.of(), List.of(), true, 0, null, null, null);

  private JsonNode invoke(String intent, String query, Map<String, String> entities) {
    return invoker.invoke(
        provider, ToolDescriptor.of("t", ""), new InvocationParams(intent, query, entities, null));
  }

  @Test
  void weatherUsesExtractedLocation() {
    JsonNode result =
        invoke(Intents.WEATHER_QUERY, "weather in Seoul", Map.of("location", "Seoul"));
    assertEquals("Seoul", result.path("location").asText());
    assertEquals("72°F", result.path("temperature").asText());
    assertEquals("2024-01-01T00:00:00Z", result.path("timestamp").asText());

    assertEquals(
        "Current Location",
        invoke(Intents.WEATHER_QUERY, "weather", Map.of()).path("location").asText());
  }

  @Test
  void cryptoMapsCoinToSymbol() {
    assertEquals(
        "ETH",
        invoke(Intents.CRYPTO_PRICE_QUERY, "", Map.of("cryptocurrency", "ethereum"))
            .path("symbol")
            .asText());
    assertEquals("BTC", invoke(Intents.CRYPTO_PRICE_QUERY, "", Map.of()).path("symbol").asText());
  }

  @Test
  void stockDefaultsToAapl() {
    assertEquals("AAPL", invoke(Intents.STOCK_PRICE_QUERY, "", Map.of()).path("symbol").asText());
    assertEquals(
        "MSFT",
        invoke(Intents.STOCK_PRICE_QUERY, "", Map.of("stockSymbol", "MSFT"))
            .path("symbol")
            .asText());
  }

  @Test
  void webSearchEchoesQuery() {
    JsonNode result = invoke(Intents.WEB_SEARCH, "java tutorials", Map.of());
    assertEquals("java tutorials", result.path("query").asText());
    assertEquals(
        "java tutorials - Top Result", result.path("results").get(0).path("title").asText());
  }

  @Test
  void unknownIntentGetsGenericAnswer() {
    JsonNode result = invoke("image_lookup", "sunsets", Map.of());
    assertEquals("Processed: sunsets", result.path("answer").asText());
    assertEquals(MockInvoker.MODE, invoker.mode());
  }

  @Test
  void argumentsMergeContextEntitiesAndQuery() {
    InvocationParams params =
        new InvocationParams(
            Intents.WEATHER_QUERY,
            "weather in Seoul",
            Map.of("location", "Seoul"),
            Map.of("location", "Busan", "units", "metric"));

    Map<String, Object> arguments = params.toArguments();

    assertEquals("Seoul", arguments.get("location"));
    assertEquals("metric", arguments.get("units"));
    assertEquals("weather in Seoul", arguments.get("query"));
  }
}
