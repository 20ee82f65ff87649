package com.gentoro.mcprouter.invoke;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.mcprouter.catalog.ProviderRecord;
import com.gentoro.mcprouter.catalog.ToolDescriptor;
import com.gentoro.mcprouter.parse.EntityExtractor;
import com.gentoro.mcprouter.parse.Intents;
import com.gentoro.mcprouter.utility.JacksonUtility;
import java.time.Clock;
import java.util.Locale;

/** Returns canned results per intent, filling in extracted entities where they fit. */
public class MockInvoker implements Invoker {
  public static final String MODE = "mock";

  private final Clock clock;

  public MockInvoker() {
    this(Clock.systemUTC());
  }

  public MockInvoker(Clock clock) {
    this.clock = clock;
  }

  @Override
  public JsonNode invoke(ProviderRecord provider, ToolDescriptor tool, InvocationParams params) {
    return resultFor(params);
  }

  /** Canned result for the intent; also used when a live call has to be degraded. */
  public ObjectNode resultFor(InvocationParams params) {
    ObjectNode node = JacksonUtility.getJsonMapper().createObjectNode();
    String intent = params.intent() == null ? "" : params.intent();
    switch (intent) {
      case Intents.WEATHER_QUERY -> {
        node.put("location", entity(params, EntityExtractor.LOCATION, "Current Location"));
        node.put("temperature", "72°F");
        node.put("condition", "Partly Cloudy");
        node.put("humidity", "45%");
        node.put("timestamp", clock.instant().toString());
      }
      case Intents.CRYPTO_PRICE_QUERY -> {
        node.put("symbol", cryptoSymbol(params));
        node.put("price", "$43,250");
        node.put("change_24h", "+2.3%");
        node.put("volume_24h", "$28.5B");
        node.put("timestamp", clock.instant().toString());
      }
      case Intents.STOCK_PRICE_QUERY -> {
        node.put("symbol", entity(params, EntityExtractor.STOCK_SYMBOL, "AAPL"));
        node.put("price", "$150.25");
        node.put("change", "-0.5%");
        node.put("volume", "52.3M");
      }
      case Intents.WEB_SEARCH -> {
        node.put("query", params.query());
        ArrayNode results = node.putArray("results");
        results
            .addObject()
            .put("title", params.query() + " - Top Result")
            .put("url", "https://example.com")
            .put("snippet", "Most relevant content...");
      }
      case Intents.TRANSLATION -> {
        node.put("original", params.query());
        node.put("translated", "[translated] " + params.query());
        node.put("detectedLanguage", "en");
      }
      case Intents.NEWS_QUERY -> {
        ArrayNode articles = node.putArray("articles");
        articles
            .addObject()
            .put("title", "Top story")
            .put("source", "example.com")
            .put("publishedAt", clock.instant().toString());
      }
      default -> {
        node.put("answer", "Processed: " + params.query());
        node.put("timestamp", clock.instant().toString());
      }
    }
    return node;
  }

  private static String entity(InvocationParams params, String key, String fallback) {
    String value = params.entities().get(key);
    return value == null || value.isBlank() ? fallback : value;
  }

  private static String cryptoSymbol(InvocationParams params) {
    String coin = params.entities().get(EntityExtractor.CRYPTOCURRENCY);
    if (coin == null) {
      return "BTC";
    }
    return switch (coin.toLowerCase(Locale.ROOT)) {
      case "bitcoin", "btc" -> "BTC";
      case "ethereum", "eth" -> "ETH";
      case "dogecoin", "doge" -> "DOGE";
      default -> coin.toUpperCase(Locale.ROOT);
    };
  }

  @Override
  public String mode() {
    return MODE;
  }
}
