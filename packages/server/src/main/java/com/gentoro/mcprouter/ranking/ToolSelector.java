package com.gentoro.mcprouter.ranking;

import com.gentoro.mcprouter.catalog.ProviderRecord;
import com.gentoro.mcprouter.catalog.ToolDescriptor;
import com.gentoro.mcprouter.parse.Intents;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/** Picks the best tool of a provider for an intent. */
public class ToolSelector {
  private static final Map<String, List<String>> INTENT_KEYWORDS =
      Map.ofEntries(
          Map.entry(
              Intents.CRYPTO_PRICE_QUERY,
              List.of("crypto", "exchange", "rate", "price", "bitcoin", "btc", "coin")),
          Map.entry(
              Intents.WEB_SEARCH, List.of("search", "query", "find", "web", "lookup", "discover")),
          Map.entry(
              Intents.WEATHER_QUERY,
              List.of("weather", "forecast", "temperature", "climate", "conditions")),
          Map.entry(
              Intents.STOCK_PRICE_QUERY,
              List.of("stock", "quote", "price", "market", "ticker", "equity")),
          Map.entry(
              Intents.NEWS_QUERY, List.of("news", "article", "headline", "current", "latest")),
          Map.entry(
              Intents.TRANSLATION, List.of("translate", "language", "convert", "translation")),
          Map.entry(Intents.FOOD_DELIVERY, List.of("food", "order", "delivery", "restaurant")),
          Map.entry(Intents.FLIGHT_BOOKING, List.of("flight", "book", "airline", "fare")),
          Map.entry(Intents.HOTEL_BOOKING, List.of("hotel", "book", "room", "stay")));

  private static final Set<String> GENERIC_WORDS =
      Set.of("query", "get", "fetch", "find", "search");

  static final double INTENT_IN_NAME = 10;
  static final double INTENT_IN_DESCRIPTION = 5;
  static final double CAPABILITY_IN_NAME = 8;
  static final double CAPABILITY_IN_DESCRIPTION = 4;
  static final double QUERY_IN_NAME = 5;
  static final double QUERY_IN_DESCRIPTION = 3;

  /**
   * Highest scoring tool, earliest declared on ties. Falls back to the first declared tool when
   * nothing scores, and returns {@code null} only for a provider without tools.
   */
  public ToolDescriptor select(
      ProviderRecord provider,
      String intent,
      Collection<String> capabilities,
      Collection<String> queryTerms) {
    List<ToolDescriptor> tools = provider.tools();
    if (tools.isEmpty()) {
      return null;
    }
    List<String> keywords = keywordsFor(intent);
    ToolDescriptor best = null;
    double bestScore = 0;
    for (ToolDescriptor tool : tools) {
      double score = score(tool, keywords, capabilities, queryTerms);
      if (score > bestScore) {
        best = tool;
        bestScore = score;
      }
    }
    return best != null ? best : tools.get(0);
  }

  double score(
      ToolDescriptor tool,
      List<String> keywords,
      Collection<String> capabilities,
      Collection<String> queryTerms) {
    String name = tool.name().toLowerCase(Locale.ROOT);
    String description = tool.description().toLowerCase(Locale.ROOT);
    double score = 0;
    for (String keyword : keywords) {
      if (name.contains(keyword)) score += INTENT_IN_NAME;
      if (description.contains(keyword)) score += INTENT_IN_DESCRIPTION;
    }
    for (String capability : safe(capabilities)) {
      String c = capability.toLowerCase(Locale.ROOT);
      if (name.contains(c)) score += CAPABILITY_IN_NAME;
      if (description.contains(c)) score += CAPABILITY_IN_DESCRIPTION;
    }
    for (String term : safe(queryTerms)) {
      String t = term.toLowerCase(Locale.ROOT);
      if (name.contains(t)) score += QUERY_IN_NAME;
      if (description.contains(t)) score += QUERY_IN_DESCRIPTION;
    }
    return score;
  }

  /** Keywords for a known intent, or words derived from the intent name. */
  public static List<String> keywordsFor(String intent) {
    if (intent == null || intent.isBlank()) {
      return List.of();
    }
    List<String> known = INTENT_KEYWORDS.get(intent);
    if (known != null) {
      return known;
    }
    List<String> derived = new ArrayList<>();
    for (String part : intent.toLowerCase(Locale.ROOT).split("[_\\s]+")) {
      if (part.length() > 2 && !GENERIC_WORDS.contains(part)) {
        derived.add(part);
      }
    }
    return derived;
  }

  private static Collection<String> safe(Collection<String> values) {
    if (values == null) {
      return List.of();
    }
    return values.stream().filter(v -> v != null && !v.isBlank()).toList();
  }
}
