package com.gentoro.mcprouter.parse;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Expands query terms and capability tags through static synonym tables, and supplies the terms
 * each intent implies. Scoring downstream is plain substring matching, so the expanded sets are
 * what gets matched against the catalog, never the raw input alone.
 */
public class SemanticExpander {
  static final List<List<String>> QUERY_SYNONYMS =
      List.of(
          List.of("bitcoin", "btc", "crypto", "cryptocurrency", "digital currency"),
          List.of("weather", "forecast", "temperature", "climate", "conditions"),
          List.of("stock", "equity", "shares", "market", "ticker"),
          List.of("search", "find", "query", "lookup", "discover"),
          List.of("price", "cost", "value", "rate", "quote"),
          List.of("news", "headlines", "articles"),
          List.of("translate", "translation"));

  static final List<List<String>> CAPABILITY_SYNONYMS =
      List.of(
          List.of("crypto_price", "crypto", "cryptocurrency", "bitcoin", "blockchain"),
          List.of("web_search", "search", "query", "find", "lookup"),
          List.of("weather_lookup", "weather", "forecast", "temperature", "climate"),
          List.of("stock_price", "stock", "quote", "ticker", "equity"),
          List.of("market_data", "market"),
          List.of("price", "cost", "value", "rate"),
          List.of("text_translation", "translate", "translation"),
          List.of("news_search", "news", "headlines"));

  static final Map<String, List<String>> INTENT_TERMS =
      Map.of(
          Intents.CRYPTO_PRICE_QUERY, List.of("crypto", "exchange", "rate"),
          Intents.WEB_SEARCH, List.of("search", "find", "web"),
          Intents.WEATHER_QUERY, List.of("weather", "forecast", "temperature"),
          Intents.STOCK_PRICE_QUERY, List.of("stock", "market", "quote"),
          Intents.NEWS_QUERY, List.of("news", "headlines"),
          Intents.TRANSLATION, List.of("translate", "language"),
          Intents.FOOD_DELIVERY, List.of("food", "delivery", "restaurant"),
          Intents.FLIGHT_BOOKING, List.of("flight", "travel"),
          Intents.HOTEL_BOOKING, List.of("hotel", "travel"));

  private final SynonymTable queryTable;
  private final SynonymTable capabilityTable;
  private final Map<String, List<String>> intentTerms;

  public SemanticExpander() {
    this(
        new SynonymTable(QUERY_SYNONYMS), new SynonymTable(CAPABILITY_SYNONYMS), INTENT_TERMS);
  }

  public SemanticExpander(
      SynonymTable queryTable,
      SynonymTable capabilityTable,
      Map<String, List<String>> intentTerms) {
    this.queryTable = queryTable;
    this.capabilityTable = capabilityTable;
    this.intentTerms = Map.copyOf(intentTerms);
  }

  public Set<String> expandTerms(Collection<String> terms) {
    return queryTable.expand(terms);
  }

  public Set<String> expandCapabilities(Collection<String> capabilities) {
    return capabilityTable.expand(capabilities);
  }

  /** Terms implied by the intent itself; empty for intents without an entry. */
  public List<String> intentTerms(String intent) {
    return intentTerms.getOrDefault(intent, List.of());
  }

  /** Raw terms plus the intent's implied terms, expanded through the query table. */
  public Set<String> expandForIntent(String intent, Collection<String> rawTerms) {
    Set<String> seed = new LinkedHashSet<>(rawTerms);
    seed.addAll(intentTerms(intent));
    return expandTerms(seed);
  }
}
