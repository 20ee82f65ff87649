package com.gentoro.mcprouter.parse;

import java.util.List;
import java.util.Map;

/** Static intent to capability-tag and intent to category tables. */
public class CapabilityMapper {
  public static final String GENERAL_CAPABILITY = "general";
  public static final String GENERAL_CATEGORY = "General";

  private static final Map<String, List<String>> CAPABILITIES =
      Map.of(
          Intents.WEATHER_QUERY, List.of("weather_lookup", "location_search"),
          Intents.CRYPTO_PRICE_QUERY, List.of("crypto_price", "market_data"),
          Intents.STOCK_PRICE_QUERY, List.of("stock_price", "market_data"),
          Intents.WEB_SEARCH, List.of("web_search", "content_retrieval"),
          Intents.FOOD_DELIVERY, List.of("food_ordering", "delivery_search", "location_search"),
          Intents.TRANSLATION, List.of("text_translation", "language_detection"),
          Intents.NEWS_QUERY, List.of("news_search", "content_retrieval"),
          Intents.FLIGHT_BOOKING, List.of("flight_search", "booking"),
          Intents.HOTEL_BOOKING, List.of("hotel_search", "booking", "location_search"));

  private static final Map<String, String> CATEGORIES =
      Map.of(
          Intents.WEATHER_QUERY, "Weather",
          Intents.CRYPTO_PRICE_QUERY, "Finance",
          Intents.STOCK_PRICE_QUERY, "Finance",
          Intents.WEB_SEARCH, "Search",
          Intents.FOOD_DELIVERY, "Commerce",
          Intents.TRANSLATION, "Language",
          Intents.NEWS_QUERY, "News",
          Intents.FLIGHT_BOOKING, "Travel",
          Intents.HOTEL_BOOKING, "Travel");

  public List<String> capabilitiesFor(String intent) {
    return CAPABILITIES.getOrDefault(intent, List.of(GENERAL_CAPABILITY));
  }

  public String categoryFor(String intent) {
    return CATEGORIES.getOrDefault(intent, GENERAL_CATEGORY);
  }
}
