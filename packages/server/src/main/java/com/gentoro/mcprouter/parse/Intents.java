package com.gentoro.mcprouter.parse;

/** Intent names known to the built-in tables. */
public final class Intents {
  public static final String WEATHER_QUERY = "weather_query";
  public static final String CRYPTO_PRICE_QUERY = "cryptocurrency_price_query";
  public static final String STOCK_PRICE_QUERY = "stock_price_query";
  public static final String WEB_SEARCH = "web_search";
  public static final String FOOD_DELIVERY = "food_delivery";
  public static final String TRANSLATION = "translation";
  public static final String NEWS_QUERY = "news_query";
  public static final String FLIGHT_BOOKING = "flight_booking";
  public static final String HOTEL_BOOKING = "hotel_booking";
  public static final String CRYPTO_TRADING = "crypto_trading";
  public static final String GENERAL_QUERY = "general_query";

  public static final double FALLBACK_CONFIDENCE = 0.3;
  public static final double STRUCTURED_CONFIDENCE = 1.0;

  private Intents() {}
}
