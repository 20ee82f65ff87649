package com.gentoro.mcprouter.parse;

import java.util.Set;

/** Picks the handling strategy for an intent from static membership tables. */
public class StrategySelector {
  private static final Set<String> DIRECT_EXECUTION =
      Set.of(
          Intents.WEATHER_QUERY,
          Intents.CRYPTO_PRICE_QUERY,
          Intents.STOCK_PRICE_QUERY,
          Intents.TRANSLATION,
          Intents.WEB_SEARCH,
          Intents.NEWS_QUERY);

  // flows where the requester has to pick among providers
  private static final Set<String> PRESENT_OPTIONS =
      Set.of(
          Intents.FOOD_DELIVERY,
          Intents.FLIGHT_BOOKING,
          Intents.HOTEL_BOOKING,
          Intents.CRYPTO_TRADING);

  public StrategyKind select(String intent) {
    if (DIRECT_EXECUTION.contains(intent)) {
      return StrategyKind.DIRECT_EXECUTION;
    }
    if (PRESENT_OPTIONS.contains(intent)) {
      return StrategyKind.PRESENT_OPTIONS;
    }
    return StrategyKind.FALLBACK;
  }
}
