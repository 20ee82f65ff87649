package com.gentoro.mcprouter.parse;

import java.util.List;
import java.util.regex.Pattern;

/**
 * First-match intent classifier over an ordered rule table.
 *
 * <p>Rules are evaluated in table order and, within a rule, patterns in declaration order; the
 * first pattern found anywhere in the text wins. Overlapping patterns are resolved purely by that
 * order, so the table must not be re-sorted. Text that matches nothing resolves to {@link
 * Intents#GENERAL_QUERY}.
 */
public class IntentClassifier {
  private static final List<IntentRule> DEFAULT_RULES =
      List.of(
          IntentRule.of(
              Intents.WEATHER_QUERY,
              0.95,
              "weather\\s+in\\s+([a-z\\s]+)",
              "forecast.*?([a-z\\s]+)",
              "temperature.*?([a-z\\s]+)",
              "(current|today'?s?)\\s+weather",
              "how.*?(hot|cold|warm).*?is.*?it"),
          IntentRule.of(
              Intents.CRYPTO_PRICE_QUERY,
              0.95,
              "(bitcoin|btc|ethereum|eth|crypto).*?price",
              "price.*?(bitcoin|btc|ethereum|eth)",
              "how.*?much.*?(bitcoin|btc|ethereum|eth)",
              "(bitcoin|btc|ethereum|eth).*?(cost|value)"),
          IntentRule.of(
              Intents.STOCK_PRICE_QUERY,
              0.90,
              "stock.*?price.*?([a-z]{2,5})",
              "([a-z]{2,5}).*?stock.*?price",
              "share.*?price.*?([a-z]{2,5})"),
          IntentRule.of(
              Intents.WEB_SEARCH,
              0.85,
              "search.*?for\\s+(.+)",
              "find.*?about\\s+(.+)",
              "look.*?up\\s+(.+)",
              "google\\s+(.+)"),
          IntentRule.of(
              Intents.FOOD_DELIVERY,
              0.90,
              "order.*?food",
              "food.*?delivery",
              "(pizza|burger|chinese|indian).*?(order|delivery)",
              "hungry.*?(order|delivery)"),
          IntentRule.of(
              Intents.TRANSLATION,
              0.95,
              "translate.*?to\\s+([a-z]+)",
              "how.*?say.*?in\\s+([a-z]+)",
              "([a-z]+).*?translation"),
          IntentRule.of(
              Intents.NEWS_QUERY,
              0.85,
              "(latest|breaking|today'?s?|top)\\s+(news|headlines)",
              "news\\s+(about|on|from)\\s+(.+)",
              "headlines"),
          IntentRule.of(
              Intents.FLIGHT_BOOKING,
              0.85,
              "book.*?flights?",
              "flights?\\s+(from|to)\\s+([a-z]+)",
              "cheap\\s+flights?"),
          IntentRule.of(
              Intents.HOTEL_BOOKING,
              0.85,
              "book.*?hotels?",
              "hotels?\\s+(in|near)\\s+([a-z]+)"));

  private final List<IntentRule> rules;

  public IntentClassifier() {
    this(DEFAULT_RULES);
  }

  public IntentClassifier(List<IntentRule> rules) {
    this.rules = List.copyOf(rules);
  }

  public IntentLabel classify(String normalizedText) {
    String text = normalizedText == null ? "" : normalizedText;
    if (!text.isEmpty()) {
      for (IntentRule rule : rules) {
        for (Pattern pattern : rule.patterns()) {
          if (pattern.matcher(text).find()) {
            return new IntentLabel(rule.name(), rule.confidence(), pattern.pattern());
          }
        }
      }
    }
    return new IntentLabel(Intents.GENERAL_QUERY, Intents.FALLBACK_CONFIDENCE, "fallback");
  }

  public List<IntentRule> rules() {
    return rules;
  }
}
