package com.gentoro.mcprouter.parse;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort extraction of structured fields from query text. Works on case-preserving text so
 * that proper nouns and ticker symbols survive; each extractor is independent and a miss simply
 * omits its key.
 */
public class EntityExtractor {
  public static final String LOCATION = "location";
  public static final String CRYPTOCURRENCY = "cryptocurrency";
  public static final String STOCK_SYMBOL = "stockSymbol";

  private static final List<Pattern> LOCATION_PATTERNS =
      List.of(
          Pattern.compile("\\b(?i:in)\\s+([A-Za-z]+(?:\\s+[A-Z][A-Za-z]*)*)"),
          Pattern.compile("\\b(?i:at)\\s+([A-Za-z]+(?:\\s+[A-Z][A-Za-z]*)*)"),
          // capitalized phrase that does not open the sentence
          Pattern.compile("(?<=\\s)([A-Z][a-z][A-Za-z]{1,13}(?:\\s+[A-Z][a-z][A-Za-z]*)*)"));

  private static final Pattern CRYPTO_PATTERN =
      Pattern.compile("\\b(bitcoin|btc|ethereum|eth|dogecoin|doge)\\b", Pattern.CASE_INSENSITIVE);

  private static final Pattern TICKER_PATTERN = Pattern.compile("\\b([A-Z]{2,5})\\b");
  private static final Set<String> CRYPTO_SYMBOLS = Set.of("BTC", "ETH", "DOGE");

  public Map<String, String> extract(String text) {
    Map<String, String> entities = new LinkedHashMap<>();
    if (text == null || text.isBlank()) {
      return entities;
    }
    extractLocation(text, entities);
    extractCryptocurrency(text, entities);
    extractStockSymbol(text, entities);
    return entities;
  }

  private void extractLocation(String text, Map<String, String> entities) {
    for (Pattern pattern : LOCATION_PATTERNS) {
      Matcher matcher = pattern.matcher(text);
      if (matcher.find()) {
        String location = matcher.group(1).trim();
        if (!location.isEmpty()) {
          entities.put(LOCATION, location);
          return;
        }
      }
    }
  }

  private void extractCryptocurrency(String text, Map<String, String> entities) {
    Matcher matcher = CRYPTO_PATTERN.matcher(text);
    if (matcher.find()) {
      entities.put(CRYPTOCURRENCY, matcher.group(1).toLowerCase(Locale.ROOT));
    }
  }

  private void extractStockSymbol(String text, Map<String, String> entities) {
    Matcher matcher = TICKER_PATTERN.matcher(text);
    while (matcher.find()) {
      String symbol = matcher.group(1);
      if (!CRYPTO_SYMBOLS.contains(symbol)) {
        entities.put(STOCK_SYMBOL, symbol);
        return;
      }
    }
  }
}
