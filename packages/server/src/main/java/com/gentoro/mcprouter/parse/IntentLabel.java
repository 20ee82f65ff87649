package com.gentoro.mcprouter.parse;

/**
 * Outcome of intent classification.
 *
 * @param name intent name, e.g. {@code weather_query}
 * @param confidence static confidence of the rule that matched, in [0, 1]
 * @param matchedPattern pattern source that matched, or {@code fallback}
 */
public record IntentLabel(String name, double confidence, String matchedPattern) {
  public IntentLabel {
    if (confidence < 0.0 || confidence > 1.0) {
      throw new IllegalArgumentException("confidence must be within [0, 1]: " + confidence);
    }
  }

  public boolean isFallback() {
    return Intents.GENERAL_QUERY.equals(name);
  }
}
