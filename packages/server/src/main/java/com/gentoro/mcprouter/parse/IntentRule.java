package com.gentoro.mcprouter.parse;

import java.util.List;
import java.util.regex.Pattern;

/** One row of the classification table: an intent, its ordered patterns and its confidence. */
public record IntentRule(String name, List<Pattern> patterns, double confidence) {
  public IntentRule {
    patterns = List.copyOf(patterns);
  }

  /** Compile the given regular expressions case-insensitively, preserving their order. */
  public static IntentRule of(String name, double confidence, String... regexes) {
    Pattern[] compiled = new Pattern[regexes.length];
    for (int i = 0; i < regexes.length; i++) {
      compiled[i] = Pattern.compile(regexes[i], Pattern.CASE_INSENSITIVE);
    }
    return new IntentRule(name, List.of(compiled), confidence);
  }
}
