package com.gentoro.mcprouter.parse;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/** Canonicalizes raw query text and splits it into searchable terms. */
public class QueryNormalizer {
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern TERM_SEPARATOR = Pattern.compile("[^\\p{L}\\p{N}]+");
  private static final Set<String> STOP_WORDS =
      Set.of(
          "a", "an", "the", "in", "at", "of", "for", "to", "is", "it", "me", "my", "what", "whats",
          "how", "and", "on", "with", "please", "show", "tell", "give", "can", "you", "be", "are",
          "was", "do", "does", "from", "by", "this", "that", "there", "some", "any", "i");
  private static final int MIN_TERM_LENGTH = 2;

  /** Trim, collapse whitespace and lower-case. {@code null} yields an empty string. */
  public String normalize(String raw) {
    return clean(raw).toLowerCase(Locale.ROOT);
  }

  /** Trim and collapse whitespace, preserving case. */
  public String clean(String raw) {
    if (raw == null) {
      return "";
    }
    return WHITESPACE.matcher(raw.trim()).replaceAll(" ");
  }

  /** Split normalized text into distinct terms, dropping stop words and one-letter tokens. */
  public Set<String> terms(String normalized) {
    Set<String> terms = new LinkedHashSet<>();
    if (normalized == null || normalized.isBlank()) {
      return terms;
    }
    for (String token : TERM_SEPARATOR.split(normalized.toLowerCase(Locale.ROOT))) {
      if (token.length() < MIN_TERM_LENGTH || STOP_WORDS.contains(token)) {
        continue;
      }
      terms.add(token);
    }
    return terms;
  }
}
