package com.gentoro.mcprouter.parse;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Result of parsing a routing request. Immutable; collections are copied on construction and keep
 * their insertion order.
 *
 * @param rawText query text as received, empty when the request was structured only
 * @param normalizedText trimmed, whitespace-collapsed, lower-cased query text
 * @param intent classified (or supplied) intent name
 * @param confidence classification confidence; exactly 1.0 for structured input
 * @param entities extracted (or supplied) entities
 * @param capabilities capability tags required by the intent
 * @param category target provider category
 * @param strategy handling strategy for the intent
 * @param queryTerms raw, unexpanded query terms
 * @param structured whether the request bypassed classification
 */
public record ParsedRequest(
    String rawText,
    String normalizedText,
    String intent,
    double confidence,
    Map<String, String> entities,
    List<String> capabilities,
    String category,
    StrategyKind strategy,
    Set<String> queryTerms,
    boolean structured) {

  public ParsedRequest {
    rawText = rawText == null ? "" : rawText;
    normalizedText = normalizedText == null ? "" : normalizedText;
    entities =
        entities == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(entities));
    capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
    queryTerms =
        queryTerms == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(queryTerms));
  }
}
