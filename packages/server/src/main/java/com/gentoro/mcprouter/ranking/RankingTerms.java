package com.gentoro.mcprouter.ranking;

import com.gentoro.mcprouter.catalog.CatalogFilter;
import com.gentoro.mcprouter.parse.ParsedRequest;
import com.gentoro.mcprouter.parse.SemanticExpander;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Expanded search terms for one request.
 *
 * @param category target category
 * @param capabilityTerms capabilities after synonym expansion
 * @param queryTerms raw query terms plus intent terms, after synonym expansion
 */
public record RankingTerms(String category, Set<String> capabilityTerms, Set<String> queryTerms) {
  public RankingTerms {
    capabilityTerms = Collections.unmodifiableSet(new LinkedHashSet<>(capabilityTerms));
    queryTerms = Collections.unmodifiableSet(new LinkedHashSet<>(queryTerms));
  }

  public static RankingTerms from(ParsedRequest parsed, SemanticExpander expander) {
    return new RankingTerms(
        parsed.category(),
        expander.expandCapabilities(parsed.capabilities()),
        expander.expandForIntent(parsed.intent(), parsed.queryTerms()));
  }

  public CatalogFilter toFilter(boolean requireVerified) {
    return new CatalogFilter(category, capabilityTerms, queryTerms, requireVerified);
  }
}
