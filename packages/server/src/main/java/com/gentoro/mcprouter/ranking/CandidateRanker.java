package com.gentoro.mcprouter.ranking;

import com.gentoro.mcprouter.catalog.CatalogFilter;
import com.gentoro.mcprouter.catalog.ProviderCatalog;
import com.gentoro.mcprouter.catalog.ProviderRecord;
import com.gentoro.mcprouter.engine.UpstreamCallGuard;
import com.gentoro.mcprouter.parse.ParsedRequest;
import com.gentoro.mcprouter.parse.SemanticExpander;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Scores catalog candidates against a parsed request.
 *
 * <p>All comparisons are case-insensitive substring checks. The score of a provider is the sum
 * of:
 *
 * <ul>
 *   <li>the better of an exact or a fuzzy category match (never both);
 *   <li>a fixed amount per expanded capability term found in the tool text;
 *   <li>per expanded query term, field weights for each of name, description, tool text and tags
 *       it appears in;
 *   <li>{@code log10(usageCount + 1)} times the popularity factor;
 *   <li>a boost for verified providers.
 * </ul>
 *
 * Providers scoring zero or less are dropped. Ties are broken on provider id so that the order is
 * reproducible.
 */
public class CandidateRanker {
  private static final org.slf4j.Logger log =
      com.gentoro.mcprouter.logging.LoggingService.getLogger(CandidateRanker.class);

  static final Comparator<ScoredCandidate> ORDER =
      Comparator.comparingDouble(ScoredCandidate::score)
          .reversed()
          .thenComparing(c -> c.provider().id());

  private final ProviderCatalog catalog;
  private final SemanticExpander expander;
  private final ScoringWeights weights;
  private final UpstreamCallGuard guard;
  private final long catalogTimeoutMs;

  public CandidateRanker(
      ProviderCatalog catalog,
      SemanticExpander expander,
      ScoringWeights weights,
      UpstreamCallGuard guard,
      long catalogTimeoutMs) {
    this.catalog = catalog;
    this.expander = expander;
    this.weights = weights;
    this.guard = guard;
    this.catalogTimeoutMs = catalogTimeoutMs;
  }

  public List<ScoredCandidate> rank(ParsedRequest parsed, boolean requireVerified) {
    RankingTerms terms = RankingTerms.from(parsed, expander);
    CatalogFilter filter = terms.toFilter(requireVerified);
    List<ProviderRecord> candidates =
        guard.call("Catalog query", catalogTimeoutMs, () -> catalog.query(filter));

    List<ScoredCandidate> scored = new ArrayList<>();
    for (ProviderRecord provider : candidates) {
      if (requireVerified && !provider.verified()) {
        continue;
      }
      double score = score(provider, terms);
      if (score > 0) {
        scored.add(new ScoredCandidate(provider, score));
      }
    }
    scored.sort(ORDER);
    log.debug(
        "Ranked {} of {} candidates for intent {} (requireVerified={})",
        scored.size(),
        candidates.size(),
        parsed.intent(),
        requireVerified);
    return scored;
  }

  public double score(ProviderRecord provider, RankingTerms terms) {
    double score = categoryScore(provider.category(), terms.category());

    String toolText = provider.toolText();
    for (String capability : terms.capabilityTerms()) {
      if (toolText.contains(lower(capability))) {
        score += weights.capabilityMatch();
      }
    }

    String name = lower(provider.displayName());
    String description = lower(provider.description());
    String tags = provider.tagText();
    for (String raw : terms.queryTerms()) {
      String term = lower(raw);
      if (term.isEmpty()) {
        continue;
      }
      if (name.contains(term)) {
        score += weights.termInName();
      }
      if (description.contains(term)) {
        score += weights.termInDescription();
      }
      if (toolText.contains(term)) {
        score += weights.termInTools();
      }
      if (tags.contains(term)) {
        score += weights.termInTags();
      }
    }

    score += Math.log10(provider.usageCount() + 1.0) * weights.popularityFactor();
    if (provider.verified()) {
      score += weights.verifiedBoost();
    }
    return score;
  }

  private double categoryScore(String providerCategory, String target) {
    if (providerCategory == null
        || providerCategory.isBlank()
        || target == null
        || target.isBlank()) {
      return 0;
    }
    String a = lower(providerCategory);
    String b = lower(target);
    if (a.equals(b)) {
      return Math.max(weights.categoryExact(), weights.categoryFuzzy());
    }
    if (a.contains(b) || b.contains(a)) {
      return weights.categoryFuzzy();
    }
    return 0;
  }

  private static String lower(String s) {
    return s == null ? "" : s.toLowerCase(Locale.ROOT).trim();
  }
}
