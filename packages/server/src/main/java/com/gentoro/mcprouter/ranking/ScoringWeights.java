package com.gentoro.mcprouter.ranking;

import org.apache.commons.configuration2.Configuration;

/** Relevance weights used by {@link CandidateRanker}; overridable under {@code routing.scoring}. */
public record ScoringWeights(
    double categoryExact,
    double categoryFuzzy,
    double capabilityMatch,
    double termInName,
    double termInDescription,
    double termInTools,
    double termInTags,
    double verifiedBoost,
    double popularityFactor) {

  public static final ScoringWeights DEFAULTS =
      new ScoringWeights(10, 5, 3, 5, 3, 2, 1, 10, 2);

  public static ScoringWeights fromConfiguration(Configuration configuration) {
    if (configuration == null) {
      return DEFAULTS;
    }
    Configuration c = configuration.subset("routing.scoring");
    return new ScoringWeights(
        c.getDouble("category-exact", DEFAULTS.categoryExact),
        c.getDouble("category-fuzzy", DEFAULTS.categoryFuzzy),
        c.getDouble("capability-match", DEFAULTS.capabilityMatch),
        c.getDouble("term-name", DEFAULTS.termInName),
        c.getDouble("term-description", DEFAULTS.termInDescription),
        c.getDouble("term-tools", DEFAULTS.termInTools),
        c.getDouble("term-tags", DEFAULTS.termInTags),
        c.getDouble("verified-boost", DEFAULTS.verifiedBoost),
        c.getDouble("popularity-factor", DEFAULTS.popularityFactor));
  }
}
