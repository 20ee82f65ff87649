package com.gentoro.mcprouter.ranking;

import com.gentoro.mcprouter.catalog.ProviderRecord;

/** A provider with its relevance score. */
public record ScoredCandidate(ProviderRecord provider, double score) {
  /** Score mapped onto [0, 1] for reporting. */
  public double confidence() {
    return Math.min(score / 100.0, 1.0);
  }

  public String id() {
    return provider.id();
  }

  public String name() {
    return provider.displayName();
  }
}
