package com.gentoro.mcprouter.model;

import com.gentoro.mcprouter.ranking.ScoredCandidate;

/** A runner-up provider reported alongside the chosen one. */
public record Alternate(String provider, String providerId, double confidence) {
  public static Alternate of(ScoredCandidate candidate) {
    return new Alternate(candidate.name(), candidate.id(), candidate.confidence());
  }
}
