package com.gentoro.mcprouter.parse;

import com.fasterxml.jackson.annotation.JsonValue;

/** High-level handling mode chosen for a parsed request. */
public enum StrategyKind {
  /** Execute the best matching provider immediately. */
  DIRECT_EXECUTION("direct_execution"),
  /** Present the matching providers and let the caller pick one. */
  PRESENT_OPTIONS("present_options"),
  /** Executes like DIRECT_EXECUTION; tagged separately so it can be told apart in metadata. */
  FALLBACK("fallback");

  private final String label;

  StrategyKind(String label) {
    this.label = label;
  }

  @JsonValue
  public String label() {
    return label;
  }

  /** Whether this strategy selects and invokes a single provider tool. */
  public boolean executes() {
    return this != PRESENT_OPTIONS;
  }

  @Override
  public String toString() {
    return label;
  }
}
