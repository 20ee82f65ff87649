package com.gentoro.mcprouter.exception;

import java.util.List;

/** Candidates were found but none of the evaluated ones exposes a usable tool. */
public class NoMatchingToolException extends RouterException {
  private final List<String> evaluatedProviders;

  public NoMatchingToolException(String message, List<String> evaluatedProviders) {
    super(RouterErrorCode.NO_MATCHING_TOOL, message);
    this.evaluatedProviders = List.copyOf(evaluatedProviders);
    withContext("evaluatedProviders", this.evaluatedProviders);
  }

  public List<String> getEvaluatedProviders() {
    return evaluatedProviders;
  }
}
