package com.gentoro.mcprouter.exception;

/** Ranking yielded nothing, even after relaxing the verification requirement. */
public class NoCandidateFoundException extends RouterException {
  public static final String SUGGESTION = "Try broader search terms or a different category";

  public NoCandidateFoundException(String message) {
    super(RouterErrorCode.NO_CANDIDATE_FOUND, message);
    withContext("suggestion", SUGGESTION);
  }
}
