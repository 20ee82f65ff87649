package com.gentoro.mcprouter.exception;

/** Stable error codes surfaced to callers in structured error payloads. */
public enum RouterErrorCode {
  MALFORMED_INPUT(400),
  NO_CANDIDATE_FOUND(404),
  NO_MATCHING_TOOL(404),
  UPSTREAM_FAILURE(502),
  UPSTREAM_TIMEOUT(504),
  CONFIG_ERROR(500),
  STATE_ERROR(500),
  NETWORK_ERROR(500),
  INTERNAL_ERROR(500),
  UNKNOWN(500);

  private final int httpStatus;

  RouterErrorCode(int httpStatus) {
    this.httpStatus = httpStatus;
  }

  /** HTTP status the transport layer should use for this code. */
  public int httpStatus() {
    return httpStatus;
  }
}
