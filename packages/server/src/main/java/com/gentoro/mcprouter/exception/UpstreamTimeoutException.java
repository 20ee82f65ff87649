package com.gentoro.mcprouter.exception;

/** A catalog query or provider invocation did not finish within its time budget. */
public class UpstreamTimeoutException extends RouterException {
  public UpstreamTimeoutException(String message) {
    super(RouterErrorCode.UPSTREAM_TIMEOUT, message);
  }

  public UpstreamTimeoutException(String message, Throwable cause) {
    super(RouterErrorCode.UPSTREAM_TIMEOUT, message, cause);
  }
}
