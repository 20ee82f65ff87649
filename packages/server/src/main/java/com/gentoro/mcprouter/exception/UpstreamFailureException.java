package com.gentoro.mcprouter.exception;

/** The catalog or the invoker failed or was unreachable. */
public class UpstreamFailureException extends RouterException {
  public UpstreamFailureException(String message) {
    super(RouterErrorCode.UPSTREAM_FAILURE, message);
  }

  public UpstreamFailureException(String message, Throwable cause) {
    super(RouterErrorCode.UPSTREAM_FAILURE, message, cause);
  }
}
