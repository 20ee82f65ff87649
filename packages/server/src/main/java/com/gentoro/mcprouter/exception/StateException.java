package com.gentoro.mcprouter.exception;

/** A component was used before it was initialized, or after shutdown. */
public class StateException extends RouterException {
  public StateException(String message) {
    super(RouterErrorCode.STATE_ERROR, message);
  }

  public StateException(String message, Throwable cause) {
    super(RouterErrorCode.STATE_ERROR, message, cause);
  }
}
