package com.gentoro.mcprouter.exception;

/** The request carried neither free text nor structured intent fields. */
public class MalformedInputException extends RouterException {
  public MalformedInputException(String message) {
    super(RouterErrorCode.MALFORMED_INPUT, message);
  }

  public MalformedInputException(String message, Throwable cause) {
    super(RouterErrorCode.MALFORMED_INPUT, message, cause);
  }
}
