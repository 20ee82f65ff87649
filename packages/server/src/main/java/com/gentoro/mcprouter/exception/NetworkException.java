package com.gentoro.mcprouter.exception;

/** The HTTP listener could not be set up or started. */
public class NetworkException extends RouterException {
  public NetworkException(String message) {
    super(RouterErrorCode.NETWORK_ERROR, message);
  }

  public NetworkException(String message, Throwable cause) {
    super(RouterErrorCode.NETWORK_ERROR, message, cause);
  }
}
