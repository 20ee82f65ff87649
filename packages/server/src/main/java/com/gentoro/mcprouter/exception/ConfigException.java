package com.gentoro.mcprouter.exception;

/** Invalid or missing configuration. */
public class ConfigException extends RouterException {
  public ConfigException(String message) {
    super(RouterErrorCode.CONFIG_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(RouterErrorCode.CONFIG_ERROR, message, cause);
  }
}
