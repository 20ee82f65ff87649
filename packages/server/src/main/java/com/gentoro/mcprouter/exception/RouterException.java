package com.gentoro.mcprouter.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base unchecked exception for the router. Carries a {@link RouterErrorCode} and an optional
 * context map that ends up in the structured error payload.
 */
public class RouterException extends RuntimeException {
  private final RouterErrorCode code;
  private final Map<String, Object> context = new LinkedHashMap<>();

  public RouterException(RouterErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public RouterException(RouterErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public RouterErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }

  public RouterException withContext(String key, Object value) {
    context.put(key, value);
    return this;
  }
}
