package com.gentoro.mcprouter;

import com.gentoro.mcprouter.exception.ConfigException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Command line parameters in {@code --key value} or {@code --key=value} form. A key with no value
 * is read as {@code true}.
 */
public class StartupParameters {
  public static final String MODE = "mode";
  public static final String DEFAULT_MODE = "server";

  private final Map<String, String> parameters = new LinkedHashMap<>();

  public StartupParameters(String[] args) {
    if (args == null) {
      return;
    }
    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if (arg == null || !arg.startsWith("--") || arg.length() <= 2) {
        throw new ConfigException("Unexpected argument: " + arg);
      }
      String body = arg.substring(2);
      int eq = body.indexOf('=');
      if (eq >= 0) {
        parameters.put(body.substring(0, eq), body.substring(eq + 1));
      } else if (i + 1 < args.length && !args[i + 1].startsWith("--")) {
        parameters.put(body, args[++i]);
      } else {
        parameters.put(body, "true");
      }
    }
  }

  public <T> T getParameter(String name, Class<T> type) {
    String value = parameters.get(name);
    if (value == null && MODE.equals(name)) {
      value = DEFAULT_MODE;
    }
    if (value == null) {
      return null;
    }
    if (type == String.class) {
      return type.cast(value);
    }
    if (type == Integer.class) {
      try {
        return type.cast(Integer.valueOf(value.trim()));
      } catch (NumberFormatException e) {
        throw new ConfigException("Parameter --" + name + " must be an integer: " + value, e);
      }
    }
    if (type == Boolean.class) {
      return type.cast(Boolean.valueOf(value.trim()));
    }
    throw new IllegalArgumentException("Unsupported parameter type: " + type.getName());
  }

  public String mode() {
    return getParameter(MODE, String.class);
  }

  /** Configuration location from {@code --config-file} or {@code --config}, or null. */
  public String configFile() {
    String file = parameters.get("config-file");
    return file != null ? file : parameters.get("config");
  }

  public Map<String, String> asMap() {
    return Collections.unmodifiableMap(parameters);
  }
}
