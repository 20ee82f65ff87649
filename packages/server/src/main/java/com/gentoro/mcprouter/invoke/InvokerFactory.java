package com.gentoro.mcprouter.invoke;

import com.gentoro.mcprouter.exception.ConfigException;
import com.gentoro.mcprouter.http.OkHttpFactory;
import java.util.Locale;
import org.apache.commons.configuration2.Configuration;

/** Builds the invoker named by {@code invoker.mode}. */
public final class InvokerFactory {
  public static final long DEFAULT_TIMEOUT_MS = 20_000L;

  private InvokerFactory() {}

  public static Invoker create(Configuration configuration) {
    String mode = configuration.getString("invoker.mode", MockInvoker.MODE);
    long timeoutMs = configuration.getLong("invoker.timeout-ms", DEFAULT_TIMEOUT_MS);
    return switch (mode.trim().toLowerCase(Locale.ROOT)) {
      case MockInvoker.MODE -> new MockInvoker();
      case HttpMcpInvoker.MODE -> new HttpMcpInvoker(OkHttpFactory.create(timeoutMs));
      default -> throw new ConfigException(
          "Unknown invoker.mode '" + mode + "'; expected 'mock' or 'http'");
    };
  }
}
