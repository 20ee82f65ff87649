package com.gentoro.mcprouter.http;

import java.util.concurrent.TimeUnit;
import okhttp3.OkHttpClient;

public class OkHttpFactory {
  public static final long DEFAULT_CONNECT_TIMEOUT_MS = 10_000L;

  public static OkHttpClient create(long readTimeoutMs) {
    return create(DEFAULT_CONNECT_TIMEOUT_MS, readTimeoutMs);
  }

  public static OkHttpClient create(long connectTimeoutMs, long readTimeoutMs) {
    if (connectTimeoutMs <= 0 || readTimeoutMs <= 0) {
      throw new IllegalArgumentException("HTTP timeouts must be positive");
    }
    return new OkHttpClient.Builder()
        .connectTimeout(connectTimeoutMs, TimeUnit.MILLISECONDS)
        .readTimeout(readTimeoutMs, TimeUnit.MILLISECONDS)
        .addInterceptor(new LoggingInterceptor())
        .build();
  }
}
