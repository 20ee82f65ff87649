package com.gentoro.mcprouter.http;

import java.io.IOException;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;
import org.jetbrains.annotations.NotNull;

/** Logs outbound provider calls; bodies only at trace, authorization headers never. */
public class LoggingInterceptor implements Interceptor {
  private static final org.slf4j.Logger log =
      com.gentoro.mcprouter.logging.LoggingService.getLogger(LoggingInterceptor.class);

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();

    long startTime = System.nanoTime();
    log.debug("Sending {} {}", request.method(), request.url());
    if (log.isTraceEnabled()) {
      log.trace("Request body:\n{}\n", bodyToString(request));
    }

    Response response;
    try {
      response = chain.proceed(request);
    } catch (java.net.SocketTimeoutException e) {
      log.warn(
          "Request timed out: {} {} ({}ms)", request.method(), request.url(), elapsedMs(startTime));
      throw e;
    } catch (java.net.ConnectException e) {
      log.warn(
          "Connection error: {} {} ({}ms): {}",
          request.method(),
          request.url(),
          elapsedMs(startTime),
          e.getMessage());
      throw e;
    } catch (IOException e) {
      log.warn(
          "IO error: {} {} ({}ms): {}",
          request.method(),
          request.url(),
          elapsedMs(startTime),
          e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
      throw e;
    }

    log.debug(
        "Received {} for {} in {} ms",
        response.code(),
        response.request().url(),
        elapsedMs(startTime));
    if (log.isTraceEnabled()) {
      ResponseBody peeked = response.peekBody(Long.MAX_VALUE);
      String body = peeked.string();
      log.trace("Response body:\n{}\n", body.isEmpty() ? "[empty]" : body);
    }
    return response;
  }

  private static long elapsedMs(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000;
  }

  private static String bodyToString(Request request) {
    try {
      Request copy = request.newBuilder().build();
      Buffer buffer = new Buffer();
      if (copy.body() != null) copy.body().writeTo(buffer);
      return buffer.readUtf8();
    } catch (IOException e) {
      return "(error reading body)";
    }
  }
}
