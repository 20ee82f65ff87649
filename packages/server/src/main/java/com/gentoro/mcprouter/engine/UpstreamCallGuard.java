package com.gentoro.mcprouter.engine;

import com.gentoro.mcprouter.exception.RouterException;
import com.gentoro.mcprouter.exception.UpstreamFailureException;
import com.gentoro.mcprouter.exception.UpstreamTimeoutException;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs calls to external collaborators (catalog, invoker) on a worker pool with a hard timeout.
 * Timeouts surface as {@link UpstreamTimeoutException}; any non-router failure is wrapped in
 * {@link UpstreamFailureException}. Router exceptions thrown by the call pass through unchanged.
 */
public class UpstreamCallGuard implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.mcprouter.logging.LoggingService.getLogger(UpstreamCallGuard.class);

  private final ExecutorService executor;

  public UpstreamCallGuard() {
    AtomicInteger counter = new AtomicInteger();
    this.executor =
        Executors.newCachedThreadPool(
            r -> {
              Thread thread = new Thread(r, "upstream-call-" + counter.incrementAndGet());
              thread.setDaemon(true);
              return thread;
            });
  }

  public <T> T call(String operation, long timeoutMs, Callable<T> call) {
    Future<T> future = executor.submit(call);
    try {
      return future.get(timeoutMs, TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      log.warn("{} timed out after {} ms", operation, timeoutMs);
      throw new UpstreamTimeoutException(
          "%s timed out after %d ms".formatted(operation, timeoutMs), e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() == null ? e : e.getCause();
      if (cause instanceof RouterException routerException) {
        throw routerException;
      }
      throw new UpstreamFailureException(
          "%s failed: %s".formatted(operation, cause.getMessage()), cause);
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new UpstreamFailureException(operation + " was interrupted", e);
    }
  }

  @Override
  public void close() {
    executor.shutdownNow();
    try {
      if (!executor.awaitTermination(1, TimeUnit.SECONDS)) {
        log.warn("Upstream call pool did not terminate within 1 second");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
