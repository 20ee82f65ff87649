package com.gentoro.mcprouter.exception;

import java.time.Instant;
import java.util.function.Function;

/** Utility helpers for dealing with exceptions and structured error details. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Convert any {@link Throwable} into {@link ErrorDetails} for logging or API responses. If the
   * throwable is a {@link RouterException}, its code and context are preserved.
   */
  public static ErrorDetails toErrorDetails(Throwable t) {
    if (t instanceof RouterException ex) {
      return new ErrorDetails(
          ex.getClass().getSimpleName(),
          safeMessage(ex.getMessage()),
          ex.getCode(),
          ex.getContext().isEmpty() ? null : ex.getContext(),
          Instant.now());
    }
    return new ErrorDetails(
        t.getClass().getSimpleName(),
        safeMessage(t.getMessage()),
        RouterErrorCode.INTERNAL_ERROR,
        null,
        Instant.now());
  }

  /**
   * Walk the cause chain and return the first non-blank message, prefixed with the type of the
   * throwable that carried it. Meant for user-facing messages where stack traces do not help.
   */
  public static String extractErrorMessage(Throwable t) {
    if (t == null) {
      return "Unknown error";
    }
    Throwable current = t;
    while (current != null) {
      String message = current.getMessage();
      if (message != null && !message.isBlank()) {
        if (current instanceof RouterException) {
          return message;
        }
        return current.getClass().getSimpleName() + ": " + message;
      }
      current = current.getCause();
    }
    return t.getClass().getSimpleName();
  }

  private static String safeMessage(String message) {
    return message == null ? "" : message;
  }

  public static RouterException rethrowIfUnchecked(
      Throwable t, Function<Throwable, RouterException> supplier) {
    if (t instanceof RouterException) {
      return (RouterException) t;
    } else {
      return supplier.apply(t);
    }
  }
}
