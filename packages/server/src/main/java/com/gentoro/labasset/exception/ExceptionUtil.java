package com.gentoro.labasset.exception;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;

/** Utility helpers for dealing with exceptions and structured error details. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Convert any {@link Throwable} into {@link ErrorDetails} for logging, job records or API
   * responses. If the throwable is a {@link LabAssetException}, its kind and context are preserved.
   */
  public static ErrorDetails toErrorDetails(Throwable t) {
    Throwable root = unwrap(t);
    if (root instanceof LabAssetException ex) {
      return new ErrorDetails(
          ex.getKind().name(),
          safeMessage(ex.getMessage()),
          ex.getClass().getSimpleName(),
          ex.getContext(),
          Instant.now());
    }
    return new ErrorDetails(
        ErrorKind.UNKNOWN.name(),
        extractErrorMessage(root),
        root == null ? null : root.getClass().getSimpleName(),
        Map.of(),
        Instant.now());
  }

  /** Kind of the throwable, or {@link ErrorKind#UNKNOWN} for foreign exceptions. */
  public static ErrorKind kindOf(Throwable t) {
    Throwable root = unwrap(t);
    return root instanceof LabAssetException ex ? ex.getKind() : ErrorKind.UNKNOWN;
  }

  /** Strip executor and completion wrappers to reach the failure that actually happened. */
  public static Throwable unwrap(Throwable t) {
    Throwable current = t;
    while ((current instanceof ExecutionException || current instanceof CompletionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  /**
   * Produce a compact, single-line representation of a throwable's stack trace.
   *
   * <p>Example output: {@code com.example.Foo.bar (Foo.java:42) > com.example.App.main
   * (App.java:10)}
   *
   * @param t the throwable whose stack should be summarized (null returns empty string)
   * @param maxFrames maximum number of top stack frames to include; if <= 0, includes all frames
   */
  public static String formatCompactStackTrace(Throwable t, int maxFrames) {
    if (t == null) return "";
    StackTraceElement[] elements = t.getStackTrace();
    if (elements == null || elements.length == 0) return "";

    int limit = maxFrames <= 0 ? elements.length : Math.min(elements.length, maxFrames);
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < limit; i++) {
      StackTraceElement e = elements[i];
      sb.append(e.getClassName())
          .append('.')
          .append(e.getMethodName())
          .append(" (")
          .append(e.getFileName() == null ? "Unknown Source" : e.getFileName());
      if (e.getLineNumber() >= 0) {
        sb.append(':').append(e.getLineNumber());
      }
      sb.append(')');
      if (i < limit - 1) sb.append(" > ");
    }
    return sb.toString();
  }

  public static String formatCompactStackTrace(Throwable t) {
    return formatCompactStackTrace(t, 10);
  }

  /**
   * Extract a user-facing message from a throwable without stack trace noise. The first non-blank
   * message in the cause chain wins; the exception type is used when none has a message.
   */
  public static String extractErrorMessage(Throwable t) {
    if (t == null) {
      return "Unknown error";
    }
    Throwable current = t;
    while (current != null) {
      String message = current.getMessage();
      if (message != null && !message.isBlank()) {
        if (current instanceof LabAssetException) {
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

  /**
   * Return {@code t} itself when it already is a {@link LabAssetException}, otherwise the exception
   * built by {@code supplier}. Intended for {@code throw ExceptionUtil.rethrowIfUnchecked(...)}.
   */
  public static LabAssetException rethrowIfUnchecked(
      Throwable t, Function<Throwable, LabAssetException> supplier) {
    Throwable root = unwrap(t);
    if (root instanceof LabAssetException ex) {
      return ex;
    }
    return supplier.apply(root);
  }
}
