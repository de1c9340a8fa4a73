package com.gentoro.projectkit.exception;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/** Utility helpers for dealing with exceptions and structured error details. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Wrap a ProjectKit failure with additional context. The returned exception carries the same
   * code and context as {@code cause} and keeps it as its cause, so identity based matching keeps
   * working at every level of the chain.
   *
   * @param message short description of the operation that failed (e.g. {@code "resolve
   *     local://rules"})
   * @param cause the failure to wrap
   * @return a new exception to be thrown by the caller
   */
  public static ProjectKitException wrap(String message, ProjectKitException cause) {
    return new ProjectKitException(message, cause, null);
  }

  /** Same as {@link #wrap(String, ProjectKitException)}, also recording {@code context}. */
  public static ProjectKitException wrap(
      String message, ProjectKitException cause, Map<String, ?> context) {
    return new ProjectKitException(message, cause, context);
  }

  /**
   * Returns true when {@code t} or any exception in its cause chain is a {@link
   * ProjectKitException} with the given code.
   */
  public static boolean hasCode(Throwable t, ProjectKitErrorCode code) {
    for (Throwable current = t; current != null; current = current.getCause()) {
      if (current instanceof ProjectKitException ex && ex.getCode() == code) {
        return true;
      }
      if (current.getCause() == current) break;
    }
    return false;
  }

  /** Finds the first throwable of the given type in the cause chain, starting with {@code t}. */
  public static <T extends Throwable> Optional<T> findCause(Throwable t, Class<T> type) {
    for (Throwable current = t; current != null; current = current.getCause()) {
      if (type.isInstance(current)) {
        return Optional.of(type.cast(current));
      }
      if (current.getCause() == current) break;
    }
    return Optional.empty();
  }

  /**
   * Convert any {@link Throwable} into {@link ErrorDetails} for logging. If the throwable is a
   * {@link ProjectKitException}, its code and context are preserved.
   */
  public static ErrorDetails toErrorDetails(Throwable t) {
    if (t instanceof ProjectKitException ex) {
      return new ErrorDetails(
          ex.getClass().getSimpleName(),
          safeMessage(ex.getMessage()),
          ex.getCode(),
          ex.getContext(),
          Instant.now());
    }
    return new ErrorDetails(
        t.getClass().getSimpleName(),
        safeMessage(t.getMessage()),
        ProjectKitErrorCode.UNKNOWN,
        null,
        Instant.now());
  }

  /**
   * Produce a compact, single-line representation of a throwable's stack trace, limited to the top
   * {@code maxFrames} frames (all frames when {@code maxFrames <= 0}).
   *
   * <p>Example output: {@code com.example.Foo.bar (Foo.java:42) > com.example.App.main
   * (App.java:10)}
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

  /** Convenience overload using a reasonable default of 10 frames. */
  public static String formatCompactStackTrace(Throwable t) {
    return formatCompactStackTrace(t, 10);
  }

  private static String safeMessage(String message) {
    return message == null ? "" : message;
  }
}
