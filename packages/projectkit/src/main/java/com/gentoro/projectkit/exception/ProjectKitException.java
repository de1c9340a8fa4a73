package com.gentoro.projectkit.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Unchecked failure of a ProjectKit operation.
 *
 * <p>The {@link ProjectKitErrorCode} identifies what went wrong and is what callers match on. The
 * message and the context map ({@code uri}, {@code path}, {@code kind}, {@code scheme}, ...) only
 * describe where it happened. A failure rethrown by an outer layer keeps the code of the original
 * one; see {@link #ProjectKitException(String, ProjectKitException, Map)}.
 */
public class ProjectKitException extends RuntimeException {
  private final ProjectKitErrorCode code;
  private final Map<String, Object> context;

  public ProjectKitException(ProjectKitErrorCode code, String message) {
    this(code, message, null, null);
  }

  public ProjectKitException(ProjectKitErrorCode code, String message, Throwable cause) {
    this(code, message, null, cause);
  }

  public ProjectKitException(ProjectKitErrorCode code, String message, Map<String, ?> context) {
    this(code, message, context, null);
  }

  public ProjectKitException(
      ProjectKitErrorCode code, String message, Map<String, ?> context, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
    this.context = merge(null, context);
  }

  /**
   * Rethrow {@code wrapped} from an outer layer. The code is taken over unchanged and {@code
   * operation} is prepended to the message. {@code context} is added to the wrapped context; keys
   * already set by the wrapped failure keep their value.
   */
  public ProjectKitException(
      String operation, ProjectKitException wrapped, Map<String, ?> context) {
    super(operation + ": " + wrapped.getMessage(), wrapped);
    this.code = wrapped.getCode();
    this.context = merge(wrapped.getContext(), context);
  }

  public ProjectKitErrorCode getCode() {
    return code;
  }

  /** @return true when this failure, not its causes, carries {@code expected}. */
  public boolean is(ProjectKitErrorCode expected) {
    return code == expected;
  }

  /** Read-only details locating the failure. */
  public Map<String, Object> getContext() {
    return context;
  }

  /** @return the context value for {@code key} as text. */
  public Optional<String> contextValue(String key) {
    return Optional.ofNullable(context.get(key)).map(String::valueOf);
  }

  private static Map<String, Object> merge(Map<String, ?> inner, Map<String, ?> outer) {
    boolean noInner = inner == null || inner.isEmpty();
    boolean noOuter = outer == null || outer.isEmpty();
    if (noInner && noOuter) return Collections.emptyMap();

    Map<String, Object> merged = new LinkedHashMap<>();
    if (!noInner) merged.putAll(inner);
    if (!noOuter) outer.forEach(merged::putIfAbsent);
    return Collections.unmodifiableMap(merged);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(getClass().getSimpleName());
    sb.append('[').append(code).append("] ").append(getMessage());
    if (!context.isEmpty()) sb.append(' ').append(context);
    return sb.toString();
  }
}
