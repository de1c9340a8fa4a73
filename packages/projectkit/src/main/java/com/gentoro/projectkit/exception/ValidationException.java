package com.gentoro.projectkit.exception;

import java.util.List;
import java.util.Map;

/**
 * A parsed resource violated one or more structural constraints. The violated constraints are
 * available through {@link #getViolations()}, one human readable entry per constraint.
 */
public class ValidationException extends ProjectKitException {
  private final List<String> violations;

  public ValidationException(String message, List<String> violations) {
    super(ProjectKitErrorCode.VALIDATION_FAILED, message + ": " + String.join("; ", violations));
    this.violations = List.copyOf(violations);
  }

  public ValidationException(String message, List<String> violations, Map<String, ?> context) {
    super(
        ProjectKitErrorCode.VALIDATION_FAILED,
        message + ": " + String.join("; ", violations),
        context);
    this.violations = List.copyOf(violations);
  }

  public List<String> getViolations() {
    return violations;
  }
}
