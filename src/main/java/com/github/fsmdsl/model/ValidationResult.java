package com.github.fsmdsl.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * This object encapsulates the outcome of validating a draft: the ordered diagnostics and, only
 * when none of them is an error, the validated definition.
 */
public final class ValidationResult {
  private final FsmDefinition definition;
  private final List<Diagnostic> diagnostics;

  ValidationResult(final FsmDefinition definition, final List<Diagnostic> diagnostics) {
    this.definition = definition;
    this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));
  }

  public boolean isValid() {
    return definition != null;
  }

  /**
   * The validated machine, null when any error was reported.
   */
  public FsmDefinition getDefinition() {
    return definition;
  }

  public List<Diagnostic> getDiagnostics() {
    return diagnostics;
  }

  public List<Diagnostic> getErrors() {
    return filter(Severity.ERROR);
  }

  public List<Diagnostic> getWarnings() {
    return filter(Severity.WARNING);
  }

  private List<Diagnostic> filter(final Severity severity) {
    final List<Diagnostic> filtered = new ArrayList<>();
    for (final Diagnostic diagnostic : diagnostics) {
      if (diagnostic.getSeverity() == severity) {
        filtered.add(diagnostic);
      }
    }
    return filtered;
  }

  @Override
  public String toString() {
    return "ValidationResult [valid=" + isValid() + ", diagnostics=" + diagnostics + "]";
  }
}
