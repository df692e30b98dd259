package com.github.fsmdsl.model;

import java.util.Objects;

/**
 * One validation finding. It names the offending identifier and where it was written so a user can
 * find the construct without re-parsing.
 */
public final class Diagnostic {
  private final DiagnosticCode code;
  private final String subject;
  private final String message;
  private final SourcePosition position;

  public Diagnostic(final DiagnosticCode code, final String subject, final String message,
      final SourcePosition position) {
    this.code = code;
    this.subject = subject;
    this.message = message;
    this.position = position == null ? SourcePosition.UNKNOWN : position;
  }

  public DiagnosticCode getCode() {
    return code;
  }

  public Severity getSeverity() {
    return code.getSeverity();
  }

  public boolean isError() {
    return code.getSeverity() == Severity.ERROR;
  }

  public String getSubject() {
    return subject;
  }

  public String getMessage() {
    return message;
  }

  public SourcePosition getPosition() {
    return position;
  }

  /**
   * Compiler-style rendering, eg. {@code 3:5: error: UNRESOLVED_TARGET: ...}.
   */
  public String format() {
    return position + ": " + getSeverity().name().toLowerCase() + ": " + code.name() + ": "
        + message;
  }

  @Override
  public int hashCode() {
    return Objects.hash(code, subject, message, position);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    Diagnostic other = (Diagnostic) obj;
    return code == other.code && Objects.equals(subject, other.subject)
        && Objects.equals(message, other.message) && position.equals(other.position);
  }

  @Override
  public String toString() {
    return format();
  }
}
