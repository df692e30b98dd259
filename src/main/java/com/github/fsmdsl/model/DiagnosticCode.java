package com.github.fsmdsl.model;

/**
 * Every problem the semantic validator knows how to report, along with its severity.
 */
public enum DiagnosticCode {
  // initial marker
  MISSING_INITIAL(Severity.ERROR),
  MULTIPLE_INITIAL(Severity.ERROR),
  INITIAL_NOT_STATE(Severity.ERROR),
  // identifiers
  INVALID_IDENTIFIER(Severity.ERROR),
  DUPLICATE_IDENTIFIER(Severity.ERROR),
  DUPLICATE_TIMER(Severity.ERROR),
  // references
  UNRESOLVED_SOURCE(Severity.ERROR),
  UNRESOLVED_TARGET(Severity.ERROR),
  CHOICE_AS_SOURCE(Severity.ERROR),
  // choices
  CHOICE_MISSING_ELSE(Severity.ERROR),
  CHOICE_MULTIPLE_ELSE(Severity.ERROR),
  CHOICE_NO_CONDITION(Severity.ERROR),
  CHOICE_CYCLE(Severity.ERROR),
  COMPLETION_CYCLE(Severity.ERROR),
  // timers
  INVALID_TIMER_DURATION(Severity.ERROR),
  UNKNOWN_TIMER(Severity.ERROR),
  UNUSED_TIMER_EVENT(Severity.WARNING),
  // reachability and dispatch
  UNREACHABLE_STATE(Severity.WARNING),
  SHADOWED_TRANSITION(Severity.WARNING);

  private final Severity severity;

  private DiagnosticCode(final Severity severity) {
    this.severity = severity;
  }

  public Severity getSeverity() {
    return severity;
  }
}
