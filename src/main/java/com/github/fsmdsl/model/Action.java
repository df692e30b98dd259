package com.github.fsmdsl.model;

import java.util.Objects;

/**
 * One action call such as {@code act()} or {@code start_timer(t)}. The full text is opaque host
 * code; only the two timer built-ins are interpreted by the simulator and the generated code.
 */
public final class Action {
  public static final String START_TIMER = "start_timer";
  public static final String STOP_TIMER = "stop_timer";

  private final String name;
  private final String arguments;
  private final SourcePosition position;

  public Action(final String name, final String arguments, final SourcePosition position) {
    if (name == null || name.isEmpty()) {
      throw new IllegalArgumentException("Action name cannot be null or empty");
    }
    this.name = name;
    this.arguments = arguments == null ? "" : arguments.trim();
    this.position = position == null ? SourcePosition.UNKNOWN : position;
  }

  /**
   * Parses {@code name(arguments)} text, used for hand-built models.
   */
  public static Action parse(final String text) {
    if (text == null) {
      throw new IllegalArgumentException("Action text cannot be null");
    }
    final String trimmed = text.trim();
    final int open = trimmed.indexOf('(');
    if (open <= 0 || !trimmed.endsWith(")")) {
      throw new IllegalArgumentException("Action must look like name(arguments): " + text);
    }
    return new Action(trimmed.substring(0, open).trim(),
        trimmed.substring(open + 1, trimmed.length() - 1), SourcePosition.UNKNOWN);
  }

  public String getName() {
    return name;
  }

  public String getArguments() {
    return arguments;
  }

  public SourcePosition getPosition() {
    return position;
  }

  public String getText() {
    return name + "(" + arguments + ")";
  }

  public boolean isStartTimer() {
    return START_TIMER.equals(name);
  }

  public boolean isStopTimer() {
    return STOP_TIMER.equals(name);
  }

  /**
   * Timer identifier for the built-ins, null for any other action.
   */
  public String getTimerId() {
    return isStartTimer() || isStopTimer() ? arguments : null;
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, arguments);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Action)) {
      return false;
    }
    Action other = (Action) obj;
    return name.equals(other.name) && arguments.equals(other.arguments);
  }

  @Override
  public String toString() {
    return getText();
  }
}
