package com.github.fsmdsl.model;

import java.util.List;
import java.util.Objects;

/**
 * An edge from a source state to a target state or choice. The event is optional: a transition
 * without one is a completion transition, tried right after its source state has been entered. The
 * guard is opaque host text, never interpreted here.
 */
public final class Transition {
  private final String source;
  private final String target;
  private final String event;
  private final String guard;
  private final List<Action> actions;
  private final SourcePosition position;

  public Transition(final String source, final String target, final String event,
      final String guard, final List<Action> actions, final SourcePosition position) {
    this.source = source;
    this.target = target;
    this.event = event;
    this.guard = guard;
    this.actions = State.copy(actions);
    this.position = position == null ? SourcePosition.UNKNOWN : position;
  }

  public Transition(final String source, final String target, final String event) {
    this(source, target, event, null, null, SourcePosition.UNKNOWN);
  }

  public String getSource() {
    return source;
  }

  public String getTarget() {
    return target;
  }

  public String getEvent() {
    return event;
  }

  public boolean isCompletion() {
    return event == null;
  }

  public String getGuard() {
    return guard;
  }

  public boolean isGuarded() {
    return guard != null;
  }

  public List<Action> getActions() {
    return actions;
  }

  public SourcePosition getPosition() {
    return position;
  }

  /**
   * Label used by diagnostics and the graph export, eg. {@code go [ready] / a()}.
   */
  public String getLabel() {
    final StringBuilder label = new StringBuilder();
    if (event != null) {
      label.append(event);
    }
    if (guard != null) {
      if (label.length() > 0) {
        label.append(' ');
      }
      label.append('[').append(guard).append(']');
    }
    if (!actions.isEmpty()) {
      if (label.length() > 0) {
        label.append(' ');
      }
      label.append("/ ");
      for (int iter = 0; iter < actions.size(); iter++) {
        if (iter > 0) {
          label.append("; ");
        }
        label.append(actions.get(iter).getText());
      }
    }
    return label.toString();
  }

  @Override
  public int hashCode() {
    return Objects.hash(source, target, event, guard, actions);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    Transition other = (Transition) obj;
    return Objects.equals(source, other.source) && Objects.equals(target, other.target)
        && Objects.equals(event, other.event) && Objects.equals(guard, other.guard)
        && actions.equals(other.actions);
  }

  @Override
  public String toString() {
    return "Transition [" + source + "->" + target + ", event=" + event + ", guard=" + guard
        + ", actions=" + actions + "]";
  }
}
