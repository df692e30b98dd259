package com.github.fsmdsl.model;

import java.util.List;
import java.util.Objects;

/**
 * One branch of a {@link Choice}. A null condition marks the default ({@code else}) branch.
 */
public final class ChoiceBranch {
  private final String condition;
  private final String target;
  private final List<Action> actions;
  private final SourcePosition position;

  public ChoiceBranch(final String condition, final String target, final List<Action> actions,
      final SourcePosition position) {
    this.condition = condition;
    this.target = target;
    this.actions = State.copy(actions);
    this.position = position == null ? SourcePosition.UNKNOWN : position;
  }

  public ChoiceBranch(final String condition, final String target) {
    this(condition, target, null, SourcePosition.UNKNOWN);
  }

  public String getCondition() {
    return condition;
  }

  public boolean isDefault() {
    return condition == null;
  }

  public String getTarget() {
    return target;
  }

  public List<Action> getActions() {
    return actions;
  }

  public SourcePosition getPosition() {
    return position;
  }

  @Override
  public int hashCode() {
    return Objects.hash(condition, target, actions);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    ChoiceBranch other = (ChoiceBranch) obj;
    return Objects.equals(condition, other.condition) && Objects.equals(target, other.target)
        && actions.equals(other.actions);
  }

  @Override
  public String toString() {
    return "ChoiceBranch [" + (condition == null ? "else" : condition) + " -> " + target
        + ", actions=" + actions + "]";
  }
}
