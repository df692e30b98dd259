package com.github.fsmdsl.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * This object represents immutable metadata about a state: its identifier, an optional
 * human-readable description and its ordered entry and exit actions.
 */
public final class State {
  private final String id;
  private final String description;
  private final List<Action> entryActions;
  private final List<Action> exitActions;
  private final SourcePosition position;

  public State(final String id, final String description, final List<Action> entryActions,
      final List<Action> exitActions, final SourcePosition position) {
    this.id = id;
    this.description = description;
    this.entryActions = copy(entryActions);
    this.exitActions = copy(exitActions);
    this.position = position == null ? SourcePosition.UNKNOWN : position;
  }

  public State(final String id) {
    this(id, null, null, null, SourcePosition.UNKNOWN);
  }

  static List<Action> copy(final List<Action> actions) {
    if (actions == null || actions.isEmpty()) {
      return Collections.emptyList();
    }
    return Collections.unmodifiableList(new ArrayList<>(actions));
  }

  public String getId() {
    return id;
  }

  /**
   * Description is optional, null when absent.
   */
  public String getDescription() {
    return description;
  }

  public List<Action> getEntryActions() {
    return entryActions;
  }

  public List<Action> getExitActions() {
    return exitActions;
  }

  public SourcePosition getPosition() {
    return position;
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, description, entryActions, exitActions);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    State other = (State) obj;
    return Objects.equals(id, other.id) && Objects.equals(description, other.description)
        && entryActions.equals(other.entryActions) && exitActions.equals(other.exitActions);
  }

  @Override
  public String toString() {
    return "State [id=" + id + ", description=" + description + ", entryActions=" + entryActions
        + ", exitActions=" + exitActions + "]";
  }
}
