package com.github.fsmdsl.codegen;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.github.fsmdsl.FsmException.Code;
import com.github.fsmdsl.model.Action;
import com.github.fsmdsl.model.Choice;
import com.github.fsmdsl.model.ChoiceBranch;
import com.github.fsmdsl.model.FsmDefinition;
import com.github.fsmdsl.model.State;
import com.github.fsmdsl.model.Timer;
import com.github.fsmdsl.model.Transition;

/**
 * Target-neutral lowering of a definition: per state its dispatch rows in declaration order, per
 * choice its branches, plus the timer table. Emitters render this and never look at the definition
 * directly.
 */
public final class DispatchTable {
  private final String machineName;
  private final String initialState;
  private final Map<String, State> states;
  private final Map<String, List<Transition>> rows;
  private final Map<String, Choice> choices;
  private final List<String> events;
  private final List<Timer> timers;

  private DispatchTable(final FsmDefinition definition) {
    this.machineName = definition.getName();
    this.initialState = definition.getInitialState();
    this.states = definition.getStates();
    final Map<String, List<Transition>> rows = new LinkedHashMap<>();
    for (final String stateId : states.keySet()) {
      rows.put(stateId, definition.transitionsFrom(stateId));
    }
    this.rows = Collections.unmodifiableMap(rows);
    this.choices = definition.getChoices();
    this.events = definition.getEventNames();
    this.timers = definition.getTimers();
  }

  /**
   * Lowers a definition, rejecting identifiers Java cannot declare and timer built-ins naming
   * timers that do not exist.
   */
  public static DispatchTable of(final FsmDefinition definition) throws CodegenException {
    if (definition == null) {
      throw new IllegalArgumentException("Definition cannot be null");
    }
    final DispatchTable table = new DispatchTable(definition);
    table.checkRenderable();
    return table;
  }

  private void checkRenderable() throws CodegenException {
    for (final String stateId : states.keySet()) {
      checkIdentifier("state", stateId);
    }
    for (final String choiceId : choices.keySet()) {
      checkIdentifier("choice", choiceId);
    }
    for (final String event : events) {
      checkIdentifier("event", event);
    }
    for (final Timer timer : timers) {
      checkIdentifier("timer", timer.getId());
    }
    for (final Action action : allActions()) {
      if ((action.isStartTimer() || action.isStopTimer()) && timer(action.getTimerId()) == null) {
        throw new CodegenException(Code.UNRENDERABLE_CONSTRUCT, action.getText(),
            "Action " + action.getText() + " names an undeclared timer");
      }
    }
  }

  private static void checkIdentifier(final String kind, final String id) throws CodegenException {
    if (JavaNames.isReserved(id)) {
      throw new CodegenException(Code.UNRENDERABLE_CONSTRUCT, id,
          "The " + kind + " '" + id + "' is a Java reserved word and cannot be rendered");
    }
  }

  private List<Action> allActions() {
    final List<Action> actions = new ArrayList<>();
    for (final State state : states.values()) {
      actions.addAll(state.getEntryActions());
      actions.addAll(state.getExitActions());
    }
    for (final List<Transition> stateRows : rows.values()) {
      for (final Transition row : stateRows) {
        actions.addAll(row.getActions());
      }
    }
    for (final Choice choice : choices.values()) {
      for (final ChoiceBranch branch : choice.getBranches()) {
        actions.addAll(branch.getActions());
      }
    }
    return actions;
  }

  public String getMachineName() {
    return machineName;
  }

  public String getInitialState() {
    return initialState;
  }

  public List<State> getStates() {
    return new ArrayList<>(states.values());
  }

  /**
   * Rows of one state, completion rows included, in declaration order.
   */
  public List<Transition> getRows(final String stateId) {
    final List<Transition> stateRows = rows.get(stateId);
    return stateRows == null ? Collections.<Transition>emptyList() : stateRows;
  }

  public List<Choice> getChoices() {
    return new ArrayList<>(choices.values());
  }

  public boolean isChoice(final String target) {
    return choices.containsKey(target);
  }

  public List<String> getEvents() {
    return events;
  }

  public List<Timer> getTimers() {
    return timers;
  }

  public Timer timer(final String timerId) {
    for (final Timer timer : timers) {
      if (timer.getId().equals(timerId)) {
        return timer;
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return "DispatchTable [machineName=" + machineName + ", states=" + states.size()
        + ", choices=" + choices.size() + ", events=" + events + ", timers=" + timers.size() + "]";
  }
}
