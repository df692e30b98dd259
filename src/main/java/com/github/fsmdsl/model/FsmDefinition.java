package com.github.fsmdsl.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The validated, immutable machine. This is the single source of truth handed to the simulator,
 * the code generator and the graph export. Instances only come out of
 * {@link SemanticValidator#validate(FsmDraft)}, so every name used by a transition, choice branch
 * or timer action resolves.
 *
 * Notes for users:<br>
 * 1. an instance is never modified after construction and may be shared freely across threads<br>
 * 2. re-parsing a document yields a brand-new instance rather than patching an existing one<br>
 */
public final class FsmDefinition {
  private final String name;
  private final String initialState;
  private final Map<String, State> states;
  private final Map<String, Choice> choices;
  private final List<Transition> transitions;
  private final List<Timer> timers;
  private final Map<String, Timer> timersById;
  private final Map<String, List<Transition>> transitionsBySource;
  private final List<String> eventNames;

  FsmDefinition(final FsmDraft draft) {
    this.name = draft.getName();
    this.initialState = draft.getInitialTransitions().get(0).getTarget();

    final Map<String, State> stateMap = new LinkedHashMap<>();
    for (final State state : draft.getStates()) {
      stateMap.put(state.getId(), state);
    }
    this.states = Collections.unmodifiableMap(stateMap);

    final Map<String, Choice> choiceMap = new LinkedHashMap<>();
    for (final Choice choice : draft.getChoices()) {
      choiceMap.put(choice.getId(), choice);
    }
    this.choices = Collections.unmodifiableMap(choiceMap);

    this.transitions = draft.getTransitions();
    this.timers = draft.getTimers();

    final Map<String, Timer> timerMap = new LinkedHashMap<>();
    for (final Timer timer : timers) {
      timerMap.put(timer.getId(), timer);
    }
    this.timersById = Collections.unmodifiableMap(timerMap);

    final Map<String, List<Transition>> bySource = new LinkedHashMap<>();
    for (final String stateId : stateMap.keySet()) {
      bySource.put(stateId, new ArrayList<Transition>());
    }
    final Set<String> events = new LinkedHashSet<>();
    for (final Transition transition : transitions) {
      bySource.get(transition.getSource()).add(transition);
      if (transition.getEvent() != null) {
        events.add(transition.getEvent());
      }
    }
    for (final Timer timer : timers) {
      events.add(timer.getEvent());
    }
    for (final Map.Entry<String, List<Transition>> entry : bySource.entrySet()) {
      entry.setValue(Collections.unmodifiableList(entry.getValue()));
    }
    this.transitionsBySource = Collections.unmodifiableMap(bySource);
    this.eventNames = Collections.unmodifiableList(new ArrayList<>(events));
  }

  public String getName() {
    return name;
  }

  public String getInitialState() {
    return initialState;
  }

  /**
   * States keyed by identifier, iterating in declaration order.
   */
  public Map<String, State> getStates() {
    return states;
  }

  public State getState(final String id) {
    return states.get(id);
  }

  public boolean isState(final String id) {
    return states.containsKey(id);
  }

  /**
   * Choices keyed by identifier, iterating in declaration order.
   */
  public Map<String, Choice> getChoices() {
    return choices;
  }

  public Choice getChoice(final String id) {
    return choices.get(id);
  }

  public boolean isChoice(final String id) {
    return choices.containsKey(id);
  }

  public List<Transition> getTransitions() {
    return transitions;
  }

  /**
   * Outgoing transitions of a state in declaration order, which is also dispatch order.
   */
  public List<Transition> transitionsFrom(final String stateId) {
    final List<Transition> outgoing = transitionsBySource.get(stateId);
    return outgoing == null ? Collections.<Transition>emptyList() : outgoing;
  }

  public List<Timer> getTimers() {
    return timers;
  }

  public Timer getTimer(final String id) {
    return timersById.get(id);
  }

  /**
   * Distinct event names: transition triggers first, then timer events, each in order of first
   * appearance.
   */
  public List<String> getEventNames() {
    return eventNames;
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, initialState, states, choices, transitions, timers);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    FsmDefinition other = (FsmDefinition) obj;
    // ordered comparison of the maps, declaration order is part of the model
    return Objects.equals(name, other.name) && Objects.equals(initialState, other.initialState)
        && new ArrayList<>(states.values()).equals(new ArrayList<>(other.states.values()))
        && new ArrayList<>(choices.values()).equals(new ArrayList<>(other.choices.values()))
        && transitions.equals(other.transitions) && timers.equals(other.timers);
  }

  @Override
  public String toString() {
    return "FsmDefinition [name=" + name + ", initialState=" + initialState + ", states="
        + states.keySet() + ", choices=" + choices.keySet() + ", transitions=" + transitions.size()
        + ", timers=" + timers.size() + "]";
  }
}
