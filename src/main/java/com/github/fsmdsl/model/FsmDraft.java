package com.github.fsmdsl.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The unvalidated result of walking a parse tree. A draft keeps every declaration in source order,
 * duplicates and dangling references included, so that {@link SemanticValidator} can report all of
 * them. Drafts are immutable; use {@link Builder} to assemble one by hand.
 */
public final class FsmDraft {
  /** Source identifier of initial transitions, as written in {@code [*] --> X}. */
  public static final String INITIAL_MARKER = "[*]";

  private final String name;
  private final List<Transition> initialTransitions;
  private final List<State> states;
  private final List<Choice> choices;
  private final List<Transition> transitions;
  private final List<Timer> timers;
  private final SourcePosition position;

  private FsmDraft(final Builder builder) {
    this.name = builder.name;
    this.initialTransitions = Collections.unmodifiableList(new ArrayList<>(builder.initials));
    this.states = Collections.unmodifiableList(new ArrayList<>(builder.states));
    this.choices = Collections.unmodifiableList(new ArrayList<>(builder.choices));
    this.transitions = Collections.unmodifiableList(new ArrayList<>(builder.transitions));
    this.timers = Collections.unmodifiableList(new ArrayList<>(builder.timers));
    this.position = builder.position;
  }

  public String getName() {
    return name;
  }

  /**
   * Every {@code [*] --> X} marker, in source order. A valid machine has exactly one.
   */
  public List<Transition> getInitialTransitions() {
    return initialTransitions;
  }

  public List<State> getStates() {
    return states;
  }

  public List<Choice> getChoices() {
    return choices;
  }

  public List<Transition> getTransitions() {
    return transitions;
  }

  public List<Timer> getTimers() {
    return timers;
  }

  public SourcePosition getPosition() {
    return position;
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, initialTransitions, states, choices, transitions, timers);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    FsmDraft other = (FsmDraft) obj;
    return Objects.equals(name, other.name) && initialTransitions.equals(other.initialTransitions)
        && states.equals(other.states) && choices.equals(other.choices)
        && transitions.equals(other.transitions) && timers.equals(other.timers);
  }

  @Override
  public String toString() {
    return "FsmDraft [name=" + name + ", initialTransitions=" + initialTransitions + ", states="
        + states + ", choices=" + choices + ", transitions=" + transitions + ", timers=" + timers
        + "]";
  }

  /**
   * A simple builder to let users use fluent APIs to assemble drafts.
   */
  public final static class Builder {
    private String name;
    private SourcePosition position = SourcePosition.UNKNOWN;
    private final List<Transition> initials = new ArrayList<>();
    private final List<State> states = new ArrayList<>();
    private final List<Choice> choices = new ArrayList<>();
    private final List<Transition> transitions = new ArrayList<>();
    private final List<Timer> timers = new ArrayList<>();

    public static Builder newBuilder(final String name) {
      return new Builder(name);
    }

    public Builder position(final SourcePosition position) {
      this.position = position == null ? SourcePosition.UNKNOWN : position;
      return this;
    }

    public Builder initial(final String target) {
      return initial(target, SourcePosition.UNKNOWN);
    }

    public Builder initial(final String target, final SourcePosition position) {
      initials.add(new Transition(INITIAL_MARKER, target, null, null, null, position));
      return this;
    }

    public Builder state(final State state) {
      states.add(state);
      return this;
    }

    public Builder state(final String id) {
      return state(new State(id));
    }

    public Builder choice(final Choice choice) {
      choices.add(choice);
      return this;
    }

    public Builder transition(final Transition transition) {
      transitions.add(transition);
      return this;
    }

    public Builder transition(final String source, final String target, final String event) {
      return transition(new Transition(source, target, event));
    }

    public Builder timer(final Timer timer) {
      timers.add(timer);
      return this;
    }

    public FsmDraft build() {
      return new FsmDraft(this);
    }

    private Builder(final String name) {
      this.name = name;
    }
  }
}
