package com.github.fsmdsl.runtime;

/**
 * Contract implemented by classes emitted by the {@code standard} code generation target. The
 * dispatch rule is the simulator's: transitions in declaration order, first satisfied guard wins,
 * choices resolved within the same step, then exit actions, transition actions, branch actions and
 * entry actions.
 *
 * Instances are not thread-safe; one owner drives them serially.
 */
public interface GeneratedMachine {

  /**
   * Enters the initial state, running its entry actions. Calling it again restarts the machine.
   */
  void start();

  /**
   * Appends an event to the pending queue.
   */
  void post(String event, Object payload);

  /**
   * Processes one pending event to completion.
   */
  DispatchOutcome step();

  /**
   * Advances logical time; expired timers post their events.
   */
  void tick(long units);

  String currentState();

  int pendingEvents();
}
