package com.github.fsmdsl.sim;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable point-in-time view of a {@link Simulator}, safe to hand to a renderer thread.
 */
public final class SimulatorSnapshot {
  private final EngineStatus status;
  private final String machineName;
  private final String currentState;
  private final List<String> pendingEvents;
  private final List<String> armedTimers;
  private final long clock;
  private final List<TraceEntry> trace;

  SimulatorSnapshot(final EngineStatus status, final String machineName,
      final String currentState, final List<String> pendingEvents, final List<String> armedTimers,
      final long clock, final List<TraceEntry> trace) {
    this.status = status;
    this.machineName = machineName;
    this.currentState = currentState;
    this.pendingEvents = Collections.unmodifiableList(new ArrayList<>(pendingEvents));
    this.armedTimers = Collections.unmodifiableList(new ArrayList<>(armedTimers));
    this.clock = clock;
    this.trace = Collections.unmodifiableList(new ArrayList<>(trace));
  }

  public EngineStatus getStatus() {
    return status;
  }

  /**
   * Null while {@link EngineStatus#IDLE}.
   */
  public String getMachineName() {
    return machineName;
  }

  public String getCurrentState() {
    return currentState;
  }

  /**
   * Names of queued events, head first.
   */
  public List<String> getPendingEvents() {
    return pendingEvents;
  }

  /**
   * Ids of armed timers in declaration order.
   */
  public List<String> getArmedTimers() {
    return armedTimers;
  }

  public long getClock() {
    return clock;
  }

  public List<TraceEntry> getTrace() {
    return trace;
  }

  @Override
  public String toString() {
    return "SimulatorSnapshot [status=" + status + ", machineName=" + machineName
        + ", currentState=" + currentState + ", pendingEvents=" + pendingEvents + ", armedTimers="
        + armedTimers + ", clock=" + clock + ", trace=" + trace.size() + "]";
  }
}
