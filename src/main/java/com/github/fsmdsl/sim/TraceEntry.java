package com.github.fsmdsl.sim;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.github.fsmdsl.runtime.DispatchOutcome;

/**
 * Record of one simulation step: where it started, where it ended, the event that drove it and the
 * actions executed on the way. The path lists every state and choice traversed, ends included.
 */
public final class TraceEntry {
  private final long sequence;
  private final String from;
  private final String to;
  private final String event;
  private final List<String> actions;
  private final DispatchOutcome outcome;
  private final List<String> path;

  TraceEntry(final long sequence, final String from, final String to, final String event,
      final List<String> actions, final DispatchOutcome outcome, final List<String> path) {
    this.sequence = sequence;
    this.from = from;
    this.to = to;
    this.event = event;
    this.actions = Collections.unmodifiableList(new ArrayList<>(actions));
    this.outcome = outcome;
    this.path = Collections.unmodifiableList(new ArrayList<>(path));
  }

  /**
   * Monotonic step number, starting at 1 after each load. Gaps at the head of the trace show
   * entries dropped by the retention bound.
   */
  public long getSequence() {
    return sequence;
  }

  public String getFrom() {
    return from;
  }

  public String getTo() {
    return to;
  }

  public String getEvent() {
    return event;
  }

  public List<String> getActions() {
    return actions;
  }

  public DispatchOutcome getOutcome() {
    return outcome;
  }

  public boolean isUnmatched() {
    return outcome == DispatchOutcome.UNMATCHED;
  }

  public List<String> getPath() {
    return path;
  }

  @Override
  public int hashCode() {
    return Objects.hash(sequence, from, to, event, actions, outcome, path);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    TraceEntry other = (TraceEntry) obj;
    return sequence == other.sequence && Objects.equals(from, other.from)
        && Objects.equals(to, other.to) && Objects.equals(event, other.event)
        && actions.equals(other.actions) && outcome == other.outcome && path.equals(other.path);
  }

  @Override
  public String toString() {
    return "{" + from + "," + to + "," + event + "," + actions + (isUnmatched() ? ",unmatched" : "")
        + "}";
  }
}
