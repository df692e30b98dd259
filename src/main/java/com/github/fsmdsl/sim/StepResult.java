package com.github.fsmdsl.sim;

import com.github.fsmdsl.runtime.DispatchOutcome;

/**
 * This object encapsulates the result of one {@link Simulator#step()}. The trace entry is null
 * only for {@link DispatchOutcome#NO_PENDING_EVENT}.
 */
public final class StepResult {
  private static final StepResult NO_PENDING_EVENT =
      new StepResult(DispatchOutcome.NO_PENDING_EVENT, null);

  private final DispatchOutcome outcome;
  private final TraceEntry traceEntry;

  StepResult(final DispatchOutcome outcome, final TraceEntry traceEntry) {
    this.outcome = outcome;
    this.traceEntry = traceEntry;
  }

  static StepResult noPendingEvent() {
    return NO_PENDING_EVENT;
  }

  public DispatchOutcome getOutcome() {
    return outcome;
  }

  public TraceEntry getTraceEntry() {
    return traceEntry;
  }

  public boolean isTransitioned() {
    return outcome == DispatchOutcome.TRANSITIONED;
  }

  @Override
  public String toString() {
    return "StepResult [outcome=" + outcome + ", traceEntry=" + traceEntry + "]";
  }
}
