package com.github.fsmdsl.runtime;

/**
 * What a single run-to-completion step did.
 */
public enum DispatchOutcome {
  // the queue was empty, nothing changed
  NO_PENDING_EVENT,
  // no transition of the current state accepted the event, it was discarded
  UNMATCHED,
  // a transition was taken, possibly through choices and completion transitions
  TRANSITIONED;
}
