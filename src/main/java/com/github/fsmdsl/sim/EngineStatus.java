package com.github.fsmdsl.sim;

/**
 * Lifecycle of a {@link Simulator}.
 */
public enum EngineStatus {
  // no machine loaded
  IDLE,
  // machine loaded, waiting for step()
  READY,
  // processing one event to completion
  RUNNING;
}
