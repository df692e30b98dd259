package com.github.fsmdsl.sim;

import com.github.fsmdsl.FsmException;

/**
 * Raised when the simulator cannot service a request: no machine loaded, a residual choice or
 * completion cycle, or a lock that could not be acquired. Unmatched events and failing guards are
 * never faults.
 */
public final class SimulationFault extends FsmException {
  private static final long serialVersionUID = 1L;

  public SimulationFault(final Code code, final String message) {
    super(code, message);
  }

  public SimulationFault(final Code code, final Throwable throwable) {
    super(code, throwable);
  }
}
