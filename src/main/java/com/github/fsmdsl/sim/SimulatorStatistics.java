package com.github.fsmdsl.sim;

/**
 * Counters for one loaded machine. Reset on every {@link Simulator#load}; mutated only under the
 * simulator's write lock.
 */
public final class SimulatorStatistics {
  private final String machineName;
  private final long startTstampMillis;
  long totalSteps;
  long totalTransitions;
  long totalUnmatched;
  long totalGuardFaults;
  long totalActionFaults;
  long totalTimerFirings;
  long totalSkippedFirings;

  SimulatorStatistics(final String machineName) {
    this(machineName, System.currentTimeMillis());
  }

  private SimulatorStatistics(final String machineName, final long startTstampMillis) {
    this.machineName = machineName;
    this.startTstampMillis = startTstampMillis;
  }

  SimulatorStatistics copy() {
    final SimulatorStatistics copy = new SimulatorStatistics(machineName, startTstampMillis);
    copy.totalSteps = totalSteps;
    copy.totalTransitions = totalTransitions;
    copy.totalUnmatched = totalUnmatched;
    copy.totalGuardFaults = totalGuardFaults;
    copy.totalActionFaults = totalActionFaults;
    copy.totalTimerFirings = totalTimerFirings;
    copy.totalSkippedFirings = totalSkippedFirings;
    return copy;
  }

  public String getMachineName() {
    return machineName;
  }

  public long getStartTimeMillis() {
    return startTstampMillis;
  }

  /**
   * Events popped off the queue, matched or not.
   */
  public long getTotalSteps() {
    return totalSteps;
  }

  public long getTotalTransitions() {
    return totalTransitions;
  }

  public long getTotalUnmatched() {
    return totalUnmatched;
  }

  public long getTotalGuardFaults() {
    return totalGuardFaults;
  }

  public long getTotalActionFaults() {
    return totalActionFaults;
  }

  public long getTotalTimerFirings() {
    return totalTimerFirings;
  }

  /**
   * Periodic timer periods dropped because a tick reached its firing bound.
   */
  public long getTotalSkippedFirings() {
    return totalSkippedFirings;
  }

  @Override
  public String toString() {
    return "SimulatorStatistics [machineName=" + machineName + ", startTstampMillis="
        + startTstampMillis + ", totalSteps=" + totalSteps + ", totalTransitions="
        + totalTransitions + ", totalUnmatched=" + totalUnmatched + ", totalGuardFaults="
        + totalGuardFaults + ", totalActionFaults=" + totalActionFaults + ", totalTimerFirings="
        + totalTimerFirings + ", totalSkippedFirings=" + totalSkippedFirings + "]";
  }

}
