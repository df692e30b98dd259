package com.github.fsmdsl.sim;

import com.github.fsmdsl.FsmException;

/**
 * This class encapsulates all the configuration parameters for the Simulator. Use the
 * {@code SimulatorConfigurationBuilder} to build it.
 *
 * Notes:<br>
 * 1. traceRetention bounds the number of trace entries kept; the oldest are dropped first. It
 * defaults to 1000.<br>
 * 2. maxChainLength bounds both the choices chained by a single transition and the completion
 * transitions following one event. Validated models never come close; it only stops a residual
 * cycle. It defaults to 64, the same bound generated code uses.<br>
 * 3. lockAcquisitionMillis bounds how long load/step/tick/snapshot wait for the engine lock.<br>
 * 4. maxTimerFiringsPerTick bounds the events a single tick posts. Once reached, periodic timers
 * skip the periods left in that tick instead of posting them; one-shot timers still fire. It
 * defaults to 10000, the same bound generated code uses.<br>
 */
public final class SimulatorConfiguration {
  public static final int DEFAULT_TRACE_RETENTION = 1000;
  public static final int DEFAULT_MAX_CHAIN_LENGTH = 64;
  public static final long DEFAULT_LOCK_ACQUISITION_MILLIS = 100L;
  public static final int DEFAULT_MAX_TIMER_FIRINGS_PER_TICK = 10000;

  private final int traceRetention;
  private final int maxChainLength;
  private final long lockAcquisitionMillis;
  private final int maxTimerFiringsPerTick;

  public int getTraceRetention() {
    return traceRetention;
  }

  public int getMaxChainLength() {
    return maxChainLength;
  }

  public long getLockAcquisitionMillis() {
    return lockAcquisitionMillis;
  }

  public int getMaxTimerFiringsPerTick() {
    return maxTimerFiringsPerTick;
  }

  public static SimulatorConfiguration defaults() {
    return new SimulatorConfiguration(DEFAULT_TRACE_RETENTION, DEFAULT_MAX_CHAIN_LENGTH,
        DEFAULT_LOCK_ACQUISITION_MILLIS, DEFAULT_MAX_TIMER_FIRINGS_PER_TICK);
  }

  public final static class SimulatorConfigurationBuilder {
    private int traceRetention = DEFAULT_TRACE_RETENTION;
    private int maxChainLength = DEFAULT_MAX_CHAIN_LENGTH;
    private long lockAcquisitionMillis = DEFAULT_LOCK_ACQUISITION_MILLIS;
    private int maxTimerFiringsPerTick = DEFAULT_MAX_TIMER_FIRINGS_PER_TICK;

    public static SimulatorConfigurationBuilder newBuilder() {
      return new SimulatorConfigurationBuilder();
    }

    public SimulatorConfigurationBuilder traceRetention(final int traceRetention) {
      this.traceRetention = traceRetention;
      return this;
    }

    public SimulatorConfigurationBuilder maxChainLength(final int maxChainLength) {
      this.maxChainLength = maxChainLength;
      return this;
    }

    public SimulatorConfigurationBuilder lockAcquisitionMillis(final long lockAcquisitionMillis) {
      this.lockAcquisitionMillis = lockAcquisitionMillis;
      return this;
    }

    public SimulatorConfigurationBuilder maxTimerFiringsPerTick(final int maxTimerFiringsPerTick) {
      this.maxTimerFiringsPerTick = maxTimerFiringsPerTick;
      return this;
    }

    public SimulatorConfiguration build() throws FsmException {
      final SimulatorConfiguration config = new SimulatorConfiguration(traceRetention,
          maxChainLength, lockAcquisitionMillis, maxTimerFiringsPerTick);
      config.validate();
      return config;
    }

    private SimulatorConfigurationBuilder() {}
  }

  private void validate() throws FsmException {
    StringBuilder messages = new StringBuilder();
    if (traceRetention <= 0) {
      messages.append("traceRetention must be positive. ");
    }
    if (maxChainLength <= 0) {
      messages.append("maxChainLength must be positive. ");
    }
    if (lockAcquisitionMillis <= 0L) {
      messages.append("lockAcquisitionMillis must be positive. ");
    }
    if (maxTimerFiringsPerTick <= 0) {
      messages.append("maxTimerFiringsPerTick must be positive. ");
    }
    if (messages.length() > 0) {
      throw new FsmException(FsmException.Code.INVALID_CONFIG, messages.toString().trim());
    }
  }

  @Override
  public String toString() {
    return "SimulatorConfiguration [traceRetention=" + traceRetention + ", maxChainLength="
        + maxChainLength + ", lockAcquisitionMillis=" + lockAcquisitionMillis
        + ", maxTimerFiringsPerTick=" + maxTimerFiringsPerTick + "]";
  }

  private SimulatorConfiguration(final int traceRetention, final int maxChainLength,
      final long lockAcquisitionMillis, final int maxTimerFiringsPerTick) {
    this.traceRetention = traceRetention;
    this.maxChainLength = maxChainLength;
    this.lockAcquisitionMillis = lockAcquisitionMillis;
    this.maxTimerFiringsPerTick = maxTimerFiringsPerTick;
  }

}
