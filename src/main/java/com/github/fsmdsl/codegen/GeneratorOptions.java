package com.github.fsmdsl.codegen;

import com.github.fsmdsl.FsmException;
import com.github.fsmdsl.sim.SimulatorConfiguration;

/**
 * Knobs for the code generator, built with {@code GeneratorOptionsBuilder}.
 *
 * Notes:<br>
 * 1. an empty package name emits a class in the default package.<br>
 * 2. without a class name the machine name is capitalized and suffixed with "Machine".<br>
 * 3. maxChainLength must match the simulator's for the two to agree on faulty models; it defaults
 * to the simulator default.<br>
 * 4. maxTimerFiringsPerTick likewise mirrors the simulator's bound on firings in one tick.<br>
 */
public final class GeneratorOptions {
  private final String packageName;
  private final String className;
  private final int maxChainLength;
  private final int maxTimerFiringsPerTick;

  public String getPackageName() {
    return packageName;
  }

  public String getClassName() {
    return className;
  }

  public int getMaxChainLength() {
    return maxChainLength;
  }

  public int getMaxTimerFiringsPerTick() {
    return maxTimerFiringsPerTick;
  }

  public static GeneratorOptions defaults() {
    return new GeneratorOptions("", null, SimulatorConfiguration.DEFAULT_MAX_CHAIN_LENGTH,
        SimulatorConfiguration.DEFAULT_MAX_TIMER_FIRINGS_PER_TICK);
  }

  public final static class GeneratorOptionsBuilder {
    private String packageName = "";
    private String className;
    private int maxChainLength = SimulatorConfiguration.DEFAULT_MAX_CHAIN_LENGTH;
    private int maxTimerFiringsPerTick =
        SimulatorConfiguration.DEFAULT_MAX_TIMER_FIRINGS_PER_TICK;

    public static GeneratorOptionsBuilder newBuilder() {
      return new GeneratorOptionsBuilder();
    }

    public GeneratorOptionsBuilder packageName(final String packageName) {
      this.packageName = packageName == null ? "" : packageName.trim();
      return this;
    }

    public GeneratorOptionsBuilder className(final String className) {
      this.className = className;
      return this;
    }

    public GeneratorOptionsBuilder maxChainLength(final int maxChainLength) {
      this.maxChainLength = maxChainLength;
      return this;
    }

    public GeneratorOptionsBuilder maxTimerFiringsPerTick(final int maxTimerFiringsPerTick) {
      this.maxTimerFiringsPerTick = maxTimerFiringsPerTick;
      return this;
    }

    public GeneratorOptions build() throws FsmException {
      final GeneratorOptions options =
          new GeneratorOptions(packageName, className, maxChainLength, maxTimerFiringsPerTick);
      options.validate();
      return options;
    }

    private GeneratorOptionsBuilder() {}
  }

  private void validate() throws FsmException {
    StringBuilder messages = new StringBuilder();
    if (!packageName.isEmpty()) {
      for (final String segment : packageName.split("\\.", -1)) {
        if (!JavaNames.isUsableIdentifier(segment)) {
          messages.append("packageName segment '").append(segment).append("' is not usable. ");
        }
      }
    }
    if (className != null && (!JavaNames.isUsableIdentifier(className)
        || JavaNames.isReservedTypeName(className))) {
      messages.append("className '").append(className).append("' is not usable. ");
    }
    if (maxChainLength <= 0) {
      messages.append("maxChainLength must be positive. ");
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
    return "GeneratorOptions [packageName=" + packageName + ", className=" + className
        + ", maxChainLength=" + maxChainLength + ", maxTimerFiringsPerTick="
        + maxTimerFiringsPerTick + "]";
  }

  private GeneratorOptions(final String packageName, final String className,
      final int maxChainLength, final int maxTimerFiringsPerTick) {
    this.packageName = packageName;
    this.className = className;
    this.maxChainLength = maxChainLength;
    this.maxTimerFiringsPerTick = maxTimerFiringsPerTick;
  }
}
