package com.github.fsmdsl.codegen;

import java.util.ArrayList;
import java.util.List;

import com.github.fsmdsl.FsmException.Code;

/**
 * Closed set of code generation targets.
 */
public enum TargetKind {
  // one Java class implementing GeneratedMachine
  STANDARD("standard");

  private final String targetName;

  private TargetKind(final String targetName) {
    this.targetName = targetName;
  }

  public String getTargetName() {
    return targetName;
  }

  /**
   * Resolves a user-supplied selector. There is no fallback: anything but an exact name fails.
   */
  public static TargetKind fromName(final String name) throws CodegenException {
    for (final TargetKind kind : values()) {
      if (kind.targetName.equals(name)) {
        return kind;
      }
    }
    throw new CodegenException(Code.UNKNOWN_TARGET, name,
        "Unknown code generation target '" + name + "', supported targets are " + names());
  }

  public static List<String> names() {
    final List<String> names = new ArrayList<>();
    for (final TargetKind kind : values()) {
      names.add(kind.targetName);
    }
    return names;
  }
}
