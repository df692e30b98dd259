package com.github.fsmdsl.graph;

import java.util.Objects;

public final class EdgeRecord {
  private final String source;
  private final String target;
  private final String label;

  public EdgeRecord(final String source, final String target, final String label) {
    this.source = source;
    this.target = target;
    this.label = label;
  }

  public String getSource() {
    return source;
  }

  public String getTarget() {
    return target;
  }

  /**
   * Transition label in DSL syntax, eg. {@code go [ready] / log()}; empty for the initial edge.
   */
  public String getLabel() {
    return label;
  }

  @Override
  public int hashCode() {
    return Objects.hash(source, target, label);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    EdgeRecord other = (EdgeRecord) obj;
    return Objects.equals(source, other.source) && Objects.equals(target, other.target)
        && Objects.equals(label, other.label);
  }

  @Override
  public String toString() {
    return "EdgeRecord [source=" + source + ", target=" + target + ", label=" + label + "]";
  }
}
