package com.github.fsmdsl.graph;

import java.util.Objects;

/**
 * A node handed to the layout collaborator: the initial marker, a state or a choice.
 */
public final class NodeRecord {
  private final String id;
  private final String label;

  public NodeRecord(final String id, final String label) {
    this.id = id;
    this.label = label;
  }

  public String getId() {
    return id;
  }

  public String getLabel() {
    return label;
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, label);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    NodeRecord other = (NodeRecord) obj;
    return Objects.equals(id, other.id) && Objects.equals(label, other.label);
  }

  @Override
  public String toString() {
    return "NodeRecord [id=" + id + ", label=" + label + "]";
  }
}
