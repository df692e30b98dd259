package com.github.fsmdsl.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Abstract graph of a machine in a layout-neutral form. Node and edge order follow declaration
 * order, so two exports of the same definition are identical.
 */
public final class GraphDescription {
  private final String name;
  private final List<NodeRecord> nodes;
  private final List<EdgeRecord> edges;

  public GraphDescription(final String name, final List<NodeRecord> nodes,
      final List<EdgeRecord> edges) {
    this.name = name;
    this.nodes = Collections.unmodifiableList(new ArrayList<>(nodes));
    this.edges = Collections.unmodifiableList(new ArrayList<>(edges));
  }

  public String getName() {
    return name;
  }

  public List<NodeRecord> getNodes() {
    return nodes;
  }

  public List<EdgeRecord> getEdges() {
    return edges;
  }

  public NodeRecord node(final String id) {
    for (final NodeRecord node : nodes) {
      if (node.getId().equals(id)) {
        return node;
      }
    }
    return null;
  }

  @Override
  public int hashCode() {
    return 31 * (31 * name.hashCode() + nodes.hashCode()) + edges.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    GraphDescription other = (GraphDescription) obj;
    return name.equals(other.name) && nodes.equals(other.nodes) && edges.equals(other.edges);
  }

  @Override
  public String toString() {
    return "GraphDescription [name=" + name + ", nodes=" + nodes + ", edges=" + edges + "]";
  }
}
