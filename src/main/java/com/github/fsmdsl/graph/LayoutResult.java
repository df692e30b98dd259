package com.github.fsmdsl.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Positions returned by a {@link LayoutEngine}: one point per node id and one polyline per edge,
 * in the edge order of the {@link GraphDescription} that was laid out.
 */
public final class LayoutResult {
  private final Map<String, Point> positions;
  private final List<List<Point>> edgeRoutes;

  public LayoutResult(final Map<String, Point> positions, final List<List<Point>> edgeRoutes) {
    this.positions = Collections.unmodifiableMap(new LinkedHashMap<>(positions));
    final List<List<Point>> routes = new ArrayList<>();
    for (final List<Point> route : edgeRoutes) {
      routes.add(Collections.unmodifiableList(new ArrayList<>(route)));
    }
    this.edgeRoutes = Collections.unmodifiableList(routes);
  }

  public Map<String, Point> getPositions() {
    return positions;
  }

  public Point position(final String nodeId) {
    return positions.get(nodeId);
  }

  public List<List<Point>> getEdgeRoutes() {
    return edgeRoutes;
  }

  @Override
  public String toString() {
    return "LayoutResult [positions=" + positions + ", edgeRoutes=" + edgeRoutes + "]";
  }
}
