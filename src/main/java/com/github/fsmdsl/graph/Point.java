package com.github.fsmdsl.graph;

/**
 * A coordinate produced by the layout collaborator. Units are whatever the renderer uses.
 */
public final class Point {
  private final double x;
  private final double y;

  public Point(final double x, final double y) {
    this.x = x;
    this.y = y;
  }

  public double getX() {
    return x;
  }

  public double getY() {
    return y;
  }

  @Override
  public int hashCode() {
    return 31 * Double.hashCode(x) + Double.hashCode(y);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    Point other = (Point) obj;
    return Double.compare(x, other.x) == 0 && Double.compare(y, other.y) == 0;
  }

  @Override
  public String toString() {
    return "(" + x + "," + y + ")";
  }
}
