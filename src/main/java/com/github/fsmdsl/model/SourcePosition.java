package com.github.fsmdsl.model;

/**
 * Location of a construct in the DSL source. The offset is counted in UTF-8 bytes, line and column
 * are 1-based and the column counts characters.
 */
public final class SourcePosition {
  public static final SourcePosition UNKNOWN = new SourcePosition(-1, 0, 0);

  private final int offset;
  private final int line;
  private final int column;

  public SourcePosition(final int offset, final int line, final int column) {
    this.offset = offset;
    this.line = line;
    this.column = column;
  }

  public int getOffset() {
    return offset;
  }

  public int getLine() {
    return line;
  }

  public int getColumn() {
    return column;
  }

  public boolean isKnown() {
    return offset >= 0;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + offset;
    result = prime * result + line;
    result = prime * result + column;
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    SourcePosition other = (SourcePosition) obj;
    return offset == other.offset && line == other.line && column == other.column;
  }

  @Override
  public String toString() {
    return isKnown() ? line + ":" + column : "?:?";
  }
}
