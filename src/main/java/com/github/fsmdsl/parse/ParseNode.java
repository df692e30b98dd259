package com.github.fsmdsl.parse;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.github.fsmdsl.model.SourcePosition;

/**
 * A node of the concrete parse tree. Terminals carry their text, rules carry their children in
 * source order.
 */
public final class ParseNode {
  private final NodeKind kind;
  private final String text;
  private final SourcePosition position;
  private final List<ParseNode> children;

  public ParseNode(final NodeKind kind, final String text, final SourcePosition position,
      final List<ParseNode> children) {
    this.kind = kind;
    this.text = text;
    this.position = position;
    this.children = children == null || children.isEmpty() ? Collections.<ParseNode>emptyList()
        : Collections.unmodifiableList(new ArrayList<>(children));
  }

  public static ParseNode leaf(final NodeKind kind, final String text,
      final SourcePosition position) {
    return new ParseNode(kind, text, position, null);
  }

  public NodeKind getKind() {
    return kind;
  }

  public String getText() {
    return text;
  }

  public SourcePosition getPosition() {
    return position;
  }

  public List<ParseNode> getChildren() {
    return children;
  }

  /**
   * First child of the given kind, null when absent.
   */
  public ParseNode child(final NodeKind childKind) {
    for (final ParseNode child : children) {
      if (child.kind == childKind) {
        return child;
      }
    }
    return null;
  }

  public List<ParseNode> children(final NodeKind childKind) {
    final List<ParseNode> matching = new ArrayList<>();
    for (final ParseNode child : children) {
      if (child.kind == childKind) {
        matching.add(child);
      }
    }
    return matching;
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, text, position, children);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    ParseNode other = (ParseNode) obj;
    return kind == other.kind && Objects.equals(text, other.text)
        && Objects.equals(position, other.position) && children.equals(other.children);
  }

  @Override
  public String toString() {
    final StringBuilder builder = new StringBuilder().append(kind);
    if (text != null) {
      builder.append('(').append(text).append(')');
    }
    if (!children.isEmpty()) {
      builder.append(children);
    }
    return builder.toString();
  }
}
